package info.isaksson.erland.fmuhandler.core;

import info.isaksson.erland.fmuhandler.error.ArchiveFormatException;
import info.isaksson.erland.fmuhandler.model.ScalarVariable;
import info.isaksson.erland.fmuhandler.model.ScalarVariableQuery;
import info.isaksson.erland.fmuhandler.xml.ModelDescriptionDocument;
import info.isaksson.erland.fmuhandler.xml.SchemaValidationException;
import info.isaksson.erland.fmuhandler.xml.SchemaValidator;
import info.isaksson.erland.fmuhandler.xml.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * An opened FMU archive with an editable model description.
 *
 * <p>{@link #open(Path)} reads every member into memory and closes the zip file again; the
 * source file is not touched until {@link #save()}. The model description is parsed on first
 * use. Saving validates the regenerated {@code modelDescription.xml} against the FMI 2.0 schema
 * and refuses to write an invalid document.</p>
 *
 * <pre>{@code
 * FmuArchive fmu = FmuArchive.open(Path.of("model.fmu"));
 * fmu.setStartValue("Var1", 42);
 * fmu.save();
 * }</pre>
 *
 * <p>Not thread safe.</p>
 */
public final class FmuArchive {

    private static final Logger log = LoggerFactory.getLogger(FmuArchive.class);

    public static final String MODEL_DESCRIPTION = "modelDescription.xml";
    public static final String FMU_EXTENSION = ".fmu";

    private final Path sourcePath;
    private final List<FmuMember> members;
    private final byte[] modelDescriptionBytes;
    private final String archiveComment;
    /** Charset of names and comments; ISO-8859-1 for archives whose metadata is not UTF-8. */
    private final Charset charset;
    private final SchemaValidator validator;
    private ModelDescriptionDocument document;

    private FmuArchive(Path sourcePath, List<FmuMember> members, byte[] modelDescriptionBytes,
                       String archiveComment, Charset charset, SchemaValidator validator) {
        this.sourcePath = sourcePath;
        this.members = members;
        this.modelDescriptionBytes = modelDescriptionBytes;
        this.archiveComment = archiveComment;
        this.charset = charset;
        this.validator = validator;
    }

    /**
     * Open an FMU, validating saves against the bundled FMI 2.0 schema.
     *
     * @throws NoSuchFileException if {@code path} does not exist
     * @throws ArchiveFormatException if the file is not a zip archive or has no model description
     */
    public static FmuArchive open(Path path) throws IOException {
        return open(path, SchemaValidator.fmi2());
    }

    public static FmuArchive open(Path path, SchemaValidator validator) throws IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        if (validator == null) throw new IllegalArgumentException("validator must not be null");
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        if (!Files.isRegularFile(path)) {
            throw new ArchiveFormatException(path, "Not a regular file");
        }

        Contents contents;
        try {
            contents = read(path, StandardCharsets.UTF_8);
        } catch (ZipException | IllegalArgumentException e) {
            // names or comments that are not UTF-8, typically from Windows zip tools
            log.debug("Reading {} as ISO-8859-1: {}", path, e.getMessage());
            try {
                contents = read(path, StandardCharsets.ISO_8859_1);
            } catch (ZipException e2) {
                throw new ArchiveFormatException(path, "Not a valid zip archive (" + e2.getMessage() + ")", e2);
            } catch (IllegalArgumentException e2) {
                throw new ArchiveFormatException(path, "Unreadable zip metadata (" + e2.getMessage() + ")", e2);
            }
        }
        if (contents.modelDescription == null) {
            throw new ArchiveFormatException(path, "Archive has no " + MODEL_DESCRIPTION + " member");
        }

        log.debug("Opened {} with {} members", path, contents.members.size());
        return new FmuArchive(path, Collections.unmodifiableList(contents.members), contents.modelDescription,
                contents.comment, contents.charset, validator);
    }

    /**
     * @throws ZipException if the file is not a zip archive or an entry name cannot be decoded
     * @throws IllegalArgumentException if a comment cannot be decoded with {@code charset}
     */
    private static Contents read(Path path, Charset charset) throws IOException {
        Contents contents = new Contents(charset);
        Set<String> names = new HashSet<>();
        try (ZipFile zip = new ZipFile(path.toFile(), charset)) {
            contents.comment = zip.getComment();
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (!names.add(entry.getName())) {
                    throw new ArchiveFormatException(path, "Duplicate archive member " + entry.getName());
                }
                byte[] data;
                try (InputStream in = zip.getInputStream(entry)) {
                    data = in.readAllBytes();
                }
                contents.members.add(new FmuMember(entry, data));
                if (MODEL_DESCRIPTION.equals(entry.getName())) {
                    contents.modelDescription = data;
                }
            }
        }
        return contents;
    }

    private static final class Contents {
        final Charset charset;
        final List<FmuMember> members = new ArrayList<>();
        byte[] modelDescription;
        String comment;

        Contents(Charset charset) {
            this.charset = charset;
        }
    }

    public Path sourcePath() {
        return sourcePath;
    }

    /** Member names in archive order. */
    public List<String> memberNames() {
        List<String> out = new ArrayList<>(members.size());
        for (FmuMember m : members) {
            out.add(m.name());
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * The parsed model description, created on first call.
     *
     * @throws info.isaksson.erland.fmuhandler.error.FmuHandlerException subtypes if the member cannot be parsed
     */
    public ModelDescriptionDocument modelDescription() {
        if (document == null) {
            document = ModelDescriptionDocument.parse(modelDescriptionBytes);
        }
        return document;
    }

    public ScalarVariable getScalarVariableByName(String name) {
        return modelDescription().getVariableByName(name);
    }

    public Optional<ScalarVariable> findScalarVariable(String name) {
        return modelDescription().findVariable(name);
    }

    public List<ScalarVariable> scalarVariables() {
        return modelDescription().scalarVariables();
    }

    public List<ScalarVariable> query(ScalarVariableQuery query) {
        return modelDescription().query(query);
    }

    public ScalarVariable setStartValue(String name, Object value) {
        return modelDescription().setStartValue(name, value);
    }

    public ScalarVariable updateVariable(String name, UnaryOperator<ScalarVariable> change) {
        return modelDescription().updateVariable(name, change);
    }

    public void addVariable(ScalarVariable variable) {
        modelDescription().addVariable(variable);
    }

    public ScalarVariable deleteVariable(String name) {
        return modelDescription().deleteVariable(name);
    }

    public ValidationResult validate() {
        return modelDescription().validate(validator);
    }

    /** Overwrite the source archive. */
    public Path save() throws IOException {
        return save(sourcePath);
    }

    /**
     * Write the archive with the current model description to {@code target}.
     * The source path of this instance is not changed. The written file keeps the permissions of
     * the file it replaces, or takes those of the source archive when {@code target} is new.
     *
     * @throws SchemaValidationException if the model description is not schema valid; nothing is written
     */
    public Path save(Path target) throws IOException {
        if (target == null) throw new IllegalArgumentException("target must not be null");

        byte[] xml = modelDescription().toXmlBytes();
        ValidationResult result = validator.validate(xml);
        if (!result.valid) {
            log.warn("Not saving {}: {}", target, result.summary());
            throw new SchemaValidationException(result);
        }

        FmuArchiveWriter.writeAtomically(target, sourcePath, members, MODEL_DESCRIPTION, xml, archiveComment, charset);
        log.info("Wrote {}", target);
        return target;
    }

    /**
     * Save into {@code targetDir}. {@code fileName} defaults to the source file name and gets
     * {@code .fmu} appended when it lacks the extension.
     */
    public Path saveCopy(Path targetDir, String fileName) throws IOException {
        if (targetDir == null) throw new IllegalArgumentException("targetDir must not be null");
        String name = fileName == null ? sourcePath.getFileName().toString() : fileName;
        if (name.isBlank() || name.contains("/") || name.contains("\\")) {
            throw new IllegalArgumentException("fileName must be a plain file name: " + fileName);
        }
        if (!name.endsWith(FMU_EXTENSION)) {
            name = name + FMU_EXTENSION;
        }
        Files.createDirectories(targetDir);
        return save(targetDir.resolve(name));
    }

    public Path saveCopy(Path targetDir) throws IOException {
        return saveCopy(targetDir, null);
    }

    @Override
    public String toString() {
        return "FmuArchive{" + sourcePath + ", members=" + members.size() + "}";
    }
}
