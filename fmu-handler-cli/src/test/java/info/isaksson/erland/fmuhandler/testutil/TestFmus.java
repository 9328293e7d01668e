package info.isaksson.erland.fmuhandler.testutil;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Writes minimal FMUs whose model variables are given as {@code name:causality} pairs. */
public final class TestFmus {

    private TestFmus() {}

    public static Path write(Path file, String... variables) throws IOException {
        return writeRaw(file, modelDescription(variables), StandardCharsets.UTF_8, null);
    }

    /** An FMU whose archive comment is encoded as ISO-8859-1, as older Windows zip tools do. */
    public static Path writeLatin1(Path file, String comment, String... variables) throws IOException {
        return writeRaw(file, modelDescription(variables), StandardCharsets.ISO_8859_1, comment);
    }

    private static String modelDescription(String... variables) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<fmiModelDescription fmiVersion=\"2.0\" modelName=\"test\" guid=\"{test}\">\n")
                .append("  <ModelVariables>\n");
        for (int i = 0; i < variables.length; i++) {
            String[] parts = variables[i].split(":", 2);
            sb.append("    <ScalarVariable name=\"").append(parts[0]).append("\" valueReference=\"").append(i)
                    .append("\" causality=\"").append(parts.length > 1 ? parts[1] : "parameter").append("\">\n")
                    .append("      <Real start=\"1.0\"/>\n")
                    .append("    </ScalarVariable>\n");
        }
        sb.append("  </ModelVariables>\n")
                .append("  <ModelStructure/>\n")
                .append("</fmiModelDescription>\n");
        return sb.toString();
    }

    public static Path writeRaw(Path file, String modelDescription) throws IOException {
        return writeRaw(file, modelDescription, StandardCharsets.UTF_8, null);
    }

    private static Path writeRaw(Path file, String modelDescription, Charset charset, String comment) throws IOException {
        try (OutputStream out = Files.newOutputStream(file);
             ZipOutputStream zip = new ZipOutputStream(out, charset)) {
            if (comment != null) {
                zip.setComment(comment);
            }
            zip.putNextEntry(new ZipEntry("modelDescription.xml"));
            zip.write(modelDescription.getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry("resources/data.txt"));
            zip.write("payload".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        return file;
    }
}
