package info.isaksson.erland.fmuhandler.testutil;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Builds small FMU archives for tests. */
public final class FmuFixtures {

    public static final long ENTRY_TIME = LocalDateTime.of(2021, 3, 4, 10, 20, 30)
            .atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();

    public static final byte[] BINARY = new byte[]{0x7f, 'E', 'L', 'F', 0, 1, 2, 3, (byte) 0xff, (byte) 0xfe, 10, 13};

    public static final String PARAMETERS_AB = """
            <?xml version="1.0" encoding="UTF-8"?>
            <fmiModelDescription fmiVersion="2.0" modelName="ab" guid="{0000-ab}">
              <CoSimulation modelIdentifier="ab"/>
              <ModelVariables>
                <ScalarVariable name="A" valueReference="0" causality="parameter" variability="fixed">
                  <Real start="1.0"/>
                </ScalarVariable>
                <ScalarVariable name="B" valueReference="1" causality="parameter" variability="fixed">
                  <Real start="2.0"/>
                </ScalarVariable>
              </ModelVariables>
              <ModelStructure/>
            </fmiModelDescription>
            """;

    public static final String VAR1 = """
            <?xml version="1.0" encoding="UTF-8"?>
            <fmiModelDescription fmiVersion="2.0" modelName="v" guid="{0000-v}">
              <ModelVariables>
                <ScalarVariable name="Var1" valueReference="0" causality="parameter" variability="tunable">
                  <Real start="0.0" unit="m"/>
                </ScalarVariable>
                <ScalarVariable name="y" valueReference="1" causality="output">
                  <Real/>
                </ScalarVariable>
              </ModelVariables>
              <ModelStructure>
                <Outputs>
                  <Unknown index="2"/>
                </Outputs>
              </ModelStructure>
            </fmiModelDescription>
            """;

    private FmuFixtures() {}

    /**
     * An FMU with a directory entry, a stored binary, the model description and a deflated
     * documentation page, in that order.
     */
    public static Path writeFmu(Path file, String modelDescription) throws IOException {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("binaries/", new byte[0]);
        members.put("binaries/linux64/model.so", BINARY);
        members.put("modelDescription.xml", modelDescription.getBytes(StandardCharsets.UTF_8));
        members.put("documentation/index.html", "<html><body>doc</body></html>".getBytes(StandardCharsets.UTF_8));
        return writeZip(file, members);
    }

    /** Like {@link #writeFmu} with the archive comment encoded in {@code charset}. */
    public static Path writeFmu(Path file, String modelDescription, Charset charset, String comment) throws IOException {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("modelDescription.xml", modelDescription.getBytes(StandardCharsets.UTF_8));
        members.put("binaries/linux64/model.so", BINARY);
        return writeZip(file, members, charset, comment);
    }

    public static Path writeZip(Path file, Map<String, byte[]> members) throws IOException {
        return writeZip(file, members, StandardCharsets.UTF_8, "fixture");
    }

    public static Path writeZip(Path file, Map<String, byte[]> members, Charset charset, String comment) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (OutputStream out = Files.newOutputStream(file);
             ZipOutputStream zip = new ZipOutputStream(out, charset)) {
            zip.setComment(comment);
            for (Map.Entry<String, byte[]> m : members.entrySet()) {
                ZipEntry e = new ZipEntry(m.getKey());
                e.setTime(ENTRY_TIME);
                if (m.getKey().endsWith(".so")) {
                    CRC32 crc = new CRC32();
                    crc.update(m.getValue());
                    e.setMethod(ZipEntry.STORED);
                    e.setSize(m.getValue().length);
                    e.setCompressedSize(m.getValue().length);
                    e.setCrc(crc.getValue());
                    e.setComment("native");
                }
                zip.putNextEntry(e);
                zip.write(m.getValue());
                zip.closeEntry();
            }
        }
        return file;
    }
}
