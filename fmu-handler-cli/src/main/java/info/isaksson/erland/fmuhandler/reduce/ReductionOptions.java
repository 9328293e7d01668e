package info.isaksson.erland.fmuhandler.reduce;

import java.nio.file.Path;

/**
 * Where reduced FMUs are written.
 *
 * <p>Without output directory and suffix every FMU is overwritten in place.</p>
 */
public final class ReductionOptions {

    private static final ReductionOptions DEFAULTS = new ReductionOptions(null, "");

    /** {@code null} writes next to the source FMU. */
    public final Path outputDir;
    /** Appended to the file stem; empty or starting with {@code _}. */
    public final String suffix;

    private ReductionOptions(Path outputDir, String suffix) {
        this.outputDir = outputDir;
        this.suffix = suffix;
    }

    public static ReductionOptions defaults() {
        return DEFAULTS;
    }

    public ReductionOptions withOutputDir(Path outputDir) {
        return new ReductionOptions(outputDir, suffix);
    }

    public ReductionOptions withSuffix(String suffix) {
        return new ReductionOptions(outputDir, normalizeSuffix(suffix));
    }

    static String normalizeSuffix(String suffix) {
        if (suffix == null || suffix.isEmpty()) return "";
        return suffix.startsWith("_") ? suffix : "_" + suffix;
    }

    /** Target file for {@code source}: the stem plus suffix, in the output directory or next to the source. */
    public Path targetFor(Path source) {
        String fileName = source.getFileName().toString();
        String stem = fileName.endsWith(".fmu") ? fileName.substring(0, fileName.length() - 4) : fileName;
        Path dir = outputDir != null ? outputDir : source.toAbsolutePath().getParent();
        return dir.resolve(stem + suffix + ".fmu");
    }

    @Override
    public String toString() {
        return "ReductionOptions{outputDir=" + outputDir + ", suffix='" + suffix + "'}";
    }
}
