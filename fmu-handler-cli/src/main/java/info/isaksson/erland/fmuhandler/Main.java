package info.isaksson.erland.fmuhandler;

import info.isaksson.erland.fmuhandler.reduce.DirectoryReducer;
import info.isaksson.erland.fmuhandler.reduce.ReductionConfig;
import info.isaksson.erland.fmuhandler.reduce.ReductionConfigJson;
import info.isaksson.erland.fmuhandler.reduce.ReductionOptions;
import info.isaksson.erland.fmuhandler.reduce.ReductionReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI entrypoint: reduce the parameters of all FMUs in a directory according to a JSON config.
 *
 * <p>Exit codes: 0 success, 1 usage error, 2 I/O failure before any FMU was processed,
 * 3 at least one FMU could not be reduced.</p>
 */
public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;
    static final int EXIT_FMU_FAILED = 3;

    private static final DirectoryReducer REDUCER = new DirectoryReducer();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return EXIT_USAGE;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return EXIT_OK;
        }

        if (parsed.dir == null) {
            System.err.println("Error: an FMU directory is required.");
            System.err.println();
            CliArgs.printHelp();
            return EXIT_USAGE;
        }

        final Path fmuDir = Paths.get(parsed.dir).toAbsolutePath().normalize();
        if (!Files.exists(fmuDir)) {
            System.err.println("Error: directory does not exist: " + fmuDir);
            return EXIT_USAGE;
        }
        if (!Files.isDirectory(fmuDir)) {
            System.err.println("Error: not a directory: " + fmuDir);
            return EXIT_USAGE;
        }

        final Path configPath = parsed.config != null
                ? Paths.get(parsed.config).toAbsolutePath().normalize()
                : fmuDir.resolve(ReductionConfig.DEFAULT_FILE_NAME);

        final ReductionConfig config;
        try {
            config = ReductionConfigJson.read(configPath);
        } catch (IOException e) {
            System.err.println("Error: could not read reduction config: " + configPath);
            System.err.println(e.getMessage());
            return EXIT_IO;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: invalid pattern in reduction config: " + e.getMessage());
            return EXIT_IO;
        }

        ReductionOptions options = ReductionOptions.defaults().withSuffix(parsed.suffix);
        if (parsed.output != null) {
            options = options.withOutputDir(Paths.get(parsed.output).toAbsolutePath().normalize());
        }

        final ReductionReport report;
        try {
            report = REDUCER.reduceDirectory(fmuDir, config, options);
        } catch (IOException e) {
            System.err.println("Error: could not process directory: " + fmuDir);
            System.err.println(e.getMessage());
            return EXIT_IO;
        }

        for (ReductionReport.FileResult f : report.files) {
            if (f.ok()) {
                System.out.println(f.source.getFileName() + ": deleted " + f.deleted.size() + " parameter(s) -> " + f.target);
            } else {
                System.err.println(f.source.getFileName() + ": FAILED " + f.error.getMessage());
            }
        }
        System.out.println("Processed " + report.files.size() + " FMU(s), " + report.failureCount() + " failed.");
        return report.allOk() ? EXIT_OK : EXIT_FMU_FAILED;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String dir;
        String config;
        String output;
        String suffix;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--dir":
                        out.dir = requireValue(args, ++i, "--dir");
                        break;
                    case "--config":
                    case "-c":
                        out.config = requireValue(args, ++i, "--config");
                        break;
                    case "--output":
                    case "-o":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--suffix":
                    case "-s":
                        out.suffix = requireValue(args, ++i, "--suffix");
                        break;
                    default:
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // a bare path is shorthand for --dir
                        if (out.dir == null) {
                            out.dir = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static void printHelp() {
            System.out.println(
                    "fmu-handler\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar fmu-handler-cli.jar <fmu-dir> [options]\n" +
                    "\n" +
                    "Reduces the parameters of every .fmu file in <fmu-dir>. A parameter is deleted when\n" +
                    "its name matches a delete_elements pattern and no keep_elements pattern.\n" +
                    "\n" +
                    "Options:\n" +
                    "  --dir <path>           Directory containing the FMUs (or give it as first argument)\n" +
                    "  -c, --config <file>    Reduction config (default: <fmu-dir>/" + ReductionConfig.DEFAULT_FILE_NAME + ")\n" +
                    "  -o, --output <dir>     Output directory (default: overwrite in <fmu-dir>)\n" +
                    "  -s, --suffix <text>    Appended to the file name, '_' is added in front when missing\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Exit codes: 0 ok, 1 usage error, 2 config or directory not readable, 3 some FMU failed\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar fmu-handler-cli.jar fmus --suffix reduced\n" +
                    "  java -jar fmu-handler-cli.jar --dir fmus --config keep.json --output out\n"
            );
        }
    }
}
