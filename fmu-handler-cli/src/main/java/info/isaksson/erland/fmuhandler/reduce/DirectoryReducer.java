package info.isaksson.erland.fmuhandler.reduce;

import info.isaksson.erland.fmuhandler.core.FmuArchive;
import info.isaksson.erland.fmuhandler.error.FmuHandlerException;
import info.isaksson.erland.fmuhandler.io.FmuScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies a {@link ReductionConfig} to every FMU directly inside a directory.
 *
 * <p>A failing FMU is recorded in the report and the remaining files are still processed.</p>
 */
public final class DirectoryReducer {

    private static final Logger log = LoggerFactory.getLogger(DirectoryReducer.class);

    /**
     * @throws IOException if the directory cannot be listed or the output directory cannot be created
     */
    public ReductionReport reduceDirectory(Path fmuDir, ReductionConfig config, ReductionOptions options) throws IOException {
        if (fmuDir == null) throw new IllegalArgumentException("fmuDir must not be null");
        if (config == null) throw new IllegalArgumentException("config must not be null");
        if (options == null) options = ReductionOptions.defaults();

        List<Path> fmus = FmuScanner.scan(fmuDir);
        if (options.outputDir != null) {
            Files.createDirectories(options.outputDir);
        }
        log.info("Reducing {} FMU(s) in {}", fmus.size(), fmuDir);
        if (config.isEmpty()) {
            log.warn("Reduction config has no delete patterns; FMUs are rewritten unchanged");
        }

        ParameterReducer reducer = new ParameterReducer(config);
        List<ReductionReport.FileResult> results = new ArrayList<>();
        for (Path fmu : fmus) {
            results.add(reduceOne(fmu, reducer, options));
        }
        return new ReductionReport(results);
    }

    private static ReductionReport.FileResult reduceOne(Path fmu, ParameterReducer reducer, ReductionOptions options) {
        try {
            FmuArchive archive = FmuArchive.open(fmu);
            List<String> deleted = reducer.reduce(archive);
            Path target = archive.save(options.targetFor(fmu));
            log.info("{}: deleted {} parameter(s) -> {}", fmu.getFileName(), deleted.size(), target);
            return ReductionReport.FileResult.success(fmu, target, deleted);
        } catch (IOException | FmuHandlerException e) {
            log.warn("Skipping {}: {}", fmu.getFileName(), e.getMessage());
            return ReductionReport.FileResult.failure(fmu, e);
        }
    }
}
