package info.isaksson.erland.fmuhandler.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Deterministic FMU discovery.
 *
 * The scanner returns a stable, sorted list of {@code .fmu} files directly inside a directory;
 * subdirectories are not searched.
 */
public final class FmuScanner {

    private FmuScanner() {}

    public static List<Path> scan(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir");
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".fmu"))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }
}
