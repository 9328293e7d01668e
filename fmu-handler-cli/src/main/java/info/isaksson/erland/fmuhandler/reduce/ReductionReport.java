package info.isaksson.erland.fmuhandler.reduce;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/** Outcome of reducing every FMU of a directory. */
public final class ReductionReport {

    public static final class FileResult {
        public final Path source;
        /** {@code null} when the FMU failed. */
        public final Path target;
        public final List<String> deleted;
        /** {@code null} on success. */
        public final Exception error;

        private FileResult(Path source, Path target, List<String> deleted, Exception error) {
            this.source = source;
            this.target = target;
            this.deleted = deleted == null ? Collections.emptyList() : List.copyOf(deleted);
            this.error = error;
        }

        static FileResult success(Path source, Path target, List<String> deleted) {
            return new FileResult(source, target, deleted, null);
        }

        static FileResult failure(Path source, Exception error) {
            return new FileResult(source, null, null, error);
        }

        public boolean ok() {
            return error == null;
        }
    }

    public final List<FileResult> files;

    ReductionReport(List<FileResult> files) {
        this.files = List.copyOf(files);
    }

    public long failureCount() {
        return files.stream().filter(f -> !f.ok()).count();
    }

    public boolean allOk() {
        return failureCount() == 0;
    }
}
