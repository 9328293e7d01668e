package info.isaksson.erland.fmuhandler.error;

import java.nio.file.Path;

/** The file is not a readable zip archive, or it has no {@code modelDescription.xml} member. */
public class ArchiveFormatException extends FmuHandlerException {

    private final Path archive;

    public ArchiveFormatException(Path archive, String message) {
        this(archive, message, null);
    }

    public ArchiveFormatException(Path archive, String message, Throwable cause) {
        super(message + ": " + archive, cause);
        this.archive = archive;
    }

    public Path getArchive() {
        return archive;
    }
}
