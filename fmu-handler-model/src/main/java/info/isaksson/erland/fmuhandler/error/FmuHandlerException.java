package info.isaksson.erland.fmuhandler.error;

/**
 * Base type of every domain failure raised by fmu-handler.
 *
 * <p>All subclasses are unchecked so batch callers can catch this single type per file and
 * continue with the next one. Plain I/O problems are reported as {@link java.io.IOException}
 * instead.</p>
 */
public class FmuHandlerException extends RuntimeException {

    public FmuHandlerException(String message) {
        super(message);
    }

    public FmuHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
