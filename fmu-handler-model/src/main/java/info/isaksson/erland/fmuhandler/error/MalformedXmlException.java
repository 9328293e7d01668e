package info.isaksson.erland.fmuhandler.error;

/**
 * The model description is not well-formed XML.
 *
 * <p>Line and column are 1-based; {@code -1} when the parser did not report a location.</p>
 */
public class MalformedXmlException extends FmuHandlerException {

    private final int line;
    private final int column;

    public MalformedXmlException(String message, int line, int column, Throwable cause) {
        super(line > 0 ? message + " (line " + line + ", column " + column + ")" : message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
