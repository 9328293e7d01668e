package info.isaksson.erland.fmuhandler.error;

/**
 * Well-formed XML that does not have the shape of an FMI 2.0 model description: missing
 * required attributes, an unknown or missing typed value element, duplicate variable names.
 */
public class ModelDescriptionParseException extends FmuHandlerException {

    /** Name of the offending ScalarVariable, or {@code null} when the problem is document level. */
    private final String variableName;

    public ModelDescriptionParseException(String message) {
        this(message, null, null);
    }

    public ModelDescriptionParseException(String message, String variableName) {
        this(message, variableName, null);
    }

    public ModelDescriptionParseException(String message, String variableName, Throwable cause) {
        super(variableName == null ? message : message + " [ScalarVariable '" + variableName + "']", cause);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
