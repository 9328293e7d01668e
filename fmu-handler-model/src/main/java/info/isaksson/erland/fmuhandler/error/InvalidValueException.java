package info.isaksson.erland.fmuhandler.error;

import info.isaksson.erland.fmuhandler.model.ValueType;

/**
 * A start value does not match the declared type of its variable.
 *
 * <p>Raised both for values supplied by callers and for {@code start} attributes read from XML
 * whose text is not a valid literal of the declared type. No truncation or rounding is ever
 * applied to make a value fit.</p>
 */
public class InvalidValueException extends FmuHandlerException {

    private final String variableName;
    private final ValueType expectedType;
    private final Object actualValue;

    public InvalidValueException(String variableName, ValueType expectedType, Object actualValue, String detail) {
        super(buildMessage(variableName, expectedType, actualValue, detail));
        this.variableName = variableName;
        this.expectedType = expectedType;
        this.actualValue = actualValue;
    }

    public String getVariableName() {
        return variableName;
    }

    public ValueType getExpectedType() {
        return expectedType;
    }

    public Object getActualValue() {
        return actualValue;
    }

    private static String buildMessage(String variableName, ValueType expectedType, Object actualValue, String detail) {
        StringBuilder sb = new StringBuilder();
        sb.append("Invalid start value for '").append(variableName).append("': expected ")
                .append(expectedType == null ? "?" : expectedType.xmlName)
                .append(" but got ");
        if (actualValue == null) {
            sb.append("null");
        } else {
            sb.append(actualValue.getClass().getSimpleName()).append(" \"").append(actualValue).append('"');
        }
        if (detail != null && !detail.isBlank()) {
            sb.append(" (").append(detail).append(')');
        }
        return sb.toString();
    }
}
