package info.isaksson.erland.fmuhandler.error;

/** Raised when adding or renaming a variable would give two ScalarVariables the same name. */
public class DuplicateVariableException extends FmuHandlerException {

    private final String variableName;

    public DuplicateVariableException(String variableName) {
        super("Scalar variable already exists: " + variableName);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
