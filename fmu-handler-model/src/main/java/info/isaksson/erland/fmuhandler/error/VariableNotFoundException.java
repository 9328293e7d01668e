package info.isaksson.erland.fmuhandler.error;

public class VariableNotFoundException extends FmuHandlerException {

    private final String variableName;

    public VariableNotFoundException(String variableName) {
        super("Scalar variable not found: " + variableName);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
