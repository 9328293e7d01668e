package info.isaksson.erland.fmuhandler.xml;

import info.isaksson.erland.fmuhandler.error.FmuHandlerException;

import java.util.List;

/**
 * The model description does not conform to the FMI 2.0 schema. Raised before anything is
 * written, so the target archive is left untouched.
 */
public class SchemaValidationException extends FmuHandlerException {

    private final ValidationResult result;

    public SchemaValidationException(ValidationResult result) {
        super("modelDescription.xml failed schema validation: " + (result == null ? "?" : result.summary()));
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }

    public List<ValidationDiagnostic> getDiagnostics() {
        return result == null ? List.of() : result.diagnostics;
    }
}
