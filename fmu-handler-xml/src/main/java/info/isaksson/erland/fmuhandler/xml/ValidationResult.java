package info.isaksson.erland.fmuhandler.xml;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating a model description against an XML Schema.
 *
 * <p>A document is valid when no diagnostic has severity {@link ValidationDiagnostic.Severity#ERROR};
 * warnings are reported but do not affect validity. Diagnostics keep the order in which the
 * validator reported them, which follows document order.</p>
 */
public final class ValidationResult {

    public final boolean valid;
    public final List<ValidationDiagnostic> diagnostics;

    public ValidationResult(List<ValidationDiagnostic> diagnostics) {
        this.diagnostics = diagnostics == null ? Collections.emptyList() : List.copyOf(diagnostics);
        this.valid = this.diagnostics.stream().noneMatch(ValidationDiagnostic::isError);
    }

    public List<ValidationDiagnostic> errors() {
        return diagnostics.stream().filter(ValidationDiagnostic::isError).collect(Collectors.toUnmodifiableList());
    }

    /** Multi-line text listing all diagnostics; suitable for logs and exception messages. */
    public String summary() {
        if (diagnostics.isEmpty()) return "valid";
        StringBuilder sb = new StringBuilder();
        sb.append(valid ? "valid" : "invalid").append(" (").append(errors().size()).append(" error(s), ")
                .append(diagnostics.size() - errors().size()).append(" warning(s))");
        for (ValidationDiagnostic d : diagnostics) {
            sb.append('\n').append("  ").append(d);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + valid + ", diagnostics=" + diagnostics.size() + "}";
    }
}
