package info.isaksson.erland.fmuhandler.xml;

import java.util.Objects;

/** One schema validation finding. Line and column are 1-based, {@code -1} when unknown. */
public final class ValidationDiagnostic {

    public enum Severity {
        WARNING,
        ERROR
    }

    public final Severity severity;
    public final int line;
    public final int column;
    public final String message;

    public ValidationDiagnostic(Severity severity, int line, int column, String message) {
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.line = line;
        this.column = column;
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationDiagnostic)) return false;
        ValidationDiagnostic that = (ValidationDiagnostic) o;
        return line == that.line && column == that.column && severity == that.severity && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, line, column, message);
    }

    @Override
    public String toString() {
        return severity + " line " + line + ", column " + column + ": " + message;
    }
}
