package io.macroexpand.core.model;

import io.macroexpand.core.syntax.SourceLocation;
import java.util.Objects;

/**
 * A problem reported to the compilation driver.
 *
 * @param severity  error, warning or note
 * @param code      diagnostic class
 * @param message   human-readable description
 * @param location  source location, {@link SourceLocation#UNKNOWN} when not attributable
 * @param macroName the macro involved, or {@code null}
 */
public record Diagnostic(
        Severity severity, DiagnosticCode code, String message, SourceLocation location, String macroName) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public static Diagnostic error(DiagnosticCode code, String message, SourceLocation location, String macroName) {
        return new Diagnostic(Severity.ERROR, code, message, location, macroName);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return location + ": " + severity.name().toLowerCase() + ": " + message + " [" + code.urn() + "]";
    }
}
