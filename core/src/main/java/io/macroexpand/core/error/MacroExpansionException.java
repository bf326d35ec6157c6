package io.macroexpand.core.error;

import io.macroexpand.core.model.Diagnostic;
import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.syntax.SourceLocation;

/**
 * Abstract parent for errors raised while a compilation unit is expanded. The engine never lets
 * these escape {@code expand()}: each one is converted to a {@link Diagnostic} with
 * {@link #toDiagnostic()}.
 */
public abstract class MacroExpansionException extends MacroException {

    private static final long serialVersionUID = 1L;

    private final transient SourceLocation location;
    private final DiagnosticCode code;

    protected MacroExpansionException(
            String message, String macroName, SourceLocation location, DiagnosticCode code) {
        super(message, macroName, Phase.EXPANSION);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.code = code;
    }

    protected MacroExpansionException(
            String message, Throwable cause, String macroName, SourceLocation location, DiagnosticCode code) {
        super(message, cause, macroName, Phase.EXPANSION);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.code = code;
    }

    public SourceLocation location() {
        return location;
    }

    public DiagnosticCode code() {
        return code;
    }

    /** Whether this error invalidates its whole batch. */
    public boolean isBatchFatal() {
        return code.batchFatal();
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.error(code, getMessage(), location, macroName());
    }
}
