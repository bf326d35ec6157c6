package io.macroexpand.core.error;

import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.syntax.SourceLocation;

/** A macro body threw. The occurrence contributes no fragments. */
public final class MacroImplementationException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public MacroImplementationException(String message, Throwable cause, String macroName, SourceLocation location) {
        super(message, cause, macroName, location, DiagnosticCode.MACRO_IMPLEMENTATION_ERROR);
    }
}
