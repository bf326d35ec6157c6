package io.macroexpand.core.error;

import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.syntax.SourceLocation;

/** An attribute names no registered macro. */
public final class UnknownMacroException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public UnknownMacroException(String macroName, SourceLocation location) {
        super("No macro named '" + macroName + "' is registered", macroName, location, DiagnosticCode.UNKNOWN_MACRO);
    }
}
