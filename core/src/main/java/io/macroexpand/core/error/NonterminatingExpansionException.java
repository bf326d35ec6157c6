package io.macroexpand.core.error;

import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.syntax.SourceLocation;

/** Expansion in a batch revisited a state or did not settle within the iteration limit. */
public final class NonterminatingExpansionException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public NonterminatingExpansionException(String message, String macroName, SourceLocation location) {
        super(message, macroName, location, DiagnosticCode.NONTERMINATING_EXPANSION);
    }
}
