package io.macroexpand.core.error;

import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.syntax.SourceLocation;

/** A produced declaration uses a name its role did not declare. */
public final class InvalidIntroducedNameException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    private final String introducedName;

    public InvalidIntroducedNameException(
            String message, String macroName, String introducedName, SourceLocation location) {
        super(message, macroName, location, DiagnosticCode.INVALID_INTRODUCED_NAME);
        this.introducedName = introducedName;
    }

    public String introducedName() {
        return introducedName;
    }
}
