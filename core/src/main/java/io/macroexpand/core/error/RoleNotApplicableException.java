package io.macroexpand.core.error;

import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.syntax.SourceLocation;

/** None of a macro's roles can expand on the declaration the attribute is attached to. */
public final class RoleNotApplicableException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public RoleNotApplicableException(String message, String macroName, SourceLocation location) {
        super(message, macroName, location, DiagnosticCode.ROLE_NOT_APPLICABLE);
    }
}
