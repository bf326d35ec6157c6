package io.macroexpand.core.error;

import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.syntax.SourceLocation;

/** A role produced a stored property without declaring that it introduces stored properties. */
public final class UndeclaredStoredPropertyException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public UndeclaredStoredPropertyException(String message, String macroName, SourceLocation location) {
        super(message, macroName, location, DiagnosticCode.UNDECLARED_STORED_PROPERTY);
    }
}
