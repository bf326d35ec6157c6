package io.macroexpand.core.error;

/** Thrown when a macro with the same module and name is registered twice. */
public final class DuplicateMacroException extends MacroRegistrationException {

    private static final long serialVersionUID = 1L;

    public DuplicateMacroException(String message, String macroName) {
        super(message, macroName, null);
    }
}
