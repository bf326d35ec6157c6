package io.macroexpand.core.error;

/** Thrown when a definition's roles or functions are structurally inconsistent. */
public final class InvalidRoleCombinationException extends MacroRegistrationException {

    private static final long serialVersionUID = 1L;

    public InvalidRoleCombinationException(String message, String macroName) {
        super(message, macroName, null);
    }

    public InvalidRoleCombinationException(String message, String macroName, String source) {
        super(message, macroName, source);
    }
}
