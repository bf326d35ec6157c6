package io.macroexpand.core.error;

/** Thrown when a macro manifest has invalid syntax, fails schema validation or is inconsistent. */
public final class ManifestParseException extends MacroRegistrationException {

    private static final long serialVersionUID = 1L;

    public ManifestParseException(String message, String macroName, String source) {
        super(message, macroName, source);
    }

    public ManifestParseException(String message, Throwable cause, String macroName, String source) {
        super(message, cause, macroName, source);
    }
}
