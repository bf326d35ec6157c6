package io.macroexpand.core.error;

/**
 * Abstract parent for errors raised while macro definitions are registered or loaded from a
 * manifest. These are thrown to the caller; they never become diagnostics. Carries a {@code source}
 * naming the manifest or API call that supplied the definition.
 */
public abstract class MacroRegistrationException extends MacroException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected MacroRegistrationException(String message, String macroName, String source) {
        super(message, macroName, Phase.REGISTRATION);
        this.source = source;
    }

    protected MacroRegistrationException(String message, Throwable cause, String macroName, String source) {
        super(message, cause, macroName, Phase.REGISTRATION);
        this.source = source;
    }

    /** The manifest path, or {@code null} for programmatic registration. */
    public String source() {
        return source;
    }
}
