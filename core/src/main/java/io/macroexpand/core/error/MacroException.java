package io.macroexpand.core.error;

/**
 * Abstract base for all macro-expansion exceptions. Never thrown directly; use the concrete
 * subclasses under {@link MacroRegistrationException} or {@link MacroExpansionException}.
 */
public abstract class MacroException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        REGISTRATION,
        EXPANSION
    }

    private final String macroName;
    private final Phase phase;

    protected MacroException(String message, String macroName, Phase phase) {
        super(message);
        this.macroName = macroName;
        this.phase = phase;
    }

    protected MacroException(String message, Throwable cause, String macroName, Phase phase) {
        super(message, cause);
        this.macroName = macroName;
        this.phase = phase;
    }

    /** The macro involved, or {@code null} if not yet identified. */
    public String macroName() {
        return macroName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    public Phase phase() {
        return phase;
    }
}
