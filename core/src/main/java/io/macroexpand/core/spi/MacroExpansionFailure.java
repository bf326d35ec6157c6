package io.macroexpand.core.spi;

import io.macroexpand.core.syntax.SourceLocation;

/**
 * Thrown by a macro implementation to reject its input. The engine reports it as a macro
 * implementation error at {@link #location()}, or at the attribute when no location is given.
 */
public class MacroExpansionFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient SourceLocation location;

    public MacroExpansionFailure(String message) {
        this(message, null);
    }

    public MacroExpansionFailure(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    /** Where the problem is, or {@code null} to use the attribute's location. */
    public SourceLocation location() {
        return location;
    }
}
