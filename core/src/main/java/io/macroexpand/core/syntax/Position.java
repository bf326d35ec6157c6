package io.macroexpand.core.syntax;

/**
 * Syntactic position of a declaration, used to decide which macro roles may apply to it. A
 * declaration can occupy more than one position (an async function is both {@link #FUNCTION} and
 * {@link #ASYNC_FUNCTION}).
 */
public enum Position {
    TYPE("type"),
    EXTENSION("extension"),
    FUNCTION("function"),
    ASYNC_FUNCTION("async-function"),
    STORED_PROPERTY("stored-property"),
    COMPUTED_PROPERTY("computed-property"),
    SUBSCRIPT("subscript");

    private final String label;

    Position(String label) {
        this.label = label;
    }

    /** The lowercase name used in manifests and diagnostics. */
    public String label() {
        return label;
    }

    /**
     * Looks up a position by its manifest label.
     *
     * @throws IllegalArgumentException if no position has that label
     */
    public static Position fromLabel(String label) {
        for (Position position : values()) {
            if (position.label.equals(label)) {
                return position;
            }
        }
        throw new IllegalArgumentException("Unknown position '" + label + "'");
    }
}
