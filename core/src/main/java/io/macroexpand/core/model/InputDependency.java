package io.macroexpand.core.model;

/** Parts of the enclosing type a role reads besides its own target declaration. */
public enum InputDependency {

    /** The stored properties of the enclosing type, including macro-produced ones. */
    STORED_PROPERTIES("stored-properties"),

    /** The full member list of the enclosing type, including macro-produced members. */
    MEMBERS("members");

    private final String label;

    InputDependency(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Looks up a dependency by its manifest label.
     *
     * @throws IllegalArgumentException if no dependency has that label
     */
    public static InputDependency fromLabel(String label) {
        for (InputDependency dependency : values()) {
            if (dependency.label.equals(label)) {
                return dependency;
            }
        }
        throw new IllegalArgumentException("Unknown input dependency '" + label + "'");
    }
}
