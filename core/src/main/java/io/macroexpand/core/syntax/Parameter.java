package io.macroexpand.core.syntax;

import java.util.Objects;

/**
 * A function or subscript parameter.
 *
 * @param label argument label, or {@code null} when it equals the name; {@code "_"} for none
 * @param name  parameter name used in the body
 * @param type  type text
 */
public record Parameter(String label, String name, String type) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static Parameter of(String name, String type) {
        return new Parameter(null, name, type);
    }

    /** The label a caller writes, or {@code null} for an unlabeled argument. */
    public String callLabel() {
        if (label == null) {
            return name;
        }
        return "_".equals(label) ? null : label;
    }

    public String render() {
        String prefix = label == null ? name : label + " " + name;
        return prefix + ": " + type;
    }
}
