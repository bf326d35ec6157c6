package io.macroexpand.core.syntax;

import java.util.Objects;

/**
 * An attribute written on a declaration, e.g. {@code @AddCompletionHandler} or
 * {@code @Wrapper(storage: "_values")}. The argument text is kept verbatim; interpreting it is up
 * to the macro implementation.
 *
 * @param name      attribute name without the leading {@code @}
 * @param arguments raw argument text without the parentheses, empty when absent
 * @param location  where the attribute was written
 */
public record Attribute(String name, String arguments, SourceLocation location) {

    public Attribute {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("attribute name must not be empty");
        }
        arguments = arguments != null ? arguments : "";
        location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public static Attribute of(String name) {
        return new Attribute(name, "", SourceLocation.UNKNOWN);
    }

    public static Attribute of(String name, String arguments) {
        return new Attribute(name, arguments, SourceLocation.UNKNOWN);
    }

    /**
     * Returns {@code true} if both attributes have the same name and argument text. Locations are
     * ignored, so an attribute added by a macro and one written by hand count as the same.
     */
    public boolean sameAs(Attribute other) {
        return other != null && name.equals(other.name) && arguments.equals(other.arguments);
    }

    /** Renders the attribute as source text. */
    public String render() {
        return arguments.isEmpty() ? "@" + name : "@" + name + "(" + arguments + ")";
    }
}
