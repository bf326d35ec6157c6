package io.macroexpand.core.syntax;

import java.util.Objects;

/**
 * One accessor of a property or subscript.
 *
 * @param kind the accessor kind
 * @param body body text, kept verbatim
 */
public record Accessor(AccessorKind kind, String body) {

    public Accessor {
        Objects.requireNonNull(kind, "kind must not be null");
        body = body != null ? body : "";
    }

    public static Accessor getter(String body) {
        return new Accessor(AccessorKind.GET, body);
    }

    public static Accessor setter(String body) {
        return new Accessor(AccessorKind.SET, body);
    }

    public String render() {
        return kind.keyword() + " { " + body + " }";
    }
}
