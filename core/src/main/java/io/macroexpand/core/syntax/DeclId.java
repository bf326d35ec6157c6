package io.macroexpand.core.syntax;

import java.util.Objects;

/**
 * Stable identity of a declaration within one compilation unit. Tree versions produced by
 * copy-with-replacement keep the ids of untouched declarations, so an id can be used to locate a
 * declaration in any later version of the tree.
 *
 * @param value the non-empty id text
 */
public record DeclId(String value) {

    public DeclId {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("declaration id must not be empty");
        }
    }

    public static DeclId of(String value) {
        return new DeclId(value);
    }

    /** Derives the id of a nested or produced declaration. */
    public DeclId child(String suffix) {
        return new DeclId(value + "/" + suffix);
    }

    @Override
    public String toString() {
        return value;
    }
}
