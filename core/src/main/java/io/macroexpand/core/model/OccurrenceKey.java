package io.macroexpand.core.model;

import io.macroexpand.core.syntax.DeclId;

/**
 * Identifies an attribute occurrence across tree versions. Attribute lists only ever grow at the
 * end, so a declaration id plus the attribute's index stays valid in every later version.
 */
public record OccurrenceKey(DeclId target, int ordinal, String name) {

    @Override
    public String toString() {
        return target + "#" + ordinal + "@" + name;
    }
}
