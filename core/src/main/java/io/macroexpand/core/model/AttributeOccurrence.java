package io.macroexpand.core.model;

import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.DeclId;
import java.util.Objects;

/**
 * An attribute on a declaration that resolved to a macro definition.
 *
 * @param target    the declaration the attribute is written on
 * @param attribute the attribute node, including its argument syntax
 * @param ordinal   index of the attribute in the declaration's attribute list (source order)
 * @param macro     the resolved definition
 */
public record AttributeOccurrence(DeclId target, Attribute attribute, int ordinal, MacroDefinition macro) {

    public AttributeOccurrence {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(attribute, "attribute must not be null");
        Objects.requireNonNull(macro, "macro must not be null");
    }

    /** Identity of this occurrence that survives tree versions. */
    public OccurrenceKey key() {
        return new OccurrenceKey(target, ordinal, attribute.name());
    }
}
