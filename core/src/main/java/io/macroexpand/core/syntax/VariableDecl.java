package io.macroexpand.core.syntax;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A property or variable declaration.
 *
 * @param id          declaration id
 * @param binding     {@code let} or {@code var}
 * @param name        property name
 * @param type        type annotation text, or {@code null}
 * @param initializer initializer expression text, or {@code null}
 * @param accessors   accessor block, or {@code null} for a plain stored property
 * @param attributes  attributes in source order
 * @param location    source location
 */
public record VariableDecl(
        DeclId id,
        Binding binding,
        String name,
        String type,
        String initializer,
        AccessorBlock accessors,
        List<Attribute> attributes,
        SourceLocation location)
        implements Declaration {

    public VariableDecl {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(binding, "binding must not be null");
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
        location = location != null ? location : SourceLocation.UNKNOWN;
    }

    /** A property is stored unless it has accessors other than observers. */
    public boolean isStored() {
        return accessors == null || accessors.isObserversOnly();
    }

    @Override
    public Set<Position> positions() {
        return isStored() ? Set.of(Position.STORED_PROPERTY) : Set.of(Position.COMPUTED_PROPERTY);
    }

    @Override
    public VariableDecl withId(DeclId newId) {
        return new VariableDecl(newId, binding, name, type, initializer, accessors, attributes, location);
    }

    @Override
    public VariableDecl withAttributes(List<Attribute> newAttributes) {
        return new VariableDecl(id, binding, name, type, initializer, accessors, newAttributes, location);
    }

    /** Replaces the accessor block and drops the initializer. */
    public VariableDecl withAccessorBlock(AccessorBlock newAccessors) {
        return new VariableDecl(id, binding, name, type, null, newAccessors, attributes, location);
    }

    @Override
    public String signature() {
        return binding.name().toLowerCase() + " " + name + (type != null ? ": " + type : "");
    }
}
