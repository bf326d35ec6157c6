package io.macroexpand.core.syntax;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A nominal type or extension declaration with its member list.
 *
 * @param id             declaration id
 * @param kind           struct, class, extension, ...
 * @param name           type name (the extended type's name for extensions)
 * @param attributes     attributes in source order
 * @param inheritedTypes inheritance clause entries
 * @param members        member declarations in source order
 * @param location       source location
 */
public record TypeDecl(
        DeclId id,
        TypeKind kind,
        String name,
        List<Attribute> attributes,
        List<String> inheritedTypes,
        List<Declaration> members,
        SourceLocation location)
        implements Declaration {

    public TypeDecl {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
        inheritedTypes = inheritedTypes != null ? List.copyOf(inheritedTypes) : List.of();
        members = members != null ? List.copyOf(members) : List.of();
        location = location != null ? location : SourceLocation.UNKNOWN;
    }

    @Override
    public Set<Position> positions() {
        return kind == TypeKind.EXTENSION ? Set.of(Position.EXTENSION) : Set.of(Position.TYPE);
    }

    /** Members that are stored properties, in source order. */
    public List<VariableDecl> storedProperties() {
        return members.stream()
                .filter(VariableDecl.class::isInstance)
                .map(VariableDecl.class::cast)
                .filter(VariableDecl::isStored)
                .toList();
    }

    /** Returns {@code true} if a direct member has the given base name. */
    public boolean hasMemberNamed(String memberName) {
        return members.stream().anyMatch(member -> member.name().equals(memberName));
    }

    @Override
    public TypeDecl withId(DeclId newId) {
        return new TypeDecl(newId, kind, name, attributes, inheritedTypes, members, location);
    }

    @Override
    public TypeDecl withAttributes(List<Attribute> newAttributes) {
        return new TypeDecl(id, kind, name, newAttributes, inheritedTypes, members, location);
    }

    public TypeDecl withMembers(List<Declaration> newMembers) {
        return new TypeDecl(id, kind, name, attributes, inheritedTypes, newMembers, location);
    }

    @Override
    public String signature() {
        return kind.name().toLowerCase() + " " + name;
    }
}
