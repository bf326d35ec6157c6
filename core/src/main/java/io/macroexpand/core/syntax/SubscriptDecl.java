package io.macroexpand.core.syntax;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A subscript declaration. Its base name is always {@code subscript}.
 *
 * @param id         declaration id
 * @param parameters index parameters
 * @param returnType element type text
 * @param accessors  accessor block, or {@code null}
 * @param attributes attributes in source order
 * @param location   source location
 */
public record SubscriptDecl(
        DeclId id,
        List<Parameter> parameters,
        String returnType,
        AccessorBlock accessors,
        List<Attribute> attributes,
        SourceLocation location)
        implements Declaration {

    public static final String BASE_NAME = "subscript";

    public SubscriptDecl {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(returnType, "returnType must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
        location = location != null ? location : SourceLocation.UNKNOWN;
    }

    @Override
    public String name() {
        return BASE_NAME;
    }

    @Override
    public Set<Position> positions() {
        return Set.of(Position.SUBSCRIPT);
    }

    @Override
    public SubscriptDecl withId(DeclId newId) {
        return new SubscriptDecl(newId, parameters, returnType, accessors, attributes, location);
    }

    @Override
    public SubscriptDecl withAttributes(List<Attribute> newAttributes) {
        return new SubscriptDecl(id, parameters, returnType, accessors, newAttributes, location);
    }

    public SubscriptDecl withAccessorBlock(AccessorBlock newAccessors) {
        return new SubscriptDecl(id, parameters, returnType, newAccessors, attributes, location);
    }

    @Override
    public String signature() {
        String params = parameters.stream().map(Parameter::render).collect(Collectors.joining(", "));
        return "subscript(" + params + ") -> " + returnType;
    }
}
