package io.macroexpand.core.syntax;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A function declaration.
 *
 * @param id         declaration id
 * @param name       base name
 * @param attributes attributes in source order
 * @param parameters parameters in order
 * @param returnType return type text, or {@code null} for none
 * @param isAsync    whether the function is marked {@code async}
 * @param isThrowing whether the function is marked {@code throws}
 * @param body       body text, or {@code null} for a requirement without a body
 * @param location   source location
 */
public record FunctionDecl(
        DeclId id,
        String name,
        List<Attribute> attributes,
        List<Parameter> parameters,
        String returnType,
        boolean isAsync,
        boolean isThrowing,
        String body,
        SourceLocation location)
        implements Declaration {

    public FunctionDecl {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        location = location != null ? location : SourceLocation.UNKNOWN;
    }

    @Override
    public Set<Position> positions() {
        Set<Position> positions = EnumSet.of(Position.FUNCTION);
        if (isAsync) {
            positions.add(Position.ASYNC_FUNCTION);
        }
        return Set.copyOf(positions);
    }

    @Override
    public FunctionDecl withId(DeclId newId) {
        return new FunctionDecl(newId, name, attributes, parameters, returnType, isAsync, isThrowing, body, location);
    }

    @Override
    public FunctionDecl withAttributes(List<Attribute> newAttributes) {
        return new FunctionDecl(id, name, newAttributes, parameters, returnType, isAsync, isThrowing, body, location);
    }

    @Override
    public String signature() {
        String params = parameters.stream().map(Parameter::render).collect(Collectors.joining(", "));
        return "func " + name + "(" + params + ")" + (isAsync ? " async" : "") + (isThrowing ? " throws" : "")
                + (returnType != null ? " -> " + returnType : "");
    }
}
