package io.macroexpand.core.syntax;

import java.util.List;
import java.util.Set;

/**
 * An immutable declaration node. Every {@code with*} method returns a new node; nothing in the
 * tree is ever mutated in place.
 */
public sealed interface Declaration permits TypeDecl, FunctionDecl, VariableDecl, SubscriptDecl {

    DeclId id();

    /** The base name macros use for name-introduction checks. */
    String name();

    List<Attribute> attributes();

    SourceLocation location();

    /** The syntactic positions this declaration occupies. */
    Set<Position> positions();

    Declaration withId(DeclId id);

    Declaration withAttributes(List<Attribute> attributes);

    /** A structural signature (kind, name and parameter types) that ignores ids and attributes. */
    String signature();
}
