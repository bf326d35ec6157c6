package io.macroexpand.core.syntax;

/** Kind of a {@link TypeDecl}. */
public enum TypeKind {
    STRUCT,
    CLASS,
    ENUM,
    ACTOR,
    PROTOCOL,
    EXTENSION
}
