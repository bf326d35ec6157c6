package io.macroexpand.core.syntax;

/** Binding keyword of a {@link VariableDecl}. */
public enum Binding {
    LET,
    VAR
}
