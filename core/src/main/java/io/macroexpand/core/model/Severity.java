package io.macroexpand.core.model;

/** Severity of a {@link Diagnostic}. */
public enum Severity {
    ERROR,
    WARNING,
    NOTE
}
