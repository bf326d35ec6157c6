package io.macroexpand.core.model;

import io.macroexpand.core.syntax.DeclId;
import java.util.Objects;

/**
 * Records that expanding {@code consumer} needs output produced while expanding {@code producer}.
 *
 * @param producer declaration whose expansion produces the data
 * @param consumer declaration whose expansion reads it
 * @param reason   short description for diagnostics
 */
public record DependencyEdge(DeclId producer, DeclId consumer, String reason) {

    public DependencyEdge {
        Objects.requireNonNull(producer, "producer must not be null");
        Objects.requireNonNull(consumer, "consumer must not be null");
    }
}
