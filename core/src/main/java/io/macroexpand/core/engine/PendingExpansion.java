package io.macroexpand.core.engine;

import io.macroexpand.core.model.AttributeOccurrence;
import io.macroexpand.core.model.RoleKind;
import io.macroexpand.core.model.RoleSpec;
import io.macroexpand.core.syntax.DeclId;
import java.util.Comparator;

/**
 * A (occurrence, role) pair that has been resolved but not yet expanded. Known before any macro
 * runs, so the dependency graph can be built from pending work alone.
 */
public record PendingExpansion(AttributeOccurrence occurrence, RoleSpec role) {

    /** Execution order on one declaration: role kind first, then source order. */
    public static final Comparator<PendingExpansion> EXECUTION_ORDER =
            Comparator.comparing((PendingExpansion pending) -> pending.role().kind())
                    .thenComparingInt(pending -> pending.occurrence().ordinal());

    public DeclId target() {
        return occurrence.target();
    }

    public RoleKind kind() {
        return role.kind();
    }
}
