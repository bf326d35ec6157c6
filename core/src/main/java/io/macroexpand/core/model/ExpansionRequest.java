package io.macroexpand.core.model;

import io.macroexpand.core.spi.ExpansionContext;
import io.macroexpand.core.syntax.DeclId;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.TypeDecl;
import java.util.Objects;
import java.util.Set;

/**
 * One unit of macro work: a single role of a single occurrence, bound to a snapshot of its target.
 *
 * @param occurrence      the attribute occurrence
 * @param role            the role being expanded
 * @param target          snapshot of the attached declaration
 * @param enclosingType   snapshot of the type containing {@code target}, or {@code null} at top level
 * @param affectedMembers for {@link RoleKind#MEMBER_ATTRIBUTE}, the members to expand for; empty
 *                        otherwise
 * @param context         the expansion context handed to the macro
 */
public record ExpansionRequest(
        AttributeOccurrence occurrence,
        RoleSpec role,
        Declaration target,
        TypeDecl enclosingType,
        Set<DeclId> affectedMembers,
        ExpansionContext context) {

    public ExpansionRequest {
        Objects.requireNonNull(occurrence, "occurrence must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(context, "context must not be null");
        affectedMembers = affectedMembers != null ? Set.copyOf(affectedMembers) : Set.of();
    }

    public RoleKind kind() {
        return role.kind();
    }

    public String macroName() {
        return occurrence.macro().name();
    }

    @Override
    public String toString() {
        return "ExpansionRequest[@" + macroName() + " " + role.kind().label() + " on " + target.id() + "]";
    }
}
