package io.macroexpand.core.testkit;

import io.macroexpand.core.engine.DefaultExpansionContext;
import io.macroexpand.core.engine.UniqueNameAllocator;
import io.macroexpand.core.model.AttributeOccurrence;
import io.macroexpand.core.model.ExpansionRequest;
import io.macroexpand.core.model.MacroDefinition;
import io.macroexpand.core.model.RoleKind;
import io.macroexpand.core.model.RoleSpec;
import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.DeclId;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.SyntaxTree;
import java.util.Set;

/** Builds {@link ExpansionRequest}s against a tree, the way the scheduler prepares them. */
public final class TestRequests {

    private TestRequests() {}

    /** A request for the first attribute named after {@code macro} on {@code target}. */
    public static ExpansionRequest request(
            SyntaxTree tree, String target, MacroDefinition macro, RoleKind kind, UniqueNameAllocator allocator) {
        return request(tree, target, macro, kind, allocator, Set.of());
    }

    public static ExpansionRequest request(
            SyntaxTree tree,
            String target,
            MacroDefinition macro,
            RoleKind kind,
            UniqueNameAllocator allocator,
            Set<DeclId> affectedMembers) {
        DeclId id = DeclId.of(target);
        Declaration declaration = tree.require(id);
        int ordinal = 0;
        for (int i = 0; i < declaration.attributes().size(); i++) {
            if (declaration.attributes().get(i).name().equals(macro.name())) {
                ordinal = i;
                break;
            }
        }
        Attribute attribute = declaration.attributes().isEmpty()
                ? Attribute.of(macro.name())
                : declaration.attributes().get(ordinal);
        RoleSpec role = macro.role(kind).orElseThrow();
        DefaultExpansionContext context =
                new DefaultExpansionContext(allocator, tree.scopePath(id), attribute.location(), macro.name());
        return new ExpansionRequest(
                new AttributeOccurrence(id, attribute, ordinal, macro),
                role,
                declaration,
                tree.parentOf(id).orElse(null),
                affectedMembers,
                context);
    }
}
