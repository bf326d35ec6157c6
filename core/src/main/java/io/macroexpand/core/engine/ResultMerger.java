package io.macroexpand.core.engine;

import io.macroexpand.core.model.ExpansionRequest;
import io.macroexpand.core.model.ExpansionResult;
import io.macroexpand.core.model.Fragment;
import io.macroexpand.core.syntax.Accessor;
import io.macroexpand.core.syntax.AccessorBlock;
import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.DeclId;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.SubscriptDecl;
import io.macroexpand.core.syntax.SyntaxTree;
import io.macroexpand.core.syntax.TypeDecl;
import io.macroexpand.core.syntax.VariableDecl;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies validated fragments to a tree, one result at a time, with role-specific insertion rules.
 *
 * <ul>
 * <li>peer: inserted right after the target, after any peers already produced for it, so peers
 * from earlier macros stay first
 * <li>member: appended to the type's member list; default-witness members are skipped when the
 * type already has a member of that name
 * <li>accessor: the first accessor result replaces the target's accessor block and drops its
 * initializer; later results on the same target are appended
 * <li>memberAttribute: attributes are unioned into each member's attribute list
 * </ul>
 *
 * <p>
 * Produced declarations get fresh ids derived from their target. One merger serves one batch and
 * is not thread-safe.
 */
public final class ResultMerger {

    private final Map<DeclId, DeclId> lastPeer = new HashMap<>();
    private final Set<DeclId> accessorsReplaced = new HashSet<>();
    private final Set<DeclId> produced = new LinkedHashSet<>();
    private int serial;

    /** Returns the tree with {@code result} applied; the input tree is unchanged. */
    public SyntaxTree merge(SyntaxTree tree, ExpansionResult result) {
        if (result.isEmpty()) {
            return tree;
        }
        ExpansionRequest request = result.request();
        DeclId target = request.target().id();
        return switch (request.kind()) {
            case PEER -> mergePeers(tree, target, result);
            case MEMBER -> mergeMembers(tree, target, result, request.role().defaultWitness());
            case ACCESSOR -> mergeAccessors(tree, target, result);
            case MEMBER_ATTRIBUTE -> mergeAttributes(tree, result);
        };
    }

    /** Ids of every declaration this merger produced, including nested members. */
    public Set<DeclId> producedIds() {
        return Set.copyOf(produced);
    }

    public boolean isProduced(DeclId id) {
        return produced.contains(id);
    }

    private SyntaxTree mergePeers(SyntaxTree tree, DeclId target, ExpansionResult result) {
        List<Declaration> peers = new ArrayList<>();
        for (Fragment fragment : result.fragments()) {
            if (fragment instanceof Fragment.DeclarationFragment declaration) {
                peers.add(assignIds(declaration.declaration(), nextId(target, "peer")));
            }
        }
        if (peers.isEmpty()) {
            return tree;
        }
        DeclId anchor = lastPeer.getOrDefault(target, target);
        SyntaxTree merged = tree.insertAfter(anchor, peers);
        lastPeer.put(target, peers.get(peers.size() - 1).id());
        return merged;
    }

    private SyntaxTree mergeMembers(SyntaxTree tree, DeclId target, ExpansionResult result, boolean defaultWitness) {
        TypeDecl type = (TypeDecl) tree.require(target);
        Set<String> present = new HashSet<>();
        type.members().forEach(member -> present.add(member.name()));

        List<Declaration> members = new ArrayList<>();
        for (Fragment fragment : result.fragments()) {
            if (fragment instanceof Fragment.DeclarationFragment declaration) {
                Declaration member = declaration.declaration();
                if (defaultWitness && present.contains(member.name())) {
                    continue;
                }
                present.add(member.name());
                members.add(assignIds(member, nextId(target, "member")));
            }
        }
        return tree.appendMembers(target, members);
    }

    private SyntaxTree mergeAccessors(SyntaxTree tree, DeclId target, ExpansionResult result) {
        List<Accessor> accessors = new ArrayList<>();
        for (Fragment fragment : result.fragments()) {
            if (fragment instanceof Fragment.AccessorFragment accessor) {
                accessors.add(accessor.accessor());
            }
        }
        if (accessors.isEmpty()) {
            return tree;
        }
        boolean first = accessorsReplaced.add(target);
        Declaration declaration = tree.require(target);
        if (declaration instanceof VariableDecl variable) {
            AccessorBlock block = first || variable.accessors() == null
                    ? new AccessorBlock(accessors)
                    : variable.accessors().append(accessors);
            return tree.replace(target, variable.withAccessorBlock(block));
        }
        if (declaration instanceof SubscriptDecl subscript) {
            AccessorBlock block = first || subscript.accessors() == null
                    ? new AccessorBlock(accessors)
                    : subscript.accessors().append(accessors);
            return tree.replace(target, subscript.withAccessorBlock(block));
        }
        throw new IllegalStateException("Declaration '" + target + "' cannot hold accessors");
    }

    /**
     * Unions produced attributes into each member's attribute list. Returns the same tree instance
     * when every attribute was already present.
     */
    public SyntaxTree mergeAttributes(SyntaxTree tree, ExpansionResult result) {
        SyntaxTree current = tree;
        for (Fragment fragment : result.fragments()) {
            if (!(fragment instanceof Fragment.AttributeFragment attributeFragment)) {
                continue;
            }
            Declaration member = current.require(attributeFragment.member());
            Attribute added = attributeFragment.attribute();
            if (member.attributes().stream().anyMatch(added::sameAs)) {
                continue;
            }
            List<Attribute> attributes = new ArrayList<>(member.attributes());
            attributes.add(added);
            current = current.replace(member.id(), member.withAttributes(attributes));
        }
        return current;
    }

    private DeclId nextId(DeclId target, String role) {
        return target.child(role + "-" + (++serial));
    }

    private Declaration assignIds(Declaration declaration, DeclId id) {
        produced.add(id);
        Declaration renamed = declaration.withId(id);
        if (renamed instanceof TypeDecl type && !type.members().isEmpty()) {
            List<Declaration> members = new ArrayList<>(type.members().size());
            for (int i = 0; i < type.members().size(); i++) {
                members.add(assignIds(type.members().get(i), id.child("m" + i)));
            }
            renamed = type.withMembers(members);
        }
        return renamed;
    }
}
