package io.macroexpand.core.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * One immutable version of a compilation unit's declaration tree.
 *
 * <p>
 * The lexical scope tree is formed by the top-level declarations and, recursively, the members of
 * type declarations. Every structural edit ({@link #replace}, {@link #insertAfter},
 * {@link #appendMembers}) returns a new version; declarations off the edited path are shared
 * between versions, and the receiver is left untouched.
 *
 * <p>
 * Thread-safe: instances are deeply immutable.
 */
public final class SyntaxTree {

    private final List<Declaration> declarations;
    private final Map<DeclId, Entry> index;

    private SyntaxTree(List<Declaration> declarations) {
        this.declarations = List.copyOf(declarations);
        this.index = Collections.unmodifiableMap(buildIndex(this.declarations));
    }

    /**
     * Creates a tree from top-level declarations in source order.
     *
     * @throws IllegalArgumentException if two declarations share an id
     */
    public static SyntaxTree of(List<Declaration> declarations) {
        Objects.requireNonNull(declarations, "declarations must not be null");
        return new SyntaxTree(declarations);
    }

    public static SyntaxTree of(Declaration... declarations) {
        return of(List.of(declarations));
    }

    /** Top-level declarations in source order. */
    public List<Declaration> declarations() {
        return declarations;
    }

    public Optional<Declaration> find(DeclId id) {
        Entry entry = index.get(id);
        return entry != null ? Optional.of(entry.declaration()) : Optional.empty();
    }

    /**
     * Looks up a declaration that must exist.
     *
     * @throws NoSuchElementException if no declaration has the given id
     */
    public Declaration require(DeclId id) {
        return find(id).orElseThrow(() -> new NoSuchElementException("No declaration with id '" + id + "'"));
    }

    public boolean contains(DeclId id) {
        return index.containsKey(id);
    }

    /** The type declaration whose member list holds {@code id}, or empty for top-level declarations. */
    public Optional<TypeDecl> parentOf(DeclId id) {
        Entry entry = index.get(id);
        if (entry == null || entry.parent() == null) {
            return Optional.empty();
        }
        return Optional.of((TypeDecl) index.get(entry.parent()).declaration());
    }

    /** Position of the declaration in a depth-first pre-order walk of the whole tree. */
    public int preorderIndex(DeclId id) {
        Entry entry = index.get(id);
        if (entry == null) {
            throw new NoSuchElementException("No declaration with id '" + id + "'");
        }
        return entry.preorder();
    }

    /** All declarations in depth-first pre-order (outer scopes before their members). */
    public List<Declaration> preorder() {
        List<Declaration> result = new ArrayList<>();
        declarations.forEach(declaration -> collect(declaration, result));
        return result;
    }

    /** The subtree rooted at {@code root} in depth-first pre-order, starting with the root itself. */
    public List<Declaration> preorder(DeclId root) {
        List<Declaration> result = new ArrayList<>();
        collect(require(root), result);
        return result;
    }

    /** Names of the enclosing scopes from the outermost down to the declaration itself. */
    public List<String> scopePath(DeclId id) {
        List<String> path = new ArrayList<>();
        DeclId current = id;
        while (current != null) {
            Entry entry = index.get(current);
            if (entry == null) {
                throw new NoSuchElementException("No declaration with id '" + current + "'");
            }
            path.add(0, entry.declaration().name());
            current = entry.parent();
        }
        return path;
    }

    /** The scope path joined with dots, e.g. {@code Point.x}. */
    public String qualifiedName(DeclId id) {
        return String.join(".", scopePath(id));
    }

    /** Returns a new version with the declaration {@code id} replaced. */
    public SyntaxTree replace(DeclId id, Declaration replacement) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        return edit(id, siblings -> {
            List<Declaration> copy = new ArrayList<>(siblings);
            copy.set(indexOf(copy, id), replacement);
            return copy;
        });
    }

    /** Returns a new version with {@code inserted} placed immediately after {@code anchor}, in order. */
    public SyntaxTree insertAfter(DeclId anchor, List<Declaration> inserted) {
        if (inserted.isEmpty()) {
            return this;
        }
        return edit(anchor, siblings -> {
            List<Declaration> copy = new ArrayList<>(siblings);
            copy.addAll(indexOf(copy, anchor) + 1, inserted);
            return copy;
        });
    }

    /**
     * Returns a new version with {@code added} appended to the member list of type {@code typeId}.
     *
     * @throws IllegalArgumentException if {@code typeId} is not a type declaration
     */
    public SyntaxTree appendMembers(DeclId typeId, List<Declaration> added) {
        if (added.isEmpty()) {
            return this;
        }
        Declaration target = require(typeId);
        if (!(target instanceof TypeDecl type)) {
            throw new IllegalArgumentException("Declaration '" + typeId + "' is not a type and has no members");
        }
        List<Declaration> members = new ArrayList<>(type.members());
        members.addAll(added);
        return replace(typeId, type.withMembers(members));
    }

    // --- Private helpers ---

    /** Rebuilds the path from the root down to the sibling list holding {@code id}. */
    private SyntaxTree edit(DeclId id, UnaryOperator<List<Declaration>> siblingEdit) {
        Entry entry = index.get(id);
        if (entry == null) {
            throw new NoSuchElementException("No declaration with id '" + id + "'");
        }
        if (entry.parent() == null) {
            return new SyntaxTree(siblingEdit.apply(declarations));
        }
        TypeDecl parent = (TypeDecl) index.get(entry.parent()).declaration();
        return replace(parent.id(), parent.withMembers(siblingEdit.apply(parent.members())));
    }

    private static int indexOf(List<Declaration> siblings, DeclId id) {
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i).id().equals(id)) {
                return i;
            }
        }
        throw new NoSuchElementException("No declaration with id '" + id + "'");
    }

    private static void collect(Declaration declaration, List<Declaration> into) {
        into.add(declaration);
        if (declaration instanceof TypeDecl type) {
            type.members().forEach(member -> collect(member, into));
        }
    }

    private static Map<DeclId, Entry> buildIndex(List<Declaration> roots) {
        Map<DeclId, Entry> index = new LinkedHashMap<>();
        int[] counter = {0};
        for (Declaration root : roots) {
            indexDeclaration(root, null, index, counter);
        }
        return index;
    }

    private static void indexDeclaration(
            Declaration declaration, DeclId parent, Map<DeclId, Entry> index, int[] counter) {
        if (index.containsKey(declaration.id())) {
            throw new IllegalArgumentException("Duplicate declaration id '" + declaration.id() + "'");
        }
        index.put(declaration.id(), new Entry(declaration, parent, counter[0]++));
        if (declaration instanceof TypeDecl type) {
            for (Declaration member : type.members()) {
                indexDeclaration(member, type.id(), index, counter);
            }
        }
    }

    private record Entry(Declaration declaration, DeclId parent, int preorder) {}

    @Override
    public String toString() {
        return "SyntaxTree[declarations=" + index.size() + "]";
    }
}
