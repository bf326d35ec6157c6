package io.macroexpand.core.engine;

import io.macroexpand.core.error.DependencyCycleException;
import io.macroexpand.core.model.DependencyEdge;
import io.macroexpand.core.model.InputDependency;
import io.macroexpand.core.model.RoleKind;
import io.macroexpand.core.syntax.DeclId;
import io.macroexpand.core.syntax.SourceLocation;
import io.macroexpand.core.syntax.SyntaxTree;
import io.macroexpand.core.syntax.TypeDecl;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the dependency graph for a set of pending expansions from the roles' declarations alone
 * and rejects cycles before any macro in the set runs.
 *
 * <p>
 * A member role on type {@code T}, and a peer role on a direct member of {@code T}, produce
 * members of {@code T}; they produce stored properties of {@code T} only if the role declares
 * {@code introducesStoredProperties}. A role that reads members or stored properties reads them
 * from the type it is attached to (member roles) or from the type enclosing its target (peer and
 * accessor roles). Each producer/reader pair on different declarations becomes an edge.
 */
public final class DependencyCycleDetector {

    /** Builds the graph without checking it. Nodes are added in tree pre-order. */
    public DependencyGraph build(SyntaxTree tree, List<PendingExpansion> pending) {
        DependencyGraph graph = new DependencyGraph();
        pending.stream()
                .map(PendingExpansion::target)
                .distinct()
                .sorted(Comparator.comparingInt(tree::preorderIndex))
                .forEach(graph::addNode);

        for (PendingExpansion consumer : pending) {
            Set<InputDependency> reads = consumer.role().effectiveReads();
            if (reads.isEmpty()) {
                continue;
            }
            Optional<DeclId> readType = readsFrom(tree, consumer);
            if (readType.isEmpty()) {
                continue;
            }
            for (PendingExpansion producer : pending) {
                if (producer.target().equals(consumer.target())) {
                    continue;
                }
                Optional<DeclId> producesInto = producesInto(tree, producer);
                if (producesInto.isEmpty() || !producesInto.get().equals(readType.get())) {
                    continue;
                }
                boolean storedDependency = reads.contains(InputDependency.STORED_PROPERTIES)
                        && producer.role().introducesStoredProperties();
                if (reads.contains(InputDependency.MEMBERS) || storedDependency) {
                    graph.addEdge(new DependencyEdge(
                            producer.target(),
                            consumer.target(),
                            "@" + consumer.occurrence().macro().name() + " on "
                                    + tree.qualifiedName(consumer.target()) + " reads "
                                    + (storedDependency ? "stored properties" : "members") + " of "
                                    + tree.qualifiedName(readType.get()) + " produced by @"
                                    + producer.occurrence().macro().name() + " on "
                                    + tree.qualifiedName(producer.target())));
                }
            }
        }
        return graph;
    }

    /**
     * Builds the graph and checks it for cycles.
     *
     * @throws DependencyCycleException naming the qualified path of the first cycle found
     */
    public DependencyGraph check(SyntaxTree tree, List<PendingExpansion> pending) {
        DependencyGraph graph = build(tree, pending);
        Optional<List<DeclId>> cycle = graph.findCycle();
        if (cycle.isPresent()) {
            List<DeclId> nodes = cycle.get();
            List<String> path = nodes.stream().map(tree::qualifiedName).toList();
            PendingExpansion culprit = pending.stream()
                    .filter(p -> p.target().equals(nodes.get(0)))
                    .filter(p -> !p.role().effectiveReads().isEmpty())
                    .findFirst()
                    .orElseGet(() -> pending.stream()
                            .filter(p -> p.target().equals(nodes.get(0)))
                            .findFirst()
                            .orElse(null));
            String macroName = culprit != null ? culprit.occurrence().macro().name() : null;
            SourceLocation location =
                    culprit != null ? culprit.occurrence().attribute().location() : SourceLocation.UNKNOWN;
            throw new DependencyCycleException(path, macroName, location);
        }
        return graph;
    }

    /**
     * Rejects producers scheduled in a later feedback pass into a type whose members or stored
     * properties an already expanded reader has seen. The reader's output was computed from a
     * type that no longer exists in that shape, so the batch cannot be made consistent.
     *
     * @param completed readers expanded in earlier passes of the batch
     * @param pending   expansions about to run in this pass
     * @throws DependencyCycleException naming reader, producer and reader again
     */
    public void checkLateProducers(
            SyntaxTree tree, List<PendingExpansion> completed, List<PendingExpansion> pending) {
        for (PendingExpansion reader : completed) {
            if (!tree.contains(reader.target())) {
                continue;
            }
            Optional<DeclId> readType = readsFrom(tree, reader);
            if (readType.isEmpty()) {
                continue;
            }
            Set<InputDependency> reads = reader.role().effectiveReads();
            for (PendingExpansion producer : pending) {
                Optional<DeclId> producesInto = producesInto(tree, producer);
                if (producesInto.isEmpty() || !producesInto.get().equals(readType.get())) {
                    continue;
                }
                boolean storedDependency = reads.contains(InputDependency.STORED_PROPERTIES)
                        && producer.role().introducesStoredProperties();
                if (reads.contains(InputDependency.MEMBERS) || storedDependency) {
                    String readerName = tree.qualifiedName(reader.target());
                    throw new DependencyCycleException(
                            List.of(readerName, tree.qualifiedName(producer.target()), readerName),
                            reader.occurrence().macro().name(),
                            reader.occurrence().attribute().location());
                }
            }
        }
    }

    private static Optional<DeclId> readsFrom(SyntaxTree tree, PendingExpansion consumer) {
        if (consumer.kind() == RoleKind.MEMBER || consumer.kind() == RoleKind.MEMBER_ATTRIBUTE) {
            return Optional.of(consumer.target());
        }
        return tree.parentOf(consumer.target()).map(TypeDecl::id);
    }

    private static Optional<DeclId> producesInto(SyntaxTree tree, PendingExpansion producer) {
        if (producer.kind() == RoleKind.MEMBER) {
            return Optional.of(producer.target());
        }
        if (producer.kind() == RoleKind.PEER) {
            return tree.parentOf(producer.target()).map(TypeDecl::id);
        }
        return Optional.empty();
    }
}
