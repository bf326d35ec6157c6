package io.macroexpand.core.engine;

import io.macroexpand.core.model.DependencyEdge;
import io.macroexpand.core.syntax.DeclId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph over declarations with pending expansions. An edge {@code A -> B} means expanding
 * {@code B} needs output produced while expanding {@code A}.
 *
 * <p>
 * Nodes keep their insertion order, which callers make the pre-order of the tree; cycle search and
 * wave ordering both follow it, so results are deterministic. Not thread-safe.
 */
public final class DependencyGraph {

    private enum Color {
        WHITE,
        GRAY,
        BLACK
    }

    private final Map<DeclId, Set<DeclId>> successors = new LinkedHashMap<>();
    private final List<DependencyEdge> edges = new ArrayList<>();

    public void addNode(DeclId node) {
        successors.computeIfAbsent(node, k -> new LinkedHashSet<>());
    }

    /** Adds an edge; self-edges and duplicates are ignored. Both ends are added as nodes. */
    public void addEdge(DependencyEdge edge) {
        addNode(edge.producer());
        addNode(edge.consumer());
        if (edge.producer().equals(edge.consumer())) {
            return;
        }
        if (successors.get(edge.producer()).add(edge.consumer())) {
            edges.add(edge);
        }
    }

    public List<DeclId> nodes() {
        return List.copyOf(successors.keySet());
    }

    public List<DependencyEdge> edges() {
        return List.copyOf(edges);
    }

    /**
     * Finds a cycle with a depth-first search using three-color marking.
     *
     * @return the cycle's nodes with the first node repeated at the end, or empty if acyclic
     */
    public Optional<List<DeclId>> findCycle() {
        Map<DeclId, Color> colors = new HashMap<>();
        successors.keySet().forEach(node -> colors.put(node, Color.WHITE));
        Deque<DeclId> path = new ArrayDeque<>();
        for (DeclId node : successors.keySet()) {
            if (colors.get(node) == Color.WHITE) {
                List<DeclId> cycle = visit(node, colors, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private List<DeclId> visit(DeclId node, Map<DeclId, Color> colors, Deque<DeclId> path) {
        colors.put(node, Color.GRAY);
        path.addLast(node);
        for (DeclId next : successors.get(node)) {
            Color color = colors.get(next);
            if (color == Color.GRAY) {
                List<DeclId> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (DeclId onPath : path) {
                    inCycle |= onPath.equals(next);
                    if (inCycle) {
                        cycle.add(onPath);
                    }
                }
                cycle.add(next);
                return cycle;
            }
            if (color == Color.WHITE) {
                List<DeclId> cycle = visit(next, colors, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.removeLast();
        colors.put(node, Color.BLACK);
        return null;
    }

    /**
     * Groups nodes into waves: every node's producers are in earlier waves, and nodes within a wave
     * keep insertion order. Only meaningful for an acyclic graph.
     *
     * @throws IllegalStateException if the graph has a cycle
     */
    public List<List<DeclId>> waves() {
        Map<DeclId, Integer> inDegree = new LinkedHashMap<>();
        successors.keySet().forEach(node -> inDegree.put(node, 0));
        successors.values().forEach(targets -> targets.forEach(t -> inDegree.merge(t, 1, Integer::sum)));

        List<List<DeclId>> waves = new ArrayList<>();
        List<DeclId> current = new ArrayList<>();
        inDegree.forEach((node, degree) -> {
            if (degree == 0) {
                current.add(node);
            }
        });
        int placed = 0;
        List<DeclId> wave = current;
        while (!wave.isEmpty()) {
            waves.add(List.copyOf(wave));
            placed += wave.size();
            Set<DeclId> next = new LinkedHashSet<>();
            for (DeclId node : wave) {
                for (DeclId successor : successors.get(node)) {
                    if (inDegree.merge(successor, -1, Integer::sum) == 0) {
                        next.add(successor);
                    }
                }
            }
            wave = orderByInsertion(next);
        }
        if (placed != successors.size()) {
            throw new IllegalStateException("Dependency graph has a cycle; waves are undefined");
        }
        return waves;
    }

    private List<DeclId> orderByInsertion(Set<DeclId> subset) {
        List<DeclId> ordered = new ArrayList<>(subset.size());
        for (DeclId node : successors.keySet()) {
            if (subset.contains(node)) {
                ordered.add(node);
            }
        }
        return ordered;
    }

    @Override
    public String toString() {
        return "DependencyGraph[nodes=" + successors.size() + ", edges=" + edges.size() + "]";
    }
}
