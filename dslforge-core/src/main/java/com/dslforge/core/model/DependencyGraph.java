package com.dslforge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Call graph of a DSL program.
 *
 * <p>Nodes are function identifiers plus {@link #ROOT} for the workflow itself.
 * An edge {@code caller -> callee} means the caller needs the callee's result:
 * either the callee is called inside the caller's arguments, or an argument of
 * the caller is derived from a value the callee produced. Node and edge order
 * follow first appearance in source.
 *
 * @param nodes node identifiers in first-appearance order
 * @param edges adjacency lists keyed by caller
 */
public record DependencyGraph(
    List<String> nodes,
    Map<String, List<String>> edges
) {
    /** Node standing for the workflow body. */
    public static final String ROOT = "main";

    /**
     * Compact constructor with validation.
     */
    public DependencyGraph {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        nodes = List.copyOf(nodes);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        edges.forEach((caller, callees) -> copy.put(caller, List.copyOf(callees)));
        edges = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a graph with only the root node.
     *
     * @return empty graph
     */
    public static DependencyGraph empty() {
        return new DependencyGraph(List.of(ROOT), Map.of());
    }

    /**
     * Returns the callees of a node.
     *
     * @param node caller
     * @return callees in first-appearance order, empty if none
     */
    public List<String> successors(String node) {
        return edges.getOrDefault(node, List.of());
    }

    /**
     * Whether {@code caller -> callee} exists.
     *
     * @param caller calling node
     * @param callee called node
     * @return true if the edge exists
     */
    public boolean hasEdge(String caller, String callee) {
        return successors(caller).contains(callee);
    }

    /**
     * Returns the function nodes, i.e. every node except {@link #ROOT}.
     *
     * @return function identifiers
     */
    public List<String> functions() {
        List<String> functions = new ArrayList<>(nodes);
        functions.remove(ROOT);
        return functions;
    }

    /**
     * Incrementally builds a graph, keeping first-appearance order and ignoring
     * self-edges and repeated edges.
     */
    public static final class Builder {
        private final LinkedHashSet<String> nodes = new LinkedHashSet<>(List.of(ROOT));
        private final Map<String, LinkedHashSet<String>> edges = new LinkedHashMap<>();

        /**
         * Adds a node.
         *
         * @param node identifier
         * @return this builder
         */
        public Builder node(String node) {
            nodes.add(node);
            return this;
        }

        /**
         * Adds an edge, creating both nodes. Self-edges are ignored.
         *
         * @param caller calling node
         * @param callee called node
         * @return this builder
         */
        public Builder edge(String caller, String callee) {
            nodes.add(caller);
            nodes.add(callee);
            if (!caller.equals(callee)) {
                edges.computeIfAbsent(caller, key -> new LinkedHashSet<>()).add(callee);
            }
            return this;
        }

        /**
         * Builds the immutable graph.
         *
         * @return graph
         */
        public DependencyGraph build() {
            Map<String, List<String>> adjacency = new LinkedHashMap<>();
            edges.forEach((caller, callees) -> adjacency.put(caller, new ArrayList<>(callees)));
            return new DependencyGraph(new ArrayList<>(nodes), adjacency);
        }
    }
}
