package com.dslforge.core.analysis;

import com.dslforge.core.model.DependencyGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Depth-first cycle detection with an explicit recursion stack.
 *
 * <p>Every back-edge yields one cycle, reported as the full path from the
 * node that closes it, e.g. {@code [a, b, c, a]}. A cycle reached through
 * different back-edges or starting points is reported once.
 */
public final class CycleDetector {

    private CycleDetector() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Finds cycles in a call graph.
     *
     * @param graph call graph
     * @return cycles in discovery order, each ending with its first node
     */
    public static List<List<String>> findCycles(DependencyGraph graph) {
        return findCycles(graph.nodes(), graph::successors);
    }

    /**
     * Finds cycles in any directed graph.
     *
     * @param nodes nodes in the order DFS should start from
     * @param successors adjacency function
     * @return cycles in discovery order, each ending with its first node
     */
    public static List<List<String>> findCycles(List<String> nodes, Function<String, List<String>> successors) {
        Search search = new Search(successors);
        for (String node : nodes) {
            if (!search.done.contains(node)) {
                search.visit(node);
            }
        }
        return search.cycles;
    }

    private static final class Search {
        private final Function<String, List<String>> successors;
        private final Set<String> done = new LinkedHashSet<>();
        private final List<String> stack = new ArrayList<>();
        private final Map<String, Integer> onStack = new HashMap<>();
        private final Set<String> seenCycles = new LinkedHashSet<>();
        private final List<List<String>> cycles = new ArrayList<>();

        private Search(Function<String, List<String>> successors) {
            this.successors = successors;
        }

        private void visit(String node) {
            onStack.put(node, stack.size());
            stack.add(node);
            for (String next : successors.apply(node)) {
                Integer position = onStack.get(next);
                if (position != null) {
                    record(new ArrayList<>(stack.subList(position, stack.size())));
                } else if (!done.contains(next)) {
                    visit(next);
                }
            }
            stack.remove(stack.size() - 1);
            onStack.remove(node);
            done.add(node);
        }

        private void record(List<String> body) {
            if (!seenCycles.add(canonicalKey(body))) {
                return;
            }
            List<String> cycle = new ArrayList<>(body);
            cycle.add(body.get(0));
            cycles.add(List.copyOf(cycle));
        }

        private static String canonicalKey(List<String> body) {
            int start = 0;
            for (int i = 1; i < body.size(); i++) {
                if (body.get(i).compareTo(body.get(start)) < 0) {
                    start = i;
                }
            }
            List<String> rotated = new ArrayList<>(body.subList(start, body.size()));
            rotated.addAll(body.subList(0, start));
            return String.join("->", rotated);
        }
    }
}
