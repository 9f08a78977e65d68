package com.dslforge.core.workflow;

import com.dslforge.core.analysis.CycleDetector;
import com.dslforge.core.model.Module;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Topological ordering of modules by their {@code dependsOn} lists.
 *
 * <p>Kahn's algorithm; among the modules that are ready, the one appearing
 * first in source runs first, so the order is deterministic and equals source
 * order whenever the dependencies allow it.
 */
public final class ModuleOrder {

    private ModuleOrder() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Result of ordering.
     *
     * @param ordered modules in invocation order; partial when a cycle exists
     * @param cycle module names forming a cycle, ending with the first name, if any
     */
    public record Result(List<Module> ordered, Optional<List<String>> cycle) {
        public Result {
            ordered = List.copyOf(ordered);
        }

        public boolean isAcyclic() {
            return cycle.isEmpty();
        }
    }

    /**
     * Orders modules so that every module runs after the modules it depends on.
     *
     * @param modules modules in source order
     * @return ordering result
     */
    public static Result order(List<Module> modules) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < modules.size(); i++) {
            position.put(modules.get(i).name(), i);
        }

        int[] pending = new int[modules.size()];
        Map<Integer, List<Integer>> dependents = new HashMap<>();
        for (int i = 0; i < modules.size(); i++) {
            for (String dependency : modules.get(i).dependsOn()) {
                Integer j = position.get(dependency);
                if (j == null) {
                    throw new IllegalArgumentException(
                        "Module " + modules.get(i).name() + " depends on unknown module " + dependency);
                }
                pending[i]++;
                dependents.computeIfAbsent(j, key -> new ArrayList<>()).add(i);
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < modules.size(); i++) {
            if (pending[i] == 0) {
                ready.add(i);
            }
        }

        List<Module> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            int next = ready.poll();
            ordered.add(modules.get(next));
            for (int dependent : dependents.getOrDefault(next, List.of())) {
                if (--pending[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() == modules.size()) {
            return new Result(ordered, Optional.empty());
        }

        Map<String, List<String>> edges = new HashMap<>();
        modules.forEach(module -> edges.put(module.name(), module.dependsOn()));
        List<String> names = modules.stream().map(Module::name).toList();
        List<List<String>> cycles = CycleDetector.findCycles(names, name -> edges.getOrDefault(name, List.of()));
        if (cycles.isEmpty()) {
            throw new IllegalStateException("Ordering stalled without a detectable cycle");
        }
        return new Result(ordered, Optional.of(cycles.get(0)));
    }
}
