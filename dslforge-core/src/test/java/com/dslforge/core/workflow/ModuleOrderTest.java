package com.dslforge.core.workflow;

import com.dslforge.core.model.Module;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ModuleOrder}.
 */
class ModuleOrderTest {

    private static Module module(String name, String... dependsOn) {
        return new Module(name, List.of(), List.of(), List.of(), List.of(dependsOn), false, "def " + name + "():\n    pass");
    }

    @Test
    void order_noDependencies_keepsSourceOrder() {
        ModuleOrder.Result result = ModuleOrder.order(List.of(module("a"), module("b"), module("c")));

        assertThat(result.isAcyclic()).isTrue();
        assertThat(result.ordered()).extracting(Module::name).containsExactly("a", "b", "c");
    }

    @Test
    void order_dependencyOnLaterModule_movesItFirst() {
        ModuleOrder.Result result = ModuleOrder.order(List.of(module("a", "c"), module("b"), module("c")));

        assertThat(result.ordered()).extracting(Module::name).containsExactly("b", "c", "a");
    }

    @Test
    void order_readyModules_runInSourceOrder() {
        ModuleOrder.Result result = ModuleOrder.order(List.of(
            module("a", "d"), module("b", "d"), module("c"), module("d")));

        assertThat(result.ordered()).extracting(Module::name).containsExactly("c", "d", "a", "b");
    }

    @Test
    void order_mutualDependency_reportsCycle() {
        ModuleOrder.Result result = ModuleOrder.order(List.of(module("a", "b"), module("b", "a"), module("c")));

        assertThat(result.isAcyclic()).isFalse();
        assertThat(result.cycle()).contains(List.of("a", "b", "a"));
        assertThat(result.ordered()).extracting(Module::name).containsExactly("c");
    }

    @Test
    void order_unknownDependency_throwsIllegalArgument() {
        assertThatThrownBy(() -> ModuleOrder.order(List.of(module("a", "missing"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
    }
}
