package com.dslforge.core.workflow;

import com.dslforge.core.analysis.SymbolAnalyzer;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.DependencyGraph;
import com.dslforge.core.model.Module;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.Statement;
import com.dslforge.core.parser.DslParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link WorkflowPlanner} and {@link ProgramEmitter}.
 */
class WorkflowPlannerTest {

    private static final String PRODUCER_AFTER_CONSUMER = """
        {{y}} = CALL b({{x}})
        {{x}} = CALL a()
        """;

    private List<Statement> statements;
    private WorkflowPlanner planner;

    @BeforeEach
    void setUp() {
        statements = new DslParser().parse(PRODUCER_AFTER_CONSUMER).statements();
        planner = new WorkflowPlanner();
    }

    @Test
    void plan_callGraphDependency_invokesProducerFirst() {
        // Given
        DependencyGraph graph = new DependencyGraph.Builder()
            .edge(DependencyGraph.ROOT, "b")
            .edge(DependencyGraph.ROOT, "a")
            .edge("b", "a")
            .build();

        // When
        WorkflowPlanner.Plan plan = planner.plan(statements, graph, ClusteringStrategy.HYBRID, Map.of(), "Scenario");

        // Then
        assertThat(plan.isComplete()).isTrue();
        assertThat(plan.modules()).extracting(Module::name).containsExactly("step_2_a", "step_1_b");
        Module consumer = plan.modules().get(1);
        assertThat(consumer.declaredInputs()).containsExactly("x");
        assertThat(consumer.dependsOn()).containsExactly("step_2_a");
        assertThat(plan.entryPoint()).contains(
            "    ctx[\"x\"] = step_2_a()\n    ctx[\"y\"] = step_1_b(ctx.get(\"x\"))");
    }

    @Test
    void plan_program_definesModulesInInvocationOrderThenEntryPoint() {
        DependencyGraph graph = new DependencyGraph.Builder().edge("b", "a").build();

        String program = planner.plan(statements, graph, ClusteringStrategy.HYBRID, Map.of(), "Scenario").program();

        assertThat(program).startsWith("\"\"\"\nScenario\n");
        assertThat(program).contains("from llm_runtime import invoke_function\n");
        assertThat(program.indexOf("def step_2_a():")).isLessThan(program.indexOf("def step_1_b(x):"));
        assertThat(program.indexOf("def step_1_b(x):")).isLessThan(program.indexOf("def main_workflow("));
        assertThat(program).endsWith("    print(main_workflow(params))\n");
    }

    @Test
    void plan_mutualCallDependency_returnsCycleDefect() {
        DependencyGraph graph = new DependencyGraph.Builder().edge("b", "a").edge("a", "b").build();

        WorkflowPlanner.Plan plan = planner.plan(statements, graph, ClusteringStrategy.HYBRID, Map.of(), "Scenario");

        assertThat(plan.isComplete()).isFalse();
        assertThat(plan.modules()).isEmpty();
        assertThat(plan.program()).isEmpty();
        Defect defect = plan.cycleDefect().orElseThrow();
        assertThat(defect.kind()).isEqualTo(DefectKind.CYCLIC_DEPENDENCY);
        assertThat(defect.subject()).isEqualTo("step_1_b -> step_2_a -> step_1_b");
        assertThat(defect.span()).isEqualTo(SourceSpan.of(1, 1));
    }

    @Test
    void plan_emptyProgram_hasOnlyEntryPoint() {
        WorkflowPlanner.Plan plan = planner.plan(List.of(), DependencyGraph.empty(), ClusteringStrategy.HYBRID,
            Map.of(), "");

        assertThat(plan.isComplete()).isTrue();
        assertThat(plan.modules()).isEmpty();
        assertThat(plan.program()).contains("Generated workflow", "def main_workflow(input_params: dict):",
            "    return ctx");
    }

    @Test
    void plan_bareReturn_endsTheWorkflowBeforeLaterModules() {
        List<Statement> parsed = new DslParser().parse("""
            CALL a()
            RETURN
            CALL b()
            """).statements();
        DependencyGraph graph = new SymbolAnalyzer().analyze(parsed, List.of()).callGraph();

        WorkflowPlanner.Plan plan = planner.plan(parsed, graph, ClusteringStrategy.HYBRID, Map.of(), "Early exit");

        assertThat(plan.isComplete()).isTrue();
        assertThat(plan.entryPoint().lines().toList()).containsSubsequence(
            "    step_1_a()",
            "    returned, value = step_2_process()",
            "    if returned:",
            "        return value",
            "    step_3_b()");
        assertThat(plan.program()).contains("def step_2_process():\n    return True, None");
    }
}
