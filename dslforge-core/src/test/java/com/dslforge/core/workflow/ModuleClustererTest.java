package com.dslforge.core.workflow;

import com.dslforge.core.analysis.SymbolAnalyzer;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.DependencyGraph;
import com.dslforge.core.model.Module;
import com.dslforge.core.model.Statement;
import com.dslforge.core.parser.DslParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ModuleClusterer}.
 */
class ModuleClustererTest {

    private static final String MIXED = """
        {{a}} = CALL f()
        {{b}} = CALL g({{a}})
        IF {{b}} > 1
            CALL h()
        ENDIF
        CALL k()
        """;

    private final DslParser parser = new DslParser();
    private final SymbolAnalyzer analyzer = new SymbolAnalyzer();
    private ModuleClusterer clusterer;

    @BeforeEach
    void setUp() {
        clusterer = new ModuleClusterer();
    }

    private List<Module> cluster(String dsl, ClusteringStrategy strategy) {
        List<Statement> statements = parser.parse(dsl).statements();
        DependencyGraph graph = analyzer.analyze(statements, List.of()).callGraph();
        return clusterer.cluster(statements, graph, strategy);
    }

    @Test
    void cluster_literalDefines_becomeContextDefaultsNotModules() {
        // Given
        String dsl = """
            DEFINE {{limit}}: Integer = 3
            DEFINE {{r}}: Any
            {{r}} = CALL fetch({{limit}})
            CALL save({{r}})
            """;

        // When
        List<Module> modules = cluster(dsl, ClusteringStrategy.HYBRID);
        List<Define> defaults = clusterer.contextDefaults(parser.parse(dsl).statements());

        // Then
        assertThat(defaults).extracting(Define::name).containsExactly("limit", "r");
        assertThat(modules).extracting(Module::name).containsExactly("step_1_fetch", "step_2_save");
        assertThat(modules.get(0).declaredInputs()).containsExactly("limit");
        assertThat(modules.get(0).declaredOutputs()).containsExactly("r");
        assertThat(modules.get(1).declaredInputs()).containsExactly("r");
        assertThat(modules.get(1).dependsOn()).containsExactly("step_1_fetch");
    }

    @Test
    void cluster_ioIsolation_isolatesEveryCallingStatement() {
        List<Module> modules = cluster(MIXED, ClusteringStrategy.IO_ISOLATION);

        assertThat(modules).extracting(Module::name)
            .containsExactly("step_1_f", "step_2_g", "step_3_h", "step_4_k");
    }

    @Test
    void cluster_controlFlow_groupsPlainStatementsAroundBlocks() {
        List<Module> modules = cluster(MIXED, ClusteringStrategy.CONTROL_FLOW);

        assertThat(modules).extracting(Module::name).containsExactly("step_1_f", "step_2_h", "step_3_k");
        assertThat(modules.get(0).statements()).hasSize(2);
        assertThat(modules.get(0).declaredInputs()).isEmpty();
        assertThat(modules.get(0).declaredOutputs()).containsExactly("a", "b");
        assertThat(modules.get(1).declaredInputs()).containsExactly("b");
        assertThat(modules.get(1).dependsOn()).containsExactly("step_1_f");
    }

    @Test
    void cluster_blockIsNeverSplit() {
        List<Module> modules = cluster("""
            FOR {{i}} IN {{items}}
                CALL a({{i}})
                CALL b({{i}})
            ENDFOR
            """, ClusteringStrategy.IO_ISOLATION);

        assertThat(modules).hasSize(1);
        assertThat(modules.get(0).declaredInputs()).containsExactly("items");
    }

    @Test
    void cluster_conditionalWrite_isAlsoAnInput() {
        List<Module> modules = cluster("""
            IF {{flag}}
                {{x}} = CALL f()
            ENDIF
            """, ClusteringStrategy.HYBRID);

        Module module = modules.get(0);
        assertThat(module.declaredInputs()).containsExactly("flag", "x");
        assertThat(module.declaredOutputs()).containsExactly("x");
        assertThat(module.code()).isEqualTo("""
            def step_1_f(flag, x):
                if flag:
                    x = invoke_function('f')
                return x""");
    }

    @Test
    void cluster_returnStatement_formsTerminalModuleFlaggingTheReturn() {
        List<Module> modules = cluster("""
            {{x}} = CALL f()
            RETURN {{x}}
            """, ClusteringStrategy.CONTROL_FLOW);

        assertThat(modules).hasSize(2);
        Module terminal = modules.get(1);
        assertThat(terminal.name()).isEqualTo("step_2_process");
        assertThat(terminal.terminal()).isTrue();
        assertThat(terminal.declaredOutputs()).isEmpty();
        assertThat(terminal.declaredInputs()).containsExactly("x");
        assertThat(terminal.dependsOn()).containsExactly("step_1_f");
        assertThat(terminal.code()).isEqualTo("""
            def step_2_process(x):
                return True, x""");
    }

    @Test
    void cluster_returnOnOneBranch_keepsWritesOfTheOtherBranchAsOutputs() {
        // Given
        String dsl = """
            DEFINE {{x}}: Integer = 1
            DEFINE {{y}}: Any
            IF {{x}} > 5
                RETURN {{x}}
            ELSE
                {{y}} = CALL f({{x}})
            ENDIF
            CALL g({{y}})
            """;

        // When
        List<Module> modules = cluster(dsl, ClusteringStrategy.HYBRID);

        // Then
        assertThat(modules).extracting(Module::name).containsExactly("step_1_f", "step_2_g");
        Module branching = modules.get(0);
        assertThat(branching.terminal()).isTrue();
        assertThat(branching.declaredInputs()).containsExactly("x", "y");
        assertThat(branching.declaredOutputs()).containsExactly("y");
        assertThat(branching.code()).isEqualTo("""
            def step_1_f(x, y):
                if x > 5:
                    return True, x
                else:
                    y = invoke_function('f', x)
                return False, {"y": y}""");
        assertThat(modules.get(1).declaredInputs()).containsExactly("y");
        assertThat(modules.get(1).dependsOn()).containsExactly("step_1_f");
    }

    @Test
    void cluster_bareReturn_flagsTheReturnWithNone() {
        List<Module> modules = cluster("""
            CALL a()
            RETURN
            CALL b()
            """, ClusteringStrategy.HYBRID);

        assertThat(modules).extracting(Module::name).containsExactly("step_1_a", "step_2_process", "step_3_b");
        assertThat(modules.get(1).terminal()).isTrue();
        assertThat(modules.get(1).code()).isEqualTo("""
            def step_2_process():
                return True, None""");
    }

    @Test
    void cluster_loopVariable_isNeitherInputNorOutput() {
        List<Module> modules = cluster("""
            FOR {{i}} IN {{items}}
                {{last}} = {{i}}
            ENDFOR
            """, ClusteringStrategy.HYBRID);

        Module module = modules.get(0);
        assertThat(module.name()).isEqualTo("step_1_compute_last");
        assertThat(module.declaredInputs()).containsExactly("items", "last");
        assertThat(module.declaredOutputs()).containsExactly("last");
    }

    @Test
    void cluster_callGraphEdgeToLaterModule_dependsOnIt() {
        List<Statement> statements = parser.parse("""
            {{y}} = CALL b({{x}})
            {{x}} = CALL a()
            """).statements();
        DependencyGraph graph = new DependencyGraph.Builder()
            .edge(DependencyGraph.ROOT, "b")
            .edge(DependencyGraph.ROOT, "a")
            .edge("b", "a")
            .build();

        List<Module> modules = clusterer.cluster(statements, graph, ClusteringStrategy.HYBRID);

        assertThat(modules.get(0).dependsOn()).containsExactly("step_2_a");
        assertThat(modules.get(1).dependsOn()).isEmpty();
    }

    @Test
    void cluster_noStatements_returnsNoModules() {
        assertThat(clusterer.cluster(List.of(), DependencyGraph.empty(), ClusteringStrategy.HYBRID)).isEmpty();
    }
}
