package com.dslforge.core;

import com.dslforge.core.config.ForgeConfig;
import com.dslforge.core.correction.LoopSettings;
import com.dslforge.core.correction.TranspileRequest;
import com.dslforge.core.generation.impl.DisabledGenerationService;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.FailureReason;
import com.dslforge.core.model.TranspileResult;
import com.dslforge.core.model.VarType;
import com.dslforge.core.model.Variable;
import com.dslforge.core.repair.RepairResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Transpiler}.
 */
class TranspilerTest {

    private Transpiler transpiler;

    @BeforeEach
    void setUp() {
        transpiler = new Transpiler(new DisabledGenerationService(), LoopSettings.defaults());
    }

    @Test
    void check_validDraft_returnsNoDefects() {
        List<Defect> defects = transpiler.check("""
            DEFINE {{x}}: Integer = 7
            IF {{x}} > 5
                CALL f()
            ENDIF
            """, List.of());

        assertThat(defects).isEmpty();
    }

    @Test
    void check_multipleDefects_sortedByLine() {
        List<Defect> defects = transpiler.check("""
            CALL notify({{user}})
            DEFINE {{d}}: Integer = 1
            DEFINE {{d}}: Integer = 2
            """, List.of());

        assertThat(defects).extracting(Defect::kind)
            .containsExactly(DefectKind.UNDEFINED_VARIABLE, DefectKind.DUPLICATE_DEFINITION);
        assertThat(defects).extracting(defect -> defect.span().line()).containsExactly(1, 3);
    }

    @Test
    void check_upstreamVariable_isDefined() {
        List<Defect> defects = transpiler.check("CALL notify({{user}})",
            List.of(Variable.of("user", VarType.STRING, "ada")));

        assertThat(defects).isEmpty();
    }

    @Test
    void repairOnce_undefinedVariable_insertsDefinition() {
        RepairResult result = transpiler.repairOnce("CALL notify({{user}})", List.of());

        assertThat(result.fixedKinds()).containsExactly(DefectKind.UNDEFINED_VARIABLE);
        assertThat(result.remaining()).isEmpty();
        assertThat(result.statements()).hasSize(2);
    }

    @Test
    void transpile_validDraft_succeedsOnFirstAttempt() {
        TranspileResult result = transpiler.transpile(TranspileRequest.of("""
            DEFINE {{x}}: Integer = 7
            IF {{x}} > 5
                CALL f()
            ENDIF
            """, List.of()));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attemptsUsed()).isEqualTo(1);
        assertThat(result.program()).contains("def main_workflow(");
    }

    @Test
    void transpile_variableReassignedThroughCalls_succeedsWithoutCycle() {
        TranspileResult result = transpiler.transpile(TranspileRequest.of("""
            DEFINE {{r}}: Any
            DEFINE {{s}}: Any
            {{r}} = CALL fetch()
            {{s}} = CALL summarize({{r}})
            {{r}} = CALL refine({{s}})
            RETURN {{r}}
            """, List.of()));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attemptsUsed()).isEqualTo(1);
        assertThat(result.program()).contains("r = invoke_function('refine', s)", "        return value");
    }

    @Test
    void transpile_unrepairableDraftWithoutProvider_exhaustsBudget() {
        // Given
        String dsl = """
            DEFINE {{x}}: Any
            {{x}} = CALL f({{x}}, CALL g())x
            """;

        // When
        TranspileResult result = transpiler.transpile(TranspileRequest.of(dsl, List.of()));

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failureReason()).isEqualTo(FailureReason.BUDGET_EXHAUSTED);
        assertThat(result.attemptsUsed()).isEqualTo(LoopSettings.defaults().maxAttempts());
        assertThat(result.defects()).extracting(Defect::kind).contains(DefectKind.UNPARSABLE_CALL_EXPRESSION);
    }

    @Test
    void fromConfig_defaults_usesDisabledProvider() {
        Transpiler configured = Transpiler.fromConfig(ForgeConfig.defaults());

        TranspileResult result = configured.transpile(TranspileRequest.of("CALL f(", List.of()));

        assertThat(result.failureReason()).isEqualTo(FailureReason.BUDGET_EXHAUSTED);
    }
}
