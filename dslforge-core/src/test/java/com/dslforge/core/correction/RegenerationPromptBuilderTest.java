package com.dslforge.core.correction;

import com.dslforge.core.generation.GenerationRequest;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.VarType;
import com.dslforge.core.model.Variable;
import com.dslforge.core.workflow.ClusteringStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RegenerationPromptBuilder}.
 */
class RegenerationPromptBuilderTest {

    private final RegenerationPromptBuilder builder = new RegenerationPromptBuilder();

    @Test
    void build_groupsDefectsBySeverity() {
        // Given
        TranspileRequest request = new TranspileRequest("s", "", "Notify admins of failures",
            List.of(Variable.of("limit", VarType.INTEGER, 3)), ClusteringStrategy.HYBRID);
        List<Defect> defects = List.of(
            Defect.of(DefectKind.UNDEFINED_VARIABLE, SourceSpan.of(2, 1), "user", "Variable 'user' is not defined"),
            Defect.of(DefectKind.DEAD_BRANCH, SourceSpan.of(4, 1), "IF", "Condition 'false' is always false"));

        // When
        GenerationRequest generated = builder.build(request, "CALL notify({{user}})\n", defects, 2,
            Duration.ofSeconds(30));

        // Then
        String prompt = generated.prompt();
        assertThat(prompt).contains(
            "Requirement:\nNotify admins of failures",
            "Available variables:\n  {{limit}}: Integer = 3",
            "Previous draft:\nCALL notify({{user}})",
            "The previous draft has 1 errors and 1 warnings.",
            "ERRORS (must fix):\n  - line 2:1 UndefinedVariable: Variable 'user' is not defined",
            "WARNINGS (should fix):\n  - line 4:1 DeadBranch:");
        assertThat(prompt).endsWith("Rewrite the complete program so that it has no errors.");
        assertThat(generated.systemPrompt()).contains("Correction rules:");
        assertThat(generated.diagnostics().attemptNumber()).isEqualTo(2);
        assertThat(generated.diagnostics().defects()).hasSize(2);
        assertThat(generated.timeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void build_noRequirementOrVariables_saysSo() {
        String prompt = builder.build(TranspileRequest.of("", List.of()), "", List.of(), 2, Duration.ofSeconds(1))
            .prompt();

        assertThat(prompt).contains("(not provided)", "  (none)", "has 0 errors and 0 warnings");
        assertThat(prompt).doesNotContain("ERRORS (must fix)");
    }

    @Test
    void build_manyDefects_truncatesEachGroup() {
        List<Defect> defects = new ArrayList<>();
        for (int line = 1; line <= RegenerationPromptBuilder.MAX_DEFECTS_PER_GROUP + 3; line++) {
            defects.add(Defect.of(DefectKind.MALFORMED_STATEMENT, SourceSpan.of(line, 1), "", "bad line"));
        }

        String prompt = builder.build(TranspileRequest.of("", List.of()), "", defects, 2, Duration.ofSeconds(1))
            .prompt();

        assertThat(prompt).contains("  ... and 3 more");
        assertThat(prompt).doesNotContain("line 11:1");
    }
}
