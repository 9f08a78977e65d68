package com.dslforge.core.renderer;

import com.dslforge.core.model.FailureReason;
import com.dslforge.core.model.TranspileResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GeneratedOutput}.
 */
class GeneratedOutputTest {

    @Test
    void of_successfulResult_containsProgramAndDsl() {
        TranspileResult result = TranspileResult.success("s", List.of(), "", "print(1)\n", List.of(), 1, List.of(),
            "CALL f()\n");

        GeneratedOutput output = GeneratedOutput.of(result, "pipeline.py");

        assertThat(output.files()).extracting(GeneratedFile::relativePath).containsExactly("pipeline.py", "pipeline.dsl");
        assertThat(output.files().get(0).content()).isEqualTo("print(1)\n");
        assertThat(output.files().get(0).contentType()).isEqualTo(GeneratedFile.PYTHON);
        assertThat(output.files().get(1).content()).isEqualTo("CALL f()\n");
    }

    @Test
    void of_fileNameWithoutExtension_appendsDslExtension() {
        TranspileResult result = TranspileResult.success("s", List.of(), "", "", List.of(), 1, List.of(), "");

        assertThat(GeneratedOutput.of(result, "workflow").files().get(1).relativePath()).isEqualTo("workflow.dsl");
    }

    @Test
    void of_failedResult_throwsIllegalArgument() {
        TranspileResult result = TranspileResult.failure("s", FailureReason.BUDGET_EXHAUSTED, List.of(), 3, List.of(), "");

        assertThatThrownBy(() -> GeneratedOutput.of(result, "workflow.py"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("failed");
    }

    @Test
    void constructor_copiesFiles() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("a.py", "", GeneratedFile.PYTHON)));

        assertThatThrownBy(() -> output.files().add(new GeneratedFile("b.py", "", GeneratedFile.PYTHON)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void generatedFile_blankPath_throwsIllegalArgument() {
        assertThatThrownBy(() -> new GeneratedFile(" ", "", GeneratedFile.DSL))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
