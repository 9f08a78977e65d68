package com.dslforge.core.history;

import com.dslforge.core.model.AttemptRecord;
import com.dslforge.core.model.CorrectionAction;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.FailureReason;
import com.dslforge.core.model.Module;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.TranspileResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AttemptLogWriter}.
 */
class AttemptLogWriterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private AttemptLogWriter writer;

    @BeforeEach
    void setUp() {
        writer = new AttemptLogWriter(tempDir.resolve("history"), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void write_successfulSession_persistsModulesAndAttempts() {
        // Given
        Module module = new Module("step_1_f", List.of(), List.of(), List.of(), List.of(), false, "def step_1_f():");
        List<AttemptRecord> attempts = List.of(
            new AttemptRecord(1, CorrectionAction.PARSED, 0, 1, "2 top-level statements"),
            new AttemptRecord(1, CorrectionAction.SUCCEEDED, 0, 0, "1 modules"));
        TranspileResult result = TranspileResult.success("session-1", List.of(module), "def main_workflow():",
            "program", List.of(), 1, attempts, "CALL f()\n");

        // When
        Path file = writer.write(result);

        // Then
        assertThat(file).exists().hasFileName("session-1.json");
        AttemptLogWriter.LogDocument document = writer.read("session-1");
        assertThat(document.recordedAt()).isEqualTo("2026-03-01T12:00:00Z");
        assertThat(document.status()).isEqualTo("SUCCESS");
        assertThat(document.failureReason()).isNull();
        assertThat(document.modules()).containsExactly("step_1_f");
        assertThat(document.attempts()).extracting(AttemptLogWriter.AttemptEntry::action)
            .containsExactly("PARSED", "SUCCEEDED");
        assertThat(document.finalDsl()).isEqualTo("CALL f()\n");
    }

    @Test
    void write_failedSession_persistsDefectsAndReason() {
        Defect defect = Defect.of(DefectKind.UNDEFINED_VARIABLE, SourceSpan.of(3, 5), "user", "Variable 'user' is not defined");
        TranspileResult result = TranspileResult.failure("session-2", FailureReason.BUDGET_EXHAUSTED, List.of(defect),
            3, List.of(), "CALL notify({{user}})\n");

        writer.write(result);
        AttemptLogWriter.LogDocument document = writer.read("session-2");

        assertThat(document.status()).isEqualTo("FAILURE");
        assertThat(document.failureReason()).isEqualTo("BUDGET_EXHAUSTED");
        assertThat(document.attemptsUsed()).isEqualTo(3);
        assertThat(document.defects()).singleElement().satisfies(entry -> {
            assertThat(entry.kind()).isEqualTo("UndefinedVariable");
            assertThat(entry.severity()).isEqualTo("ERROR");
            assertThat(entry.line()).isEqualTo(3);
            assertThat(entry.column()).isEqualTo(5);
            assertThat(entry.subject()).isEqualTo("user");
        });
    }

    @Test
    void write_sameSessionTwice_replacesFile() throws Exception {
        writer.write(TranspileResult.failure("s", FailureReason.CANCELLED, List.of(), 1, List.of(), ""));
        writer.write(TranspileResult.failure("s", FailureReason.SERVICE_ERROR, List.of(), 2, List.of(), ""));

        try (var files = Files.list(tempDir.resolve("history"))) {
            assertThat(files).hasSize(1);
        }
        assertThat(writer.read("s").failureReason()).isEqualTo("SERVICE_ERROR");
    }

    @Test
    void fileFor_unsafeCharacters_areReplaced() {
        assertThat(writer.fileFor("../etc/passwd").getFileName().toString()).isEqualTo(".._etc_passwd.json");
        assertThat(writer.fileFor("../etc/passwd").getParent()).isEqualTo(tempDir.resolve("history"));
    }

    @Test
    void read_unknownSession_throwsUncheckedIO() {
        assertThatThrownBy(() -> writer.read("missing")).isInstanceOf(UncheckedIOException.class);
    }
}
