package com.dslforge.core.history;

import com.dslforge.core.model.AttemptRecord;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.Module;
import com.dslforge.core.model.TranspileResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persists the attempt log of a session as {@code <directory>/<sessionId>.json}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AttemptLogWriter writer = new AttemptLogWriter(Paths.get(".dslforge/history"));
 * Path file = writer.write(result);
 * AttemptLogWriter.LogDocument document = writer.read(result.sessionId());
 * }</pre>
 */
public class AttemptLogWriter {

    private static final Logger log = LoggerFactory.getLogger(AttemptLogWriter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path directory;
    private final Clock clock;

    public AttemptLogWriter(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public AttemptLogWriter(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Persisted form of a session.
     *
     * @param sessionId session identifier
     * @param recordedAt ISO-8601 instant the document was written
     * @param status terminal status
     * @param failureReason failure reason, null on success
     * @param attemptsUsed drafts consumed
     * @param modules module names in invocation order
     * @param defects remaining defects
     * @param attempts attempt log
     * @param finalDsl DSL of the last draft
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LogDocument(
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("recordedAt") String recordedAt,
        @JsonProperty("status") String status,
        @JsonProperty("failureReason") String failureReason,
        @JsonProperty("attemptsUsed") int attemptsUsed,
        @JsonProperty("modules") List<String> modules,
        @JsonProperty("defects") List<DefectEntry> defects,
        @JsonProperty("attempts") List<AttemptEntry> attempts,
        @JsonProperty("finalDsl") String finalDsl
    ) {}

    /**
     * Persisted defect.
     *
     * @param kind defect kind display name
     * @param severity severity
     * @param line source line, 0 when synthetic
     * @param column source column, 0 when synthetic
     * @param subject offending name or text
     * @param message explanation
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DefectEntry(
        @JsonProperty("kind") String kind,
        @JsonProperty("severity") String severity,
        @JsonProperty("line") int line,
        @JsonProperty("column") int column,
        @JsonProperty("subject") String subject,
        @JsonProperty("message") String message
    ) {
        static DefectEntry of(Defect defect) {
            return new DefectEntry(defect.kind().getDisplayName(), defect.severity().name(),
                defect.span().line(), defect.span().column(), defect.subject(), defect.message());
        }
    }

    /**
     * Persisted attempt record.
     *
     * @param attempt draft number
     * @param action action taken
     * @param defectsBefore fatal defects before
     * @param defectsAfter fatal defects after
     * @param detail detail text
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AttemptEntry(
        @JsonProperty("attempt") int attempt,
        @JsonProperty("action") String action,
        @JsonProperty("defectsBefore") int defectsBefore,
        @JsonProperty("defectsAfter") int defectsAfter,
        @JsonProperty("detail") String detail
    ) {
        static AttemptEntry of(AttemptRecord record) {
            return new AttemptEntry(record.attemptNumber(), record.action().name(),
                record.defectsBefore(), record.defectsAfter(), record.detail());
        }
    }

    /**
     * Writes the attempt log of a session, replacing an earlier log with the same id.
     *
     * @param result session result
     * @return written file
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path write(TranspileResult result) {
        LogDocument document = new LogDocument(
            result.sessionId(),
            Instant.now(clock).toString(),
            result.status().name(),
            result.failureReason() == null ? null : result.failureReason().name(),
            result.attemptsUsed(),
            result.modules().stream().map(Module::name).toList(),
            result.defects().stream().map(DefectEntry::of).toList(),
            result.attemptLog().stream().map(AttemptEntry::of).toList(),
            result.finalDsl()
        );

        Path file = fileFor(result.sessionId());
        try {
            Files.createDirectories(directory);
            MAPPER.writeValue(file.toFile(), document);
            log.info("Wrote attempt log: {}", file);
            return file;
        } catch (IOException e) {
            log.error("Failed to write attempt log {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to write attempt log: " + file, e);
        }
    }

    /**
     * Reads a previously written attempt log.
     *
     * @param sessionId session identifier
     * @return document
     * @throws UncheckedIOException if the file is missing or unreadable
     */
    public LogDocument read(String sessionId) {
        Path file = fileFor(sessionId);
        try {
            return MAPPER.readValue(file.toFile(), LogDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read attempt log: " + file, e);
        }
    }

    /**
     * Returns the file used for a session.
     *
     * @param sessionId session identifier
     * @return path under the history directory
     */
    public Path fileFor(String sessionId) {
        String safe = sessionId.replaceAll("[^A-Za-z0-9._-]", "_");
        return directory.resolve(safe + ".json");
    }
}
