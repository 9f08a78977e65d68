package com.dslforge.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single rule violation with its location.
 *
 * <p>Defects are values: the pipeline collects and returns them instead of
 * throwing. The {@code subject} names what the defect is about (a variable, a
 * block keyword, a cycle, raw expression text) and is what repair fixers key on.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Defect defect = Defect.of(
 *     DefectKind.DUPLICATE_DEFINITION,
 *     SourceSpan.of(2, 1),
 *     "d",
 *     "Variable 'd' is already defined at line 1"
 * );
 * }</pre>
 *
 * @param kind defect kind
 * @param span source location
 * @param subject identifier or text the defect concerns, empty when not applicable
 * @param message human-readable description, suitable for direct display
 */
public record Defect(
    DefectKind kind,
    SourceSpan span,
    String subject,
    String message
) implements Comparable<Defect> {

    private static final Comparator<Defect> ORDER = Comparator
        .comparing(Defect::span)
        .thenComparing(Defect::kind)
        .thenComparing(Defect::subject);

    /**
     * Compact constructor with validation.
     */
    public Defect {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (subject == null) {
            subject = "";
        }
    }

    /**
     * Creates a defect.
     *
     * @param kind defect kind
     * @param span source location
     * @param subject identifier or text the defect concerns
     * @param message description
     * @return a new defect
     */
    public static Defect of(DefectKind kind, SourceSpan span, String subject, String message) {
        return new Defect(kind, span, subject, message);
    }

    /**
     * Returns the severity of this defect's kind.
     *
     * @return severity
     */
    public DefectSeverity severity() {
        return kind.getSeverity();
    }

    /**
     * Whether this defect blocks code generation.
     *
     * @return true for error-level defects
     */
    public boolean isFatal() {
        return severity() == DefectSeverity.ERROR;
    }

    /**
     * Formats the defect for display, e.g. {@code line 3:1 UnclosedBlock: IF block is never closed}.
     *
     * @return formatted line
     */
    public String describe() {
        String location = span.isSourceLine() ? "line " + span : "(no line)";
        return location + " " + kind.getDisplayName() + ": " + message;
    }

    @Override
    public int compareTo(Defect other) {
        return ORDER.compare(this, other);
    }
}
