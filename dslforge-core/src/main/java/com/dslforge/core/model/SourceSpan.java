package com.dslforge.core.model;

import java.util.Comparator;

/**
 * Position of a statement in DSL source.
 *
 * <p>Lines are 1-based. The column is the 1-based column of the first
 * non-blank character, which makes it the indentation of the statement.
 * Statements synthesized by the repair engine carry {@link #SYNTHETIC}, and
 * defects about upstream variables carry {@link #UPSTREAM}.
 *
 * @param line 1-based line number, or 0 when the node has no source line
 * @param column 1-based indentation column, or 0 when the node has no source line
 */
public record SourceSpan(int line, int column) implements Comparable<SourceSpan> {

    /** Span for nodes inserted by repair rather than read from source. */
    public static final SourceSpan SYNTHETIC = new SourceSpan(0, 0);

    /** Span for defects about the upstream variable list. */
    public static final SourceSpan UPSTREAM = new SourceSpan(0, 0);

    private static final Comparator<SourceSpan> ORDER =
        Comparator.comparingInt(SourceSpan::line).thenComparingInt(SourceSpan::column);

    /**
     * Compact constructor with validation.
     */
    public SourceSpan {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line and column must not be negative: " + line + ":" + column);
        }
    }

    /**
     * Creates a span for a source line.
     *
     * @param line 1-based line number
     * @param column 1-based indentation column
     * @return the span
     */
    public static SourceSpan of(int line, int column) {
        return new SourceSpan(line, column);
    }

    /**
     * Whether this span points at a real source line.
     *
     * @return true for spans read from source
     */
    public boolean isSourceLine() {
        return line > 0;
    }

    @Override
    public int compareTo(SourceSpan other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return isSourceLine() ? line + ":" + column : "-";
    }
}
