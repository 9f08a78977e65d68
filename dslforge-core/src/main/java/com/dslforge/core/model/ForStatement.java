package com.dslforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code FOR {{item}} IN iterable ... ENDFOR}.
 *
 * @param span location of the FOR line
 * @param loopVar loop variable name
 * @param iterable iterated expression
 * @param body loop body
 * @param closed whether a matching ENDFOR was found
 */
public record ForStatement(
    SourceSpan span,
    String loopVar,
    Expression iterable,
    List<Statement> body,
    boolean closed
) implements Statement {

    /**
     * Compact constructor with validation.
     */
    public ForStatement {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(loopVar, "loopVar must not be null");
        Objects.requireNonNull(iterable, "iterable must not be null");
        body = body == null ? List.of() : List.copyOf(body);
    }

    /**
     * Returns a copy with another body and closed state.
     *
     * @param newBody loop body
     * @param isClosed closed flag
     * @return updated loop
     */
    public ForStatement withBody(List<Statement> newBody, boolean isClosed) {
        return new ForStatement(span, loopVar, iterable, newBody, isClosed);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
