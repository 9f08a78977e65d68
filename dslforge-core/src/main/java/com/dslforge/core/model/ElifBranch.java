package com.dslforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One {@code ELIF condition} branch of an {@link IfStatement}.
 *
 * @param span location of the ELIF line
 * @param condition branch condition
 * @param body branch statements
 */
public record ElifBranch(
    SourceSpan span,
    Expression condition,
    List<Statement> body
) {
    /**
     * Compact constructor with validation.
     */
    public ElifBranch {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        body = body == null ? List.of() : List.copyOf(body);
    }

    /**
     * Returns a copy with another body.
     *
     * @param newBody replacement body
     * @return updated branch
     */
    public ElifBranch withBody(List<Statement> newBody) {
        return new ElifBranch(span, condition, newBody);
    }
}
