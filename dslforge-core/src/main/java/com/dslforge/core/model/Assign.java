package com.dslforge.core.model;

import java.util.Objects;

/**
 * {@code {{target}} = expression}.
 *
 * @param span source location
 * @param target assigned variable
 * @param expression assigned value
 */
public record Assign(
    SourceSpan span,
    String target,
    Expression expression
) implements Statement {

    /**
     * Compact constructor with validation.
     */
    public Assign {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
