package com.dslforge.core.model;

import java.util.Objects;

/**
 * {@code RETURN [expression]}, including {@code RETURN CALL f(...)}.
 *
 * @param span source location
 * @param expression returned value, or null for a bare RETURN
 */
public record ReturnStatement(
    SourceSpan span,
    Expression expression
) implements Statement {

    /**
     * Compact constructor with validation.
     */
    public ReturnStatement {
        Objects.requireNonNull(span, "span must not be null");
    }

    /**
     * Whether a value is returned.
     *
     * @return true when an expression follows RETURN
     */
    public boolean hasValue() {
        return expression != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
