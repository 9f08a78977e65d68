package com.dslforge.core.model;

import java.util.Objects;

/**
 * {@code CALL f(args)} or {@code {{result}} = CALL f(args)}.
 *
 * @param span source location
 * @param resultBinding variable receiving the result, or null for a bare call
 * @param call the call
 */
public record CallStatement(
    SourceSpan span,
    String resultBinding,
    CallExpression call
) implements Statement {

    /**
     * Compact constructor with validation.
     */
    public CallStatement {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(call, "call must not be null");
    }

    /**
     * Whether the result is bound to a variable.
     *
     * @return true when a result binding exists
     */
    public boolean hasResultBinding() {
        return resultBinding != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
