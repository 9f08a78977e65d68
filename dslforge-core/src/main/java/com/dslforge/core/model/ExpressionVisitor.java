package com.dslforge.core.model;

/**
 * Exhaustive dispatch over {@link Expression} shapes.
 *
 * @param <R> result type
 */
public interface ExpressionVisitor<R> {

    R visitValue(ValueExpression value);

    R visitCall(CallExpression call);

    R visitRaw(RawExpression raw);
}
