package com.dslforge.core.model;

import java.util.List;

/**
 * Right-hand side of assignments, conditions, iterables, arguments and returns.
 */
public sealed interface Expression permits ValueExpression, CallExpression, RawExpression {

    /**
     * Renders the expression back to DSL syntax.
     *
     * @return DSL text
     */
    String sourceText();

    /**
     * Variable names referenced anywhere in the expression, in order of
     * appearance, including references inside nested call arguments.
     *
     * @return referenced names, possibly with repeats
     */
    List<String> references();

    /**
     * Dispatches to the visitor method for this expression shape.
     *
     * @param visitor visitor
     * @param <R> result type
     * @return visitor result
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
