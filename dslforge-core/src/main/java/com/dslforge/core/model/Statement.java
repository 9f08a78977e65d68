package com.dslforge.core.model;

/**
 * A parsed DSL statement.
 *
 * <p>The set of statement shapes is closed. Consumers that need to handle every
 * shape implement {@link StatementVisitor}, so a new shape fails compilation
 * everywhere it is not handled instead of falling through silently.
 */
public sealed interface Statement
    permits Define, Assign, CallStatement, IfStatement, ForStatement, ReturnStatement {

    /**
     * Source location of the statement's first line.
     *
     * @return span
     */
    SourceSpan span();

    /**
     * Dispatches to the visitor method for this statement shape.
     *
     * @param visitor visitor
     * @param <R> result type
     * @return visitor result
     */
    <R> R accept(StatementVisitor<R> visitor);
}
