package com.dslforge.core.model;

/**
 * Piece of a {@link ValueExpression}: a variable reference or literal text between references.
 */
public sealed interface ExpressionPart permits Reference, Literal {

    /**
     * Renders the part back to DSL syntax.
     *
     * @return DSL text
     */
    String sourceText();
}
