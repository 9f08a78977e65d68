package com.dslforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Expression text the parser could not structure. Kept verbatim so it can be
 * shown in diagnostics and sent back for regeneration.
 *
 * @param text raw source text
 */
public record RawExpression(String text) implements Expression {

    /**
     * Compact constructor with validation.
     */
    public RawExpression {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String sourceText() {
        return text;
    }

    @Override
    public List<String> references() {
        return List.of();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRaw(this);
    }
}
