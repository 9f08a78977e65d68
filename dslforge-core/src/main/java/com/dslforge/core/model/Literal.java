package com.dslforge.core.model;

import java.util.Objects;

/**
 * Literal expression text: numbers, strings, operators and keywords.
 *
 * @param text raw text, including surrounding whitespace
 */
public record Literal(String text) implements ExpressionPart {

    /**
     * Compact constructor with validation.
     */
    public Literal {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String sourceText() {
        return text;
    }
}
