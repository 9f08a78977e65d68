package com.dslforge.core.model;

import java.util.Objects;

/**
 * A {@code {{name}}} variable reference with delimiters stripped.
 *
 * @param name referenced variable name
 */
public record Reference(String name) implements ExpressionPart {

    /**
     * Compact constructor with validation.
     */
    public Reference {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String sourceText() {
        return "{{" + name + "}}";
    }
}
