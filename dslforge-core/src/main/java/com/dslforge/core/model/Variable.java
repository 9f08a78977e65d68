package com.dslforge.core.model;

import java.util.Objects;

/**
 * A resolved variable handed in by upstream extraction.
 *
 * <p>Variables are immutable within a transpile session. Name uniqueness is
 * checked by the analyzer, not assumed here.
 *
 * @param name variable name as used inside {@code {{...}}}
 * @param type declared type
 * @param value resolved value, may be null
 * @param originText source text the variable was extracted from, may be empty
 */
public record Variable(
    String name,
    VarType type,
    Object value,
    String originText
) {
    /**
     * Compact constructor with validation.
     */
    public Variable {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (originText == null) {
            originText = "";
        }
    }

    /**
     * Creates a variable with no origin text.
     *
     * @param name variable name
     * @param type declared type
     * @param value resolved value
     * @return the variable
     */
    public static Variable of(String name, VarType type, Object value) {
        return new Variable(name, type, value, "");
    }
}
