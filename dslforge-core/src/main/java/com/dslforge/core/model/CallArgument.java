package com.dslforge.core.model;

import java.util.Objects;

/**
 * Positional or named ({@code key=value}) argument of a call.
 *
 * @param name keyword name, or null for a positional argument
 * @param value argument value
 */
public record CallArgument(String name, Expression value) {

    /**
     * Compact constructor with validation.
     */
    public CallArgument {
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Creates a positional argument.
     *
     * @param value argument value
     * @return argument
     */
    public static CallArgument positional(Expression value) {
        return new CallArgument(null, value);
    }

    /**
     * Whether this is a keyword argument.
     *
     * @return true when a name is set
     */
    public boolean isNamed() {
        return name != null;
    }

    /**
     * Renders the argument back to DSL syntax.
     *
     * @return DSL text
     */
    public String sourceText() {
        return isNamed() ? name + "=" + value.sourceText() : value.sourceText();
    }
}
