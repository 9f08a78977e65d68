package com.dslforge.core.model;

import java.util.Objects;

/**
 * {@code DEFINE {{name}}: Type [= value]}.
 *
 * @param span source location
 * @param name variable name
 * @param type declared type
 * @param initialValue initial value, or null when none is given
 */
public record Define(
    SourceSpan span,
    String name,
    VarType type,
    Expression initialValue
) implements Statement {

    /**
     * Compact constructor with validation.
     */
    public Define {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * Returns a copy with another name.
     *
     * @param newName replacement name
     * @return renamed definition
     */
    public Define withName(String newName) {
        return new Define(span, newName, type, initialValue);
    }

    /**
     * Returns a copy with another initial value.
     *
     * @param value replacement value
     * @return updated definition
     */
    public Define withInitialValue(Expression value) {
        return new Define(span, name, type, value);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDefine(this);
    }
}
