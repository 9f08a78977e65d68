package com.dslforge.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An expression built from literals, operators and variable references,
 * such as {@code {{score}} >= 90 AND {{active}}}.
 *
 * @param parts references and literal text in source order
 */
public record ValueExpression(List<ExpressionPart> parts) implements Expression {

    /**
     * Compact constructor with validation.
     */
    public ValueExpression {
        Objects.requireNonNull(parts, "parts must not be null");
        parts = List.copyOf(parts);
    }

    /**
     * Creates an expression consisting of a single literal.
     *
     * @param text literal text
     * @return expression
     */
    public static ValueExpression literal(String text) {
        return new ValueExpression(List.of(new Literal(text)));
    }

    /**
     * Creates an expression consisting of a single reference.
     *
     * @param name variable name
     * @return expression
     */
    public static ValueExpression reference(String name) {
        return new ValueExpression(List.of(new Reference(name)));
    }

    /**
     * Whether the expression contains no variable references.
     *
     * @return true for pure literals
     */
    public boolean isLiteral() {
        return parts.stream().noneMatch(Reference.class::isInstance);
    }

    @Override
    public String sourceText() {
        return parts.stream().map(ExpressionPart::sourceText).collect(Collectors.joining()).trim();
    }

    @Override
    public List<String> references() {
        return parts.stream()
            .filter(Reference.class::isInstance)
            .map(part -> ((Reference) part).name())
            .toList();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitValue(this);
    }
}
