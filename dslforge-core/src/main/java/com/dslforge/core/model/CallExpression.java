package com.dslforge.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code CALL function(arguments)}, wherever it appears: as a statement, a
 * condition, a returned value or a nested argument.
 *
 * @param functionName called function
 * @param arguments arguments in source order
 */
public record CallExpression(String functionName, List<CallArgument> arguments) implements Expression {

    /**
     * Compact constructor with validation.
     */
    public CallExpression {
        Objects.requireNonNull(functionName, "functionName must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public String sourceText() {
        return "CALL " + functionName + "("
            + arguments.stream().map(CallArgument::sourceText).collect(Collectors.joining(", "))
            + ")";
    }

    @Override
    public List<String> references() {
        return arguments.stream()
            .flatMap(argument -> argument.value().references().stream())
            .toList();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
