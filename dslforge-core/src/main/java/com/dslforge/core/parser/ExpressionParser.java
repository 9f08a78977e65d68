package com.dslforge.core.parser;

import com.dslforge.core.model.CallArgument;
import com.dslforge.core.model.CallExpression;
import com.dslforge.core.model.Expression;
import com.dslforge.core.model.ExpressionPart;
import com.dslforge.core.model.Literal;
import com.dslforge.core.model.RawExpression;
import com.dslforge.core.model.Reference;
import com.dslforge.core.model.ValueExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Structures expression text into {@link ValueExpression} or {@link CallExpression}.
 *
 * <p>Never throws for malformed input. Text it cannot structure comes back as a
 * {@link RawExpression} holding the original text:
 * <ul>
 *   <li>unbalanced quotes, brackets or {@code {{ }}} delimiters</li>
 *   <li>{@code CALL} anywhere other than as the whole expression or a whole argument</li>
 *   <li>empty arguments such as {@code f(a,,b)}</li>
 * </ul>
 *
 * <p>{@code {{name}}} inside a quoted string is literal text, not a reference.
 */
public class ExpressionParser {

    /**
     * Parses expression text.
     *
     * @param text expression text, e.g. {@code {{x}} > 5} or {@code CALL f({{x}}, limit=3)}
     * @return structured expression, or a {@link RawExpression} when the text has no known shape
     */
    public Expression parse(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return new RawExpression(trimmed);
        }

        Matcher call = DslPatterns.CALL_EXPRESSION.matcher(trimmed);
        if (call.matches()) {
            return parseCall(trimmed, call.group(1), call.group(2));
        }
        if (DslPatterns.CALL_KEYWORD.matcher(stripQuoted(trimmed)).find()) {
            return new RawExpression(trimmed);
        }
        return parseValue(trimmed).map(Expression.class::cast).orElseGet(() -> new RawExpression(trimmed));
    }

    private Expression parseCall(String fullText, String functionName, String argumentText) {
        Optional<List<String>> pieces = splitArguments(argumentText);
        if (pieces.isEmpty()) {
            return new RawExpression(fullText);
        }

        List<CallArgument> arguments = new ArrayList<>();
        for (String piece : pieces.get()) {
            Matcher named = DslPatterns.NAMED_ARGUMENT.matcher(piece);
            String name = null;
            String valueText = piece;
            if (named.matches()) {
                name = named.group(1);
                valueText = named.group(2);
            }
            Expression value = parse(valueText);
            if (value instanceof RawExpression) {
                return new RawExpression(fullText);
            }
            arguments.add(new CallArgument(name, value));
        }
        return new CallExpression(functionName, arguments);
    }

    /**
     * Splits an argument list on top-level commas.
     *
     * @param text text between the call's parentheses
     * @return trimmed arguments, or empty when brackets or quotes are unbalanced
     */
    Optional<List<String>> splitArguments(String text) {
        List<String> arguments = new ArrayList<>();
        if (text.isBlank()) {
            return Optional.of(arguments);
        }

        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote && text.charAt(i - 1) != '\\') {
                    quote = 0;
                }
                current.append(c);
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth--;
                default -> {
                    // other characters carry no structure
                }
            }
            if (depth < 0) {
                return Optional.empty();
            }
            if (c == ',' && depth == 0) {
                if (current.toString().isBlank()) {
                    return Optional.empty();
                }
                arguments.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (depth != 0 || quote != 0 || current.toString().isBlank()) {
            return Optional.empty();
        }
        arguments.add(current.toString().trim());
        return Optional.of(arguments);
    }

    private Optional<ValueExpression> parseValue(String text) {
        List<ExpressionPart> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int depth = 0;
        char quote = 0;

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote && text.charAt(i - 1) != '\\') {
                    quote = 0;
                }
                literal.append(c);
                i++;
                continue;
            }
            if (text.startsWith("{{", i)) {
                int close = text.indexOf("}}", i + 2);
                if (close < 0) {
                    return Optional.empty();
                }
                String name = text.substring(i + 2, close).trim();
                if (name.isEmpty() || name.contains("{") || name.contains("}")) {
                    return Optional.empty();
                }
                flushLiteral(literal, parts);
                parts.add(new Reference(name));
                i = close + 2;
                continue;
            }
            if (text.startsWith("}}", i)) {
                return Optional.empty();
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth--;
                default -> {
                    // plain literal character
                }
            }
            if (depth < 0) {
                return Optional.empty();
            }
            literal.append(c);
            i++;
        }
        if (depth != 0 || quote != 0) {
            return Optional.empty();
        }
        flushLiteral(literal, parts);
        return Optional.of(new ValueExpression(parts));
    }

    private static void flushLiteral(StringBuilder literal, List<ExpressionPart> parts) {
        if (literal.length() > 0) {
            parts.add(new Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    /**
     * Blanks out quoted strings so keyword searches only see code.
     *
     * @param text expression text
     * @return text with quoted content replaced by spaces
     */
    static String stripQuoted(String text) {
        StringBuilder out = new StringBuilder(text.length());
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote && text.charAt(i - 1) != '\\') {
                    quote = 0;
                }
                out.append(' ');
            } else if (c == '"' || c == '\'') {
                quote = c;
                out.append(' ');
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
