package com.dslforge.core.validation;

import com.dslforge.core.model.VarType;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Type inference and coercion for literal DSL values.
 *
 * <p>Inference recognizes quoted strings, {@code true}/{@code false}, integers,
 * decimals, {@code [...]} lists and {@code {...}} dicts. Coercion only happens
 * when the result is unambiguous; everything else is left for regeneration.
 */
public final class LiteralTypes {

    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^-?\\d+\\.\\d+$");
    private static final Pattern QUOTED = Pattern.compile("^(\"([^\"]*)\"|'([^']*)')$");
    private static final Pattern BOOLEAN = Pattern.compile("^(?i)(true|false)$");

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "0");

    private LiteralTypes() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Infers the type of literal text.
     *
     * @param literal literal text, e.g. {@code 90}, {@code "high"}, {@code [1, 2]}
     * @return inferred type, or empty when the text is not a recognized literal
     */
    public static Optional<VarType> infer(String literal) {
        if (literal == null) {
            return Optional.empty();
        }
        String text = literal.trim();
        if (QUOTED.matcher(text).matches()) {
            return Optional.of(VarType.STRING);
        }
        if (BOOLEAN.matcher(text).matches()) {
            return Optional.of(VarType.BOOLEAN);
        }
        if (INTEGER.matcher(text).matches()) {
            return Optional.of(VarType.INTEGER);
        }
        if (DECIMAL.matcher(text).matches()) {
            return Optional.of(VarType.FLOAT);
        }
        if (text.startsWith("[") && text.endsWith("]")) {
            return Optional.of(VarType.LIST);
        }
        if (text.startsWith("{") && text.endsWith("}")) {
            return Optional.of(VarType.DICT);
        }
        return Optional.empty();
    }

    /**
     * Whether a value of the inferred type may be stored in a variable of the declared type.
     *
     * @param declared declared variable type
     * @param inferred literal type
     * @return true if compatible; integers are accepted where floats are declared
     */
    public static boolean isCompatible(VarType declared, VarType inferred) {
        return declared == VarType.ANY
            || declared == inferred
            || (declared == VarType.FLOAT && inferred == VarType.INTEGER);
    }

    /**
     * Coerces literal text to a declared type when there is exactly one sensible result.
     *
     * @param literal literal text
     * @param target declared type
     * @return coerced literal text, or empty when the conversion is ambiguous or impossible
     */
    public static Optional<String> coerce(String literal, VarType target) {
        Optional<VarType> source = infer(literal);
        if (source.isEmpty()) {
            return Optional.empty();
        }
        String text = literal.trim();
        String bare = unquote(text);
        return switch (target) {
            case INTEGER -> toInteger(source.get(), bare);
            case FLOAT -> toFloat(source.get(), bare);
            case BOOLEAN -> toBoolean(source.get(), bare);
            case STRING -> source.get() == VarType.LIST || source.get() == VarType.DICT
                ? Optional.empty()
                : Optional.of("\"" + bare.replace("\"", "\\\"") + "\"");
            case LIST, DICT, ANY -> Optional.empty();
        };
    }

    private static Optional<String> toInteger(VarType source, String bare) {
        if (source == VarType.STRING || source == VarType.FLOAT) {
            if (INTEGER.matcher(bare).matches()) {
                return Optional.of(bare);
            }
            if (DECIMAL.matcher(bare).matches()) {
                BigDecimal value = new BigDecimal(bare);
                if (value.stripTrailingZeros().scale() <= 0) {
                    return Optional.of(value.toBigIntegerExact().toString());
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> toFloat(VarType source, String bare) {
        if (source == VarType.STRING && (INTEGER.matcher(bare).matches() || DECIMAL.matcher(bare).matches())) {
            return Optional.of(DECIMAL.matcher(bare).matches() ? bare : bare + ".0");
        }
        return Optional.empty();
    }

    private static Optional<String> toBoolean(VarType source, String bare) {
        if (source != VarType.STRING && source != VarType.INTEGER) {
            return Optional.empty();
        }
        String normalized = bare.trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(normalized)) {
            return Optional.of("true");
        }
        if (FALSE_WORDS.contains(normalized)) {
            return Optional.of("false");
        }
        return Optional.empty();
    }

    private static String unquote(String text) {
        Matcher matcher = QUOTED.matcher(text);
        if (!matcher.matches()) {
            return text;
        }
        return matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
    }
}
