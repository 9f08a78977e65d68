package com.dslforge.core.naming;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The single rule set deciding whether a DSL variable name is a legal
 * identifier in the generated Python code, and how to make it one.
 *
 * <p>The validator, the repair engine and the code synthesizer all go through
 * this class, so a name accepted by one is accepted by all three and a name
 * sanitized by the repair engine is emitted unchanged by the synthesizer.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Only ASCII letters, digits and underscores. Each run of other characters becomes one {@code _}.</li>
 *   <li>Must not start with a digit. A leading digit gets a {@code _} prefix ({@code 95th_percentile} becomes {@code _95th_percentile}).</li>
 *   <li>Must not collide with {@link #RESERVED_WORDS}. A reserved word gets a {@code _} prefix.</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IdentifierRules.isValid("95th_percentile");   // false
 * IdentifierRules.sanitize("95th_percentile");  // "_95th_percentile"
 * IdentifierRules.sanitize("order-total");      // "order_total"
 * IdentifierRules.sanitize("class");            // "_class"
 * }</pre>
 */
public final class IdentifierRules {

    /**
     * Python keywords plus the names the generated program itself defines or calls.
     */
    public static final Set<String> RESERVED_WORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await",
        "break", "class", "continue", "def", "del", "elif", "else", "except",
        "finally", "for", "from", "global", "if", "import", "in", "is",
        "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
        "while", "with", "yield",
        "invoke_function", "main_workflow",
        "bool", "dict", "len", "print", "json", "sys"
    );

    public static final Pattern VALID_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Pattern ILLEGAL_RUN = Pattern.compile("[^A-Za-z0-9_]+");
    private static final Pattern LEADING_DIGIT = Pattern.compile("^[0-9]");

    private static final String FALLBACK_NAME = "_var";

    private IdentifierRules() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Whether a name can be emitted as-is.
     *
     * @param name candidate identifier
     * @return true if legal and not reserved
     */
    public static boolean isValid(String name) {
        return name != null
            && VALID_IDENTIFIER.matcher(name).matches()
            && !RESERVED_WORDS.contains(name);
    }

    /**
     * Explains why a name is not a legal identifier.
     *
     * @param name candidate identifier
     * @return the first violated rule, or empty when the name is valid
     */
    public static Optional<String> violation(String name) {
        if (name == null || name.isBlank()) {
            return Optional.of("is empty");
        }
        if (ILLEGAL_RUN.matcher(name).find()) {
            return Optional.of("contains characters other than letters, digits and '_'");
        }
        if (LEADING_DIGIT.matcher(name).find()) {
            return Optional.of("starts with a digit");
        }
        if (RESERVED_WORDS.contains(name)) {
            return Optional.of("collides with the reserved word '" + name + "'");
        }
        return Optional.empty();
    }

    /**
     * Turns a name into a legal identifier. Valid names come back unchanged,
     * and sanitizing twice gives the same result as sanitizing once.
     *
     * @param name candidate identifier
     * @return legal identifier
     */
    public static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return FALLBACK_NAME;
        }
        if (isValid(name)) {
            return name;
        }
        String cleaned = ILLEGAL_RUN.matcher(name.trim()).replaceAll("_");
        if (cleaned.isEmpty() || cleaned.chars().allMatch(c -> c == '_')) {
            return FALLBACK_NAME;
        }
        if (LEADING_DIGIT.matcher(cleaned).find() || RESERVED_WORDS.contains(cleaned)) {
            cleaned = "_" + cleaned;
        }
        return cleaned;
    }
}
