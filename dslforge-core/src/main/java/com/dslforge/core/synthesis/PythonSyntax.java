package com.dslforge.core.synthesis;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python spelling of DSL literals, operators and keywords.
 */
public final class PythonSyntax {

    public static final String INDENT = "    ";

    /** The single runtime primitive every DSL call is translated to. */
    public static final String INVOKE_FUNCTION = "invoke_function";

    public static final String RUNTIME_MODULE = "llm_runtime";

    private static final Pattern WORD = Pattern.compile("\\b(AND|OR|NOT|IN|true|false|TRUE|FALSE|True|False|null|NULL)\\b");

    private static final Pattern SYMBOLIC_OPERATOR = Pattern.compile("&&|\\|\\|");

    private static final Map<String, String> WORDS = Map.ofEntries(
        Map.entry("AND", "and"),
        Map.entry("OR", "or"),
        Map.entry("NOT", "not"),
        Map.entry("IN", "in"),
        Map.entry("true", "True"),
        Map.entry("TRUE", "True"),
        Map.entry("True", "True"),
        Map.entry("false", "False"),
        Map.entry("FALSE", "False"),
        Map.entry("False", "False"),
        Map.entry("null", "None"),
        Map.entry("NULL", "None")
    );

    private PythonSyntax() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Translates literal DSL text, leaving quoted strings untouched.
     *
     * @param text literal text, e.g. {@code  > 5 AND }
     * @return Python text, e.g. {@code  > 5 and }
     */
    public static String translateLiteral(String text) {
        StringBuilder out = new StringBuilder(text.length());
        StringBuilder code = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (c == quote && text.charAt(i - 1) != '\\') {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                out.append(translateCode(code.toString()));
                code.setLength(0);
                quote = c;
                out.append(c);
            } else {
                code.append(c);
            }
        }
        out.append(translateCode(code.toString()));
        return out.toString();
    }

    private static String translateCode(String code) {
        if (code.isEmpty()) {
            return code;
        }
        Matcher words = WORD.matcher(code);
        StringBuilder translated = new StringBuilder();
        while (words.find()) {
            words.appendReplacement(translated, Matcher.quoteReplacement(WORDS.get(words.group(1))));
        }
        words.appendTail(translated);

        Matcher symbols = SYMBOLIC_OPERATOR.matcher(translated.toString());
        StringBuilder result = new StringBuilder();
        while (symbols.find()) {
            symbols.appendReplacement(result, "&&".equals(symbols.group()) ? " and " : " or ");
        }
        symbols.appendTail(result);
        return result.toString();
    }

    /**
     * Quotes text as a Python string literal.
     *
     * @param value raw text
     * @return double-quoted, escaped literal
     */
    public static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /**
     * Indentation for a nesting depth.
     *
     * @param depth nesting depth, 0 for module level
     * @return spaces
     */
    public static String indent(int depth) {
        return INDENT.repeat(depth);
    }
}
