package com.dslforge.core.parser;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for the line-oriented DSL.
 *
 * <p>Each statement shape has one line pattern. Patterns are applied to a
 * trimmed line, so none of them deal with indentation.
 *
 * <h2>Grammar</h2>
 * <pre>{@code
 * DEFINE {{name}}: Type [= value]
 * {{name}} = expression
 * {{name}} = CALL function(args)
 * CALL function(args)
 * IF condition | IF CALL function(args)
 * ELIF condition
 * ELSE
 * ENDIF
 * FOR {{item}} IN iterable
 * ENDFOR
 * RETURN [expression] | RETURN CALL function(args)
 * # comment
 * }</pre>
 */
public final class DslPatterns {

    public static final Pattern DEFINE =
        Pattern.compile("^DEFINE\\s+\\{\\{([^{}]+)\\}\\}\\s*:\\s*([A-Za-z_]\\w*)(?:\\s*=\\s*(.+))?$");

    public static final Pattern ASSIGN =
        Pattern.compile("^\\{\\{([^{}]+)\\}\\}\\s*=(?!=)\\s*(.+)$");

    public static final Pattern IF = Pattern.compile("^IF\\s+(.+)$");

    public static final Pattern ELIF = Pattern.compile("^ELIF\\s+(.+)$");

    public static final Pattern ELSE = Pattern.compile("^ELSE:?$");

    public static final Pattern ENDIF = Pattern.compile("^(?:ENDIF|END\\s+IF)$");

    public static final Pattern FOR =
        Pattern.compile("^FOR\\s+\\{\\{([^{}]+)\\}\\}\\s+IN\\s+(.+)$");

    public static final Pattern ENDFOR = Pattern.compile("^(?:ENDFOR|END\\s+FOR)$");

    public static final Pattern RETURN = Pattern.compile("^RETURN(?:\\s+(.+))?$");

    public static final Pattern CALL_STATEMENT = Pattern.compile("^CALL\\b.*$");

    /** Whole-expression call: {@code CALL name(args)}. */
    public static final Pattern CALL_EXPRESSION =
        Pattern.compile("^CALL\\s+([A-Za-z_][\\w.]*)\\s*\\((.*)\\)$", Pattern.DOTALL);

    /** {@code CALL} anywhere in an expression. */
    public static final Pattern CALL_KEYWORD = Pattern.compile("\\bCALL\\b");

    /** A {@code {{name}}} reference. */
    public static final Pattern REFERENCE = Pattern.compile("\\{\\{([^{}]*)\\}\\}");

    /** Leading upper-case word, used to tell keyword lines from anything else. */
    public static final Pattern LEADING_KEYWORD = Pattern.compile("^([A-Z][A-Z_]*)\\b");

    /** Keyword argument prefix: {@code name=} but not {@code name==}. */
    public static final Pattern NAMED_ARGUMENT = Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.*)$", Pattern.DOTALL);

    public static final Pattern COMMENT = Pattern.compile("^(?:#|//).*$");

    private DslPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
