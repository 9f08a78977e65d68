package com.dslforge.core.validation;

import com.dslforge.core.analysis.AnalysisResult;
import com.dslforge.core.analysis.StatementWalker;
import com.dslforge.core.model.CallArgument;
import com.dslforge.core.model.CallExpression;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.ElifBranch;
import com.dslforge.core.model.Expression;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.RawExpression;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.ValueExpression;
import com.dslforge.core.model.VarType;
import com.dslforge.core.naming.IdentifierRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic checks over a parsed and analyzed statement tree.
 *
 * <p>Validation is a pure function of its inputs. It returns every defect in
 * one pass, merged with the parse and analysis defects it is given, without
 * duplicates and sorted by position:
 * <ul>
 *   <li>blocks without a close, and expressions that could not be parsed</li>
 *   <li>identifier legality, through {@link IdentifierRules}</li>
 *   <li>DEFINE literals that do not fit the declared type</li>
 *   <li>ordering comparisons on non-numeric operands, and {@code IN} on non-collections</li>
 *   <li>branches that can never run because their condition is constant (warning only)</li>
 * </ul>
 */
public class DslValidator {

    private static final Logger log = LoggerFactory.getLogger(DslValidator.class);

    /** Nesting deeper than this is legal but logged. */
    public static final int MAX_RECOMMENDED_DEPTH = 5;

    private static final String OPERAND =
        "(\\{\\{[^{}]+\\}\\}|\"[^\"]*\"|'[^']*'|-?\\d+(?:\\.\\d+)?|(?i:true|false)\\b)";

    private static final Pattern ORDERING = Pattern.compile(OPERAND + "\\s*(>=|<=|>|<)\\s*" + OPERAND);

    private static final Pattern MEMBERSHIP =
        Pattern.compile("\\bIN\\s+(\\{\\{[^{}]+\\}\\}|\\[[^\\]]*\\]|\\{[^{}]*\\}|\"[^\"]*\"|'[^']*'|-?\\d+(?:\\.\\d+)?|(?i:true|false)\\b)");

    private static final Pattern REFERENCE_OPERAND = Pattern.compile("^\\{\\{([^{}]+)\\}\\}$");

    private static final Pattern BOOLEAN_CONSTANT = Pattern.compile("^(?i)(true|false)$");

    private static final Pattern NUMERIC_EQUALITY =
        Pattern.compile("^(-?\\d+(?:\\.\\d+)?)\\s*(==|!=)\\s*(-?\\d+(?:\\.\\d+)?)$");

    /**
     * Validates statements using only the defects analysis produced.
     *
     * @param statements statement tree
     * @param analysis analyzer output for the same tree
     * @return every defect, sorted
     */
    public List<Defect> validate(List<Statement> statements, AnalysisResult analysis) {
        return validate(statements, analysis, List.of());
    }

    /**
     * Validates statements and merges in defects found earlier.
     *
     * @param statements statement tree
     * @param analysis analyzer output for the same tree
     * @param upstreamDefects defects from parsing that the tree cannot show, may be empty
     * @return every defect, sorted and without duplicates
     */
    public List<Defect> validate(List<Statement> statements, AnalysisResult analysis, List<Defect> upstreamDefects) {
        List<Defect> found = new ArrayList<>(upstreamDefects);
        found.addAll(analysis.defects());

        StatementWalker.forEach(statements, statement -> {
            checkBlockClosed(statement, found);
            checkExpressions(statement, found);
            checkDefineType(statement, found);
            checkConditions(statement, analysis, found);
        });
        checkIdentifiers(statements, found);

        int depth = StatementWalker.maxDepth(statements);
        if (depth > MAX_RECOMMENDED_DEPTH) {
            log.warn("Blocks are nested {} levels deep (recommended at most {})", depth, MAX_RECOMMENDED_DEPTH);
        }

        List<Defect> defects = deduplicate(found);
        log.debug("Validation produced {} defects ({} fatal)", defects.size(),
            defects.stream().filter(Defect::isFatal).count());
        return defects;
    }

    private void checkBlockClosed(Statement statement, List<Defect> found) {
        if (statement instanceof IfStatement ifStatement && !ifStatement.closed()) {
            found.add(unclosed(ifStatement.span(), "IF", "ENDIF"));
        } else if (statement instanceof ForStatement forStatement && !forStatement.closed()) {
            found.add(unclosed(forStatement.span(), "FOR", "ENDFOR"));
        }
    }

    private static Defect unclosed(SourceSpan span, String open, String close) {
        return Defect.of(DefectKind.UNCLOSED_BLOCK, span, open,
            open + " block opened at line " + span.line() + " has no matching " + close);
    }

    private void checkExpressions(Statement statement, List<Defect> found) {
        for (Expression expression : StatementWalker.expressionsOf(statement)) {
            rawTextIn(expression).ifPresent(text -> found.add(Defect.of(DefectKind.UNPARSABLE_CALL_EXPRESSION,
                statement.span(), text, "Cannot parse expression: " + text)));
        }
    }

    private Optional<String> rawTextIn(Expression expression) {
        if (expression instanceof RawExpression raw) {
            return Optional.of(raw.text());
        }
        if (expression instanceof CallExpression call) {
            for (CallArgument argument : call.arguments()) {
                Optional<String> nested = rawTextIn(argument.value());
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    private void checkDefineType(Statement statement, List<Defect> found) {
        if (!(statement instanceof Define define)
            || !(define.initialValue() instanceof ValueExpression value)
            || !value.isLiteral()) {
            return;
        }
        String literal = value.sourceText();
        LiteralTypes.infer(literal)
            .filter(inferred -> !LiteralTypes.isCompatible(define.type(), inferred))
            .ifPresent(inferred -> found.add(Defect.of(DefectKind.TYPE_MISMATCH, define.span(), define.name(),
                "Variable '" + define.name() + "' is declared " + define.type().getDisplayName()
                    + " but initialized with " + inferred.getDisplayName() + " literal " + literal)));
    }

    private void checkConditions(Statement statement, AnalysisResult analysis, List<Defect> found) {
        if (!(statement instanceof IfStatement ifStatement)) {
            return;
        }
        checkOperandTypes(ifStatement.condition(), ifStatement.span(), analysis, found);
        for (ElifBranch elif : ifStatement.elifBranches()) {
            checkOperandTypes(elif.condition(), elif.span(), analysis, found);
        }
        checkDeadBranches(ifStatement, found);
    }

    private void checkOperandTypes(Expression condition, SourceSpan span, AnalysisResult analysis,
                                   List<Defect> found) {
        if (!(condition instanceof ValueExpression value)) {
            return;
        }
        String text = value.sourceText();

        Matcher ordering = ORDERING.matcher(text);
        while (ordering.find()) {
            for (String operand : List.of(ordering.group(1), ordering.group(3))) {
                VarType type = operandType(operand, analysis);
                if (!type.isNumericCompatible()) {
                    found.add(Defect.of(DefectKind.TYPE_MISMATCH, span, text,
                        "Operator '" + ordering.group(2) + "' needs numeric operands but " + operand
                            + " is " + type.getDisplayName()));
                }
            }
        }

        Matcher membership = MEMBERSHIP.matcher(text);
        while (membership.find()) {
            VarType type = operandType(membership.group(1), analysis);
            if (!type.isContainerCompatible()) {
                found.add(Defect.of(DefectKind.TYPE_MISMATCH, span, text,
                    "Operator 'IN' needs a List, Dict or String on the right but " + membership.group(1)
                        + " is " + type.getDisplayName()));
            }
        }
    }

    private VarType operandType(String operand, AnalysisResult analysis) {
        Matcher reference = REFERENCE_OPERAND.matcher(operand);
        if (reference.matches()) {
            return analysis.typeOf(reference.group(1).trim()).orElse(VarType.ANY);
        }
        return LiteralTypes.infer(operand).orElse(VarType.ANY);
    }

    private void checkDeadBranches(IfStatement ifStatement, List<Defect> found) {
        Optional<Boolean> constant = constantValue(ifStatement.condition());
        if (constant.isPresent() && !constant.get()) {
            found.add(Defect.of(DefectKind.DEAD_BRANCH, ifStatement.span(), "IF",
                "IF condition '" + ifStatement.condition().sourceText() + "' is always false; its body never runs"));
        } else if (constant.isPresent() && (ifStatement.hasElse() || !ifStatement.elifBranches().isEmpty())) {
            found.add(Defect.of(DefectKind.DEAD_BRANCH, ifStatement.span(), "IF",
                "IF condition '" + ifStatement.condition().sourceText()
                    + "' is always true; its ELIF/ELSE branches never run"));
        }
        for (ElifBranch elif : ifStatement.elifBranches()) {
            if (constantValue(elif.condition()).filter(value -> !value).isPresent()) {
                found.add(Defect.of(DefectKind.DEAD_BRANCH, elif.span(), "ELIF",
                    "ELIF condition '" + elif.condition().sourceText() + "' is always false; its body never runs"));
            }
        }
    }

    /**
     * Evaluates conditions that do not depend on any variable.
     *
     * @param condition condition expression
     * @return the constant truth value, or empty when the condition is not constant
     */
    static Optional<Boolean> constantValue(Expression condition) {
        if (!(condition instanceof ValueExpression value) || !value.isLiteral()) {
            return Optional.empty();
        }
        String text = value.sourceText();
        if (BOOLEAN_CONSTANT.matcher(text).matches()) {
            return Optional.of(Boolean.parseBoolean(text.toLowerCase(Locale.ROOT)));
        }
        Matcher equality = NUMERIC_EQUALITY.matcher(text);
        if (equality.matches()) {
            boolean equal = new BigDecimal(equality.group(1)).compareTo(new BigDecimal(equality.group(3))) == 0;
            return Optional.of("==".equals(equality.group(2)) == equal);
        }
        return Optional.empty();
    }

    private void checkIdentifiers(List<Statement> statements, List<Defect> found) {
        Map<String, SourceSpan> firstSeen = new LinkedHashMap<>();
        StatementWalker.forEach(statements, statement -> {
            String written = StatementWalker.writtenName(statement);
            if (written != null) {
                firstSeen.putIfAbsent(written, statement.span());
            }
            for (Expression expression : StatementWalker.expressionsOf(statement)) {
                expression.references().forEach(name -> firstSeen.putIfAbsent(name, statement.span()));
            }
        });

        firstSeen.forEach((name, span) -> IdentifierRules.violation(name).ifPresent(reason ->
            found.add(Defect.of(DefectKind.INVALID_IDENTIFIER, span, name,
                "Identifier '" + name + "' " + reason + "; suggested '" + IdentifierRules.sanitize(name) + "'"))));
    }

    private static List<Defect> deduplicate(List<Defect> defects) {
        Map<String, Defect> unique = new LinkedHashMap<>();
        for (Defect defect : defects) {
            String key = defect.kind() + "|" + defect.span() + "|" + defect.subject();
            unique.putIfAbsent(key, defect);
        }
        List<Defect> sorted = new ArrayList<>(unique.values());
        sorted.sort(null);
        return sorted;
    }
}
