package com.dslforge.core.repair;

import com.dslforge.core.analysis.StatementWalker;
import com.dslforge.core.model.Expression;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.ValueExpression;
import com.dslforge.core.model.VarType;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Guesses the type of an undeclared variable from the way it is first used.
 *
 * <ul>
 *   <li>iterated by FOR, or on the right of {@code IN}: List</li>
 *   <li>ordered comparison against a decimal: Float, otherwise Integer</li>
 *   <li>equality with a quoted string: String</li>
 *   <li>equality with {@code true}/{@code false}: Boolean</li>
 *   <li>anything else: Any</li>
 * </ul>
 */
final class TypeInference {

    private TypeInference() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static VarType inferFromUse(String name, List<Statement> statements) {
        for (Statement statement : StatementWalker.flatten(statements)) {
            Optional<VarType> type = inferFromStatement(name, statement);
            if (type.isPresent()) {
                return type.get();
            }
        }
        return VarType.ANY;
    }

    private static Optional<VarType> inferFromStatement(String name, Statement statement) {
        if (statement instanceof ForStatement forStatement
            && forStatement.iterable() instanceof ValueExpression iterable
            && iterable.references().equals(List.of(name))
            && iterable.sourceText().equals("{{" + name + "}}")) {
            return Optional.of(VarType.LIST);
        }
        for (Expression expression : StatementWalker.expressionsOf(statement)) {
            if (expression instanceof ValueExpression value && value.references().contains(name)) {
                Optional<VarType> type = inferFromText(name, value.sourceText());
                if (type.isPresent()) {
                    return type;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<VarType> inferFromText(String name, String text) {
        String ref = Pattern.quote("{{" + name + "}}");
        if (Pattern.compile("\\bIN\\s+" + ref).matcher(text).find()) {
            return Optional.of(VarType.LIST);
        }
        if (Pattern.compile(ref + "\\s*(>=|<=|>|<)\\s*-?\\d+\\.\\d+").matcher(text).find()
            || Pattern.compile("-?\\d+\\.\\d+\\s*(>=|<=|>|<)\\s*" + ref).matcher(text).find()) {
            return Optional.of(VarType.FLOAT);
        }
        if (Pattern.compile(ref + "\\s*(>=|<=|>|<)").matcher(text).find()
            || Pattern.compile("(>=|<=|>|<)\\s*" + ref).matcher(text).find()) {
            return Optional.of(VarType.INTEGER);
        }
        if (Pattern.compile(ref + "\\s*(==|!=)\\s*[\"']").matcher(text).find()
            || Pattern.compile("[\"']\\s*(==|!=)\\s*" + ref).matcher(text).find()) {
            return Optional.of(VarType.STRING);
        }
        if (Pattern.compile(ref + "\\s*(==|!=)\\s*(?i:true|false)\\b").matcher(text).find()) {
            return Optional.of(VarType.BOOLEAN);
        }
        return Optional.empty();
    }
}
