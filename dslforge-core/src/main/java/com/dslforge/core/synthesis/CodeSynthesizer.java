package com.dslforge.core.synthesis;

import com.dslforge.core.model.Assign;
import com.dslforge.core.model.CallArgument;
import com.dslforge.core.model.CallExpression;
import com.dslforge.core.model.CallStatement;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.ElifBranch;
import com.dslforge.core.model.Expression;
import com.dslforge.core.model.ExpressionPart;
import com.dslforge.core.model.ExpressionVisitor;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.Literal;
import com.dslforge.core.model.RawExpression;
import com.dslforge.core.model.Reference;
import com.dslforge.core.model.ReturnStatement;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.StatementVisitor;
import com.dslforge.core.model.ValueExpression;
import com.dslforge.core.naming.IdentifierRules;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Translates validated statements into Python.
 *
 * <p>Every call shape (bare call, bound call, call as condition, call as
 * returned value, call nested in arguments) goes through one primitive,
 * {@code invoke_function('name', args...)}. A call used as a condition is
 * wrapped in {@code bool(...)}. Every variable name goes through
 * {@link IdentifierRules#sanitize(String)}, the rule the validator checks.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeSynthesizer synthesizer = new CodeSynthesizer();
 * String python = synthesizer.synthesize(ifStatement);
 * // if x > 5:
 * //     invoke_function('f')
 * }</pre>
 *
 * <p>Input is expected to be validator-clean. An unparsed expression is a
 * programming error and fails with {@link IllegalArgumentException}.
 */
public class CodeSynthesizer {

    /**
     * Synthesizes one statement at module level.
     *
     * @param statement statement to translate
     * @return Python source lines joined by newlines
     */
    public String synthesize(Statement statement) {
        return String.join("\n", synthesize(statement, 0));
    }

    /**
     * Synthesizes one statement at the given nesting depth.
     *
     * @param statement statement to translate
     * @param depth nesting depth, one indentation level each
     * @return indented Python source lines
     */
    public List<String> synthesize(Statement statement, int depth) {
        List<String> lines = new ArrayList<>();
        statement.accept(new LineWriter(depth, lines, false));
        return lines;
    }

    /**
     * Synthesizes a function around a statement list.
     *
     * <p>A function gets at most one implicit trailing return, and only when
     * no explicit RETURN exists anywhere in its statement tree. The implicit
     * return hands back the given outputs (a tuple for several); with no
     * outputs nothing is added.
     *
     * @param name function name
     * @param parameters parameter variable names
     * @param statements function body
     * @param outputs variables returned implicitly
     * @return Python function source
     */
    public String function(String name, List<String> parameters, List<Statement> statements, List<String> outputs) {
        List<String> lines = new ArrayList<>();
        String params = parameters.stream().map(IdentifierRules::sanitize).collect(Collectors.joining(", "));
        lines.add("def " + name + "(" + params + "):");

        List<String> body = new ArrayList<>();
        for (Statement statement : statements) {
            body.addAll(synthesize(statement, 1));
        }
        if (!ReturnAnalysis.containsReturn(statements) && !outputs.isEmpty()) {
            body.add(PythonSyntax.indent(1) + "return "
                + outputs.stream().map(IdentifierRules::sanitize).collect(Collectors.joining(", ")));
        }
        if (body.isEmpty()) {
            body.add(PythonSyntax.indent(1) + "pass");
        }
        lines.addAll(body);
        return String.join("\n", lines);
    }

    /**
     * Synthesizes a function whose statements may end the workflow.
     *
     * <p>The function always returns a pair. A RETURN becomes
     * {@code return True, value} ({@code None} for a bare RETURN). Falling off
     * the end returns {@code False} with a dict of the outputs keyed by their
     * sanitized names, so the caller can tell a returned {@code None} from a
     * path that did not return and still pick up that path's writes.
     *
     * @param name function name
     * @param parameters parameter variable names
     * @param statements function body
     * @param outputs variables handed back when no RETURN is reached
     * @return Python function source
     */
    public String terminalFunction(String name, List<String> parameters, List<Statement> statements,
                                   List<String> outputs) {
        List<String> lines = new ArrayList<>();
        String params = parameters.stream().map(IdentifierRules::sanitize).collect(Collectors.joining(", "));
        lines.add("def " + name + "(" + params + "):");
        for (Statement statement : statements) {
            statement.accept(new LineWriter(1, lines, true));
        }
        boolean endsWithReturn = !statements.isEmpty()
            && statements.get(statements.size() - 1) instanceof ReturnStatement;
        if (!endsWithReturn) {
            String entries = outputs.stream()
                .map(IdentifierRules::sanitize)
                .map(output -> PythonSyntax.quote(output) + ": " + output)
                .collect(Collectors.joining(", "));
            lines.add(PythonSyntax.indent(1) + "return False, {" + entries + "}");
        }
        return String.join("\n", lines);
    }

    /**
     * Synthesizes an expression.
     *
     * @param expression expression
     * @return Python expression
     */
    public String expression(Expression expression) {
        return expression.accept(EXPRESSIONS);
    }

    /**
     * Synthesizes a condition; a call condition is adapted to a boolean.
     *
     * @param condition condition expression
     * @return Python boolean expression
     */
    public String condition(Expression condition) {
        if (condition instanceof CallExpression call) {
            return "bool(" + expression(call) + ")";
        }
        return expression(condition);
    }

    private static final ExpressionVisitor<String> EXPRESSIONS = new ExpressionVisitor<>() {
        @Override
        public String visitValue(ValueExpression value) {
            StringBuilder sb = new StringBuilder();
            for (ExpressionPart part : value.parts()) {
                if (part instanceof Reference reference) {
                    sb.append(IdentifierRules.sanitize(reference.name()));
                } else if (part instanceof Literal literal) {
                    sb.append(PythonSyntax.translateLiteral(literal.text()));
                }
            }
            return sb.toString().trim();
        }

        @Override
        public String visitCall(CallExpression call) {
            List<String> arguments = new ArrayList<>();
            arguments.add("'" + call.functionName() + "'");
            for (CallArgument argument : call.arguments()) {
                String value = argument.value().accept(this);
                arguments.add(argument.isNamed() ? IdentifierRules.sanitize(argument.name()) + "=" + value : value);
            }
            return PythonSyntax.INVOKE_FUNCTION + "(" + String.join(", ", arguments) + ")";
        }

        @Override
        public String visitRaw(RawExpression raw) {
            throw new IllegalArgumentException("Cannot synthesize unparsed expression: " + raw.text());
        }
    };

    private final class LineWriter implements StatementVisitor<Void> {
        private final int depth;
        private final List<String> lines;
        private final String indent;
        private final boolean flagReturns;

        private LineWriter(int depth, List<String> lines, boolean flagReturns) {
            this.depth = depth;
            this.lines = lines;
            this.indent = PythonSyntax.indent(depth);
            this.flagReturns = flagReturns;
        }

        private void block(List<Statement> statements) {
            if (statements.isEmpty()) {
                lines.add(PythonSyntax.indent(depth + 1) + "pass");
                return;
            }
            LineWriter nested = new LineWriter(depth + 1, lines, flagReturns);
            for (Statement statement : statements) {
                statement.accept(nested);
            }
        }

        @Override
        public Void visitDefine(Define define) {
            String value = define.initialValue() == null ? "None" : expression(define.initialValue());
            lines.add(indent + IdentifierRules.sanitize(define.name()) + " = " + value);
            return null;
        }

        @Override
        public Void visitAssign(Assign assign) {
            lines.add(indent + IdentifierRules.sanitize(assign.target()) + " = " + expression(assign.expression()));
            return null;
        }

        @Override
        public Void visitCall(CallStatement call) {
            String invocation = expression(call.call());
            lines.add(call.hasResultBinding()
                ? indent + IdentifierRules.sanitize(call.resultBinding()) + " = " + invocation
                : indent + invocation);
            return null;
        }

        @Override
        public Void visitIf(IfStatement ifStatement) {
            lines.add(indent + "if " + condition(ifStatement.condition()) + ":");
            block(ifStatement.thenBranch());
            for (ElifBranch elif : ifStatement.elifBranches()) {
                lines.add(indent + "elif " + condition(elif.condition()) + ":");
                block(elif.body());
            }
            if (ifStatement.hasElse()) {
                lines.add(indent + "else:");
                block(ifStatement.elseBranch());
            }
            return null;
        }

        @Override
        public Void visitFor(ForStatement forStatement) {
            lines.add(indent + "for " + IdentifierRules.sanitize(forStatement.loopVar())
                + " in " + expression(forStatement.iterable()) + ":");
            block(forStatement.body());
            return null;
        }

        @Override
        public Void visitReturn(ReturnStatement returnStatement) {
            String value = returnStatement.hasValue() ? expression(returnStatement.expression()) : null;
            if (flagReturns) {
                lines.add(indent + "return True, " + (value == null ? "None" : value));
            } else {
                lines.add(value == null ? indent + "return" : indent + "return " + value);
            }
            return null;
        }
    }
}
