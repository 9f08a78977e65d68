package com.dslforge.core.analysis;

import com.dslforge.core.model.Assign;
import com.dslforge.core.model.CallArgument;
import com.dslforge.core.model.CallExpression;
import com.dslforge.core.model.CallStatement;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.ElifBranch;
import com.dslforge.core.model.Expression;
import com.dslforge.core.model.ExpressionVisitor;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.RawExpression;
import com.dslforge.core.model.ReturnStatement;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.StatementVisitor;
import com.dslforge.core.model.ValueExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Traversal helpers over statement trees shared by the analyzer, validator,
 * repair engine and clustering.
 */
public final class StatementWalker {

    private StatementWalker() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Visits every statement, parents before children, in source order.
     *
     * @param statements statements to walk
     * @param action action per statement
     */
    public static void forEach(List<Statement> statements, Consumer<Statement> action) {
        for (Statement statement : statements) {
            action.accept(statement);
            children(statement).forEach(block -> forEach(block, action));
        }
    }

    /**
     * Returns every statement of the tree, parents before children.
     *
     * @param statements statements to flatten
     * @return flattened statements
     */
    public static List<Statement> flatten(List<Statement> statements) {
        List<Statement> all = new ArrayList<>();
        forEach(statements, all::add);
        return all;
    }

    /**
     * Returns the nested statement lists of a block, empty for simple statements.
     *
     * @param statement any statement
     * @return then, elif and else bodies of an IF, the body of a FOR
     */
    public static List<List<Statement>> children(Statement statement) {
        if (statement instanceof IfStatement ifStatement) {
            List<List<Statement>> blocks = new ArrayList<>();
            blocks.add(ifStatement.thenBranch());
            ifStatement.elifBranches().forEach(elif -> blocks.add(elif.body()));
            if (ifStatement.hasElse()) {
                blocks.add(ifStatement.elseBranch());
            }
            return blocks;
        }
        if (statement instanceof ForStatement forStatement) {
            return List.of(forStatement.body());
        }
        return List.of();
    }

    /**
     * Returns the expressions written directly on a statement's own line(s),
     * not those of nested statements. ELIF conditions count as the IF's own.
     *
     * @param statement any statement
     * @return expressions in source order
     */
    public static List<Expression> expressionsOf(Statement statement) {
        return statement.accept(new StatementVisitor<List<Expression>>() {
            @Override
            public List<Expression> visitDefine(Define define) {
                return define.initialValue() == null ? List.of() : List.of(define.initialValue());
            }

            @Override
            public List<Expression> visitAssign(Assign assign) {
                return List.of(assign.expression());
            }

            @Override
            public List<Expression> visitCall(CallStatement call) {
                return List.of(call.call());
            }

            @Override
            public List<Expression> visitIf(IfStatement ifStatement) {
                List<Expression> conditions = new ArrayList<>();
                conditions.add(ifStatement.condition());
                ifStatement.elifBranches().stream().map(ElifBranch::condition).forEach(conditions::add);
                return conditions;
            }

            @Override
            public List<Expression> visitFor(ForStatement forStatement) {
                return List.of(forStatement.iterable());
            }

            @Override
            public List<Expression> visitReturn(ReturnStatement returnStatement) {
                return returnStatement.hasValue() ? List.of(returnStatement.expression()) : List.of();
            }
        });
    }

    /**
     * Returns the variable a statement writes on its own line, if any.
     *
     * @param statement any statement
     * @return defined name, assignment target, call result binding or loop variable; null otherwise
     */
    public static String writtenName(Statement statement) {
        return statement.accept(new StatementVisitor<String>() {
            @Override
            public String visitDefine(Define define) {
                return define.name();
            }

            @Override
            public String visitAssign(Assign assign) {
                return assign.target();
            }

            @Override
            public String visitCall(CallStatement call) {
                return call.resultBinding();
            }

            @Override
            public String visitIf(IfStatement ifStatement) {
                return null;
            }

            @Override
            public String visitFor(ForStatement forStatement) {
                return forStatement.loopVar();
            }

            @Override
            public String visitReturn(ReturnStatement returnStatement) {
                return null;
            }
        });
    }

    /**
     * Returns every call in an expression, outer calls before the calls nested in their arguments.
     *
     * @param expression any expression
     * @return calls, empty if there are none
     */
    public static List<CallExpression> callsIn(Expression expression) {
        List<CallExpression> calls = new ArrayList<>();
        expression.accept(new ExpressionVisitor<Void>() {
            @Override
            public Void visitValue(ValueExpression value) {
                return null;
            }

            @Override
            public Void visitCall(CallExpression call) {
                calls.add(call);
                for (CallArgument argument : call.arguments()) {
                    argument.value().accept(this);
                }
                return null;
            }

            @Override
            public Void visitRaw(RawExpression raw) {
                return null;
            }
        });
        return calls;
    }

    /**
     * Whether a tree contains a statement of the given type anywhere.
     *
     * @param statements statements to search
     * @param type statement type
     * @return true if found
     */
    public static boolean contains(List<Statement> statements, Class<? extends Statement> type) {
        for (Statement statement : statements) {
            if (type.isInstance(statement)) {
                return true;
            }
            for (List<Statement> block : children(statement)) {
                if (contains(block, type)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns the deepest block nesting, 0 for a flat program.
     *
     * @param statements statements to measure
     * @return maximum depth
     */
    public static int maxDepth(List<Statement> statements) {
        int max = 0;
        for (Statement statement : statements) {
            for (List<Statement> block : children(statement)) {
                max = Math.max(max, 1 + maxDepth(block));
            }
        }
        return max;
    }
}
