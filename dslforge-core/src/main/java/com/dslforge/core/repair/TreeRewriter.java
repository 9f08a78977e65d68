package com.dslforge.core.repair;

import com.dslforge.core.model.ElifBranch;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Rebuilds immutable statement trees bottom-up.
 */
final class TreeRewriter {

    private TreeRewriter() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Applies a function to every statement, children first, so the function
     * sees blocks whose bodies are already rewritten. Leaves are visited in
     * source order.
     *
     * @param statements statements to rewrite
     * @param function replacement per statement
     * @return rewritten statements
     */
    static List<Statement> rewrite(List<Statement> statements, UnaryOperator<Statement> function) {
        List<Statement> result = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            result.add(function.apply(rewriteChildren(statement, function)));
        }
        return result;
    }

    private static Statement rewriteChildren(Statement statement, UnaryOperator<Statement> function) {
        if (statement instanceof IfStatement ifStatement) {
            List<Statement> thenBranch = rewrite(ifStatement.thenBranch(), function);
            List<ElifBranch> elifs = ifStatement.elifBranches().stream()
                .map(elif -> elif.withBody(rewrite(elif.body(), function)))
                .toList();
            List<Statement> elseBranch = ifStatement.hasElse() ? rewrite(ifStatement.elseBranch(), function) : null;
            return ifStatement.withBranches(thenBranch, elifs, elseBranch, ifStatement.closed());
        }
        if (statement instanceof ForStatement forStatement) {
            return forStatement.withBody(rewrite(forStatement.body(), function), forStatement.closed());
        }
        return statement;
    }
}
