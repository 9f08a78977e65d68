package com.dslforge.core.parser;

import com.dslforge.core.model.Assign;
import com.dslforge.core.model.CallStatement;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.ElifBranch;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.ReturnStatement;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.StatementVisitor;

import java.util.List;

/**
 * Renders a statement tree back to canonical DSL text, four spaces per level.
 *
 * <p>Blocks that were never closed are printed without their close keyword,
 * so printing and re-parsing a tree reproduces the same defects.
 */
public class DslPrinter {

    private static final String INDENT = "    ";

    /**
     * Prints statements as DSL source.
     *
     * @param statements top-level statements
     * @return DSL text ending with a newline, or empty for no statements
     */
    public String print(List<Statement> statements) {
        StringBuilder sb = new StringBuilder();
        printBlock(statements, 0, sb);
        return sb.toString();
    }

    private void printBlock(List<Statement> statements, int depth, StringBuilder sb) {
        for (Statement statement : statements) {
            statement.accept(new LinePrinter(depth, sb));
        }
    }

    private final class LinePrinter implements StatementVisitor<Void> {
        private final int depth;
        private final StringBuilder sb;

        private LinePrinter(int depth, StringBuilder sb) {
            this.depth = depth;
            this.sb = sb;
        }

        private void line(String text) {
            sb.append(INDENT.repeat(depth)).append(text).append('\n');
        }

        @Override
        public Void visitDefine(Define define) {
            String head = "DEFINE {{" + define.name() + "}}: " + define.type().getDisplayName();
            line(define.initialValue() == null ? head : head + " = " + define.initialValue().sourceText());
            return null;
        }

        @Override
        public Void visitAssign(Assign assign) {
            line("{{" + assign.target() + "}} = " + assign.expression().sourceText());
            return null;
        }

        @Override
        public Void visitCall(CallStatement call) {
            String text = call.call().sourceText();
            line(call.hasResultBinding() ? "{{" + call.resultBinding() + "}} = " + text : text);
            return null;
        }

        @Override
        public Void visitIf(IfStatement ifStatement) {
            line("IF " + ifStatement.condition().sourceText());
            printBlock(ifStatement.thenBranch(), depth + 1, sb);
            for (ElifBranch elif : ifStatement.elifBranches()) {
                line("ELIF " + elif.condition().sourceText());
                printBlock(elif.body(), depth + 1, sb);
            }
            if (ifStatement.hasElse()) {
                line("ELSE");
                printBlock(ifStatement.elseBranch(), depth + 1, sb);
            }
            if (ifStatement.closed()) {
                line("ENDIF");
            }
            return null;
        }

        @Override
        public Void visitFor(ForStatement forStatement) {
            line("FOR {{" + forStatement.loopVar() + "}} IN " + forStatement.iterable().sourceText());
            printBlock(forStatement.body(), depth + 1, sb);
            if (forStatement.closed()) {
                line("ENDFOR");
            }
            return null;
        }

        @Override
        public Void visitReturn(ReturnStatement returnStatement) {
            line(returnStatement.hasValue() ? "RETURN " + returnStatement.expression().sourceText() : "RETURN");
            return null;
        }
    }
}
