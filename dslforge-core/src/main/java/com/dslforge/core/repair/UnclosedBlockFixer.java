package com.dslforge.core.repair;

import com.dslforge.core.analysis.NameResolutionContext;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.ElifBranch;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.Statement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Closes open blocks where their indentation says they end.
 *
 * <p>The parser lets an unclosed block swallow everything up to end of input.
 * This fixer moves the first statement of the block's last branch that is
 * indented no deeper than the block opener, and everything after it, out of
 * the block. With no such statement the block closes at end of input. Inner
 * blocks are closed before outer ones, so statements move outwards one level
 * at a time.
 */
final class UnclosedBlockFixer implements DefectFixer {

    @Override
    public DefectKind kind() {
        return DefectKind.UNCLOSED_BLOCK;
    }

    @Override
    public FixOutcome fix(List<Statement> statements, List<Defect> defects, NameResolutionContext names) {
        Set<SourceSpan> closedSpans = new HashSet<>();
        List<Statement> rewritten = closeBlocks(statements, closedSpans);
        List<Defect> resolved = defects.stream()
            .filter(defect -> closedSpans.contains(defect.span()))
            .toList();
        return FixOutcome.of(rewritten, resolved);
    }

    private List<Statement> closeBlocks(List<Statement> statements, Set<SourceSpan> closedSpans) {
        List<Statement> result = new ArrayList<>();
        for (Statement statement : statements) {
            if (statement instanceof IfStatement ifStatement) {
                closeIf(ifStatement, closedSpans, result);
            } else if (statement instanceof ForStatement forStatement) {
                closeFor(forStatement, closedSpans, result);
            } else {
                result.add(statement);
            }
        }
        return result;
    }

    private void closeIf(IfStatement ifStatement, Set<SourceSpan> closedSpans, List<Statement> out) {
        List<Statement> thenBranch = closeBlocks(ifStatement.thenBranch(), closedSpans);
        List<ElifBranch> elifs = new ArrayList<>();
        for (ElifBranch elif : ifStatement.elifBranches()) {
            elifs.add(elif.withBody(closeBlocks(elif.body(), closedSpans)));
        }
        List<Statement> elseBranch = ifStatement.hasElse() ? closeBlocks(ifStatement.elseBranch(), closedSpans) : null;

        if (ifStatement.closed()) {
            out.add(ifStatement.withBranches(thenBranch, elifs, elseBranch, true));
            return;
        }

        int column = ifStatement.span().column();
        List<Statement> spill;
        if (elseBranch != null) {
            spill = split(elseBranch, column);
            elseBranch = elseBranch.subList(0, elseBranch.size() - spill.size());
        } else if (!elifs.isEmpty()) {
            ElifBranch last = elifs.get(elifs.size() - 1);
            spill = split(last.body(), column);
            elifs.set(elifs.size() - 1, last.withBody(last.body().subList(0, last.body().size() - spill.size())));
        } else {
            spill = split(thenBranch, column);
            thenBranch = thenBranch.subList(0, thenBranch.size() - spill.size());
        }

        closedSpans.add(ifStatement.span());
        out.add(ifStatement.withBranches(thenBranch, elifs, elseBranch, true));
        out.addAll(spill);
    }

    private void closeFor(ForStatement forStatement, Set<SourceSpan> closedSpans, List<Statement> out) {
        List<Statement> body = closeBlocks(forStatement.body(), closedSpans);
        if (forStatement.closed()) {
            out.add(forStatement.withBody(body, true));
            return;
        }
        List<Statement> spill = split(body, forStatement.span().column());
        closedSpans.add(forStatement.span());
        out.add(forStatement.withBody(body.subList(0, body.size() - spill.size()), true));
        out.addAll(spill);
    }

    /**
     * Returns the tail of a branch that belongs after the block.
     *
     * @param branch branch statements
     * @param openerColumn indentation column of the block opener
     * @return statements from the first one indented no deeper than the opener
     */
    private List<Statement> split(List<Statement> branch, int openerColumn) {
        for (int i = 0; i < branch.size(); i++) {
            SourceSpan span = branch.get(i).span();
            if (span.isSourceLine() && span.column() <= openerColumn) {
                return new ArrayList<>(branch.subList(i, branch.size()));
            }
        }
        return List.of();
    }
}
