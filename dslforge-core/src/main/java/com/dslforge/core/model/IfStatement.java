package com.dslforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code IF / ELIF / ELSE / ENDIF} block.
 *
 * <p>{@code closed} is false when the source never closed the block. The parser
 * then lets the last open branch run to the point where it gave up, and the
 * repair engine decides where the block really ends.
 *
 * @param span location of the IF line
 * @param condition IF condition, either a value expression or a call
 * @param thenBranch statements run when the condition holds
 * @param elifBranches ELIF branches in source order
 * @param elseBranch ELSE statements, or null when there is no ELSE
 * @param closed whether a matching ENDIF was found
 */
public record IfStatement(
    SourceSpan span,
    Expression condition,
    List<Statement> thenBranch,
    List<ElifBranch> elifBranches,
    List<Statement> elseBranch,
    boolean closed
) implements Statement {

    /**
     * Compact constructor with validation.
     */
    public IfStatement {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        thenBranch = thenBranch == null ? List.of() : List.copyOf(thenBranch);
        elifBranches = elifBranches == null ? List.of() : List.copyOf(elifBranches);
        elseBranch = elseBranch == null ? null : List.copyOf(elseBranch);
    }

    /**
     * Whether an ELSE branch exists.
     *
     * @return true when ELSE was written
     */
    public boolean hasElse() {
        return elseBranch != null;
    }

    /**
     * Returns a copy with other branches and closed state.
     *
     * @param newThen then statements
     * @param newElifs elif branches
     * @param newElse else statements, or null
     * @param isClosed closed flag
     * @return updated block
     */
    public IfStatement withBranches(List<Statement> newThen, List<ElifBranch> newElifs,
                                    List<Statement> newElse, boolean isClosed) {
        return new IfStatement(span, condition, newThen, newElifs, newElse, isClosed);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
