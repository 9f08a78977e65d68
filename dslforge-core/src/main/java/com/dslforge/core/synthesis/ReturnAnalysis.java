package com.dslforge.core.synthesis;

import com.dslforge.core.analysis.StatementWalker;
import com.dslforge.core.model.ReturnStatement;
import com.dslforge.core.model.Statement;

import java.util.List;

/**
 * Return-path facts computed from the statement tree.
 */
public final class ReturnAnalysis {

    private ReturnAnalysis() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Whether any path through the statements contains an explicit RETURN.
     *
     * @param statements statements of one function
     * @return true if a RETURN exists anywhere, including nested blocks
     */
    public static boolean containsReturn(List<Statement> statements) {
        return StatementWalker.contains(statements, ReturnStatement.class);
    }
}
