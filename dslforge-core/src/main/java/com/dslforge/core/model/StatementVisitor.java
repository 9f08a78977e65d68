package com.dslforge.core.model;

/**
 * Exhaustive dispatch over {@link Statement} shapes.
 *
 * @param <R> result type
 */
public interface StatementVisitor<R> {

    R visitDefine(Define define);

    R visitAssign(Assign assign);

    R visitCall(CallStatement call);

    R visitIf(IfStatement ifStatement);

    R visitFor(ForStatement forStatement);

    R visitReturn(ReturnStatement returnStatement);
}
