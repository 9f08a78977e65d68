package com.dslforge.core.repair;

import com.dslforge.core.analysis.NameResolutionContext;
import com.dslforge.core.model.Assign;
import com.dslforge.core.model.CallArgument;
import com.dslforge.core.model.CallExpression;
import com.dslforge.core.model.CallStatement;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.ElifBranch;
import com.dslforge.core.model.Expression;
import com.dslforge.core.model.ExpressionPart;
import com.dslforge.core.model.ExpressionVisitor;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.RawExpression;
import com.dslforge.core.model.Reference;
import com.dslforge.core.model.ReturnStatement;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.StatementVisitor;
import com.dslforge.core.model.ValueExpression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renames illegal identifiers everywhere they occur: definitions, assignment
 * targets, result bindings, loop variables and references.
 *
 * <p>New names come from {@link NameResolutionContext#sanitize(String)}, the
 * same rule the validator checks and the synthesizer emits. Every rename is
 * reported as {@code new name -> original name}.
 */
final class InvalidIdentifierFixer implements DefectFixer {

    @Override
    public DefectKind kind() {
        return DefectKind.INVALID_IDENTIFIER;
    }

    @Override
    public FixOutcome fix(List<Statement> statements, List<Defect> defects, NameResolutionContext names) {
        Map<String, String> renames = new LinkedHashMap<>();
        Map<String, String> mapping = new LinkedHashMap<>();
        List<Defect> resolved = new ArrayList<>();
        for (Defect defect : defects) {
            String original = defect.subject();
            String replacement = renames.computeIfAbsent(original, names::sanitize);
            if (!replacement.equals(original)) {
                mapping.put(replacement, original);
                resolved.add(defect);
            }
        }
        if (renames.isEmpty()) {
            return FixOutcome.of(statements, List.of());
        }

        Renamer renamer = new Renamer(renames);
        List<Statement> rewritten = TreeRewriter.rewrite(statements, statement -> statement.accept(renamer));
        return new FixOutcome(rewritten, resolved, mapping);
    }

    /**
     * Applies a rename map to one statement's own names and expressions.
     */
    private static final class Renamer implements StatementVisitor<Statement>, ExpressionVisitor<Expression> {
        private final Map<String, String> renames;

        private Renamer(Map<String, String> renames) {
            this.renames = renames;
        }

        private String name(String original) {
            return original == null ? null : renames.getOrDefault(original, original);
        }

        private Expression expression(Expression expression) {
            return expression == null ? null : expression.accept(this);
        }

        @Override
        public Statement visitDefine(Define define) {
            return new Define(define.span(), name(define.name()), define.type(), expression(define.initialValue()));
        }

        @Override
        public Statement visitAssign(Assign assign) {
            return new Assign(assign.span(), name(assign.target()), expression(assign.expression()));
        }

        @Override
        public Statement visitCall(CallStatement call) {
            return new CallStatement(call.span(), name(call.resultBinding()), (CallExpression) expression(call.call()));
        }

        @Override
        public Statement visitIf(IfStatement ifStatement) {
            List<ElifBranch> elifs = ifStatement.elifBranches().stream()
                .map(elif -> new ElifBranch(elif.span(), expression(elif.condition()), elif.body()))
                .toList();
            return new IfStatement(ifStatement.span(), expression(ifStatement.condition()), ifStatement.thenBranch(),
                elifs, ifStatement.elseBranch(), ifStatement.closed());
        }

        @Override
        public Statement visitFor(ForStatement forStatement) {
            return new ForStatement(forStatement.span(), name(forStatement.loopVar()),
                expression(forStatement.iterable()), forStatement.body(), forStatement.closed());
        }

        @Override
        public Statement visitReturn(ReturnStatement returnStatement) {
            return new ReturnStatement(returnStatement.span(), expression(returnStatement.expression()));
        }

        @Override
        public Expression visitValue(ValueExpression value) {
            List<ExpressionPart> parts = value.parts().stream()
                .map(part -> part instanceof Reference reference ? new Reference(name(reference.name())) : part)
                .toList();
            return new ValueExpression(parts);
        }

        @Override
        public Expression visitCall(CallExpression call) {
            List<CallArgument> arguments = call.arguments().stream()
                .map(argument -> new CallArgument(argument.name(), expression(argument.value())))
                .toList();
            return new CallExpression(call.functionName(), arguments);
        }

        @Override
        public Expression visitRaw(RawExpression raw) {
            return raw;
        }
    }
}
