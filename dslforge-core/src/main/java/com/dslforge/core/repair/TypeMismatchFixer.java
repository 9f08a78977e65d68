package com.dslforge.core.repair;

import com.dslforge.core.analysis.NameResolutionContext;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.ValueExpression;
import com.dslforge.core.validation.LiteralTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Coerces DEFINE literals to their declared type when the conversion is
 * unambiguous, e.g. {@code "90"} to {@code 90} for an Integer. Mismatches in
 * conditions and unknown type names are left for regeneration.
 */
final class TypeMismatchFixer implements DefectFixer {

    @Override
    public DefectKind kind() {
        return DefectKind.TYPE_MISMATCH;
    }

    @Override
    public FixOutcome fix(List<Statement> statements, List<Defect> defects, NameResolutionContext names) {
        List<Defect> resolved = new ArrayList<>();
        List<Statement> rewritten = TreeRewriter.rewrite(statements, statement -> {
            if (!(statement instanceof Define define)) {
                return statement;
            }
            for (Defect defect : defects) {
                if (!defect.span().equals(define.span()) || !defect.subject().equals(define.name())) {
                    continue;
                }
                Optional<Define> coerced = coerce(define);
                if (coerced.isPresent()) {
                    resolved.add(defect);
                    return coerced.get();
                }
            }
            return statement;
        });
        return FixOutcome.of(rewritten, resolved);
    }

    private Optional<Define> coerce(Define define) {
        if (!(define.initialValue() instanceof ValueExpression value) || !value.isLiteral()) {
            return Optional.empty();
        }
        return LiteralTypes.coerce(value.sourceText(), define.type())
            .map(literal -> define.withInitialValue(ValueExpression.literal(literal)));
    }
}
