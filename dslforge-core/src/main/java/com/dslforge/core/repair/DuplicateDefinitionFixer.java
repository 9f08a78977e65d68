package com.dslforge.core.repair;

import com.dslforge.core.analysis.NameResolutionContext;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.Statement;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renames the second and later DEFINE of a name to {@code name_2}, {@code name_3}, ...
 * in source order. The first definition always keeps its name, so existing
 * references to it stay valid.
 *
 * <p>Duplicates in the upstream variable list have no source line to rename
 * and stay unresolved.
 */
final class DuplicateDefinitionFixer implements DefectFixer {

    @Override
    public DefectKind kind() {
        return DefectKind.DUPLICATE_DEFINITION;
    }

    @Override
    public FixOutcome fix(List<Statement> statements, List<Defect> defects, NameResolutionContext names) {
        List<Defect> fixable = defects.stream().filter(defect -> defect.span().isSourceLine()).toList();
        Set<String> duplicated = new HashSet<>();
        fixable.forEach(defect -> duplicated.add(defect.subject()));
        if (duplicated.isEmpty()) {
            return FixOutcome.of(statements, List.of());
        }

        Set<String> seen = new HashSet<>();
        List<Statement> rewritten = TreeRewriter.rewrite(statements, statement -> {
            if (statement instanceof Define define && duplicated.contains(define.name())) {
                if (seen.add(define.name())) {
                    return define;
                }
                return define.withName(names.allocate(define.name()));
            }
            return statement;
        });
        return FixOutcome.of(rewritten, fixable);
    }
}
