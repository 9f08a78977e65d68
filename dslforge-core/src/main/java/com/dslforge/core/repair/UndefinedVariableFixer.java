package com.dslforge.core.repair;

import com.dslforge.core.analysis.NameResolutionContext;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.VarType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Inserts a DEFINE for every undefined variable, after the leading block of
 * top-level DEFINEs, with a type guessed from the variable's first use.
 */
final class UndefinedVariableFixer implements DefectFixer {

    @Override
    public DefectKind kind() {
        return DefectKind.UNDEFINED_VARIABLE;
    }

    @Override
    public FixOutcome fix(List<Statement> statements, List<Defect> defects, NameResolutionContext names) {
        Set<String> missing = new LinkedHashSet<>();
        defects.forEach(defect -> missing.add(defect.subject()));

        List<Statement> inserted = new ArrayList<>();
        for (String name : missing) {
            VarType type = TypeInference.inferFromUse(name, statements);
            inserted.add(new Define(SourceSpan.SYNTHETIC, name, type, null));
            names.reserve(name);
        }

        int position = 0;
        while (position < statements.size() && statements.get(position) instanceof Define) {
            position++;
        }
        List<Statement> rewritten = new ArrayList<>(statements);
        rewritten.addAll(position, inserted);
        return FixOutcome.of(rewritten, defects);
    }
}
