package com.dslforge.core.repair;

import com.dslforge.core.analysis.NameResolutionContext;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Statement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic, local fix for one {@link DefectKind}.
 *
 * <p>Fixers never call out of the process. A fixer returns the defects it
 * actually resolved; anything else it was handed stays unresolved.
 */
interface DefectFixer {

    /**
     * Returns the defect kind this fixer handles.
     *
     * @return handled kind
     */
    DefectKind kind();

    /**
     * Applies the fix.
     *
     * @param statements current statement tree
     * @param defects defects of {@link #kind()} to fix
     * @param names name bookkeeping of this repair run
     * @return rewritten tree and resolved defects
     */
    FixOutcome fix(List<Statement> statements, List<Defect> defects, NameResolutionContext names);

    /**
     * Result of one fixer.
     *
     * @param statements rewritten tree
     * @param resolved defects that no longer apply
     * @param identifierMapping identifier renames as new name to original, empty if none
     */
    record FixOutcome(List<Statement> statements, List<Defect> resolved, Map<String, String> identifierMapping) {

        public FixOutcome {
            statements = List.copyOf(statements);
            resolved = List.copyOf(resolved);
            identifierMapping = identifierMapping == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(identifierMapping));
        }

        static FixOutcome of(List<Statement> statements, List<Defect> resolved) {
            return new FixOutcome(statements, resolved, Map.of());
        }
    }
}
