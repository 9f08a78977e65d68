package com.dslforge.core.repair;

import com.dslforge.core.analysis.NameResolutionContext;
import com.dslforge.core.analysis.StatementWalker;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Expression;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies deterministic local fixes for a known defect taxonomy.
 *
 * <p>Fixes run grouped by kind in a fixed order:
 * <ol>
 *   <li>{@code DuplicateDefinition}: rename second and later definitions</li>
 *   <li>{@code UndefinedVariable}: insert a DEFINE typed from first use</li>
 *   <li>{@code UnclosedBlock}: close where indentation says the block ended</li>
 *   <li>{@code InvalidIdentifier}: sanitize and rename everywhere</li>
 *   <li>{@code TypeMismatch}: coerce unambiguous DEFINE literals</li>
 * </ol>
 * Kinds without a fixer pass through to the remaining defects. Repair never
 * contacts the generation service, and repairing with no defects returns the
 * statements unchanged.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RepairResult repaired = new RepairEngine().repair(statements, defects);
 * repaired.fixedKinds();   // [DUPLICATE_DEFINITION]
 * repaired.remaining();    // defects needing regeneration
 * }</pre>
 */
public class RepairEngine {

    private static final Logger log = LoggerFactory.getLogger(RepairEngine.class);

    private final List<DefectFixer> fixers = List.of(
        new DuplicateDefinitionFixer(),
        new UndefinedVariableFixer(),
        new UnclosedBlockFixer(),
        new InvalidIdentifierFixer(),
        new TypeMismatchFixer()
    );

    /**
     * Whether a defect kind has a registered fix.
     *
     * @param kind defect kind
     * @return true if repair can attempt it
     */
    public boolean hasFix(DefectKind kind) {
        return fixers.stream().anyMatch(fixer -> fixer.kind() == kind);
    }

    /**
     * Whether any of the defects has a registered fix.
     *
     * @param defects defects to check
     * @return true if repair can attempt at least one
     */
    public boolean canRepair(List<Defect> defects) {
        return defects.stream().anyMatch(defect -> defect.isFatal() && hasFix(defect.kind()));
    }

    /**
     * Repairs statements with no upstream variables.
     *
     * @param statements statement tree
     * @param defects defects to fix
     * @return repaired tree, fixed kinds and remaining defects
     */
    public RepairResult repair(List<Statement> statements, List<Defect> defects) {
        return repair(statements, defects, List.of());
    }

    /**
     * Repairs statements.
     *
     * @param statements statement tree
     * @param defects defects to fix
     * @param upstream upstream variables, whose names are never handed out as new names
     * @return repaired tree, fixed kinds and remaining defects
     */
    public RepairResult repair(List<Statement> statements, List<Defect> defects, List<Variable> upstream) {
        NameResolutionContext names = NameResolutionContext.of(namesIn(statements, upstream));
        List<Statement> current = statements;
        List<DefectKind> fixedKinds = new ArrayList<>();
        Map<String, String> identifierMapping = new LinkedHashMap<>();
        Set<Defect> resolved = Collections.newSetFromMap(new IdentityHashMap<>());

        for (DefectFixer fixer : fixers) {
            List<Defect> ofKind = defects.stream().filter(defect -> defect.kind() == fixer.kind()).toList();
            if (ofKind.isEmpty()) {
                continue;
            }
            DefectFixer.FixOutcome outcome = fixer.fix(current, ofKind, names);
            current = outcome.statements();
            identifierMapping.putAll(outcome.identifierMapping());
            resolved.addAll(outcome.resolved());
            if (!outcome.resolved().isEmpty()) {
                fixedKinds.add(fixer.kind());
                log.debug("Fixed {} of {} {} defects", outcome.resolved().size(), ofKind.size(),
                    fixer.kind().getDisplayName());
            }
        }

        List<Defect> remaining = defects.stream().filter(defect -> !resolved.contains(defect)).toList();
        if (!fixedKinds.isEmpty()) {
            log.info("Repair fixed {} defects ({}), {} remain", resolved.size(), fixedKinds, remaining.size());
        }
        return new RepairResult(current, fixedKinds, remaining, identifierMapping);
    }

    private static Set<String> namesIn(List<Statement> statements, List<Variable> upstream) {
        Set<String> names = new LinkedHashSet<>();
        upstream.forEach(variable -> names.add(variable.name()));
        StatementWalker.forEach(statements, statement -> {
            String written = StatementWalker.writtenName(statement);
            if (written != null) {
                names.add(written);
            }
            for (Expression expression : StatementWalker.expressionsOf(statement)) {
                names.addAll(expression.references());
            }
        });
        return names;
    }
}
