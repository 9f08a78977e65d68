package com.dslforge.core.repair;

import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Statement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one repair pass.
 *
 * @param statements repaired statement tree
 * @param fixedKinds kinds for which at least one defect was fixed, in fix order
 * @param remaining defects that were not fixed, in their original order
 * @param identifierMapping identifier renames as new name to original name
 */
public record RepairResult(
    List<Statement> statements,
    List<DefectKind> fixedKinds,
    List<Defect> remaining,
    Map<String, String> identifierMapping
) {
    /**
     * Compact constructor with validation.
     */
    public RepairResult {
        Objects.requireNonNull(statements, "statements must not be null");
        statements = List.copyOf(statements);
        fixedKinds = fixedKinds == null ? List.of() : List.copyOf(fixedKinds);
        remaining = remaining == null ? List.of() : List.copyOf(remaining);
        identifierMapping = identifierMapping == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(identifierMapping));
    }

    /**
     * Whether the pass changed anything.
     *
     * @return true if at least one defect was fixed
     */
    public boolean madeProgress() {
        return !fixedKinds.isEmpty();
    }
}
