package com.dslforge.core.generation;

import com.dslforge.core.model.Defect;

import java.util.List;

/**
 * Structured context sent along with a regeneration prompt.
 *
 * @param defects unresolved defects of the previous draft
 * @param previousDraft DSL text of the previous draft
 * @param attemptNumber number of the draft being requested
 */
public record Diagnostics(
    List<Defect> defects,
    String previousDraft,
    int attemptNumber
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostics {
        defects = defects == null ? List.of() : List.copyOf(defects);
        previousDraft = previousDraft == null ? "" : previousDraft;
    }
}
