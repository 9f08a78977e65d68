package com.dslforge.core.model;

import java.util.Objects;

/**
 * One entry in the attempt log of a transpile session.
 *
 * @param attemptNumber 1-based draft number the transition belongs to
 * @param action what happened
 * @param defectsBefore fatal defect count before the transition
 * @param defectsAfter fatal defect count after the transition
 * @param detail short human-readable detail
 */
public record AttemptRecord(
    int attemptNumber,
    CorrectionAction action,
    int defectsBefore,
    int defectsAfter,
    String detail
) {
    /**
     * Compact constructor with validation.
     */
    public AttemptRecord {
        Objects.requireNonNull(action, "action must not be null");
        if (detail == null) {
            detail = "";
        }
    }
}
