package com.dslforge.core.model;

/**
 * Action recorded for one transition of the self-correction loop.
 */
public enum CorrectionAction {
    PARSED,
    VALIDATED,
    REPAIRED,
    REPAIR_STALLED,
    REGENERATED,
    SERVICE_FAILED,
    SUCCEEDED,
    FAILED,
    CANCELLED
}
