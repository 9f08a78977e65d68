package com.dslforge.core.model;

/**
 * Why a transpile session ended in failure.
 */
public enum FailureReason {
    /** Every attempt was used and fatal defects remain. */
    BUDGET_EXHAUSTED,
    /** The generation service returned output that could not be used, even after local cleanup. */
    SERVICE_ERROR,
    /** The caller cancelled the session between attempts. */
    CANCELLED
}
