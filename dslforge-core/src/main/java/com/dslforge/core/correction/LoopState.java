package com.dslforge.core.correction;

/**
 * States of the self-correction loop.
 */
public enum LoopState {
    /** Turning the current draft text into statements. */
    PARSING,

    /** Analyzing, validating and planning the current statements. */
    VALIDATING,

    /** Applying one round of deterministic repair. */
    REPAIRING,

    /** Asking the generation service for a new draft. */
    REGENERATING,

    /** Terminal: a result has been produced. */
    DONE
}
