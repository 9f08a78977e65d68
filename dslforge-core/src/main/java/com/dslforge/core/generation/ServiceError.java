package com.dslforge.core.generation;

/**
 * Failure kinds reported by a {@link GenerationService}.
 */
public enum ServiceError {
    /** The request did not complete within the configured timeout. */
    TIMEOUT,

    /** The service rejected the request because of rate limits. */
    RATE_LIMITED,

    /** The service could not be reached or answered with a server error. */
    UNAVAILABLE,

    /** The service answered, but not with a usable draft. */
    MALFORMED_RESPONSE;

    /**
     * Whether retrying with another attempt makes sense without local fixup.
     *
     * @return false only for {@link #MALFORMED_RESPONSE}
     */
    public boolean isRetryable() {
        return this != MALFORMED_RESPONSE;
    }
}
