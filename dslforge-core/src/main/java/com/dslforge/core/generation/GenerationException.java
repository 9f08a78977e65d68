package com.dslforge.core.generation;

import java.util.Objects;

/**
 * Checked failure of a generation request.
 */
public class GenerationException extends Exception {

    private final ServiceError kind;
    private final String rawResponse;

    public GenerationException(ServiceError kind, String message) {
        this(kind, message, null, null);
    }

    public GenerationException(ServiceError kind, String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.rawResponse = rawResponse;
    }

    public ServiceError getKind() {
        return kind;
    }

    /**
     * Returns the raw response text, if the service answered at all.
     *
     * @return response body, or null
     */
    public String getRawResponse() {
        return rawResponse;
    }
}
