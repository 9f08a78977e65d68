package com.dslforge.core.generation;

import java.time.Duration;
import java.util.Objects;

/**
 * One request to a generation service.
 *
 * @param systemPrompt instructions describing the DSL and the correction rules
 * @param prompt the user prompt
 * @param diagnostics defects of the previous draft, null for a first draft
 * @param timeout request timeout
 */
public record GenerationRequest(
    String systemPrompt,
    String prompt,
    Diagnostics diagnostics,
    Duration timeout
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationRequest {
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
    }
}
