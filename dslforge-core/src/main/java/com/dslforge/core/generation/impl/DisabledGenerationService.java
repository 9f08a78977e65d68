package com.dslforge.core.generation.impl;

import com.dslforge.core.generation.GenerationException;
import com.dslforge.core.generation.GenerationRequest;
import com.dslforge.core.generation.GenerationService;
import com.dslforge.core.generation.ServiceError;

/**
 * Placeholder used when no generation provider is configured. Every request
 * fails as {@link ServiceError#UNAVAILABLE}, so the loop spends its remaining
 * attempts and reports the unresolved defects.
 */
public class DisabledGenerationService implements GenerationService {

    @Override
    public String getId() {
        return "none";
    }

    @Override
    public String getDisplayName() {
        return "Disabled (deterministic repair only)";
    }

    @Override
    public String generate(GenerationRequest request) throws GenerationException {
        throw new GenerationException(ServiceError.UNAVAILABLE, "No generation provider configured");
    }
}
