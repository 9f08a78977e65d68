package com.dslforge.core.correction;

import com.dslforge.core.config.ForgeConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds of one self-correction session.
 *
 * @param maxAttempts drafts allowed, counting the initial draft
 * @param maxRepairRounds deterministic repair rounds allowed per draft
 * @param generationTimeout timeout of one generation request
 */
public record LoopSettings(int maxAttempts, int maxRepairRounds, Duration generationTimeout) {

    /**
     * Compact constructor with validation.
     */
    public LoopSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (maxRepairRounds < 0) {
            throw new IllegalArgumentException("maxRepairRounds must not be negative, got " + maxRepairRounds);
        }
        Objects.requireNonNull(generationTimeout, "generationTimeout must not be null");
    }

    public static LoopSettings defaults() {
        return from(ForgeConfig.TranspilerConfig.defaults());
    }

    public static LoopSettings from(ForgeConfig.TranspilerConfig config) {
        return new LoopSettings(config.maxAttempts(), config.maxRepairRounds(),
            Duration.ofSeconds(config.generationTimeoutSeconds()));
    }
}
