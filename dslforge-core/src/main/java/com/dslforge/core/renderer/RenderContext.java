package com.dslforge.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers.
 *
 * @param outputDirectory target directory
 * @param settings renderer-specific settings, e.g. {@code console.colors}
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Reads a boolean setting.
     *
     * @param key setting key
     * @param defaultValue value when unset
     * @return parsed value
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }
}
