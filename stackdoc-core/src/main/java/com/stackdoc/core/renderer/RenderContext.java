package com.stackdoc.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers during execution.
 *
 * @param outputDirectory target output directory path
 * @param settings renderer-specific settings
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

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    public boolean isEnabled(String key, boolean defaultValue) {
        return Boolean.parseBoolean(settings.getOrDefault(key, String.valueOf(defaultValue)));
    }
}
