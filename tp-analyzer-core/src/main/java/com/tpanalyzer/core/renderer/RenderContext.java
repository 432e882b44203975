package com.tpanalyzer.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Destination and settings for one render call.
 *
 * @param outputDirectory directory files are written to
 * @param settings renderer-specific settings, e.g. {@code console.separator}
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
}
