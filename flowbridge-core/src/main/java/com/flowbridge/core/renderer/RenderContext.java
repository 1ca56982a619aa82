package com.flowbridge.core.renderer;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Where and how a renderer writes one compile run.
 *
 * <p>Settings are free-form strings keyed by renderer, e.g. {@code console.showHeaders}.
 *
 * @param outputDirectory directory relative file paths are resolved against
 * @param settings renderer-specific settings
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Creates a context for a directory.
     *
     * @param directory output directory
     * @param settings renderer settings, may be null
     * @return render context
     */
    public static RenderContext of(Path directory, Map<String, String> settings) {
        Objects.requireNonNull(directory, "directory must not be null");
        return new RenderContext(directory.toString(), settings);
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    /**
     * Reads a boolean setting; anything but {@code "true"} (ignoring case) is false.
     *
     * @param key setting key
     * @param defaultValue value when the key is absent
     * @return flag value
     */
    public boolean flag(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
