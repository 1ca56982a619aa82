package com.flowbridge.core.emit;

import java.util.Map;

/**
 * Settings passed to emitters.
 *
 * @param pretty whether structured output is indented
 * @param customSettings emitter-specific settings
 */
public record EmitterConfig(
    boolean pretty,
    Map<String, Object> customSettings
) {
    public EmitterConfig {
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    public static EmitterConfig defaults() {
        return new EmitterConfig(true, Map.of());
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
