package com.uptimesentinel.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record ChannelConfig(String type, Map<String, String> settings) {
    public ChannelConfig {
        Objects.requireNonNull(type, "type is required");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public Optional<String> setting(String key) {
        String value = settings.get(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public String requiredSetting(String key) {
        return setting(key).orElseThrow(() ->
                new IllegalArgumentException("Channel '" + type + "' requires setting '" + key + "'"));
    }
}
