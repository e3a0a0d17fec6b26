package com.uptimesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record Monitor(
        String id,
        String ownerId,
        String url,
        int intervalSeconds,
        int timeoutSeconds,
        boolean enabled,
        List<ChannelConfig> channels,
        Instant createdAt,
        Instant updatedAt
) {
    public Monitor {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(url, "url is required");
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    @JsonIgnore
    public Duration interval() {
        return Duration.ofSeconds(intervalSeconds);
    }

    @JsonIgnore
    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public Monitor withEnabled(boolean nextEnabled, Instant at) {
        return new Monitor(id, ownerId, url, intervalSeconds, timeoutSeconds, nextEnabled, channels, createdAt, at);
    }
}
