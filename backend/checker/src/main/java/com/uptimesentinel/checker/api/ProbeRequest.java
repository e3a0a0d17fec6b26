package com.uptimesentinel.checker.api;

import java.time.Duration;
import java.util.Objects;

public record ProbeRequest(String key, String url, Duration timeout) {
    public ProbeRequest {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive for " + key);
        }
    }
}
