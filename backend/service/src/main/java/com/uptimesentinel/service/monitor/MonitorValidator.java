package com.uptimesentinel.service.monitor;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class MonitorValidator {
    public static final int MIN_INTERVAL_SECONDS = 60;
    public static final int MAX_INTERVAL_SECONDS = 86_400;
    public static final int MIN_TIMEOUT_SECONDS = 1;
    public static final int MAX_TIMEOUT_SECONDS = 300;

    private MonitorValidator() {
    }

    static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL format: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("URL must use http or https scheme");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("Invalid URL format: " + url);
        }
    }

    static void validateInterval(int intervalSeconds) {
        if (intervalSeconds < MIN_INTERVAL_SECONDS) {
            throw new IllegalArgumentException("Interval must be at least " + MIN_INTERVAL_SECONDS + " seconds");
        }
        if (intervalSeconds > MAX_INTERVAL_SECONDS) {
            throw new IllegalArgumentException("Interval cannot exceed " + MAX_INTERVAL_SECONDS + " seconds (24 hours)");
        }
    }

    static void validateTimeout(int timeoutSeconds) {
        if (timeoutSeconds < MIN_TIMEOUT_SECONDS) {
            throw new IllegalArgumentException("Timeout must be at least 1 second");
        }
        if (timeoutSeconds > MAX_TIMEOUT_SECONDS) {
            throw new IllegalArgumentException("Timeout cannot exceed " + MAX_TIMEOUT_SECONDS + " seconds");
        }
    }
}
