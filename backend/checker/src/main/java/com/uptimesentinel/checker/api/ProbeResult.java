package com.uptimesentinel.checker.api;

public record ProbeResult(
        String key,
        boolean success,
        Integer httpStatusCode,
        long responseTimeMs,
        String errorMessage
) {
    public static ProbeResult up(String key, int httpStatusCode, long responseTimeMs) {
        return new ProbeResult(key, true, httpStatusCode, responseTimeMs, null);
    }

    public static ProbeResult down(String key, Integer httpStatusCode, long responseTimeMs, String errorMessage) {
        return new ProbeResult(key, false, httpStatusCode, responseTimeMs, errorMessage);
    }
}
