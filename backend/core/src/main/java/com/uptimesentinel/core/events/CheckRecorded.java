package com.uptimesentinel.core.events;

import java.time.Instant;

public record CheckRecorded(
        Instant timestamp,
        String monitorId,
        String url,
        String status,
        Integer httpStatusCode,
        Long responseTimeMs
) implements Event {
    @Override
    public String type() {
        return "CheckRecorded";
    }
}
