package com.uptimesentinel.core.events;

import java.time.Instant;

public record StatusChanged(
        Instant timestamp,
        String monitorId,
        String url,
        String previousStatus,
        String currentStatus
) implements Event {
    @Override
    public String type() {
        return "StatusChanged";
    }
}
