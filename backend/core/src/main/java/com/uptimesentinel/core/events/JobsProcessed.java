package com.uptimesentinel.core.events;

import java.time.Instant;

public record JobsProcessed(
        Instant timestamp,
        int claimed,
        int completed,
        int failed,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "JobsProcessed";
    }
}
