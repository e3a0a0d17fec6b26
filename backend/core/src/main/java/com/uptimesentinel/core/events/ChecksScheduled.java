package com.uptimesentinel.core.events;

import java.time.Instant;

public record ChecksScheduled(
        Instant timestamp,
        int enabledMonitors,
        int scheduled
) implements Event {
    @Override
    public String type() {
        return "ChecksScheduled";
    }
}
