package com.uptimesentinel.core.events;

import java.time.Instant;

public record JobsPurged(
        Instant timestamp,
        int retentionDays,
        int deleted
) implements Event {
    @Override
    public String type() {
        return "JobsPurged";
    }
}
