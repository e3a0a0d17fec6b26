package com.uptimesentinel.core.events;

import java.time.Instant;

public record NotificationDelivered(
        Instant timestamp,
        String monitorId,
        String channelType,
        boolean success,
        String detail
) implements Event {
    @Override
    public String type() {
        return "NotificationDelivered";
    }
}
