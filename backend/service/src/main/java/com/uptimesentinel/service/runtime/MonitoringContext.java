package com.uptimesentinel.service.runtime;

import com.uptimesentinel.core.bus.EventBus;
import com.uptimesentinel.service.store.JobQueue;
import com.uptimesentinel.service.store.MonitorRegistry;
import com.uptimesentinel.service.store.StatusHistoryStore;

import java.time.Clock;
import java.util.Objects;

public record MonitoringContext(
        MonitorRegistry monitors,
        StatusHistoryStore history,
        JobQueue queue,
        EventBus eventBus,
        Clock clock
) {
    public MonitoringContext {
        Objects.requireNonNull(monitors, "monitors is required");
        Objects.requireNonNull(history, "history is required");
        Objects.requireNonNull(queue, "queue is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}
