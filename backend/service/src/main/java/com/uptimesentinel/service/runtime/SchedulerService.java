package com.uptimesentinel.service.runtime;

import com.uptimesentinel.core.events.AlertRaised;
import com.uptimesentinel.core.events.ChecksScheduled;
import com.uptimesentinel.core.model.CheckOutcome;
import com.uptimesentinel.core.model.Monitor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final MonitoringContext context;

    public SchedulerService(MonitoringContext context) {
        this.context = context;
    }

    public int scheduleDueChecks() {
        Instant now = context.clock().instant();
        List<Monitor> monitors = context.monitors().listEnabled();
        int scheduled = 0;
        for (Monitor monitor : monitors) {
            Optional<Instant> dueAt = dueAt(monitor, now);
            if (dueAt.isPresent()) {
                context.queue().enqueue(monitor.id(), dueAt.get());
                scheduled++;
            }
        }
        context.eventBus().publish(new ChecksScheduled(now, monitors.size(), scheduled));
        if (scheduled > 0) {
            LOGGER.info("Scheduled " + scheduled + " check(s) across " + monitors.size() + " enabled monitor(s)");
        }
        return scheduled;
    }

    public int runTick() {
        try {
            return scheduleDueChecks();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Scheduler tick failed", ex);
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    "scheduler",
                    "Scheduler tick failed: " + ex.getMessage(),
                    Map.of()
            ));
            return 0;
        }
    }

    Optional<Instant> dueAt(Monitor monitor, Instant now) {
        Optional<CheckOutcome> latest = context.history().latest(monitor.id());
        if (latest.isEmpty()) {
            return Optional.of(now);
        }
        Instant next = latest.get().checkedAt().plus(monitor.interval());
        return now.isBefore(next) ? Optional.empty() : Optional.of(next);
    }
}
