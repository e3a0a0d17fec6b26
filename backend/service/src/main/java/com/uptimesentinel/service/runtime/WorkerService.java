package com.uptimesentinel.service.runtime;

import com.uptimesentinel.checker.api.ConcurrentChecker;
import com.uptimesentinel.checker.api.ProbeRequest;
import com.uptimesentinel.checker.api.ProbeResult;
import com.uptimesentinel.core.events.AlertRaised;
import com.uptimesentinel.core.events.CheckRecorded;
import com.uptimesentinel.core.events.JobsProcessed;
import com.uptimesentinel.core.events.JobsPurged;
import com.uptimesentinel.core.model.CheckOutcome;
import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.core.model.QueueJob;
import com.uptimesentinel.service.notify.NotificationDispatcher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

// A job completes once its outcome is written or its monitor is gone; anything else fails it.
public class WorkerService {
    private static final Logger LOGGER = Logger.getLogger(WorkerService.class.getName());

    private final MonitoringContext context;
    private final ConcurrentChecker checker;
    private final NotificationDispatcher dispatcher;
    private final int concurrencyLimit;
    private final int retentionDays;
    private final int purgeEveryTicks;
    private final AtomicLong ticks = new AtomicLong();

    public WorkerService(
            MonitoringContext context,
            ConcurrentChecker checker,
            NotificationDispatcher dispatcher,
            int concurrencyLimit,
            int retentionDays,
            int purgeEveryTicks
    ) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1");
        }
        if (purgeEveryTicks < 1) {
            throw new IllegalArgumentException("purgeEveryTicks must be at least 1");
        }
        this.context = context;
        this.checker = checker;
        this.dispatcher = dispatcher;
        this.concurrencyLimit = concurrencyLimit;
        this.retentionDays = retentionDays;
        this.purgeEveryTicks = purgeEveryTicks;
    }

    public WorkerTickResult runTick() {
        WorkerTickResult result;
        try {
            result = processJobs();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Worker tick failed", ex);
            raiseAlert("Worker tick failed: " + ex.getMessage(), Map.of());
            result = WorkerTickResult.idle(0);
        }
        if (ticks.incrementAndGet() % purgeEveryTicks == 0) {
            int purged = purgeQuietly();
            result = new WorkerTickResult(result.claimed(), result.recorded(), result.completed(), result.failed(), purged);
        }
        return result;
    }

    public WorkerTickResult processJobs() {
        Instant started = context.clock().instant();
        List<QueueJob> jobs = context.queue().claimDue(concurrencyLimit);
        if (jobs.isEmpty()) {
            return WorkerTickResult.idle(0);
        }
        LOGGER.fine("Claimed " + jobs.size() + " job(s)");

        Map<String, ProbeResult> results = probe(uniqueMonitors(jobs));

        int recorded = 0;
        int completed = 0;
        int failed = 0;
        for (QueueJob job : jobs) {
            switch (processJob(job, results)) {
                case RECORDED -> {
                    recorded++;
                    completed++;
                }
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }

        Instant finished = context.clock().instant();
        long durationMillis = Duration.between(started, finished).toMillis();
        context.eventBus().publish(new JobsProcessed(finished, jobs.size(), completed, failed, durationMillis));
        LOGGER.info("Processed " + jobs.size() + " job(s): " + recorded + " recorded, " + failed + " failed");
        return new WorkerTickResult(jobs.size(), recorded, completed, failed, 0);
    }

    public int purgeOldJobs() {
        int deleted = context.queue().purgeTerminalOlderThan(retentionDays);
        context.eventBus().publish(new JobsPurged(context.clock().instant(), retentionDays, deleted));
        if (deleted > 0) {
            LOGGER.info("Purged " + deleted + " finished job(s) older than " + retentionDays + " day(s)");
        }
        return deleted;
    }

    private Map<String, Monitor> uniqueMonitors(List<QueueJob> jobs) {
        Map<String, Monitor> monitors = new LinkedHashMap<>();
        for (QueueJob job : jobs) {
            if (monitors.containsKey(job.monitorId())) {
                continue;
            }
            try {
                context.monitors().get(job.monitorId()).ifPresent(monitor -> monitors.put(monitor.id(), monitor));
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Unable to load monitor " + job.monitorId(), ex);
            }
        }
        return monitors;
    }

    private Map<String, ProbeResult> probe(Map<String, Monitor> monitors) {
        List<ProbeRequest> requests = new ArrayList<>();
        for (Monitor monitor : monitors.values()) {
            try {
                requests.add(new ProbeRequest(monitor.id(), monitor.url(), monitor.timeout()));
            } catch (IllegalArgumentException ex) {
                LOGGER.warning("Skipping probe for monitor " + monitor.id() + ": " + ex.getMessage());
            }
        }
        if (requests.isEmpty()) {
            return Map.of();
        }
        try {
            return checker.checkAll(requests).join();
        } catch (CompletionException ex) {
            LOGGER.log(Level.WARNING, "Probe batch failed", ex.getCause());
            raiseAlert("Probe batch failed: " + ex.getCause(), Map.of("requests", requests.size()));
            return Map.of();
        }
    }

    private JobResolution processJob(QueueJob job, Map<String, ProbeResult> results) {
        try {
            Optional<Monitor> monitor = context.monitors().get(job.monitorId());
            if (monitor.isEmpty()) {
                LOGGER.fine("Monitor " + job.monitorId() + " was deleted; completing job " + job.id());
                context.queue().markCompleted(job.id());
                return JobResolution.COMPLETED;
            }
            ProbeResult result = results.get(job.monitorId());
            if (result == null) {
                LOGGER.warning("No probe result for monitor " + job.monitorId() + "; failing job " + job.id());
                context.queue().markFailed(job.id());
                return JobResolution.FAILED;
            }

            CheckStatus previous = context.history().latest(job.monitorId()).map(CheckOutcome::status).orElse(null);
            CheckOutcome outcome = context.history().append(new CheckOutcome(
                    null,
                    job.monitorId(),
                    CheckStatus.fromSuccess(result.success()),
                    context.clock().instant(),
                    result.responseTimeMs(),
                    result.httpStatusCode(),
                    result.errorMessage()
            ));
            context.eventBus().publish(new CheckRecorded(
                    outcome.checkedAt(),
                    outcome.monitorId(),
                    monitor.get().url(),
                    outcome.status().label(),
                    outcome.httpStatusCode(),
                    outcome.responseTimeMs()
            ));
            dispatcher.dispatch(monitor.get(), outcome, previous);
            context.queue().markCompleted(job.id());
            return JobResolution.RECORDED;
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Error processing job " + job.id() + " for monitor " + job.monitorId(), ex);
            raiseAlert("Job " + job.id() + " failed: " + ex.getMessage(), Map.of("jobId", job.id(), "monitorId", job.monitorId()));
            markFailedQuietly(job);
            return JobResolution.FAILED;
        }
    }

    private void markFailedQuietly(QueueJob job) {
        try {
            context.queue().markFailed(job.id());
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Unable to mark job " + job.id() + " failed", ex);
        }
    }

    private int purgeQuietly() {
        try {
            return purgeOldJobs();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Job purge failed", ex);
            raiseAlert("Job purge failed: " + ex.getMessage(), Map.of());
            return 0;
        }
    }

    private void raiseAlert(String message, Map<String, Object> details) {
        context.eventBus().publish(new AlertRaised(context.clock().instant(), "worker", message, details));
    }

    private enum JobResolution {
        RECORDED,
        COMPLETED,
        FAILED
    }
}
