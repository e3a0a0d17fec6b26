package com.uptimesentinel.service.runtime;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

// Waits interval after each tick finishes; stop() cancels the pending wait.
public final class PollingLoop {
    private static final Logger LOGGER = Logger.getLogger(PollingLoop.class.getName());

    private final String name;
    private final Duration interval;
    private final Runnable tick;
    private final AtomicLong completedTicks = new AtomicLong();
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> schedule;

    public PollingLoop(String name, Duration interval, Runnable tick) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
        this.tick = Objects.requireNonNull(tick, "tick is required");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive for loop " + name);
        }
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(false);
            return thread;
        });
        schedule = executor.scheduleWithFixedDelay(this::runOnce, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOGGER.info(name + " started (interval " + interval.toMillis() + " ms)");
    }

    public void runOnce() {
        try {
            tick.run();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, name + " tick failed", ex);
        } finally {
            completedTicks.incrementAndGet();
        }
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        schedule.cancel(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOGGER.warning(name + " did not finish its current tick within 30s");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        schedule = null;
        LOGGER.info(name + " stopped after " + completedTicks.get() + " tick(s)");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    public long completedTicks() {
        return completedTicks.get();
    }
}
