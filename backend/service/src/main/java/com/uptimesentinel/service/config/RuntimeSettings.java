package com.uptimesentinel.service.config;

import com.uptimesentinel.service.monitor.MonitorValidator;
import com.uptimesentinel.service.store.SettingsStore;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

public record RuntimeSettings(
        Duration schedulerInterval,
        Duration workerInterval,
        int concurrencyLimit,
        int retentionDays,
        int defaultCheckIntervalSeconds,
        int defaultTimeoutSeconds,
        int purgeEveryTicks
) {
    static final int DEFAULT_SCHEDULER_INTERVAL_SECONDS = 30;
    static final int DEFAULT_CONCURRENCY = 50;
    static final int DEFAULT_RETENTION_DAYS = 7;
    static final int DEFAULT_CHECK_INTERVAL_SECONDS = 60;
    static final int DEFAULT_TIMEOUT_SECONDS = 30;
    static final int DEFAULT_PURGE_EVERY_TICKS = 100;

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
                Duration.ofSeconds(DEFAULT_SCHEDULER_INTERVAL_SECONDS),
                Duration.ofSeconds(1),
                DEFAULT_CONCURRENCY,
                DEFAULT_RETENTION_DAYS,
                DEFAULT_CHECK_INTERVAL_SECONDS,
                DEFAULT_TIMEOUT_SECONDS,
                DEFAULT_PURGE_EVERY_TICKS
        );
    }

    public static RuntimeSettings resolve(SettingsStore settings, Map<String, String> env, Consumer<String> warn) {
        Resolver resolver = new Resolver(settings, env, warn);
        return new RuntimeSettings(
                Duration.ofSeconds(resolver.positiveInt("scheduler_interval", "SCHEDULER_INTERVAL", DEFAULT_SCHEDULER_INTERVAL_SECONDS)),
                Duration.ofSeconds(1),
                resolver.positiveInt("worker_concurrency", "WORKER_CONCURRENCY", DEFAULT_CONCURRENCY),
                resolver.positiveInt("job_retention_days", "JOB_RETENTION_DAYS", DEFAULT_RETENTION_DAYS),
                resolver.rangedInt("default_check_interval", "DEFAULT_CHECK_INTERVAL", DEFAULT_CHECK_INTERVAL_SECONDS,
                        MonitorValidator.MIN_INTERVAL_SECONDS, MonitorValidator.MAX_INTERVAL_SECONDS),
                resolver.rangedInt("default_check_timeout", "DEFAULT_CHECK_TIMEOUT", DEFAULT_TIMEOUT_SECONDS,
                        MonitorValidator.MIN_TIMEOUT_SECONDS, MonitorValidator.MAX_TIMEOUT_SECONDS),
                resolver.positiveInt("purge_every_ticks", "PURGE_EVERY_TICKS", DEFAULT_PURGE_EVERY_TICKS)
        );
    }

    private record Resolver(SettingsStore settings, Map<String, String> env, Consumer<String> warn) {
        int positiveInt(String settingKey, String envKey, int fallback) {
            return rangedInt(settingKey, envKey, fallback, 1, Integer.MAX_VALUE);
        }

        int rangedInt(String settingKey, String envKey, int fallback, int min, int max) {
            Optional<String> stored = settings.get(settingKey).filter(value -> !value.isBlank());
            if (stored.isPresent()) {
                return parse(stored.get(), "setting '" + settingKey + "'", fallback, min, max);
            }
            String fromEnv = env.get(envKey);
            if (fromEnv != null && !fromEnv.isBlank()) {
                return parse(fromEnv, "environment variable " + envKey, fallback, min, max);
            }
            return fallback;
        }

        private int parse(String raw, String source, int fallback, int min, int max) {
            try {
                int value = Integer.parseInt(raw.trim());
                if (value >= min && value <= max) {
                    return value;
                }
            } catch (NumberFormatException ignored) {
                // reported below
            }
            warn.accept("Ignoring invalid " + source + " value '" + raw + "'; using " + fallback);
            return fallback;
        }
    }
}
