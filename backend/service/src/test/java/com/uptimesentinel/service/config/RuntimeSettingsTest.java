package com.uptimesentinel.service.config;

import com.uptimesentinel.service.store.JsonFileSettingsStore;
import com.uptimesentinel.service.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuntimeSettingsTest {
    @Test
    void defaultsApplyWhenNothingConfigured() throws Exception {
        RuntimeSettings settings = RuntimeSettings.resolve(store(), Map.of(), message -> {
        });

        assertEquals(RuntimeSettings.defaults(), settings);
        assertEquals(Duration.ofSeconds(30), settings.schedulerInterval());
        assertEquals(50, settings.concurrencyLimit());
        assertEquals(7, settings.retentionDays());
        assertEquals(100, settings.purgeEveryTicks());
    }

    @Test
    void storedSettingWinsOverEnvironment() throws Exception {
        JsonFileSettingsStore store = store();
        store.set("scheduler_interval", "45", "Seconds between scheduler ticks");

        RuntimeSettings settings = RuntimeSettings.resolve(store, Map.of(
                "SCHEDULER_INTERVAL", "10",
                "WORKER_CONCURRENCY", "8"
        ), message -> {
        });

        assertEquals(Duration.ofSeconds(45), settings.schedulerInterval());
        assertEquals(8, settings.concurrencyLimit());
    }

    @Test
    void invalidValuesWarnAndFallBack() throws Exception {
        JsonFileSettingsStore store = store();
        store.set("job_retention_days", "0", null);
        List<String> warnings = new CopyOnWriteArrayList<>();

        RuntimeSettings settings = RuntimeSettings.resolve(store, Map.of("WORKER_CONCURRENCY", "lots"), warnings::add);

        assertEquals(50, settings.concurrencyLimit());
        assertEquals(7, settings.retentionDays());
        assertEquals(2, warnings.size());
        assertTrue(warnings.stream().anyMatch(warning -> warning.contains("WORKER_CONCURRENCY")));
        assertTrue(warnings.stream().anyMatch(warning -> warning.contains("job_retention_days")));
    }

    @Test
    void monitorDefaultsOutsideAcceptedRangesWarnAndFallBack() throws Exception {
        JsonFileSettingsStore store = store();
        store.set("default_check_timeout", "301", null);
        List<String> warnings = new CopyOnWriteArrayList<>();

        RuntimeSettings settings = RuntimeSettings.resolve(store, Map.of("DEFAULT_CHECK_INTERVAL", "30"), warnings::add);

        assertEquals(60, settings.defaultCheckIntervalSeconds());
        assertEquals(30, settings.defaultTimeoutSeconds());
        assertEquals(List.of(
                "Ignoring invalid environment variable DEFAULT_CHECK_INTERVAL value '30'; using 60",
                "Ignoring invalid setting 'default_check_timeout' value '301'; using 30"
        ), warnings);
    }

    @Test
    void monitorDefaultsInsideRangesAreKept() throws Exception {
        RuntimeSettings settings = RuntimeSettings.resolve(store(), Map.of(
                "DEFAULT_CHECK_INTERVAL", "86400",
                "DEFAULT_CHECK_TIMEOUT", "1"
        ), message -> {
        });

        assertEquals(86_400, settings.defaultCheckIntervalSeconds());
        assertEquals(1, settings.defaultTimeoutSeconds());
    }

    private static JsonFileSettingsStore store() throws Exception {
        return new JsonFileSettingsStore(Files.createTempDirectory("runtime-settings-").resolve("settings.json"),
                new MutableClock(Instant.parse("2026-03-01T00:00:00Z")));
    }
}
