package com.uptimesentinel.service.monitor;

import com.uptimesentinel.core.model.ChannelConfig;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.service.notify.ChannelSenderRegistry;
import com.uptimesentinel.service.notify.UnsupportedChannelException;
import com.uptimesentinel.service.store.JobQueue;
import com.uptimesentinel.service.store.MonitorRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

public class MonitorService {
    private static final Logger LOGGER = Logger.getLogger(MonitorService.class.getName());

    private final MonitorRepository monitors;
    private final JobQueue queue;
    private final ChannelSenderRegistry channels;
    private final Clock clock;
    private final int defaultIntervalSeconds;
    private final int defaultTimeoutSeconds;

    public MonitorService(
            MonitorRepository monitors,
            JobQueue queue,
            ChannelSenderRegistry channels,
            Clock clock,
            int defaultIntervalSeconds,
            int defaultTimeoutSeconds
    ) {
        this.monitors = monitors;
        this.queue = queue;
        this.channels = channels;
        this.clock = clock;
        this.defaultIntervalSeconds = defaultIntervalSeconds;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public Monitor create(MonitorDefinition definition) {
        Objects.requireNonNull(definition.ownerId(), "ownerId is required");
        int interval = definition.intervalSeconds() == null ? defaultIntervalSeconds : definition.intervalSeconds();
        int timeout = definition.timeoutSeconds() == null ? defaultTimeoutSeconds : definition.timeoutSeconds();
        MonitorValidator.validateUrl(definition.url());
        MonitorValidator.validateInterval(interval);
        MonitorValidator.validateTimeout(timeout);
        validateChannels(definition.channels());

        Instant now = clock.instant();
        Monitor monitor = monitors.save(new Monitor(
                monitors.nextId(),
                definition.ownerId(),
                definition.url().trim(),
                interval,
                timeout,
                definition.enabled() == null || definition.enabled(),
                definition.channels(),
                now,
                now
        ));
        LOGGER.info("Created monitor " + monitor.id() + " for " + monitor.url());
        if (monitor.enabled()) {
            queue.enqueue(monitor.id(), now);
        }
        return monitor;
    }

    public Monitor update(String monitorId, String ownerId, MonitorChanges changes) {
        Monitor current = owned(monitorId, ownerId);
        String url = current.url();
        if (changes.url() != null) {
            MonitorValidator.validateUrl(changes.url());
            url = changes.url().trim();
        }
        int interval = current.intervalSeconds();
        if (changes.intervalSeconds() != null) {
            MonitorValidator.validateInterval(changes.intervalSeconds());
            interval = changes.intervalSeconds();
        }
        int timeout = current.timeoutSeconds();
        if (changes.timeoutSeconds() != null) {
            MonitorValidator.validateTimeout(changes.timeoutSeconds());
            timeout = changes.timeoutSeconds();
        }
        List<ChannelConfig> channelConfigs = current.channels();
        if (changes.channels() != null) {
            validateChannels(changes.channels());
            channelConfigs = changes.channels();
        }
        boolean enabled = changes.enabled() == null ? current.enabled() : changes.enabled();

        Instant now = clock.instant();
        Monitor updated = monitors.save(new Monitor(
                current.id(),
                current.ownerId(),
                url,
                interval,
                timeout,
                enabled,
                channelConfigs,
                current.createdAt(),
                now
        ));
        if (enabled && !current.enabled()) {
            queue.enqueue(updated.id(), now);
        }
        return updated;
    }

    public void delete(String monitorId, String ownerId) {
        owned(monitorId, ownerId);
        monitors.delete(monitorId);
        LOGGER.info("Deleted monitor " + monitorId);
    }

    public List<Monitor> listByOwner(String ownerId) {
        return monitors.listByOwner(ownerId);
    }

    public Optional<Monitor> get(String monitorId, String ownerId) {
        return monitors.get(monitorId).filter(monitor -> Objects.equals(monitor.ownerId(), ownerId));
    }

    private Monitor owned(String monitorId, String ownerId) {
        Monitor monitor = monitors.get(monitorId)
                .orElseThrow(() -> new IllegalArgumentException("Monitor not found: " + monitorId));
        if (!Objects.equals(monitor.ownerId(), ownerId)) {
            throw new IllegalArgumentException("Monitor does not belong to user");
        }
        return monitor;
    }

    private void validateChannels(List<ChannelConfig> configs) {
        for (ChannelConfig config : configs) {
            if (!channels.supports(config.type())) {
                throw new UnsupportedChannelException(config.type());
            }
        }
    }
}
