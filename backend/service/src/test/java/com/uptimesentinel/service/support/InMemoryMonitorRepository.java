package com.uptimesentinel.service.support;

import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.service.store.MonitorRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryMonitorRepository implements MonitorRepository {
    private final Map<String, Monitor> monitors = new LinkedHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public synchronized Optional<Monitor> get(String monitorId) {
        return Optional.ofNullable(monitors.get(monitorId));
    }

    @Override
    public synchronized List<Monitor> listEnabled() {
        return monitors.values().stream().filter(Monitor::enabled).toList();
    }

    @Override
    public synchronized List<Monitor> listByOwner(String ownerId) {
        return monitors.values().stream().filter(monitor -> Objects.equals(monitor.ownerId(), ownerId)).toList();
    }

    @Override
    public synchronized Monitor save(Monitor monitor) {
        monitors.put(monitor.id(), monitor);
        return monitor;
    }

    @Override
    public synchronized boolean delete(String monitorId) {
        return monitors.remove(monitorId) != null;
    }

    @Override
    public synchronized List<Monitor> listAll() {
        return new ArrayList<>(monitors.values());
    }

    @Override
    public String nextId() {
        return "mon-" + sequence.incrementAndGet();
    }
}
