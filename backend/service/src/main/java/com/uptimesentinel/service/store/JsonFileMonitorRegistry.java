package com.uptimesentinel.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.uptimesentinel.core.model.Monitor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public class JsonFileMonitorRegistry implements MonitorRepository {
    private static final Comparator<Monitor> NEWEST_FIRST = Comparator.comparing(
            Monitor::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final JsonDocumentFile<List<Monitor>> document;

    public JsonFileMonitorRegistry(Path file) {
        this.document = new JsonDocumentFile<>(file, new TypeReference<>() {
        }, List::of);
    }

    @Override
    public Optional<Monitor> get(String monitorId) {
        return document.read().stream().filter(monitor -> monitor.id().equals(monitorId)).findFirst();
    }

    @Override
    public List<Monitor> listEnabled() {
        return document.read().stream().filter(Monitor::enabled).toList();
    }

    @Override
    public List<Monitor> listByOwner(String ownerId) {
        return document.read().stream()
                .filter(monitor -> Objects.equals(monitor.ownerId(), ownerId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public List<Monitor> listAll() {
        return List.copyOf(document.read());
    }

    @Override
    public Monitor save(Monitor monitor) {
        return document.<Monitor>update(monitors -> {
            List<Monitor> next = new ArrayList<>(monitors);
            boolean replaced = false;
            for (int i = 0; i < next.size(); i++) {
                if (next.get(i).id().equals(monitor.id())) {
                    next.set(i, monitor);
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                next.add(monitor);
            }
            return JsonDocumentFile.Change.of(List.copyOf(next), monitor);
        });
    }

    @Override
    public boolean delete(String monitorId) {
        return document.<Boolean>update(monitors -> {
            List<Monitor> next = monitors.stream().filter(monitor -> !monitor.id().equals(monitorId)).toList();
            if (next.size() == monitors.size()) {
                return JsonDocumentFile.Change.of(monitors, false);
            }
            return JsonDocumentFile.Change.of(next, true);
        });
    }

    @Override
    public String nextId() {
        return "mon-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
