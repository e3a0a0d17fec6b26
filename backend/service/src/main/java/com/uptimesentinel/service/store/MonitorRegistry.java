package com.uptimesentinel.service.store;

import com.uptimesentinel.core.model.Monitor;

import java.util.List;
import java.util.Optional;

public interface MonitorRegistry {
    Optional<Monitor> get(String monitorId);

    List<Monitor> listEnabled();

    List<Monitor> listByOwner(String ownerId);
}
