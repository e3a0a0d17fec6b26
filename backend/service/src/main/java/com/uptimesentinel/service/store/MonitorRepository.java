package com.uptimesentinel.service.store;

import com.uptimesentinel.core.model.Monitor;

import java.util.List;

public interface MonitorRepository extends MonitorRegistry {
    Monitor save(Monitor monitor);

    boolean delete(String monitorId);

    List<Monitor> listAll();

    String nextId();
}
