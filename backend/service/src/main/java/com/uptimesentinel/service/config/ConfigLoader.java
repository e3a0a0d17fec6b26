package com.uptimesentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.uptimesentinel.core.util.JsonUtils;
import com.uptimesentinel.service.monitor.MonitorDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static List<MonitorDefinition> loadMonitorDefinitions(Path file) {
        if (!Files.exists(file)) {
            throw new IllegalStateException("Monitor definition file does not exist: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return JsonUtils.objectMapper().readValue(in, new TypeReference<>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading monitor definitions from " + file, e);
        }
    }
}
