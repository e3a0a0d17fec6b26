package com.uptimesentinel.service.monitor;

import com.uptimesentinel.core.model.ChannelConfig;

import java.util.List;

public record MonitorDefinition(
        String ownerId,
        String url,
        Integer intervalSeconds,
        Integer timeoutSeconds,
        Boolean enabled,
        List<ChannelConfig> channels
) {
    public MonitorDefinition {
        channels = channels == null ? List.of() : List.copyOf(channels);
    }
}
