package com.uptimesentinel.service.monitor;

import com.uptimesentinel.core.model.ChannelConfig;

import java.util.List;

public record MonitorChanges(
        String url,
        Integer intervalSeconds,
        Integer timeoutSeconds,
        Boolean enabled,
        List<ChannelConfig> channels
) {
    public static MonitorChanges enabled(boolean enabled) {
        return new MonitorChanges(null, null, null, enabled, null);
    }
}
