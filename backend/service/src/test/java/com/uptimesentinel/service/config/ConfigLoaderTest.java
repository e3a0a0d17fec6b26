package com.uptimesentinel.service.config;

import com.uptimesentinel.service.monitor.MonitorDefinition;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsDefinitionsWithChannelsAndOptionalFields() throws Exception {
        Path file = Files.createTempDirectory("monitor-defs-").resolve("monitors.json");
        Files.writeString(file, """
                [
                  {
                    "ownerId": "alice",
                    "url": "https://example.com/health",
                    "intervalSeconds": 120,
                    "channels": [
                      {"type": "telegram", "settings": {"bot_token": "123:abc", "chat_id": "42"}}
                    ]
                  },
                  {"ownerId": "bob", "url": "https://status.example.org"}
                ]
                """);

        List<MonitorDefinition> definitions = ConfigLoader.loadMonitorDefinitions(file);

        assertEquals(2, definitions.size());
        assertEquals(120, definitions.get(0).intervalSeconds());
        assertEquals("42", definitions.get(0).channels().get(0).requiredSetting("chat_id"));
        assertNull(definitions.get(1).timeoutSeconds());
        assertTrue(definitions.get(1).channels().isEmpty());
    }

    @Test
    void missingFileFailsWithPath() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.loadMonitorDefinitions(Path.of("/tmp/uptime-sentinel-missing/monitors.json")));
        assertTrue(ex.getMessage().contains("monitors.json"));
    }
}
