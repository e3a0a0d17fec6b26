package com.uptimesentinel.service.store;

import java.util.Map;
import java.util.Optional;

public interface SettingsStore {
    Optional<String> get(String key);

    void set(String key, String value, String description);

    void delete(String key);

    Map<String, String> all();
}
