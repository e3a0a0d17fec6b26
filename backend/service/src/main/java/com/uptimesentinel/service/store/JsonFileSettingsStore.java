package com.uptimesentinel.service.store;

import com.fasterxml.jackson.core.type.TypeReference;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class JsonFileSettingsStore implements SettingsStore {
    private final JsonDocumentFile<Map<String, Setting>> document;
    private final Clock clock;

    public JsonFileSettingsStore(Path file, Clock clock) {
        this.document = new JsonDocumentFile<>(file, new TypeReference<>() {
        }, Map::of);
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(document.read().get(key)).map(Setting::value);
    }

    @Override
    public void set(String key, String value, String description) {
        Instant now = clock.instant();
        document.<Void>update(settings -> {
            Map<String, Setting> next = new TreeMap<>(settings);
            Setting previous = settings.get(key);
            String keptDescription = description != null || previous == null ? description : previous.description();
            next.put(key, new Setting(value, keptDescription, now));
            return JsonDocumentFile.Change.of(next, null);
        });
    }

    @Override
    public void delete(String key) {
        document.<Void>update(settings -> {
            if (!settings.containsKey(key)) {
                return JsonDocumentFile.Change.of(settings, null);
            }
            Map<String, Setting> next = new TreeMap<>(settings);
            next.remove(key);
            return JsonDocumentFile.Change.of(next, null);
        });
    }

    @Override
    public Map<String, String> all() {
        Map<String, String> values = new LinkedHashMap<>();
        new TreeMap<>(document.read()).forEach((key, setting) -> values.put(key, setting.value()));
        return values;
    }

    record Setting(String value, String description, Instant updatedAt) {
    }
}
