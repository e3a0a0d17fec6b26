package com.uptimesentinel.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptimesentinel.core.events.AlertRaised;
import com.uptimesentinel.core.events.CheckRecorded;
import com.uptimesentinel.core.events.ChecksScheduled;
import com.uptimesentinel.core.events.Event;
import com.uptimesentinel.core.events.JobsProcessed;
import com.uptimesentinel.core.events.JobsPurged;
import com.uptimesentinel.core.events.NotificationDelivered;
import com.uptimesentinel.core.events.StatusChanged;
import com.uptimesentinel.core.util.JsonUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final List<Class<? extends Event>> EVENT_TYPES = List.of(
            ChecksScheduled.class,
            JobsProcessed.class,
            JobsPurged.class,
            CheckRecorded.class,
            StatusChanged.class,
            NotificationDelivered.class,
            AlertRaised.class
    );
    private static final Map<String, Class<? extends Event>> BY_NAME = EVENT_TYPES.stream()
            .collect(Collectors.toUnmodifiableMap(Class::getSimpleName, Function.identity()));

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return EVENT_TYPES;
    }

    public static String toJsonLine(Event event) {
        return JsonUtils.toJson(new StoredEvent(event.type(), event.timestamp(), event));
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = BY_NAME.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
