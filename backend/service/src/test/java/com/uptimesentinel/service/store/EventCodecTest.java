package com.uptimesentinel.service.store;

import com.uptimesentinel.core.events.Event;
import com.uptimesentinel.core.events.JobsProcessed;
import com.uptimesentinel.core.events.StatusChanged;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {
    @Test
    void linesCarryTypeAndDecodeToTheSameEvent() {
        Event event = new StatusChanged(Instant.parse("2026-03-02T12:00:00Z"), "m1", "https://example.com", null, "down");

        String line = EventCodec.toJsonLine(event);

        assertTrue(line.startsWith("{\"type\":\"StatusChanged\""));
        assertFalse(line.contains("previousStatus"));
        assertEquals(event, EventCodec.fromJsonLine(line));
        assertEquals(7, EventCodec.allEventTypes().size());
    }

    @Test
    void countsSurviveEncoding() {
        Event event = new JobsProcessed(Instant.parse("2026-03-02T12:00:00Z"), 5, 4, 1, 1830);

        assertEquals(event, EventCodec.fromJsonLine(EventCodec.toJsonLine(event)));
    }

    @Test
    void rejectsUnsupportedOrInvalidPayload() {
        IllegalArgumentException unsupported = assertThrows(IllegalArgumentException.class, () ->
                EventCodec.fromJsonLine("{\"type\":\"Nope\",\"timestamp\":\"2026-03-02T12:00:00Z\",\"event\":{}}"));
        assertTrue(unsupported.getMessage().contains("Unsupported event type"));

        IllegalStateException invalid = assertThrows(IllegalStateException.class, () -> EventCodec.fromJsonLine("not-json"));
        assertTrue(invalid.getMessage().contains("Unable to deserialize event"));
    }
}
