package com.uptimesentinel.core.bus;

import com.uptimesentinel.core.events.ChecksScheduled;
import com.uptimesentinel.core.events.Event;
import com.uptimesentinel.core.events.JobsPurged;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void publishRoutesOnlyToSubscribersOfThatType() {
        EventBus bus = new EventBus();
        AtomicInteger scheduledHits = new AtomicInteger();
        AtomicInteger purgedHits = new AtomicInteger();

        bus.subscribe(ChecksScheduled.class, event -> scheduledHits.incrementAndGet());
        bus.subscribe(JobsPurged.class, event -> purgedHits.incrementAndGet());

        bus.publish(new ChecksScheduled(NOW, 3, 2));
        bus.publish(new ChecksScheduled(NOW, 3, 0));
        bus.publish(new JobsPurged(NOW, 7, 12));

        assertEquals(2, scheduledHits.get());
        assertEquals(1, purgedHits.get());
    }

    @Test
    void catchAllSubscribersSeeEveryEventInOrder() {
        EventBus bus = new EventBus();
        List<Event> seen = new CopyOnWriteArrayList<>();
        bus.subscribeAll(seen::add);

        bus.publish(new ChecksScheduled(NOW, 1, 1));
        bus.publish(new JobsPurged(NOW, 7, 0));

        assertEquals(List.of("ChecksScheduled", "JobsPurged"), seen.stream().map(Event::type).toList());
    }

    @Test
    void throwingHandlerIsReportedAndOthersStillRun() {
        AtomicReference<Exception> captured = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> captured.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(ChecksScheduled.class, event -> {
            throw new IllegalStateException("disk full");
        });
        bus.subscribe(ChecksScheduled.class, event -> safeHits.incrementAndGet());
        bus.subscribeAll(event -> safeHits.incrementAndGet());

        bus.publish(new ChecksScheduled(NOW, 1, 1));

        assertEquals(2, safeHits.get());
        assertNotNull(captured.get());
        assertEquals("disk full", captured.get().getMessage());
    }
}
