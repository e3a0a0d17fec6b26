package com.uptimesentinel.core.bus;

import com.uptimesentinel.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? super Event>>> byType = new ConcurrentHashMap<>();
    private final List<Consumer<? super Event>> everyEvent = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Handler failed for " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        byType.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>())
                .add(event -> handler.accept(type.cast(event)));
    }

    public void subscribeAll(Consumer<? super Event> handler) {
        everyEvent.add(handler);
    }

    public void publish(Event event) {
        for (Consumer<? super Event> handler : byType.getOrDefault(event.getClass(), List.of())) {
            deliver(handler, event);
        }
        for (Consumer<? super Event> handler : everyEvent) {
            deliver(handler, event);
        }
    }

    private void deliver(Consumer<? super Event> handler, Event event) {
        try {
            handler.accept(event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
