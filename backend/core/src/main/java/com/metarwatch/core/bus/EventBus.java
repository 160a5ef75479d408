package com.metarwatch.core.bus;

import com.metarwatch.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process publish/subscribe. A handler registered for a type also receives
 * events of its subtypes, so subscribing to {@link Event} sees everything.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? extends Event>>> subscribers =
            new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void publish(Event event) {
        for (Map.Entry<Class<? extends Event>, List<Consumer<? extends Event>>> entry : subscribers.entrySet()) {
            if (!entry.getKey().isInstance(event)) {
                continue;
            }
            for (Consumer<? extends Event> handler : entry.getValue()) {
                invokeHandler(handler, event);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends Event> void invokeHandler(Consumer<? extends Event> rawHandler, Event event) {
        try {
            ((Consumer<T>) rawHandler).accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
