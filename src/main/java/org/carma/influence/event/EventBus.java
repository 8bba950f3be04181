package org.carma.influence.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Event bus for publish-subscribe communication between the harness and observers.
 *
 * Provides:
 * - Type-safe subscription
 * - Synchronous event dispatch on the publishing thread
 * - Event history for audit trail
 *
 * Workers publish concurrently; handlers must be thread-safe.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<? extends HarnessEvent>, List<Consumer<HarnessEvent>>> subscribers;
    private final List<Consumer<HarnessEvent>> wildcardSubscribers;
    private final List<HarnessEvent> eventHistory;
    private final boolean recordHistory;

    public EventBus() {
        this(true);
    }

    public EventBus(boolean recordHistory) {
        this.subscribers = new ConcurrentHashMap<>();
        this.wildcardSubscribers = new CopyOnWriteArrayList<>();
        this.eventHistory = Collections.synchronizedList(new ArrayList<>());
        this.recordHistory = recordHistory;
    }

    // ========================================================================
    // Subscription
    // ========================================================================

    /**
     * Subscribe to a specific event type.
     */
    @SuppressWarnings("unchecked")
    public <T extends HarnessEvent> void subscribe(Class<T> eventType, Consumer<T> handler) {
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
            .add(event -> handler.accept((T) event));
    }

    /**
     * Subscribe to all events.
     */
    public void subscribeAll(Consumer<HarnessEvent> handler) {
        wildcardSubscribers.add(handler);
    }

    // ========================================================================
    // Publishing
    // ========================================================================

    /**
     * Publish an event to all subscribers. A failing handler is logged and does not
     * stop delivery to the others.
     */
    public void publish(HarnessEvent event) {
        if (recordHistory) {
            eventHistory.add(event);
        }

        List<Consumer<HarnessEvent>> handlers = subscribers.get(event.getClass());
        if (handlers != null) {
            handlers.forEach(handler -> deliver(handler, event));
        }
        wildcardSubscribers.forEach(handler -> deliver(handler, event));
    }

    private void deliver(Consumer<HarnessEvent> handler, HarnessEvent event) {
        try {
            handler.accept(event);
        } catch (RuntimeException e) {
            log.warn("Error in event handler for {}: {}", event.eventType(), e.getMessage(), e);
        }
    }

    // ========================================================================
    // History Management
    // ========================================================================

    public List<HarnessEvent> getHistory() {
        synchronized (eventHistory) {
            return new ArrayList<>(eventHistory);
        }
    }

    /**
     * Get events of a specific type.
     */
    public <T extends HarnessEvent> List<T> getHistory(Class<T> eventType) {
        List<T> filtered = new ArrayList<>();
        for (HarnessEvent event : getHistory()) {
            if (eventType.isInstance(event)) {
                filtered.add(eventType.cast(event));
            }
        }
        return filtered;
    }

    public int getEventCount(Class<? extends HarnessEvent> eventType) {
        return getHistory(eventType).size();
    }

    public void clearHistory() {
        eventHistory.clear();
    }

    @Override
    public String toString() {
        return String.format("EventBus[subscribers=%d, history=%d events]",
            subscribers.values().stream().mapToInt(List::size).sum() + wildcardSubscribers.size(),
            eventHistory.size());
    }
}
