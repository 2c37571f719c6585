package com.auraide.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for sandbox lifecycle, file and terminal events.
 * <p>
 * Supports per-type subscriptions and global subscriptions that receive every event.
 * A listener that throws is logged and skipped; remaining listeners still run.
 * Thread-safe for concurrent publish and subscribe operations.
 * <p>
 * The Spring bean is the application-wide channel fed by {@code SandboxManager};
 * each provider owns a private instance that the manager relays from.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Subscribers keyed by event type. */
    private final ConcurrentHashMap<SandboxEventType, CopyOnWriteArrayList<Consumer<SandboxEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events of every type. */
    private final CopyOnWriteArrayList<Consumer<SandboxEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (type-specific first, then global).
     *
     * @param event the event to publish
     */
    public void publish(SandboxEvent event) {
        log.debug("Publishing event: {} for sandbox {}", event.type().wireName(), event.sandboxId());

        List<Consumer<SandboxEvent>> typeSubs = typeSubscribers.get(event.type());
        if (typeSubs != null) {
            for (Consumer<SandboxEvent> subscriber : typeSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<SandboxEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of a single type.
     *
     * @param type     the event type to listen for
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(SandboxEventType type, Consumer<SandboxEvent> consumer) {
        typeSubscribers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", type.wireName());
        return () -> unsubscribe(type, consumer);
    }

    /**
     * Subscribe to every event regardless of type.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<SandboxEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Removes a listener previously registered with {@link #subscribe}.
     *
     * @return true if the listener was registered
     */
    public boolean unsubscribe(SandboxEventType type, Consumer<SandboxEvent> consumer) {
        CopyOnWriteArrayList<Consumer<SandboxEvent>> subs = typeSubscribers.get(type);
        return subs != null && subs.remove(consumer);
    }

    public int subscriberCount(SandboxEventType type) {
        CopyOnWriteArrayList<Consumer<SandboxEvent>> subs = typeSubscribers.get(type);
        return (subs != null ? subs.size() : 0) + globalSubscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SandboxEvent> subscriber, SandboxEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type().wireName(), e.getMessage(), e);
        }
    }
}
