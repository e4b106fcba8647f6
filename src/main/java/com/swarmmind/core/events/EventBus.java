package com.swarmmind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for swarm events.
 * <p>
 * Supports per-agent subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-agent subscribers keyed by agentId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SwarmEvent>>> agentSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<SwarmEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(SwarmEvent event) {
        log.debug("Publishing event: {} (agent {}, tick {})", event.eventType(), event.agentId(), event.tick());

        if (event.agentId() != null) {
            List<Consumer<SwarmEvent>> agentSubs = agentSubscribers.get(event.agentId());
            if (agentSubs != null) {
                for (Consumer<SwarmEvent> subscriber : agentSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<SwarmEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events about one agent.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String agentId, Consumer<SwarmEvent> consumer) {
        agentSubscribers.computeIfAbsent(agentId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to agent {}", agentId);
        return () -> {
            CopyOnWriteArrayList<Consumer<SwarmEvent>> subs = agentSubscribers.get(agentId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to every event, swarm-level ones included.
     */
    public Subscription subscribeAll(Consumer<SwarmEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SwarmEvent> subscriber, SwarmEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
