package com.orbit.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub channel for agent events.
 * <p>
 * Supports per-agent subscriptions and global subscriptions that receive all events.
 * Delivery is synchronous on the publishing thread; a failing subscriber is logged
 * and never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-agent subscribers keyed by agentId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AgentEvent>>> agentSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<AgentEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (agent-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(AgentEvent event) {
        log.debug("Publishing event: {} for agent {}", event.eventType(), event.agentId());

        List<Consumer<AgentEvent>> agentSubs = agentSubscribers.get(event.agentId());
        if (agentSubs != null) {
            for (Consumer<AgentEvent> subscriber : agentSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<AgentEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events emitted by a specific agent.
     *
     * @param agentId  the agent to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String agentId, Consumer<AgentEvent> consumer) {
        agentSubscribers.computeIfAbsent(agentId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to agent {}", agentId);
        return () -> {
            agentSubscribers.computeIfPresent(agentId, (k, subs) -> {
                subs.remove(consumer);
                return subs.isEmpty() ? null : subs;
            });
        };
    }

    /**
     * Subscribe to one kind of event emitted by a specific agent.
     *
     * @param agentId   the agent to subscribe to
     * @param eventType one of the names in {@link AgentEvents}
     * @param consumer  callback invoked for matching events
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String agentId, String eventType, Consumer<AgentEvent> consumer) {
        return subscribe(agentId, event -> {
            if (eventType.equals(event.eventType())) {
                consumer.accept(event);
            }
        });
    }

    /**
     * Number of live subscriptions for an agent.
     */
    public int subscriberCount(String agentId) {
        List<Consumer<AgentEvent>> subs = agentSubscribers.get(agentId);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Subscribe to events from all agents.
     *
     * @param consumer callback invoked for each event regardless of agent
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<AgentEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all agent events");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AgentEvent> subscriber, AgentEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
