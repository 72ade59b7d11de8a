package com.redline.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for campaign progress events.
 * <p>
 * Per-campaign subscriptions plus global ones that see every event. A subscriber that
 * throws is logged and skipped; it never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-campaign subscribers keyed by campaignId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<RedlineEvent>>> campaignSubscribers =
            new ConcurrentHashMap<>();

    /** Subscribers that see every event, quick-test events included. */
    private final CopyOnWriteArrayList<Consumer<RedlineEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Delivers an event to the subscribers of its campaign, then to the global ones.
     * Quick-test events carry no campaign and reach global subscribers only.
     *
     * @param event the event to publish
     */
    public void publish(RedlineEvent event) {
        log.debug("Publishing event: {} for campaign {}", event.eventType(), event.campaignId());

        if (event.campaignId() != null) {
            List<Consumer<RedlineEvent>> subs = campaignSubscribers.get(event.campaignId());
            if (subs != null) {
                for (Consumer<RedlineEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<RedlineEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one campaign.
     *
     * @param campaignId the campaign to follow
     * @param consumer   callback invoked on the publishing thread for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String campaignId, Consumer<RedlineEvent> consumer) {
        campaignSubscribers.computeIfAbsent(campaignId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to campaign {}", campaignId);
        return () -> {
            CopyOnWriteArrayList<Consumer<RedlineEvent>> subs = campaignSubscribers.get(campaignId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events of every campaign.
     *
     * @param consumer callback invoked for each event regardless of campaign
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<RedlineEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription. Unsubscribing twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<RedlineEvent> subscriber, RedlineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
