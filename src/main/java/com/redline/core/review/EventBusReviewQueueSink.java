package com.redline.core.review;

import com.redline.core.events.EventBus;
import com.redline.core.events.RedlineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Publishes review items as {@code review.created} events.
 */
@Component
public class EventBusReviewQueueSink implements ReviewQueueSink {

    private static final Logger log = LoggerFactory.getLogger(EventBusReviewQueueSink.class);

    private final EventBus eventBus;

    public EventBusReviewQueueSink(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void createReviewItem(ReviewItem item) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("reviewItemId", item.id());
        payload.put("severity", item.severity().value());
        payload.put("flaggedPolicies", item.flaggedPolicies());
        log.info("Review item {} queued for attack {} ({})", item.id(), item.attackId(), item.severity().value());
        eventBus.publish(RedlineEvent.of("review.created", item.campaignId(), item.attackId(), payload));
    }
}
