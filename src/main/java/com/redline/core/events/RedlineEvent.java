package com.redline.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress event emitted while a campaign runs, streamed over SSE and printed by the CLI.
 *
 * @param eventType  e.g. "campaign.started", "attack.completed", "review.created"
 * @param campaignId the campaign this event belongs to; null for quick tests
 * @param attackId   the attack this event relates to (nullable for campaign-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record RedlineEvent(
    String eventType,
    String campaignId,
    String attackId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static RedlineEvent of(String eventType, String campaignId, String attackId,
                                  Map<String, Object> payload) {
        return new RedlineEvent(eventType, campaignId, attackId,
                payload == null ? Map.of() : payload, Instant.now());
    }

    public boolean isTerminal() {
        return "campaign.completed".equals(eventType)
                || "campaign.failed".equals(eventType)
                || "campaign.cancelled".equals(eventType);
    }
}
