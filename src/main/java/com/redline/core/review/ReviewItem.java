package com.redline.core.review;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.redline.core.model.Severity;

import java.time.Instant;
import java.util.List;

/**
 * Request for a human to look at a successful high-impact attack.
 */
public record ReviewItem(
    String id,
    @JsonProperty("attack_id") String attackId,
    @JsonProperty("campaign_id") String campaignId,
    @JsonProperty("flagged_policies") List<String> flaggedPolicies,
    Severity severity,
    Instant createdAt
) {

    public ReviewItem {
        flaggedPolicies = flaggedPolicies == null ? List.of() : List.copyOf(flaggedPolicies);
    }
}
