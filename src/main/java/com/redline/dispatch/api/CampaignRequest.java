package com.redline.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/campaigns.
 *
 * @param name                 display name; nullable, derived from the categories when absent
 * @param description          free text; nullable
 * @param categories           attack categories, e.g. "jailbreak", "data-leakage"
 * @param target               model name; nullable, defaults to the configured target
 * @param attacksPerTemplate   instantiations per template; nullable, defaults to 1
 * @param failThresholdPercent success rate that fails the campaign; nullable, never fails
 */
public record CampaignRequest(
    String name,
    String description,
    List<String> categories,
    String target,
    @JsonProperty("attacks_per_template") Integer attacksPerTemplate,
    @JsonProperty("fail_threshold_percent") Double failThresholdPercent
) {}
