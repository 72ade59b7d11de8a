package com.redline.core.model;

import java.util.Set;

/**
 * Caller-supplied settings for a new campaign.
 *
 * @param name                 display name
 * @param description          optional free text
 * @param categories           attack categories to exercise; must not be empty
 * @param target               model name or endpoint label the attacks are sent to
 * @param attacksPerTemplate   instantiations per matching template, at least 1
 * @param failThresholdPercent success rate (percent) at or above which the campaign fails; nullable
 */
public record CampaignConfig(
    String name,
    String description,
    Set<AttackCategory> categories,
    String target,
    int attacksPerTemplate,
    Double failThresholdPercent
) {

    public CampaignConfig {
        categories = categories == null ? Set.of() : Set.copyOf(categories);
    }
}
