package com.redline.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.redline.core.model.AttackCategory;
import com.redline.core.model.Campaign;
import com.redline.core.model.RiskLevel;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * JSON response for campaign endpoints.
 */
public record CampaignResponse(
    @JsonProperty("campaign_id") String campaignId,
    String name,
    String description,
    String status,
    List<String> categories,
    String target,
    @JsonProperty("attacks_per_template") int attacksPerTemplate,
    @JsonProperty("fail_threshold_percent") Double failThresholdPercent,
    @JsonProperty("planned_attacks") int plannedAttacks,
    @JsonProperty("total_attacks") int totalAttacks,
    @JsonProperty("successful_attacks") int successfulAttacks,
    @JsonProperty("blocked_attacks") int blockedAttacks,
    @JsonProperty("errored_attacks") int erroredAttacks,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("error_message") String errorMessage
) {

    public static CampaignResponse from(Campaign campaign) {
        var config = campaign.config();
        var stats = campaign.statistics();
        List<String> categories = Arrays.stream(AttackCategory.values())
                .filter(config.categories()::contains)
                .map(AttackCategory::value)
                .toList();
        return new CampaignResponse(campaign.id(), config.name(), config.description(),
                campaign.status().value(), categories, config.target(), config.attacksPerTemplate(),
                config.failThresholdPercent(), campaign.plannedAttacks(), stats.total(),
                stats.bypassed(), stats.blocked(), stats.errored(),
                Math.round(campaign.successRate() * 100.0) / 100.0, campaign.riskLevel(),
                campaign.createdAt(), campaign.startedAt(), campaign.completedAt(), campaign.errorMessage());
    }
}
