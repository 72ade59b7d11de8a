package com.redline.core.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.redline.core.model.RiskLevel;

import java.util.List;
import java.util.Map;

/**
 * Post-run analysis of a campaign's attacks.
 */
public record CampaignReport(
    @JsonProperty("campaign_id") String campaignId,
    @JsonProperty("total_attacks") int totalAttacks,
    @JsonProperty("successful_attacks") int successfulAttacks,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("critical_vulnerabilities") int criticalVulnerabilities,
    @JsonProperty("high_vulnerabilities") int highVulnerabilities,
    @JsonProperty("vulnerabilities_by_category") Map<String, Integer> vulnerabilitiesByCategory,
    List<String> recommendations
) {}
