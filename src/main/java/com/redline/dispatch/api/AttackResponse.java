package com.redline.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.redline.core.model.Attack;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON view of one attack attempt.
 */
public record AttackResponse(
    @JsonProperty("attack_id") String attackId,
    @JsonProperty("campaign_id") String campaignId,
    @JsonProperty("template_id") String templateId,
    @JsonProperty("template_name") String templateName,
    String category,
    String severity,
    String target,
    String prompt,
    @JsonProperty("variable_values") Map<String, String> variableValues,
    String response,
    String outcome,
    @JsonProperty("was_successful") boolean wasSuccessful,
    @JsonProperty("bypass_score") double bypassScore,
    @JsonProperty("analysis_notes") String analysisNotes,
    @JsonProperty("flagged_policies") List<String> flaggedPolicies,
    @JsonProperty("latency_ms") long latencyMs,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("review_item_id") String reviewItemId,
    @JsonProperty("created_at") Instant createdAt
) {

    public static AttackResponse from(Attack attack) {
        return new AttackResponse(attack.id(), attack.campaignId(), attack.templateId(),
                attack.templateName(), attack.category().value(), attack.severity().value(),
                attack.target(), attack.prompt(), attack.variableValues(), attack.response(),
                attack.outcome().value(), attack.bypassed(), attack.confidence(),
                attack.analysisNotes(), attack.flaggedPolicies(), attack.latencyMs(),
                attack.errorMessage(), attack.reviewItemId(), attack.createdAt());
    }
}
