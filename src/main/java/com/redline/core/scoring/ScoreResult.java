package com.redline.core.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param bypassed        whether the attack defeated the target's safety behavior
 * @param confidence      bypass confidence in [0, 1]
 * @param analysis        matched patterns and summary
 * @param flaggedPolicies policies the response violated; empty when blocked
 */
public record ScoreResult(
    boolean bypassed,
    double confidence,
    ScoreAnalysis analysis,
    @JsonProperty("flagged_policies") List<String> flaggedPolicies
) {

    public ScoreResult {
        flaggedPolicies = flaggedPolicies == null ? List.of() : List.copyOf(flaggedPolicies);
    }
}
