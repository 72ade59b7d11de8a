package com.redline.core.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured notes behind a score: which patterns matched and why.
 */
public record ScoreAnalysis(
    @JsonProperty("refusal_matches") List<String> refusalMatches,
    @JsonProperty("compliance_matches") List<String> complianceMatches,
    List<String> corroborations,
    String summary
) {

    public ScoreAnalysis {
        refusalMatches = refusalMatches == null ? List.of() : List.copyOf(refusalMatches);
        complianceMatches = complianceMatches == null ? List.of() : List.copyOf(complianceMatches);
        corroborations = corroborations == null ? List.of() : List.copyOf(corroborations);
    }

    public int refusalCount() {
        return refusalMatches.size();
    }

    public int complianceCount() {
        return complianceMatches.size();
    }
}
