package com.redline.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One attack attempt: the instantiated prompt, what the target answered and how the
 * answer was scored.
 * <p>
 * Created {@link AttackOutcome#PENDING} when its prompt is dispatched and moved exactly
 * once to a terminal outcome. After that only {@code reviewItemId} may change.
 *
 * @param id              attack identifier
 * @param campaignId      owning campaign; null for quick tests
 * @param templateId      source template
 * @param templateName    source template name, kept for reporting
 * @param category        attack category inherited from the template
 * @param severity        severity inherited from the template
 * @param target          target the prompt was sent to
 * @param prompt          instantiated prompt; empty when instantiation itself failed
 * @param variableValues  exact placeholder values used
 * @param response        raw target response; null unless scored
 * @param outcome         attempt state
 * @param confidence      bypass confidence in [0, 1]
 * @param analysisNotes   scorer explanation
 * @param flaggedPolicies policy names the response violated
 * @param latencyMs       wall time of the target call
 * @param errorMessage    why the attempt errored; null otherwise
 * @param reviewItemId    review-queue back-reference; nullable
 * @param createdAt       dispatch time
 */
public record Attack(
    String id,
    String campaignId,
    String templateId,
    String templateName,
    AttackCategory category,
    Severity severity,
    String target,
    String prompt,
    Map<String, String> variableValues,
    String response,
    AttackOutcome outcome,
    double confidence,
    String analysisNotes,
    List<String> flaggedPolicies,
    long latencyMs,
    String errorMessage,
    String reviewItemId,
    Instant createdAt
) {

    public Attack {
        variableValues = variableValues == null ? Map.of() : Map.copyOf(variableValues);
        flaggedPolicies = flaggedPolicies == null ? List.of() : List.copyOf(flaggedPolicies);
    }

    public static Attack dispatched(String id, String campaignId, Template template, String target,
                                    String prompt, Map<String, String> variableValues) {
        return new Attack(id, campaignId, template.id(), template.name(), template.category(),
                template.severity(), target, prompt, variableValues, null, AttackOutcome.PENDING,
                0.0, null, List.of(), 0L, null, null, Instant.now());
    }

    public boolean bypassed() {
        return outcome == AttackOutcome.BYPASSED;
    }

    public Attack scored(String targetResponse, boolean bypassed, double score, String notes,
                         List<String> policies, long latency) {
        requirePending();
        return new Attack(id, campaignId, templateId, templateName, category, severity, target,
                prompt, variableValues, targetResponse,
                bypassed ? AttackOutcome.BYPASSED : AttackOutcome.BLOCKED,
                score, notes, policies, latency, null, null, createdAt);
    }

    public Attack errored(String error, long latency) {
        requirePending();
        return new Attack(id, campaignId, templateId, templateName, category, severity, target,
                prompt, variableValues, null, AttackOutcome.ERRORED, 0.0, null, List.of(),
                latency, error, null, createdAt);
    }

    public Attack withReviewItem(String reviewId) {
        return new Attack(id, campaignId, templateId, templateName, category, severity, target,
                prompt, variableValues, response, outcome, confidence, analysisNotes,
                flaggedPolicies, latencyMs, errorMessage, reviewId, createdAt);
    }

    private void requirePending() {
        if (outcome.isTerminal()) {
            throw new IllegalStateException("Attack " + id + " already reached " + outcome);
        }
    }
}
