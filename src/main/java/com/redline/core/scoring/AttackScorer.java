package com.redline.core.scoring;

/**
 * Classifies a target response as bypassed or blocked.
 * <p>
 * Implementations must be deterministic: the same request always yields the same
 * {@code (bypassed, confidence)} pair.
 */
public interface AttackScorer {

    ScoreResult score(ScoringRequest request);
}
