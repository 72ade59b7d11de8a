package com.redline.core.model;

import java.time.Instant;

/**
 * Snapshot of a red-team campaign.
 * <p>
 * While a campaign runs, its executor owns the live state and publishes a fresh snapshot
 * after every completed attack. Viewers only ever see snapshots, so totals may trail the
 * in-flight work by one attack.
 *
 * @param id             campaign identifier
 * @param config         settings the campaign was created with
 * @param status         lifecycle status
 * @param statistics     running totals
 * @param plannedAttacks attacks enumerated when the run started (0 until then)
 * @param createdAt      creation time
 * @param startedAt      time the campaign entered RUNNING; nullable
 * @param completedAt    time the campaign reached a terminal status; nullable
 * @param errorMessage   explanation of a FAILED status; nullable
 */
public record Campaign(
    String id,
    CampaignConfig config,
    CampaignStatus status,
    CampaignStatistics statistics,
    int plannedAttacks,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String errorMessage
) {

    public static Campaign pending(String id, CampaignConfig config, Instant createdAt) {
        return new Campaign(id, config, CampaignStatus.PENDING, CampaignStatistics.EMPTY,
                0, createdAt, null, null, null);
    }

    public double successRate() {
        return statistics.successRate();
    }

    /** Risk rollup; low until at least one attack has been attempted. */
    public RiskLevel riskLevel() {
        return statistics.riskLevel();
    }

    public Campaign withStatistics(CampaignStatistics updated) {
        return new Campaign(id, config, status, updated, plannedAttacks,
                createdAt, startedAt, completedAt, errorMessage);
    }

    public Campaign withPlannedAttacks(int planned) {
        return new Campaign(id, config, status, statistics, planned,
                createdAt, startedAt, completedAt, errorMessage);
    }

    public Campaign withLifecycle(CampaignStatus newStatus, Instant started, Instant completed, String error) {
        return new Campaign(id, config, newStatus, statistics, plannedAttacks,
                createdAt, started, completed, error);
    }
}
