package com.redline.core.model;

/**
 * Running totals of a campaign. {@code total} counts every attempted attack,
 * errored ones included, so {@code total == bypassed + blocked + errored} always holds.
 */
public record CampaignStatistics(int bypassed, int blocked, int errored) {

    public static final CampaignStatistics EMPTY = new CampaignStatistics(0, 0, 0);

    public int total() {
        return bypassed + blocked + errored;
    }

    /** Bypass rate as a percentage in [0, 100]; zero when nothing was attempted. */
    public double successRate() {
        int total = total();
        return total == 0 ? 0.0 : (bypassed * 100.0) / total;
    }

    public RiskLevel riskLevel() {
        return RiskLevel.fromSuccessRate(successRate());
    }

    public CampaignStatistics record(AttackOutcome outcome) {
        return switch (outcome) {
            case BYPASSED -> new CampaignStatistics(bypassed + 1, blocked, errored);
            case BLOCKED -> new CampaignStatistics(bypassed, blocked + 1, errored);
            case ERRORED -> new CampaignStatistics(bypassed, blocked, errored + 1);
            case PENDING -> throw new IllegalArgumentException("Cannot count an unscored attack");
        };
    }
}
