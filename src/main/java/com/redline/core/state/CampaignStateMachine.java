package com.redline.core.state;

import com.redline.core.model.AttackOutcome;
import com.redline.core.model.Campaign;
import com.redline.core.model.CampaignStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Locale;

/**
 * Lifecycle and running totals of one campaign.
 * <p>
 * {@code pending -> running -> {completed, failed, cancelled}}. Once terminal, the status
 * never changes again: late results still count toward the totals, and
 * {@link #finish(Double)} only stamps the completion time.
 * <p>
 * All methods are synchronized and return a fresh {@link Campaign} snapshot.
 */
public class CampaignStateMachine {

    private static final Logger log = LoggerFactory.getLogger(CampaignStateMachine.class);

    private Campaign campaign;

    public CampaignStateMachine(Campaign campaign) {
        this.campaign = campaign;
    }

    public synchronized Campaign snapshot() {
        return campaign;
    }

    public synchronized CampaignStatus status() {
        return campaign.status();
    }

    /**
     * Moves a pending campaign to running. Allowed exactly once.
     *
     * @throws InvalidStateTransitionException if the campaign is not pending
     */
    public synchronized Campaign start(int plannedAttacks) {
        require(CampaignStatus.PENDING, CampaignStatus.RUNNING);
        campaign = campaign.withPlannedAttacks(plannedAttacks)
                .withLifecycle(CampaignStatus.RUNNING, Instant.now(), null, null);
        log.info("Campaign {} running with {} planned attack(s)", campaign.id(), plannedAttacks);
        return campaign;
    }

    /**
     * @throws InvalidStateTransitionException unless the campaign is running
     */
    public synchronized Campaign cancel() {
        require(CampaignStatus.RUNNING, CampaignStatus.CANCELLED);
        campaign = campaign.withLifecycle(CampaignStatus.CANCELLED, campaign.startedAt(), null, null);
        log.info("Campaign {} cancelled", campaign.id());
        return campaign;
    }

    /**
     * Fails a running campaign immediately. A no-op on a campaign that is already terminal,
     * so the first failure reason wins.
     */
    public synchronized Campaign fail(String message) {
        if (campaign.status().isTerminal()) {
            log.debug("Campaign {} already {}, ignoring failure: {}", campaign.id(),
                    campaign.status().value(), message);
            return campaign;
        }
        if (campaign.status() == CampaignStatus.PENDING) {
            throw new InvalidStateTransitionException(campaign.id(), CampaignStatus.PENDING, CampaignStatus.FAILED);
        }
        campaign = campaign.withLifecycle(CampaignStatus.FAILED, campaign.startedAt(), null, message);
        log.warn("Campaign {} failed: {}", campaign.id(), message);
        return campaign;
    }

    /**
     * Counts one terminal attack. Accepted in any state after start, so in-flight attacks
     * that land after cancellation or failure are still recorded.
     */
    public synchronized Campaign record(AttackOutcome outcome) {
        if (campaign.status() == CampaignStatus.PENDING) {
            throw new IllegalStateException("Campaign " + campaign.id() + " has not started");
        }
        campaign = campaign.withStatistics(campaign.statistics().record(outcome));
        return campaign;
    }

    /**
     * Finalizes the run once every dispatched attack is recorded. A running campaign
     * completes, or fails when its success rate meets the threshold. An already terminal
     * campaign keeps its status.
     */
    public synchronized Campaign finish(Double failThresholdPercent) {
        Instant now = Instant.now();
        switch (campaign.status()) {
            case RUNNING -> {
                double rate = campaign.successRate();
                if (failThresholdPercent != null && rate >= failThresholdPercent) {
                    String message = String.format(Locale.ROOT,
                            "Success rate %.1f%% exceeded threshold %.1f%%", rate, failThresholdPercent);
                    campaign = campaign.withLifecycle(CampaignStatus.FAILED, campaign.startedAt(), now, message);
                } else {
                    campaign = campaign.withLifecycle(CampaignStatus.COMPLETED, campaign.startedAt(), now, null);
                }
            }
            case CANCELLED, FAILED, COMPLETED -> {
                if (campaign.completedAt() == null) {
                    campaign = campaign.withLifecycle(campaign.status(), campaign.startedAt(), now,
                            campaign.errorMessage());
                }
            }
            case PENDING -> throw new InvalidStateTransitionException(campaign.id(),
                    CampaignStatus.PENDING, CampaignStatus.COMPLETED);
        }
        log.info("Campaign {} finished {}: {} attack(s), success rate {}%", campaign.id(),
                campaign.status().value(), campaign.statistics().total(),
                String.format(Locale.ROOT, "%.1f", campaign.successRate()));
        return campaign;
    }

    private void require(CampaignStatus expected, CampaignStatus target) {
        if (campaign.status() != expected) {
            throw new InvalidStateTransitionException(campaign.id(), campaign.status(), target);
        }
    }
}
