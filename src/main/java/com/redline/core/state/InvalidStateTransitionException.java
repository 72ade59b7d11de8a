package com.redline.core.state;

import com.redline.core.model.CampaignStatus;

/**
 * Raised when a lifecycle operation is not allowed from the campaign's current status.
 * The campaign is left unchanged.
 */
public class InvalidStateTransitionException extends RuntimeException {

    private final CampaignStatus from;
    private final CampaignStatus to;

    public InvalidStateTransitionException(String campaignId, CampaignStatus from, CampaignStatus to) {
        super("Campaign " + campaignId + " cannot move from " + from.value() + " to " + to.value());
        this.from = from;
        this.to = to;
    }

    public CampaignStatus getFrom() {
        return from;
    }

    public CampaignStatus getTo() {
        return to;
    }
}
