package com.redline.core.engine;

public class CampaignNotFoundException extends RuntimeException {

    public CampaignNotFoundException(String campaignId) {
        super("Campaign not found: " + campaignId);
    }
}
