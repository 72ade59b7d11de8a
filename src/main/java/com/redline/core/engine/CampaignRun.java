package com.redline.core.engine;

import com.redline.core.model.Campaign;
import com.redline.core.model.CampaignConfig;
import com.redline.core.model.Template;
import com.redline.core.state.CampaignStateMachine;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live execution state of one campaign: its state machine, its aggregator, the planned
 * template slots and the cooperative stop flag.
 */
class CampaignRun {

    private final String campaignId;
    private final CampaignConfig config;
    private final CampaignStateMachine stateMachine;
    private final CampaignAggregator aggregator;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CompletableFuture<Campaign> completion = new CompletableFuture<>();
    private volatile List<Template> plan = List.of();

    CampaignRun(Campaign campaign, CampaignAggregatorFactory aggregators) {
        this.campaignId = campaign.id();
        this.config = campaign.config();
        this.stateMachine = new CampaignStateMachine(campaign);
        this.aggregator = aggregators.create(stateMachine, this::requestStop);
    }

    String campaignId() {
        return campaignId;
    }

    CampaignConfig config() {
        return config;
    }

    CampaignStateMachine stateMachine() {
        return stateMachine;
    }

    CampaignAggregator aggregator() {
        return aggregator;
    }

    List<Template> plan() {
        return plan;
    }

    void plan(List<Template> slots) {
        this.plan = List.copyOf(slots);
    }

    void requestStop() {
        stopRequested.set(true);
    }

    boolean stopRequested() {
        return stopRequested.get();
    }

    CompletableFuture<Campaign> completion() {
        return completion;
    }
}
