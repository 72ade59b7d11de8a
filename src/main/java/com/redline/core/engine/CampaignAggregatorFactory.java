package com.redline.core.engine;

import com.redline.core.config.RedlineProperties;
import com.redline.core.events.EventBus;
import com.redline.core.metrics.RedlineMetrics;
import com.redline.core.persistence.CampaignRepository;
import com.redline.core.review.ReviewEmitter;
import com.redline.core.state.CampaignStateMachine;
import org.springframework.stereotype.Component;

/**
 * Wires a {@link CampaignAggregator} for each new campaign run.
 */
@Component
class CampaignAggregatorFactory {

    private final CampaignRepository repository;
    private final EventBus eventBus;
    private final RedlineMetrics metrics;
    private final ReviewEmitter reviewEmitter;
    private final RedlineProperties properties;

    CampaignAggregatorFactory(CampaignRepository repository, EventBus eventBus, RedlineMetrics metrics,
                              ReviewEmitter reviewEmitter, RedlineProperties properties) {
        this.repository = repository;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.reviewEmitter = reviewEmitter;
        this.properties = properties;
    }

    CampaignAggregator create(CampaignStateMachine stateMachine, Runnable stopDispatch) {
        return new CampaignAggregator(stateMachine, repository, eventBus, metrics, reviewEmitter,
                properties.getExecutor().getMaxConsecutiveErrors(), stopDispatch);
    }
}
