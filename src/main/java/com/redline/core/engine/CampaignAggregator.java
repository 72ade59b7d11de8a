package com.redline.core.engine;

import com.redline.core.events.EventBus;
import com.redline.core.events.RedlineEvent;
import com.redline.core.logging.MdcContext;
import com.redline.core.metrics.RedlineMetrics;
import com.redline.core.model.Attack;
import com.redline.core.model.AttackOutcome;
import com.redline.core.model.Campaign;
import com.redline.core.model.CampaignStatistics;
import com.redline.core.persistence.CampaignRepository;
import com.redline.core.persistence.PersistenceException;
import com.redline.core.review.ReviewEmitter;
import com.redline.core.state.CampaignStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single writer for a campaign's aggregate state.
 * <p>
 * Every mutation (dispatch, completion, cancellation snapshot, finalization) is queued on
 * one thread, so completions arriving from parallel workers are applied strictly one at a
 * time and in arrival order. Also tracks the consecutive-error streak and escalates the
 * campaign to failed when the target looks unreachable.
 */
class CampaignAggregator {

    private static final Logger log = LoggerFactory.getLogger(CampaignAggregator.class);

    private final CampaignStateMachine stateMachine;
    private final CampaignRepository repository;
    private final EventBus eventBus;
    private final RedlineMetrics metrics;
    private final ReviewEmitter reviewEmitter;
    private final int maxConsecutiveErrors;
    private final Runnable stopDispatch;
    private final ExecutorService actor;

    // confined to the actor thread
    private final List<Attack> recorded = new ArrayList<>();
    private int errorStreak;

    CampaignAggregator(CampaignStateMachine stateMachine, CampaignRepository repository, EventBus eventBus,
                       RedlineMetrics metrics, ReviewEmitter reviewEmitter, int maxConsecutiveErrors,
                       Runnable stopDispatch) {
        this.stateMachine = stateMachine;
        this.repository = repository;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.reviewEmitter = reviewEmitter;
        this.maxConsecutiveErrors = maxConsecutiveErrors;
        this.stopDispatch = stopDispatch;
        this.actor = Executors.newSingleThreadExecutor(
                new CustomizableThreadFactory("redline-aggregator-" + shortId(stateMachine.snapshot().id()) + "-"));
    }

    /** Persists the pending attack and announces it. */
    void dispatched(Attack pending) {
        submit(() -> {
            try {
                repository.saveAttack(pending);
            } catch (PersistenceException e) {
                escalate("persistence", "Persistence failure: " + e.getMessage());
                return;
            }
            eventBus.publish(RedlineEvent.of("attack.dispatched", pending.campaignId(), pending.id(),
                    Map.of("templateId", pending.templateId(), "category", pending.category().value())));
        });
    }

    /** Records one terminal attack. */
    void record(Attack attack) {
        submit(() -> apply(attack));
    }

    /** Persists the current snapshot, e.g. after a cancellation. */
    void snapshotChanged() {
        submit(() -> {
            try {
                repository.saveCampaign(stateMachine.snapshot());
            } catch (PersistenceException e) {
                log.error("Could not persist campaign snapshot: {}", e.getMessage(), e);
            }
        });
    }

    /**
     * Finalizes the campaign once every earlier queued mutation has been applied, then
     * stops the actor.
     */
    CompletableFuture<Campaign> finish(Double failThresholdPercent) {
        CompletableFuture<Campaign> done = CompletableFuture.supplyAsync(() -> {
            MdcContext.setCampaign(stateMachine.snapshot().id());
            try {
                return finalizeRun(failThresholdPercent);
            } finally {
                MdcContext.clear();
            }
        }, actor);
        actor.shutdown();
        return done;
    }

    private void apply(Attack attack) {
        try {
            repository.saveAttack(attack);
            recorded.add(attack);
            Campaign snapshot = stateMachine.record(attack.outcome());
            repository.saveCampaign(snapshot);
            eventBus.publish(RedlineEvent.of("attack.completed", attack.campaignId(), attack.id(),
                    completionPayload(attack, snapshot.statistics())));
        } catch (PersistenceException e) {
            escalate("persistence", "Persistence failure: " + e.getMessage());
            return;
        }

        if (attack.outcome() == AttackOutcome.ERRORED) {
            errorStreak++;
            if (maxConsecutiveErrors > 0 && errorStreak == maxConsecutiveErrors) {
                escalate("consecutive_errors", "Target unavailable: " + errorStreak
                        + " consecutive attacks errored (last: " + attack.errorMessage() + ")");
            }
        } else {
            errorStreak = 0;
        }
    }

    private void escalate(String reason, String message) {
        log.error("Escalating campaign {}: {}", stateMachine.snapshot().id(), message);
        stopDispatch.run();
        Campaign failed = stateMachine.fail(message);
        metrics.incrementEscalations(reason);
        try {
            repository.saveCampaign(failed);
        } catch (PersistenceException e) {
            log.error("Could not persist failed campaign: {}", e.getMessage(), e);
        }
    }

    private Campaign finalizeRun(Double failThresholdPercent) {
        Campaign finished = stateMachine.finish(failThresholdPercent);
        int reviews = 0;
        for (Attack attack : recorded) {
            var withReview = reviewEmitter.emit(attack);
            if (withReview.isPresent()) {
                reviews++;
                try {
                    repository.saveAttack(withReview.get());
                } catch (PersistenceException e) {
                    log.error("Could not persist review reference for attack {}: {}", attack.id(), e.getMessage());
                }
            }
        }
        try {
            repository.saveCampaign(finished);
        } catch (PersistenceException e) {
            log.error("Could not persist final campaign state: {}", e.getMessage(), e);
        }

        metrics.recordCampaignResult(finished.status());
        metrics.recordSuccessRate(finished.successRate());
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", finished.status().value());
        payload.put("totalAttacks", finished.statistics().total());
        payload.put("successRate", finished.successRate());
        payload.put("reviewItems", reviews);
        if (finished.errorMessage() != null) {
            payload.put("error", finished.errorMessage());
        }
        eventBus.publish(RedlineEvent.of("campaign." + finished.status().value(), finished.id(), null, payload));
        return finished;
    }

    private static Map<String, Object> completionPayload(Attack attack, CampaignStatistics stats) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("templateId", attack.templateId());
        payload.put("outcome", attack.outcome().value());
        payload.put("confidence", attack.confidence());
        payload.put("completed", stats.total());
        payload.put("bypassed", stats.bypassed());
        payload.put("blocked", stats.blocked());
        payload.put("errored", stats.errored());
        return payload;
    }

    private void submit(Runnable work) {
        try {
            actor.execute(() -> {
                MdcContext.setCampaign(stateMachine.snapshot().id());
                try {
                    work.run();
                } finally {
                    MdcContext.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            // finalization already ran and persisted the terminal snapshot
            log.debug("Aggregator for campaign {} closed, dropping late update", stateMachine.snapshot().id());
        }
    }

    private static String shortId(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
