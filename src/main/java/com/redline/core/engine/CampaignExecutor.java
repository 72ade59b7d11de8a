package com.redline.core.engine;

import com.redline.core.config.RedlineProperties;
import com.redline.core.logging.MdcContext;
import com.redline.core.model.Attack;
import com.redline.core.model.Campaign;
import com.redline.core.model.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Drives the attacks of one campaign against the target.
 * <p>
 * At most {@code maxParallel} target calls are in flight, bounded by a semaphore. A permit
 * is returned when the target call has really ended, not when its attack timed out. The stop
 * flag is checked after a permit is acquired and before each dispatch, so nothing new is
 * sent once cancellation or escalation is observed; attacks already in flight finish and
 * are still recorded. Completions are handed to the run's {@link CampaignAggregator}.
 */
@Component
public class CampaignExecutor {

    private static final Logger log = LoggerFactory.getLogger(CampaignExecutor.class);

    private final AttackRunner runner;
    private final int maxParallel;
    private final Duration attackTimeout;

    @Autowired
    public CampaignExecutor(AttackRunner runner, RedlineProperties properties) {
        this(runner, properties.getExecutor().getMaxParallel(),
                Duration.ofSeconds(properties.getExecutor().getAttackTimeoutSeconds()));
    }

    CampaignExecutor(AttackRunner runner, int maxParallel, Duration attackTimeout) {
        this.runner = runner;
        this.maxParallel = Math.max(1, maxParallel);
        this.attackTimeout = attackTimeout;
    }

    /**
     * Runs the planned attacks and finalizes the campaign. Blocks until done; callers run
     * it off the request path.
     */
    void execute(CampaignRun run) {
        String campaignId = run.campaignId();
        String target = run.config().target();
        MdcContext.setCampaign(campaignId);
        log.info("Executing campaign {} against {}: {} attack(s), max {} in flight",
                campaignId, target, run.plan().size(), maxParallel);

        var semaphore = new Semaphore(maxParallel);
        var futures = new ArrayList<CompletableFuture<Void>>();
        ExecutorService workers = Executors.newFixedThreadPool(maxParallel,
                new CustomizableThreadFactory("redline-attack-"));
        try {
            int dispatched = 0;
            for (Template template : run.plan()) {
                semaphore.acquire();
                if (run.stopRequested()) {
                    semaphore.release();
                    log.info("Stop observed for campaign {} after {} of {} dispatch(es)",
                            campaignId, dispatched, run.plan().size());
                    break;
                }
                dispatched++;
                futures.add(CompletableFuture.runAsync(() -> {
                    MdcContext.setCampaign(campaignId);
                    try {
                        Attack attack = runner.run(campaignId, template, target, Map.of(), attackTimeout,
                                run.aggregator()::dispatched, semaphore::release);
                        run.aggregator().record(attack);
                    } finally {
                        MdcContext.clear();
                    }
                }, workers));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.requestStop();
            run.stateMachine().fail("Campaign executor interrupted");
        } catch (CompletionException e) {
            log.error("Unexpected error executing campaign {}: {}", campaignId, e.getMessage(), e);
            run.requestStop();
            run.stateMachine().fail("Executor error: " + e.getCause().getMessage());
        } finally {
            workers.shutdown();
        }

        try {
            Campaign finished = run.aggregator().finish(run.config().failThresholdPercent()).join();
            run.completion().complete(finished);
        } catch (CompletionException e) {
            log.error("Finalization of campaign {} failed: {}", campaignId, e.getMessage(), e);
            run.completion().completeExceptionally(e.getCause());
        } finally {
            MdcContext.clear();
        }
    }
}
