package com.redline.core.engine;

import com.redline.core.logging.MdcContext;
import com.redline.core.metrics.RedlineMetrics;
import com.redline.core.model.Attack;
import com.redline.core.model.Template;
import com.redline.core.scoring.AttackScorer;
import com.redline.core.scoring.ScoreResult;
import com.redline.core.scoring.ScoringRequest;
import com.redline.core.target.AttackTimeoutException;
import com.redline.core.target.TargetClient;
import com.redline.core.target.TargetUnavailableException;
import com.redline.core.template.InstantiatedPrompt;
import com.redline.core.template.TemplateException;
import com.redline.core.template.TemplateInstantiator;
import com.redline.core.template.ValidationException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs a single attack end to end: instantiate, send, score.
 * <p>
 * Used by both the campaign executor and the quick-test path. Never throws for a
 * per-attack failure; instantiation errors, target errors and timeouts come back as an
 * {@link com.redline.core.model.AttackOutcome#ERRORED} attack.
 * <p>
 * A timed-out attack returns as soon as its budget runs out, but the target call itself
 * is only interrupted, not abandoned: the {@code onCallSettled} hook fires once that call
 * has actually returned. Callers that bound concurrency hold their slot until then. The
 * call pool grows only as far as callers let calls overlap.
 */
@Component
public class AttackRunner {

    private static final Logger log = LoggerFactory.getLogger(AttackRunner.class);

    private final TemplateInstantiator instantiator;
    private final TargetClient targetClient;
    private final AttackScorer scorer;
    private final RedlineMetrics metrics;
    private final ExecutorService callPool =
            Executors.newCachedThreadPool(new CustomizableThreadFactory("redline-target-"));

    public AttackRunner(TemplateInstantiator instantiator, TargetClient targetClient,
                        AttackScorer scorer, RedlineMetrics metrics) {
        this.instantiator = instantiator;
        this.targetClient = targetClient;
        this.scorer = scorer;
        this.metrics = metrics;
    }

    /**
     * @param campaignId   owning campaign; null for quick tests
     * @param template     template to instantiate
     * @param target       target identifier
     * @param overrides    caller-supplied placeholder values; nullable
     * @param timeout      time budget for the target call
     * @param onDispatched called with the pending attack just before the target is called
     * @return the attack in a terminal state
     */
    public Attack run(String campaignId, Template template, String target, Map<String, String> overrides,
                      Duration timeout, Consumer<Attack> onDispatched) {
        return run(campaignId, template, target, overrides, timeout, onDispatched, () -> {});
    }

    /**
     * Same as {@link #run(String, Template, String, Map, Duration, Consumer)}, and runs
     * {@code onCallSettled} exactly once when no target call of this attack is in flight
     * any more. That can be after this method returns if the call timed out.
     */
    public Attack run(String campaignId, Template template, String target, Map<String, String> overrides,
                      Duration timeout, Consumer<Attack> onDispatched, Runnable onCallSettled) {
        String attackId = UUID.randomUUID().toString();
        Runnable settle = once(onCallSettled);
        boolean sent = false;
        MdcContext.setAttack(campaignId, attackId, template.id());
        try {
            InstantiatedPrompt instantiated;
            try {
                instantiated = instantiator.instantiate(template, overrides);
            } catch (ValidationException | TemplateException e) {
                log.warn("Could not instantiate template {}: {}", template.id(), e.getMessage());
                Attack failed = Attack.dispatched(attackId, campaignId, template, target, "", Map.of())
                        .errored("Instantiation failed: " + e.getMessage(), 0L);
                metrics.recordAttack(failed.category(), failed.outcome(), 0L);
                return failed;
            }

            Attack pending = Attack.dispatched(attackId, campaignId, template, target,
                    instantiated.prompt(), instantiated.variableValues());
            if (onDispatched != null) {
                onDispatched.accept(pending);
            }

            long start = System.currentTimeMillis();
            Attack result;
            try {
                sent = true;
                String response = send(instantiated.prompt(), target, timeout, settle);
                long latency = System.currentTimeMillis() - start;
                ScoreResult score = scorer.score(new ScoringRequest(template.category(),
                        instantiated.prompt(), response, instantiated.plainPayloads()));
                result = pending.scored(response, score.bypassed(), score.confidence(),
                        score.analysis().summary(), score.flaggedPolicies(), latency);
                log.info("Attack {} on {} {} (confidence {})", attackId, template.id(),
                        result.bypassed() ? "BYPASSED" : "blocked", score.confidence());
            } catch (TargetUnavailableException | AttackTimeoutException e) {
                result = pending.errored(e.getMessage(), System.currentTimeMillis() - start);
                log.warn("Attack {} on {} errored: {}", attackId, template.id(), e.getMessage());
            } catch (RuntimeException e) {
                result = pending.errored("Unexpected error: " + e.getMessage(), System.currentTimeMillis() - start);
                log.warn("Attack {} on {} errored unexpectedly: {}", attackId, template.id(), e.getMessage(), e);
            }
            metrics.recordAttack(result.category(), result.outcome(), result.latencyMs());
            return result;
        } finally {
            MdcContext.clearAttack();
            if (!sent) {
                settle.run();
            }
        }
    }

    /**
     * Runs the call on the call pool. {@code settle} runs on the pool thread when the call
     * ends, however late, or right away if the pool refuses the call.
     */
    private String send(String prompt, String target, Duration timeout, Runnable settle) {
        var call = new CompletableFuture<String>();
        var caller = new AtomicReference<Thread>();
        try {
            callPool.execute(() -> {
                caller.set(Thread.currentThread());
                try {
                    call.complete(targetClient.send(prompt, target));
                } catch (Exception e) {
                    call.completeExceptionally(e);
                } finally {
                    caller.set(null);
                    Thread.interrupted();
                    settle.run();
                }
            });
        } catch (RejectedExecutionException e) {
            settle.run();
            throw new TargetUnavailableException("Target call rejected: runner is shutting down");
        }
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            interrupt(caller);
            throw new AttackTimeoutException(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupt(caller);
            throw new TargetUnavailableException("Interrupted while waiting for target");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TargetUnavailableException unavailable) {
                throw unavailable;
            }
            throw new TargetUnavailableException("Target call failed: " + cause.getMessage(), cause);
        }
    }

    private static void interrupt(AtomicReference<Thread> caller) {
        Thread thread = caller.get();
        if (thread != null) {
            thread.interrupt();
        }
    }

    private static Runnable once(Runnable action) {
        var done = new AtomicBoolean();
        return () -> {
            if (action != null && done.compareAndSet(false, true)) {
                action.run();
            }
        };
    }

    @PreDestroy
    public void shutdown() {
        callPool.shutdownNow();
    }
}
