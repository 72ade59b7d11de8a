package com.redline.core.review;

import com.redline.core.metrics.RedlineMetrics;
import com.redline.core.model.Attack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides which attacks need human review and hands them to the {@link ReviewQueueSink}.
 * An attack qualifies when it bypassed the target and its severity is critical or high.
 */
@Component
public class ReviewEmitter {

    private static final Logger log = LoggerFactory.getLogger(ReviewEmitter.class);

    private final ReviewQueueSink sink;
    private final RedlineMetrics metrics;

    public ReviewEmitter(ReviewQueueSink sink, RedlineMetrics metrics) {
        this.sink = sink;
        this.metrics = metrics;
    }

    public static boolean qualifies(Attack attack) {
        return attack.bypassed() && attack.severity().requiresReview() && attack.reviewItemId() == null;
    }

    /**
     * Emits one review item for a qualifying attack.
     *
     * @return the attack carrying its review back-reference, or empty when it does not qualify
     */
    public Optional<Attack> emit(Attack attack) {
        if (!qualifies(attack)) {
            return Optional.empty();
        }
        List<String> policies = attack.flaggedPolicies().isEmpty()
                ? List.of(attack.category().value())
                : attack.flaggedPolicies();
        var item = new ReviewItem(UUID.randomUUID().toString(), attack.id(), attack.campaignId(),
                policies, attack.severity(), Instant.now());
        try {
            sink.createReviewItem(item);
        } catch (RuntimeException e) {
            log.warn("Review sink rejected item for attack {}: {}", attack.id(), e.getMessage(), e);
        }
        metrics.recordReviewItem(attack.severity());
        return Optional.of(attack.withReviewItem(item.id()));
    }
}
