package com.redline.core.metrics;

import com.redline.core.model.AttackCategory;
import com.redline.core.model.AttackOutcome;
import com.redline.core.model.CampaignStatus;
import com.redline.core.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for campaign execution.
 */
@Service
public class RedlineMetrics {

    private final MeterRegistry registry;

    public RedlineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAttack(AttackCategory category, AttackOutcome outcome, long latencyMs) {
        Counter.builder("redline.attacks.total")
                .tag("category", category.value())
                .tag("outcome", outcome.value())
                .register(registry)
                .increment();
        Timer.builder("redline.attack.duration")
                .tag("category", category.value())
                .register(registry)
                .record(Duration.ofMillis(latencyMs));
    }

    public void recordCampaignResult(CampaignStatus status) {
        Counter.builder("redline.campaigns.total")
                .tag("status", status.value())
                .register(registry)
                .increment();
    }

    /**
     * Records the bypass rate of a finished campaign, in percent.
     */
    public void recordSuccessRate(double percent) {
        DistributionSummary.builder("redline.campaign.success_rate")
                .description("Bypass rate of finished campaigns")
                .baseUnit("percent")
                .register(registry)
                .record(percent);
    }

    public void recordReviewItem(Severity severity) {
        Counter.builder("redline.review_items.total")
                .tag("severity", severity.value())
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("redline.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
