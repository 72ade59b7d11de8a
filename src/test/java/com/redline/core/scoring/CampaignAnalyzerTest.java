package com.redline.core.scoring;

import com.redline.core.model.Attack;
import com.redline.core.model.AttackCategory;
import com.redline.core.model.Campaign;
import com.redline.core.model.CampaignConfig;
import com.redline.core.model.RiskLevel;
import com.redline.core.model.Severity;
import com.redline.core.model.Template;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CampaignAnalyzerTest {

    private final CampaignAnalyzer analyzer = new CampaignAnalyzer();

    private final Campaign campaign = Campaign.pending("c-1",
            new CampaignConfig("test", null, Set.of(AttackCategory.JAILBREAK), "model", 1, null), Instant.now());

    private static Attack attack(AttackCategory category, Severity severity) {
        var template = new Template("t-" + category.value(), "T", category, severity, null, "x",
                Map.of(), null, true, false);
        return Attack.dispatched(UUID.randomUUID().toString(), "c-1", template, "model", "x", Map.of());
    }

    private static Attack bypassed(AttackCategory category, Severity severity) {
        return attack(category, severity).scored("ok", true, 0.9, "n", List.of(category.value()), 10);
    }

    private static Attack blocked(AttackCategory category, Severity severity) {
        return attack(category, severity).scored("no", false, 0.2, "n", List.of(), 10);
    }

    @Test
    @DisplayName("no bypasses yields the default recommendation and low risk")
    void allBlocked() {
        CampaignReport report = analyzer.analyze(campaign, List.of(
                blocked(AttackCategory.JAILBREAK, Severity.HIGH),
                blocked(AttackCategory.TOXICITY, Severity.MEDIUM)));

        assertEquals(2, report.totalAttacks());
        assertEquals(0, report.successfulAttacks());
        assertEquals(0.0, report.successRate());
        assertEquals(RiskLevel.LOW, report.riskLevel());
        assertTrue(report.vulnerabilitiesByCategory().isEmpty());
        assertEquals(List.of(CampaignAnalyzer.DEFAULT_RECOMMENDATION), report.recommendations());
    }

    @Test
    @DisplayName("critical bypass leads the recommendations")
    void criticalFirst() {
        CampaignReport report = analyzer.analyze(campaign, List.of(
                bypassed(AttackCategory.DATA_LEAKAGE, Severity.CRITICAL),
                bypassed(AttackCategory.JAILBREAK, Severity.HIGH),
                blocked(AttackCategory.JAILBREAK, Severity.HIGH),
                blocked(AttackCategory.TOXICITY, Severity.MEDIUM)));

        assertEquals(50.0, report.successRate());
        assertEquals(RiskLevel.CRITICAL, report.riskLevel());
        assertEquals(1, report.criticalVulnerabilities());
        assertEquals(1, report.highVulnerabilities());
        assertEquals(Map.of("data-leakage", 1, "jailbreak", 1), report.vulnerabilitiesByCategory());
        assertEquals(CampaignAnalyzer.CRITICAL_RECOMMENDATION, report.recommendations().get(0));
        assertEquals(3, report.recommendations().size());
    }

    @Test
    @DisplayName("errored attacks count toward the total; pending ones do not")
    void erroredAndPending() {
        var attacks = new ArrayList<Attack>();
        attacks.add(bypassed(AttackCategory.TOXICITY, Severity.MEDIUM));
        attacks.add(attack(AttackCategory.TOXICITY, Severity.MEDIUM).errored("boom", 5));
        attacks.add(blocked(AttackCategory.TOXICITY, Severity.MEDIUM));
        attacks.add(blocked(AttackCategory.TOXICITY, Severity.MEDIUM));
        attacks.add(attack(AttackCategory.TOXICITY, Severity.MEDIUM));

        CampaignReport report = analyzer.analyze(campaign, attacks);

        assertEquals(4, report.totalAttacks());
        assertEquals(25.0, report.successRate());
        assertEquals(RiskLevel.HIGH, report.riskLevel());
        assertEquals(0, report.criticalVulnerabilities());
    }

    @Test
    @DisplayName("empty campaign reports zero")
    void empty() {
        CampaignReport report = analyzer.analyze(campaign, List.of());

        assertEquals(0, report.totalAttacks());
        assertEquals(RiskLevel.LOW, report.riskLevel());
        assertEquals("c-1", report.campaignId());
    }
}
