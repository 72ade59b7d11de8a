package com.redline.core.health;

import com.redline.core.scoring.AttackScorer;
import com.redline.core.target.ChatClientTargetClient;
import com.redline.core.target.TargetClient;
import com.redline.core.template.TemplateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TemplateStore templateStore;
    private final TargetClient targetClient;
    private final AttackScorer scorer;

    public HealthCheckService(
            @Autowired(required = false) TemplateStore templateStore,
            @Autowired(required = false) TargetClient targetClient,
            @Autowired(required = false) AttackScorer scorer) {
        this.templateStore = templateStore;
        this.targetClient = targetClient;
        this.scorer = scorer;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkTemplates());
        results.add(checkTarget());
        results.add(checkScorer());
        return results;
    }

    private HealthStatus checkTemplates() {
        if (templateStore == null) {
            return new HealthStatus("templates", HealthStatus.Status.DOWN,
                    "No template store configured", Map.of());
        }
        try {
            int active = templateStore.findAllActive().size();
            if (active == 0) {
                return new HealthStatus("templates", HealthStatus.Status.DOWN,
                        "No active templates loaded", Map.of());
            }
            return new HealthStatus("templates", HealthStatus.Status.UP,
                    active + " active template(s)", Map.of("active", String.valueOf(active)));
        } catch (RuntimeException e) {
            log.warn("Template health check failed: {}", e.getMessage());
            return new HealthStatus("templates", HealthStatus.Status.DOWN,
                    "Template store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkTarget() {
        if (targetClient == null) {
            return new HealthStatus("target", HealthStatus.Status.DOWN,
                    "No target client configured", Map.of());
        }
        if (targetClient instanceof ChatClientTargetClient chatClient) {
            if ("NOT_SET".equals(chatClient.baseUrl())) {
                return new HealthStatus("target", HealthStatus.Status.DEGRADED,
                        "Target client has no base-url, using provider default", Map.of());
            }
            return new HealthStatus("target", HealthStatus.Status.UP,
                    "OpenAI-compatible endpoint " + chatClient.baseUrl(),
                    Map.of("baseUrl", chatClient.baseUrl()));
        }
        return new HealthStatus("target", HealthStatus.Status.UP,
                "TargetClient available (" + targetClient.getClass().getSimpleName() + ")", Map.of());
    }

    private HealthStatus checkScorer() {
        if (scorer == null) {
            return new HealthStatus("scorer", HealthStatus.Status.DOWN, "No scorer configured", Map.of());
        }
        return new HealthStatus("scorer", HealthStatus.Status.UP,
                scorer.getClass().getSimpleName(), Map.of());
    }
}
