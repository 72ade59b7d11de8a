package com.redline.dispatch.api;

import com.redline.core.engine.CampaignEngine;
import com.redline.core.model.Attack;
import com.redline.core.template.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for single synchronous attacks.
 */
@RestController
@RequestMapping("/api/v1/quick-test")
public class QuickTestController {

    private static final Logger log = LoggerFactory.getLogger(QuickTestController.class);

    private final CampaignEngine campaignEngine;

    public QuickTestController(CampaignEngine campaignEngine) {
        this.campaignEngine = campaignEngine;
    }

    /**
     * POST /api/v1/quick-test: Run one attack and return the scored result.
     */
    @PostMapping
    public ResponseEntity<?> quickTest(@RequestBody QuickTestRequest request) {
        if (request.templateId() == null || request.templateId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "template_id is required"));
        }
        try {
            Attack attack = campaignEngine.runQuickTest(request.templateId(), request.target(), request.variables());
            return ResponseEntity.ok(AttackResponse.from(attack));
        } catch (TemplateException e) {
            log.debug("Quick test rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }
}
