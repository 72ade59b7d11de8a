package com.redline.dispatch.api;

import com.redline.core.engine.CampaignEngine;
import com.redline.core.model.AttackCategory;
import com.redline.core.model.Campaign;
import com.redline.core.model.CampaignConfig;
import com.redline.core.scoring.CampaignReport;
import com.redline.core.state.InvalidStateTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for campaign lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/campaigns")
public class CampaignController {

    private static final Logger log = LoggerFactory.getLogger(CampaignController.class);

    private final CampaignEngine campaignEngine;
    private final SseStreamingService sseStreamingService;

    public CampaignController(CampaignEngine campaignEngine, SseStreamingService sseStreamingService) {
        this.campaignEngine = campaignEngine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/campaigns: Create a campaign in pending.
     */
    @PostMapping
    public ResponseEntity<?> createCampaign(@RequestBody CampaignRequest request) {
        if (request.categories() == null || request.categories().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one category is required"));
        }
        var categories = new LinkedHashSet<AttackCategory>();
        try {
            for (String label : request.categories()) {
                categories.add(AttackCategory.fromValue(label));
            }
            var config = new CampaignConfig(request.name(), request.description(), categories,
                    request.target(),
                    request.attacksPerTemplate() != null ? request.attacksPerTemplate() : 1,
                    request.failThresholdPercent());
            Campaign campaign = campaignEngine.createCampaign(config);
            return ResponseEntity.status(HttpStatus.CREATED).body(CampaignResponse.from(campaign));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/campaigns: List campaigns, newest first.
     */
    @GetMapping
    public ResponseEntity<List<CampaignResponse>> listCampaigns() {
        return ResponseEntity.ok(campaignEngine.listCampaigns().stream()
                .map(CampaignResponse::from)
                .toList());
    }

    /**
     * GET /api/v1/campaigns/{id}: Current snapshot, including live totals while running.
     */
    @GetMapping("/{id}")
    public ResponseEntity<CampaignResponse> getCampaign(@PathVariable String id) {
        Optional<Campaign> campaign = campaignEngine.getCampaign(id);
        return campaign.map(c -> ResponseEntity.ok(CampaignResponse.from(c)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/campaigns/{id}/start: Start execution; returns as soon as it is running.
     */
    @PostMapping("/{id}/start")
    public ResponseEntity<Map<String, String>> startCampaign(@PathVariable String id) {
        if (campaignEngine.getCampaign(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        try {
            Campaign started = campaignEngine.startCampaign(id);
            log.info("Campaign {} start accepted", id);
            return ResponseEntity.accepted().body(Map.of(
                    "campaign_id", id,
                    "status", started.status().value()));
        } catch (InvalidStateTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/campaigns/{id}/cancel: Request a cooperative stop.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancelCampaign(@PathVariable String id) {
        if (campaignEngine.getCampaign(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        log.info("Cancelling campaign {}", id);
        try {
            Campaign cancelled = campaignEngine.cancelCampaign(id);
            return ResponseEntity.ok(Map.of(
                    "campaign_id", id,
                    "status", cancelled.status().value()));
        } catch (InvalidStateTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/campaigns/{id}/attacks: Attacks recorded so far, optionally only bypasses.
     */
    @GetMapping("/{id}/attacks")
    public ResponseEntity<List<AttackResponse>> listAttacks(
            @PathVariable String id,
            @RequestParam(name = "successful_only", defaultValue = "false") boolean successfulOnly) {
        if (campaignEngine.getCampaign(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(campaignEngine.listAttacks(id, successfulOnly).stream()
                .map(AttackResponse::from)
                .toList());
    }

    /**
     * GET /api/v1/campaigns/{id}/report: Risk analysis and recommendations.
     */
    @GetMapping("/{id}/report")
    public ResponseEntity<CampaignReport> getReport(@PathVariable String id) {
        if (campaignEngine.getCampaign(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(campaignEngine.report(id));
    }

    /**
     * GET /api/v1/campaigns/{id}/events: SSE stream of campaign progress events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (campaignEngine.getCampaign(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }
}
