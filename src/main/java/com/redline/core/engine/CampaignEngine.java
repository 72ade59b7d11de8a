package com.redline.core.engine;

import com.redline.core.config.RedlineProperties;
import com.redline.core.events.EventBus;
import com.redline.core.events.RedlineEvent;
import com.redline.core.logging.MdcContext;
import com.redline.core.model.Attack;
import com.redline.core.model.AttackCategory;
import com.redline.core.model.Campaign;
import com.redline.core.model.CampaignConfig;
import com.redline.core.model.Template;
import com.redline.core.persistence.CampaignRepository;
import com.redline.core.review.ReviewEmitter;
import com.redline.core.scoring.CampaignAnalyzer;
import com.redline.core.scoring.CampaignReport;
import com.redline.core.state.InvalidStateTransitionException;
import com.redline.core.template.TemplateException;
import com.redline.core.template.TemplateStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for campaign execution: create, start, cancel, quick test and read access.
 * <p>
 * {@link #startCampaign(String)} returns as soon as the campaign is running; the attacks
 * themselves run on a background pool. Campaigns are fully independent of each other.
 */
@Service
public class CampaignEngine {

    private static final Logger log = LoggerFactory.getLogger(CampaignEngine.class);

    static final String NO_TEMPLATES_MESSAGE = "No templates found for selected categories";

    private final TemplateStore templateStore;
    private final CampaignExecutor executor;
    private final AttackRunner runner;
    private final CampaignAggregatorFactory aggregators;
    private final CampaignRepository repository;
    private final ReviewEmitter reviewEmitter;
    private final CampaignAnalyzer analyzer;
    private final EventBus eventBus;
    private final RedlineProperties properties;

    private final ConcurrentHashMap<String, CampaignRun> runs = new ConcurrentHashMap<>();
    private final ExecutorService campaignPool =
            Executors.newCachedThreadPool(new CustomizableThreadFactory("redline-campaign-"));

    public CampaignEngine(TemplateStore templateStore, CampaignExecutor executor, AttackRunner runner,
                          CampaignAggregatorFactory aggregators, CampaignRepository repository,
                          ReviewEmitter reviewEmitter, CampaignAnalyzer analyzer, EventBus eventBus,
                          RedlineProperties properties) {
        this.templateStore = templateStore;
        this.executor = executor;
        this.runner = runner;
        this.aggregators = aggregators;
        this.repository = repository;
        this.reviewEmitter = reviewEmitter;
        this.analyzer = analyzer;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    /**
     * Registers a new campaign in {@code pending}.
     *
     * @throws IllegalArgumentException if the configuration is unusable
     */
    public Campaign createCampaign(CampaignConfig config) {
        CampaignConfig effective = normalize(config);
        Campaign campaign = Campaign.pending(UUID.randomUUID().toString(), effective, Instant.now());
        repository.saveCampaign(campaign);
        runs.put(campaign.id(), new CampaignRun(campaign, aggregators));

        MdcContext.setCampaign(campaign.id());
        try {
            log.info("Created campaign {} '{}' targeting {} with categories {}", campaign.id(),
                    effective.name(), effective.target(), effective.categories());
            eventBus.publish(RedlineEvent.of("campaign.created", campaign.id(), null,
                    Map.of("name", effective.name(), "target", effective.target())));
        } finally {
            MdcContext.clear();
        }
        return campaign;
    }

    /**
     * Moves the campaign to {@code running} and hands execution to the background pool.
     * A campaign whose categories match no active template fails immediately.
     *
     * @throws CampaignNotFoundException       if no such campaign exists
     * @throws InvalidStateTransitionException if the campaign was already started
     */
    public Campaign startCampaign(String campaignId) {
        CampaignRun run = requireRun(campaignId);
        List<Template> plan = buildPlan(run.config());

        MdcContext.setCampaign(campaignId);
        try {
            Campaign started = run.stateMachine().start(plan.size());
            run.plan(plan);
            repository.saveCampaign(started);
            eventBus.publish(RedlineEvent.of("campaign.started", campaignId, null,
                    Map.of("plannedAttacks", plan.size())));

            if (plan.isEmpty()) {
                log.warn("Campaign {} has nothing to run: {}", campaignId, NO_TEMPLATES_MESSAGE);
                run.stateMachine().fail(NO_TEMPLATES_MESSAGE);
                run.completion().complete(run.aggregator().finish(run.config().failThresholdPercent()).join());
                return run.stateMachine().snapshot();
            }

            campaignPool.execute(() -> executor.execute(run));
            return started;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Requests a cooperative stop. Attacks already in flight still finish and are recorded.
     *
     * @throws InvalidStateTransitionException unless the campaign is running
     */
    public Campaign cancelCampaign(String campaignId) {
        CampaignRun run = requireRun(campaignId);
        Campaign cancelled = run.stateMachine().cancel();
        run.requestStop();
        run.aggregator().snapshotChanged();
        eventBus.publish(RedlineEvent.of("campaign.cancel_requested", campaignId, null, Map.of()));
        return cancelled;
    }

    /**
     * Runs one attack synchronously without touching any campaign.
     *
     * @throws TemplateException if the template does not exist
     */
    public Attack runQuickTest(String templateId, String target, Map<String, String> overrides) {
        Template template = templateStore.findById(templateId)
                .orElseThrow(() -> new TemplateException("Template not found: " + templateId));
        String effectiveTarget = target == null || target.isBlank()
                ? properties.getExecutor().getDefaultTarget() : target;
        Duration timeout = Duration.ofSeconds(properties.getExecutor().getAttackTimeoutSeconds());

        log.info("Quick test of template {} against {}", templateId, effectiveTarget);
        Attack attack = runner.run(null, template, effectiveTarget, overrides, timeout, pending ->
                eventBus.publish(RedlineEvent.of("attack.dispatched", null, pending.id(),
                        Map.of("templateId", templateId, "category", template.category().value()))));
        return reviewEmitter.emit(attack).orElse(attack);
    }

    public Optional<Campaign> getCampaign(String campaignId) {
        CampaignRun run = runs.get(campaignId);
        if (run != null) {
            return Optional.of(run.stateMachine().snapshot());
        }
        return repository.findCampaign(campaignId);
    }

    public List<Campaign> listCampaigns() {
        return repository.findAllCampaigns().stream()
                .map(c -> getCampaign(c.id()).orElse(c))
                .toList();
    }

    public List<Attack> listAttacks(String campaignId, boolean successfulOnly) {
        requireCampaign(campaignId);
        return repository.findAttacks(campaignId).stream()
                .filter(a -> !successfulOnly || a.bypassed())
                .toList();
    }

    public CampaignReport report(String campaignId) {
        Campaign campaign = requireCampaign(campaignId);
        return analyzer.analyze(campaign, repository.findAttacks(campaignId));
    }

    /**
     * Blocks until the campaign reaches a terminal status.
     *
     * @throws TimeoutException if it is still running after {@code timeout}
     */
    public Campaign awaitCompletion(String campaignId, Duration timeout)
            throws InterruptedException, TimeoutException {
        CampaignRun run = requireRun(campaignId);
        try {
            return run.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            log.error("Campaign {} did not finalize cleanly: {}", campaignId, e.getCause().getMessage());
            return run.stateMachine().snapshot();
        }
    }

    @PreDestroy
    public void shutdown() {
        runs.values().forEach(CampaignRun::requestStop);
        campaignPool.shutdown();
    }

    List<Template> buildPlan(CampaignConfig config) {
        var plan = new ArrayList<Template>();
        List<Template> templates = templateStore.findByCategories(config.categories()).stream()
                .sorted(Comparator.comparing((Template t) -> t.category().ordinal()).thenComparing(Template::id))
                .toList();
        for (Template template : templates) {
            for (int i = 0; i < config.attacksPerTemplate(); i++) {
                plan.add(template);
            }
        }
        return plan;
    }

    private CampaignConfig normalize(CampaignConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Campaign configuration is required");
        }
        if (config.categories().isEmpty()) {
            throw new IllegalArgumentException("At least one attack category is required");
        }
        if (config.attacksPerTemplate() < 1) {
            throw new IllegalArgumentException("attacks_per_template must be at least 1");
        }
        Double threshold = config.failThresholdPercent();
        if (threshold != null && (threshold < 0 || threshold > 100)) {
            throw new IllegalArgumentException("fail_threshold_percent must be between 0 and 100");
        }
        String name = config.name() == null || config.name().isBlank()
                ? "campaign-" + String.join("-", categoryValues(config)) : config.name();
        String target = config.target() == null || config.target().isBlank()
                ? properties.getExecutor().getDefaultTarget() : config.target();
        return new CampaignConfig(name, config.description(), config.categories(), target,
                config.attacksPerTemplate(), threshold);
    }

    private static List<String> categoryValues(CampaignConfig config) {
        return Arrays.stream(AttackCategory.values())
                .filter(config.categories()::contains)
                .map(AttackCategory::value)
                .toList();
    }

    private CampaignRun requireRun(String campaignId) {
        CampaignRun run = runs.get(campaignId);
        if (run == null) {
            throw new CampaignNotFoundException(campaignId);
        }
        return run;
    }

    private Campaign requireCampaign(String campaignId) {
        return getCampaign(campaignId).orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }
}
