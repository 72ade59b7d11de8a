package com.redline.dispatch.cli;

import com.redline.core.engine.CampaignEngine;
import com.redline.core.events.EventBus;
import com.redline.core.model.AttackCategory;
import com.redline.core.model.Campaign;
import com.redline.core.model.CampaignConfig;
import com.redline.core.model.CampaignStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: redline campaign --category jailbreak --category toxicity
 * <p>
 * Creates and runs a campaign in-process, streams progress as it goes and prints the
 * risk report. Exit code 1 when the campaign does not complete, so the command can gate
 * a build on the fail threshold.
 */
@Command(name = "campaign", mixinStandardHelpOptions = true, description = "Run a red-team campaign")
@Component
public class CampaignCommand implements Callable<Integer> {

    @Option(names = {"--category", "-c"}, required = true,
            description = "Attack category (repeatable): jailbreak, prompt-injection, toxicity, data-leakage, obfuscation")
    private List<String> categories;

    @Option(names = {"--target", "-t"}, description = "Target model name (defaults to redline.executor.default-target)")
    private String target;

    @Option(names = {"--name", "-n"}, description = "Campaign name")
    private String name;

    @Option(names = {"--attacks-per-template", "-a"}, defaultValue = "1",
            description = "Instantiations per template (default: ${DEFAULT-VALUE})")
    private int attacksPerTemplate;

    @Option(names = {"--fail-threshold", "-f"},
            description = "Fail when the success rate (percent) reaches this value")
    private Double failThreshold;

    @Option(names = "--timeout-minutes", defaultValue = "60",
            description = "Give up waiting after this many minutes (default: ${DEFAULT-VALUE})")
    private long timeoutMinutes;

    @Option(names = "--verbose", description = "Print every event, not just completed attacks")
    private boolean verbose;

    private final CampaignEngine campaignEngine;
    private final EventBus eventBus;

    public CampaignCommand(CampaignEngine campaignEngine, EventBus eventBus) {
        this.campaignEngine = campaignEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var selected = new LinkedHashSet<AttackCategory>();
        Campaign campaign;
        try {
            for (String label : categories) {
                selected.add(AttackCategory.fromValue(label));
            }
            campaign = campaignEngine.createCampaign(
                    new CampaignConfig(name, null, selected, target, attacksPerTemplate, failThreshold));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        ConsoleOutput.info("Campaign " + campaign.id() + " targeting " + campaign.config().target());
        EventBus.Subscription subscription = eventBus.subscribe(campaign.id(), event -> {
            if (verbose || !"attack.dispatched".equals(event.eventType())) {
                ConsoleOutput.watchEvent(event.eventType(), event.payload().toString());
            }
        });

        Campaign finished;
        try {
            campaignEngine.startCampaign(campaign.id());
            finished = campaignEngine.awaitCompletion(campaign.id(), Duration.ofMinutes(timeoutMinutes));
        } catch (TimeoutException e) {
            ConsoleOutput.error("Campaign still running after " + timeoutMinutes + " minute(s), cancelling");
            campaignEngine.cancelCampaign(campaign.id());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted");
            return 1;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.summary(finished);
        ConsoleOutput.report(campaignEngine.report(finished.id()));
        campaignEngine.listAttacks(finished.id(), true).forEach(ConsoleOutput::attack);

        if (finished.status() == CampaignStatus.COMPLETED) {
            ConsoleOutput.success("Campaign complete.");
            return 0;
        }
        ConsoleOutput.error("Campaign " + finished.status().value() + ".");
        return 1;
    }
}
