package com.redline.dispatch.cli;

import com.redline.core.engine.CampaignEngine;
import com.redline.core.model.Attack;
import com.redline.core.template.TemplateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: redline quick-test &lt;templateId&gt; [--var NAME=VALUE]...
 */
@Command(name = "quick-test", mixinStandardHelpOptions = true,
        description = "Send one attack from a template and print the scored result")
@Component
public class QuickTestCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Template id")
    private String templateId;

    @Option(names = {"--target", "-t"}, description = "Target model name")
    private String target;

    @Option(names = "--var", description = "Placeholder override, NAME=VALUE (repeatable)")
    private Map<String, String> variables = new LinkedHashMap<>();

    private final CampaignEngine campaignEngine;

    public QuickTestCommand(CampaignEngine campaignEngine) {
        this.campaignEngine = campaignEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Attack attack;
        try {
            attack = campaignEngine.runQuickTest(templateId, target, variables);
        } catch (TemplateException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        System.out.println("Prompt:");
        System.out.println("  " + attack.prompt());
        if (attack.response() != null) {
            System.out.println("Response:");
            System.out.println("  " + attack.response());
        }
        ConsoleOutput.attack(attack);
        if (!attack.flaggedPolicies().isEmpty()) {
            ConsoleOutput.info("Flagged policies: " + String.join(", ", attack.flaggedPolicies()));
        }
        if (attack.reviewItemId() != null) {
            ConsoleOutput.info("Queued for review: " + attack.reviewItemId());
        }
        return attack.bypassed() ? 1 : 0;
    }
}
