package com.redline.dispatch.cli;

import com.redline.core.model.Attack;
import com.redline.core.model.Campaign;
import com.redline.core.scoring.CampaignReport;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Redline CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) REDLINE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [REDLINE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void attack(Attack attack) {
        String verdict = switch (attack.outcome()) {
            case BYPASSED -> "@|fg(red),bold BYPASSED|@";
            case BLOCKED -> "@|fg(green) BLOCKED |@";
            case ERRORED -> "@|fg(yellow) ERRORED |@";
            case PENDING -> "@|fg(white) PENDING |@";
        };
        String detail = attack.errorMessage() != null ? attack.errorMessage() : attack.analysisNotes();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + verdict + " " + attack.templateId() + " [" + attack.severity().value() + "] "
                        + String.format(Locale.ROOT, "%.2f", attack.confidence()) + " - " + detail));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "campaign.created", "campaign.started" -> "@|fg(cyan) [CAMPAIGN]|@";
            case "attack.dispatched" -> "@|fg(blue) [ATTACK]|@";
            case "attack.completed" -> "@|fg(blue),bold [ATTACK]|@";
            case "review.created" -> "@|fg(magenta) [REVIEW]|@";
            case "campaign.cancel_requested", "campaign.cancelled" -> "@|fg(yellow) [CANCELLED]|@";
            case "campaign.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "campaign.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    public static void summary(Campaign campaign) {
        var stats = campaign.statistics();
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Campaign " + campaign.id() + "|@"));
        System.out.println("  Status:  " + campaign.status().value()
                + (campaign.errorMessage() != null ? " (" + campaign.errorMessage() + ")" : ""));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Attacks: " + stats.total() + " of " + campaign.plannedAttacks() + " planned, "
                        + "@|fg(red) " + stats.bypassed() + " bypassed|@, "
                        + "@|fg(green) " + stats.blocked() + " blocked|@, "
                        + "@|fg(yellow) " + stats.errored() + " errored|@"));
        System.out.println(String.format(Locale.ROOT, "  Success rate: %.1f%%", campaign.successRate()));
    }

    public static void report(CampaignReport report) {
        String risk = report.riskLevel().value().toUpperCase(Locale.ROOT);
        String color = switch (report.riskLevel()) {
            case CRITICAL, HIGH -> "fg(red)";
            case MEDIUM -> "fg(yellow)";
            case LOW -> "fg(green)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  Risk level: @|bold," + color + " " + risk + "|@"));
        System.out.println("  Critical: " + report.criticalVulnerabilities()
                + ", high: " + report.highVulnerabilities());
        report.vulnerabilitiesByCategory().forEach((category, count) ->
                System.out.println("    " + category + ": " + count));
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Recommendations|@"));
        for (String recommendation : report.recommendations()) {
            System.out.println("  - " + recommendation);
        }
    }
}
