package com.redline.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Redline.
 */
@Command(
        name = "redline",
        mixinStandardHelpOptions = true,
        version = "Redline 0.1.0",
        description = "Red-team campaign runner for language models",
        subcommands = {
                CampaignCommand.class,
                QuickTestCommand.class,
                TemplatesCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RedlineCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
