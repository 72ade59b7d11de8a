package com.redline.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final RedlineCommand redlineCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(RedlineCommand redlineCommand, IFactory factory) {
        this.redlineCommand = redlineCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // serve mode: the embedded web server owns the process
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(redlineCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
