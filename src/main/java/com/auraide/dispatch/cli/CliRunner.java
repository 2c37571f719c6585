package com.auraide.dispatch.cli;

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

    private final AuraCommand auraCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AuraCommand auraCommand, IFactory factory) {
        this.auraCommand = auraCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // The embedded web server owns serve mode; picocli would return and let main finish.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(auraCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
