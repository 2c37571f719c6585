package com.auraide.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to serve, health, providers, sandboxes and exec.
 */
@Command(
        name = "aura",
        mixinStandardHelpOptions = true,
        version = "Aura Sandbox 0.1.0",
        description = "Sandbox orchestration for the Aura IDE",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                ProvidersCommand.class,
                SandboxesCommand.class,
                ExecCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AuraCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
