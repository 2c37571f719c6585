package com.auraide.dispatch.cli;

import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.model.SandboxEnvironment;
import com.auraide.sandbox.model.SandboxFilters;
import com.auraide.sandbox.model.SandboxStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: aura sandboxes [--user ID] [--project ID] [--status S] [--provider P]
 */
@Command(name = "sandboxes", mixinStandardHelpOptions = true, description = "List sandboxes")
@Component
public class SandboxesCommand implements Runnable {

    @Option(names = {"--user", "-u"}, description = "Only sandboxes owned by this user")
    private String userId;

    @Option(names = {"--project", "-p"}, description = "Only sandboxes of this project")
    private String projectId;

    @Option(names = {"--status", "-s"}, description = "Only sandboxes in this status (running, stopped, ...)")
    private String status;

    @Option(names = {"--provider"}, description = "Query one provider instead of all")
    private String provider;

    private final SandboxManager sandboxManager;

    public SandboxesCommand(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var filters = new SandboxFilters(userId, projectId,
                status != null ? SandboxStatus.fromWire(status) : null, null);
        ProviderType target = provider != null ? ProviderType.fromWire(provider) : null;

        List<SandboxEnvironment> sandboxes = sandboxManager.listSandboxes(filters, target);
        if (sandboxes.isEmpty()) {
            ConsoleOutput.info("No sandboxes found.");
            return;
        }
        sandboxes.forEach(ConsoleOutput::sandbox);
        ConsoleOutput.info(sandboxes.size() + " sandbox" + (sandboxes.size() != 1 ? "es" : ""));
    }
}
