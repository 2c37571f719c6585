package com.auraide.dispatch.cli;

import com.auraide.sandbox.Capability;
import com.auraide.sandbox.ProviderCapabilities;
import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.model.ProviderInfo;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI command: aura providers
 * <p>
 * Lists registered providers with their capabilities and current load.
 */
@Command(name = "providers", mixinStandardHelpOptions = true, description = "List sandbox providers")
@Component
public class ProvidersCommand implements Runnable {

    private final SandboxManager sandboxManager;

    public ProvidersCommand(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<ProviderType> providers = sandboxManager.getAvailableProviders();
        if (providers.isEmpty()) {
            ConsoleOutput.error("No sandbox providers registered");
            return;
        }

        Map<ProviderType, Integer> loads = sandboxManager.getProviderLoads();
        for (ProviderType type : providers) {
            ProviderInfo info = sandboxManager.getProviderInfo(type);
            ConsoleOutput.success(type.wireName() + " " + info.version() + " (" + info.status().wireName()
                    + ", " + loads.getOrDefault(type, 0) + " active)");
            System.out.println("    capabilities: " + describe(sandboxManager.getProviderCapabilities(type)));
        }
    }

    static String describe(ProviderCapabilities capabilities) {
        List<String> parts = new ArrayList<>();
        for (Capability capability : Capability.values()) {
            if (capabilities.supports(capability)) {
                parts.add(capability.wireName());
            }
        }
        parts.add("runtimes=" + String.join(",", capabilities.supportedRuntimes()));
        return String.join(" ", parts);
    }
}
