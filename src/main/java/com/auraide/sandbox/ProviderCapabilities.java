package com.auraide.sandbox;

import java.util.List;

/**
 * Static feature declaration of a provider.
 */
public record ProviderCapabilities(
    boolean supportsFileSystem,
    boolean supportsTerminal,
    boolean supportsPortForwarding,
    boolean supportsSnapshots,
    boolean supportsResourceScaling,
    int maxConcurrentSessions,
    List<String> supportedRuntimes
) {
    public ProviderCapabilities {
        supportedRuntimes = supportedRuntimes != null ? List.copyOf(supportedRuntimes) : List.of();
    }

    public boolean supports(Capability capability) {
        return switch (capability) {
            case FILE_SYSTEM -> supportsFileSystem;
            case TERMINAL -> supportsTerminal;
            case PORT_FORWARDING -> supportsPortForwarding;
            case SNAPSHOTS -> supportsSnapshots;
            case RESOURCE_SCALING -> supportsResourceScaling;
        };
    }

    public boolean supportsRuntime(String runtime) {
        return runtime == null || supportedRuntimes.contains(runtime);
    }
}
