package com.auraide.sandbox.model;

import com.auraide.sandbox.ProviderType;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Descriptive snapshot of a provider: version, limits and current usage.
 */
public record ProviderInfo(
    ProviderType type,
    String version,
    Status status,
    Limits limits,
    Usage usage
) {
    public enum Status {
        HEALTHY, DEGRADED, UNAVAILABLE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    /**
     * @param maxFileSize       bytes
     * @param maxExecutionTimeMs longest permitted command run
     */
    public record Limits(int maxSandboxes, int maxConcurrentSessions, long maxFileSize, long maxExecutionTimeMs) {}

    /**
     * @param cpu     cores allocated across active sandboxes
     * @param memory  MB allocated across active sandboxes
     * @param storage MB used on disk
     */
    public record Usage(int activeSandboxes, int totalSandboxes, double cpu, long memory, long storage) {}
}
