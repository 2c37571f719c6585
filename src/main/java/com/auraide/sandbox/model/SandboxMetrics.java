package com.auraide.sandbox.model;

import java.time.Instant;

/**
 * Point-in-time resource usage. Memory and storage are in MB, network in bytes.
 *
 * @param uptimeSeconds seconds since the sandbox was created
 */
public record SandboxMetrics(
    Cpu cpu,
    Usage memory,
    Usage storage,
    Network network,
    long uptimeSeconds,
    Instant lastUpdated
) {
    public record Cpu(double usage, double limit) {}

    public record Usage(double usage, double limit, double percentage) {
        public static Usage of(double usage, double limit) {
            return new Usage(usage, limit, limit > 0 ? (usage / limit) * 100.0 : 0.0);
        }
    }

    public record Network(long bytesIn, long bytesOut, int connectionsActive) {
        public static Network idle() {
            return new Network(0, 0, 0);
        }
    }
}
