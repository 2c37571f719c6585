package com.auraide.sandbox.model;

import java.util.Map;

/**
 * @param latencyMs round-trip time of the check
 * @param error     failure message when unhealthy
 */
public record ProviderHealth(boolean healthy, long latencyMs, String error, Map<String, Object> details) {

    public ProviderHealth {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static ProviderHealth healthy(long latencyMs, Map<String, Object> details) {
        return new ProviderHealth(true, latencyMs, null, details);
    }

    public static ProviderHealth unhealthy(long latencyMs, String error) {
        return new ProviderHealth(false, latencyMs, error != null ? error : "unknown error", Map.of());
    }
}
