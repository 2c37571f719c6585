package com.auraide.sandbox.model;

import com.auraide.sandbox.ProviderType;

import java.time.Instant;
import java.util.Map;

/**
 * A sandbox as reported by its provider. Identity is {@code id}, unique within the provider.
 */
public record SandboxEnvironment(
    String id,
    String name,
    ProviderType provider,
    SandboxStatus status,
    String template,
    String runtime,
    ResourceSpec resources,
    NetworkInfo network,
    Map<String, String> metadata,
    Instant createdAt,
    Instant lastActivity,
    Instant expiresAt
) {
    public SandboxEnvironment {
        network = network != null ? network : NetworkInfo.empty();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public String metadataValue(String key) {
        return metadata.get(key);
    }
}
