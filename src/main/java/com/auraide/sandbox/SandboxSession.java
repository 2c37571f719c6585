package com.auraide.sandbox;

import java.time.Instant;
import java.util.Map;

/**
 * Manager bookkeeping for one live sandbox. Immutable; touching a session
 * replaces it with a copy carrying the new {@code lastActivity}.
 */
public record SandboxSession(
    String id,
    String sandboxId,
    ProviderType provider,
    String userId,
    String projectId,
    Instant createdAt,
    Instant lastActivity,
    Map<String, String> metadata
) {
    public SandboxSession {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public SandboxSession touchedAt(Instant when) {
        return new SandboxSession(id, sandboxId, provider, userId, projectId, createdAt, when, metadata);
    }
}
