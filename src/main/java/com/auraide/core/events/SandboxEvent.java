package com.auraide.core.events;

import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.model.SandboxEnvironment;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by a provider or by the manager itself.
 *
 * @param type        event channel
 * @param provider    provider the sandbox lives on (nullable for manager-level events)
 * @param sandboxId   sandbox the event relates to (nullable for provider-level events)
 * @param environment snapshot of the sandbox at emission time, when the emitter had one
 * @param payload     additional event data
 * @param timestamp   when the event occurred
 */
public record SandboxEvent(
    SandboxEventType type,
    ProviderType provider,
    String sandboxId,
    SandboxEnvironment environment,
    Map<String, Object> payload,
    Instant timestamp
) {
    public SandboxEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static SandboxEvent of(SandboxEventType type, ProviderType provider, String sandboxId,
                                  SandboxEnvironment environment, Map<String, Object> payload) {
        return new SandboxEvent(type, provider, sandboxId, environment, payload, Instant.now());
    }
}
