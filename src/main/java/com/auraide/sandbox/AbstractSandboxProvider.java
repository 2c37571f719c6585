package com.auraide.sandbox;

import com.auraide.core.events.EventBus;
import com.auraide.core.events.SandboxEvent;
import com.auraide.core.events.SandboxEventType;
import com.auraide.sandbox.model.SandboxEnvironment;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Event plumbing shared by providers. Each provider owns a private bus so the
 * manager can relay per provider.
 */
public abstract class AbstractSandboxProvider implements SandboxProvider {

    private final EventBus events = new EventBus();

    @Override
    public EventBus.Subscription on(SandboxEventType type, Consumer<SandboxEvent> listener) {
        return events.subscribe(type, listener);
    }

    @Override
    public EventBus.Subscription onAny(Consumer<SandboxEvent> listener) {
        return events.subscribeAll(listener);
    }

    @Override
    public void off(SandboxEventType type, Consumer<SandboxEvent> listener) {
        events.unsubscribe(type, listener);
    }

    protected void emit(SandboxEventType type, SandboxEnvironment environment) {
        emit(type, environment.id(), environment, Map.of());
    }

    protected void emit(SandboxEventType type, String sandboxId, SandboxEnvironment environment,
                        Map<String, Object> payload) {
        events.publish(SandboxEvent.of(type, type(), sandboxId, environment, payload));
    }

    /**
     * Throws unless the provider declares the capability. Used on operations whose
     * signature has no room for a {@link CapabilityResult}.
     */
    protected void requireCapability(Capability capability) {
        if (!capabilities().supports(capability)) {
            throw new UnsupportedOperationException(
                    "Provider '" + type().wireName() + "' does not support " + capability.wireName());
        }
    }

    protected static String normalizeRelativePath(String path) {
        if (path == null || path.isBlank() || ".".equals(path) || "/".equals(path)) {
            return "";
        }
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        for (String segment : normalized.split("/")) {
            if ("..".equals(segment)) {
                throw new IllegalArgumentException("Path escapes the sandbox root: " + path);
            }
        }
        return normalized;
    }
}
