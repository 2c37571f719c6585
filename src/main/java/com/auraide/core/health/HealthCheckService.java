package com.auraide.core.health;

import com.auraide.broadcast.SseFileChangeBroadcaster;
import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.model.ProviderHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates component health: one entry per registered provider, plus the session
 * table and the file-change stream.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SandboxManager sandboxManager;
    private final SseFileChangeBroadcaster broadcaster;

    public HealthCheckService(SandboxManager sandboxManager,
                              @Autowired(required = false) SseFileChangeBroadcaster broadcaster) {
        this.sandboxManager = sandboxManager;
        this.broadcaster = broadcaster;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.addAll(checkProviders());
        results.add(checkSessions());
        results.add(checkFileBroadcast());
        return results;
    }

    /**
     * UP when every component is UP, DOWN when no provider is UP, DEGRADED otherwise.
     */
    public static HealthStatus.Status overall(List<HealthStatus> checks) {
        boolean anyProviderUp = false;
        boolean anyNotUp = false;
        for (HealthStatus check : checks) {
            if (check.status() != HealthStatus.Status.UP) {
                anyNotUp = true;
            } else if (check.component().startsWith("provider:")) {
                anyProviderUp = true;
            }
        }
        if (!anyProviderUp) {
            return HealthStatus.Status.DOWN;
        }
        return anyNotUp ? HealthStatus.Status.DEGRADED : HealthStatus.Status.UP;
    }

    private List<HealthStatus> checkProviders() {
        Map<ProviderType, ProviderHealth> health;
        try {
            health = sandboxManager.healthCheckProviders();
        } catch (RuntimeException e) {
            log.warn("Provider health check failed: {}", e.getMessage());
            return List.of(new HealthStatus("providers", HealthStatus.Status.DOWN,
                    "Health check failed: " + e.getMessage(), Map.of()));
        }
        if (health.isEmpty()) {
            return List.of(new HealthStatus("providers", HealthStatus.Status.DOWN,
                    "No sandbox providers registered", Map.of()));
        }
        var results = new ArrayList<HealthStatus>();
        health.forEach((type, result) -> {
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("latencyMs", Long.toString(result.latencyMs()));
            result.details().forEach((k, v) -> metadata.put(k, String.valueOf(v)));
            results.add(result.healthy()
                    ? new HealthStatus("provider:" + type.wireName(), HealthStatus.Status.UP,
                            "Provider healthy", metadata)
                    : new HealthStatus("provider:" + type.wireName(), HealthStatus.Status.DOWN,
                            result.error(), metadata));
        });
        return results;
    }

    private HealthStatus checkSessions() {
        int active = sandboxManager.activeSessionCount();
        return new HealthStatus("sessions", HealthStatus.Status.UP,
                active + " active session(s)", Map.of("active", Integer.toString(active)));
    }

    private HealthStatus checkFileBroadcast() {
        if (broadcaster == null) {
            return new HealthStatus("fileBroadcast", HealthStatus.Status.DEGRADED,
                    "No file change stream configured", Map.of());
        }
        return new HealthStatus("fileBroadcast", HealthStatus.Status.UP,
                broadcaster.clientCount() + " connected client(s)",
                Map.of("clients", Integer.toString(broadcaster.clientCount())));
    }
}
