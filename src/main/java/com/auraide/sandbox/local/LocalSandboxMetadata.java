package com.auraide.sandbox.local;

import com.auraide.sandbox.model.PortMapping;
import com.auraide.sandbox.model.ResourceSpec;
import com.auraide.sandbox.model.SandboxStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Contents of the {@code .sandbox-metadata.json} sidecar kept in each sandbox directory.
 * Updates produce a new instance.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record LocalSandboxMetadata(
    String id,
    String name,
    String path,
    SandboxStatus status,
    String template,
    String runtime,
    ResourceSpec resources,
    List<PortMapping> ports,
    Map<String, String> environment,
    Map<String, String> metadata,
    Integer timeoutMinutes,
    Instant createdAt,
    Instant lastActivity
) {
    LocalSandboxMetadata {
        ports = ports != null ? List.copyOf(ports) : List.of();
        environment = environment != null ? Map.copyOf(environment) : Map.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    LocalSandboxMetadata withStatus(SandboxStatus newStatus, Instant when) {
        return new LocalSandboxMetadata(id, name, path, newStatus, template, runtime, resources, ports,
                environment, metadata, timeoutMinutes, createdAt, when);
    }

    LocalSandboxMetadata withLastActivity(Instant when) {
        return withStatus(status, when);
    }

    LocalSandboxMetadata withUpdates(List<PortMapping> newPorts, Map<String, String> newEnvironment,
                                     Map<String, String> newMetadata, Integer newTimeout, Instant when) {
        return new LocalSandboxMetadata(id, name, path, status, template, runtime, resources,
                newPorts != null ? newPorts : ports,
                newEnvironment != null ? newEnvironment : environment,
                newMetadata != null ? newMetadata : metadata,
                newTimeout != null ? newTimeout : timeoutMinutes,
                createdAt, when);
    }
}
