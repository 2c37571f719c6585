package com.auraide.dispatch.api;

import com.auraide.sandbox.model.PortMapping;
import com.auraide.sandbox.model.ResourceSpec;
import com.auraide.sandbox.model.SandboxCreateOptions;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/sandboxes}. {@code provider} pins the sandbox to one backend.
 */
public record CreateSandboxRequest(
    String name,
    String description,
    String template,
    String runtime,
    ResourceSpec resources,
    Map<String, String> environment,
    List<PortMapping> ports,
    Integer timeoutMinutes,
    Boolean persistent,
    Map<String, String> metadata,
    String userId,
    String projectId,
    String provider
) {
    public SandboxCreateOptions toOptions() {
        return SandboxCreateOptions.builder()
                .name(name)
                .description(description)
                .template(template)
                .runtime(runtime)
                .resources(resources)
                .environment(environment)
                .ports(ports)
                .timeoutMinutes(timeoutMinutes)
                .persistent(persistent != null && persistent)
                .metadata(metadata)
                .userId(userId)
                .projectId(projectId)
                .build();
    }
}
