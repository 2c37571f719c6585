package com.auraide.sandbox.model;

import java.util.List;
import java.util.Map;

/**
 * Parameters for creating a sandbox. The provider override is passed separately
 * to {@code SandboxManager#createSandbox}.
 */
public record SandboxCreateOptions(
    String name,
    String description,
    String template,
    String runtime,
    ResourceSpec resources,
    Map<String, String> environment,
    List<PortMapping> ports,
    Integer timeoutMinutes,
    boolean persistent,
    Map<String, String> metadata,
    String userId,
    String projectId
) {
    public SandboxCreateOptions {
        environment = environment != null ? Map.copyOf(environment) : Map.of();
        ports = ports != null ? List.copyOf(ports) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private String template;
        private String runtime;
        private ResourceSpec resources;
        private Map<String, String> environment = Map.of();
        private List<PortMapping> ports = List.of();
        private Integer timeoutMinutes;
        private boolean persistent;
        private Map<String, String> metadata = Map.of();
        private String userId;
        private String projectId;

        private Builder() {}

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder template(String template) { this.template = template; return this; }
        public Builder runtime(String runtime) { this.runtime = runtime; return this; }
        public Builder resources(ResourceSpec resources) { this.resources = resources; return this; }
        public Builder environment(Map<String, String> environment) { this.environment = environment; return this; }
        public Builder ports(List<PortMapping> ports) { this.ports = ports; return this; }
        public Builder timeoutMinutes(Integer timeoutMinutes) { this.timeoutMinutes = timeoutMinutes; return this; }
        public Builder persistent(boolean persistent) { this.persistent = persistent; return this; }
        public Builder metadata(Map<String, String> metadata) { this.metadata = metadata; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder projectId(String projectId) { this.projectId = projectId; return this; }

        public SandboxCreateOptions build() {
            return new SandboxCreateOptions(name, description, template, runtime, resources, environment,
                    ports, timeoutMinutes, persistent, metadata, userId, projectId);
        }
    }
}
