package com.auraide.sandbox.model;

import java.util.List;
import java.util.Map;

/**
 * Partial update; null fields are left unchanged.
 */
public record SandboxUpdateOptions(
    ResourceSpec resources,
    Map<String, String> environment,
    List<PortMapping> ports,
    Integer timeoutMinutes,
    Map<String, String> metadata
) {
    public boolean requestsResources() {
        return resources != null;
    }
}
