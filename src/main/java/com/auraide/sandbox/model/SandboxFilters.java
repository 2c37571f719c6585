package com.auraide.sandbox.model;

public record SandboxFilters(String userId, String projectId, SandboxStatus status, String template) {

    public static SandboxFilters none() {
        return new SandboxFilters(null, null, null, null);
    }

    public boolean matches(SandboxEnvironment environment) {
        if (userId != null && !userId.equals(environment.metadataValue("userId"))) return false;
        if (projectId != null && !projectId.equals(environment.metadataValue("projectId"))) return false;
        if (status != null && status != environment.status()) return false;
        return template == null || template.equals(environment.template());
    }
}
