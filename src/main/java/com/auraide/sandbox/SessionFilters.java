package com.auraide.sandbox;

public record SessionFilters(String userId, String projectId, ProviderType provider) {

    public static SessionFilters none() {
        return new SessionFilters(null, null, null);
    }

    public boolean matches(SandboxSession session) {
        if (userId != null && !userId.equals(session.userId())) return false;
        if (projectId != null && !projectId.equals(session.projectId())) return false;
        return provider == null || provider == session.provider();
    }
}
