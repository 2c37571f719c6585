package com.auraide.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event channels emitted by sandbox providers and relayed by the manager.
 */
public enum SandboxEventType {

    SANDBOX_CREATED("sandbox:created"),
    SANDBOX_STARTED("sandbox:started"),
    SANDBOX_STOPPED("sandbox:stopped"),
    SANDBOX_DELETED("sandbox:deleted"),
    SANDBOX_ERROR("sandbox:error"),
    SANDBOX_METRICS("sandbox:metrics"),
    FILE_CHANGED("file:changed"),
    TERMINAL_CONNECTED("terminal:connected"),
    TERMINAL_DISCONNECTED("terminal:disconnected");

    private final String wireName;

    SandboxEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
