package com.auraide.sandbox.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SandboxStatus {

    INITIALIZING,
    RUNNING,
    STOPPED,
    ERROR,
    TIMEOUT,
    TERMINATING,
    TERMINATED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Lenient parse used for provider payloads; unknown states map to {@link #ERROR}.
     */
    @JsonCreator
    public static SandboxStatus fromWire(String value) {
        if (value == null) {
            return ERROR;
        }
        return switch (value.trim().toLowerCase()) {
            case "initializing", "creating", "starting", "pending" -> INITIALIZING;
            case "running", "active", "started" -> RUNNING;
            case "stopped", "exited", "created", "paused" -> STOPPED;
            case "timeout" -> TIMEOUT;
            case "terminating", "stopping", "removing" -> TERMINATING;
            case "terminated", "deleted", "dead" -> TERMINATED;
            default -> ERROR;
        };
    }
}
