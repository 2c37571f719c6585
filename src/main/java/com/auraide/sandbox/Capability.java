package com.auraide.sandbox;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Optional provider features that the manager checks before dispatching.
 */
public enum Capability {

    FILE_SYSTEM("fileSystem"),
    TERMINAL("terminal"),
    PORT_FORWARDING("portForwarding"),
    SNAPSHOTS("snapshots"),
    RESOURCE_SCALING("resourceScaling");

    private final String wireName;

    Capability(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
