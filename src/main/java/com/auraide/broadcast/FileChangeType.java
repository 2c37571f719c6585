package com.auraide.broadcast;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FileChangeType {
    CREATED, MODIFIED, DELETED, RENAMED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
