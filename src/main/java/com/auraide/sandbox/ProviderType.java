package com.auraide.sandbox;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Known provider kinds. Declaration order is the registry order used when
 * probing for a sandbox and when breaking load-balancing ties.
 */
public enum ProviderType {

    WORKSPACE("workspace"),
    DOCKER("docker"),
    LOCAL("local");

    private final String wireName;

    ProviderType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a provider name, accepting either the wire name or the enum constant.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    @JsonCreator
    public static ProviderType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider type must not be blank");
        }
        for (ProviderType type : values()) {
            if (type.wireName.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown provider type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
