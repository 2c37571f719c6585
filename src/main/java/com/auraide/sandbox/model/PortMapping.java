package com.auraide.sandbox.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PortMapping(
    int internal,
    Integer external,
    String protocol,
    @JsonProperty("public") boolean isPublic,
    String description
) {
    public PortMapping {
        protocol = protocol != null ? protocol : "tcp";
    }

    public static PortMapping tcp(int internal) {
        return new PortMapping(internal, null, "tcp", false, null);
    }
}
