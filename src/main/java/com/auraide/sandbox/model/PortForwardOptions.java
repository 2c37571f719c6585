package com.auraide.sandbox.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PortForwardOptions(Integer externalPort, String protocol, @JsonProperty("public") boolean isPublic) {

    public PortForwardOptions {
        protocol = protocol != null ? protocol : "tcp";
    }

    public static PortForwardOptions defaults() {
        return new PortForwardOptions(null, "tcp", false);
    }
}
