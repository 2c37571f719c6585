package com.auraide.dispatch.api;

import com.auraide.sandbox.model.PortForwardOptions;
import com.fasterxml.jackson.annotation.JsonProperty;

public record PortForwardRequest(int port, Integer externalPort, String protocol,
                                 @JsonProperty("public") boolean isPublic) {

    public PortForwardOptions toOptions() {
        return new PortForwardOptions(externalPort, protocol, isPublic);
    }
}
