package com.auraide.sandbox.model;

import java.util.List;

public record NetworkInfo(List<PortMapping> ports, String publicUrl) {

    public NetworkInfo {
        ports = ports != null ? List.copyOf(ports) : List.of();
    }

    public static NetworkInfo empty() {
        return new NetworkInfo(List.of(), null);
    }
}
