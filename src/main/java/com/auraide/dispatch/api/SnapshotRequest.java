package com.auraide.dispatch.api;

import com.auraide.sandbox.model.SnapshotOptions;

public record SnapshotRequest(String name, String description, boolean includeRuntime, boolean compress) {

    public SnapshotOptions toOptions() {
        return new SnapshotOptions(description, includeRuntime, compress);
    }
}
