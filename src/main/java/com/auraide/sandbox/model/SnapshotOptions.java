package com.auraide.sandbox.model;

public record SnapshotOptions(String description, boolean includeRuntime, boolean compress) {

    public static SnapshotOptions defaults() {
        return new SnapshotOptions(null, false, false);
    }
}
