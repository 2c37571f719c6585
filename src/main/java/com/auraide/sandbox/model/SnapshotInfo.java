package com.auraide.sandbox.model;

import java.time.Instant;

/**
 * @param size total bytes captured
 */
public record SnapshotInfo(String snapshotId, String sandboxId, String name, String description,
                           long size, Instant createdAt) {}
