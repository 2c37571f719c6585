package com.auraide.broadcast;

import java.time.Instant;
import java.util.Map;

/**
 * A file change pushed to connected editor clients.
 *
 * @param content new content for created/modified files, when known
 * @param newPath destination for renames
 */
public record FileChangeEvent(
    FileChangeType type,
    String path,
    String content,
    String newPath,
    Instant timestamp,
    String projectId,
    String sandboxId,
    String userId,
    Map<String, Object> metadata
) {
    public FileChangeEvent {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
