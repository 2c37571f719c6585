package com.auraide.sandbox.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * File content read from a sandbox.
 */
public record SandboxFile(
    String path,
    @JsonIgnore byte[] content,
    FileEncoding encoding,
    long size,
    Instant modified
) {
    /** Content rendered in {@link #encoding()}; this is what goes over the wire. */
    @JsonProperty("content")
    public String encodedContent() {
        return encoding.encode(content);
    }

    public String asText() {
        return FileEncoding.UTF_8.encode(content);
    }
}
