package com.auraide.sandbox.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * @param path        path relative to the sandbox root, '/'-separated
 * @param size        byte size for files, null for directories
 * @param permissions octal mode, e.g. {@code 644}
 */
public record FileSystemEntry(String path, EntryType type, Long size, Instant modified, String permissions) {

    public enum EntryType {
        FILE, DIRECTORY;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public boolean isDirectory() {
        return type == EntryType.DIRECTORY;
    }
}
