package com.auraide.sandbox.model;

import java.util.List;

/**
 * @param preserveFiles sandbox-relative files whose current content survives the restore
 * @param restartAfter  restart the sandbox once files are restored
 */
public record RestoreOptions(List<String> preserveFiles, boolean restartAfter) {

    public RestoreOptions {
        preserveFiles = preserveFiles != null ? List.copyOf(preserveFiles) : List.of();
    }

    public static RestoreOptions defaults() {
        return new RestoreOptions(List.of(), false);
    }
}
