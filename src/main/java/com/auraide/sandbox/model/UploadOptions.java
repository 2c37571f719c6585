package com.auraide.sandbox.model;

/**
 * @param baseDir   directory the upload paths are relative to, null for the sandbox root
 * @param overwrite replace files that already exist
 */
public record UploadOptions(String baseDir, boolean overwrite, boolean createDirs) {

    public static UploadOptions defaults() {
        return new UploadOptions(null, true, true);
    }

    public String resolve(String path) {
        if (baseDir == null || baseDir.isBlank()) {
            return path;
        }
        String base = baseDir.endsWith("/") ? baseDir.substring(0, baseDir.length() - 1) : baseDir;
        return base + "/" + (path.startsWith("/") ? path.substring(1) : path);
    }
}
