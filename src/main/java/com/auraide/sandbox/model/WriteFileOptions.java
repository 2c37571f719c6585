package com.auraide.sandbox.model;

/**
 * @param createDirs create missing parent directories (default true)
 * @param backup     keep the previous version as {@code <file>.backup}
 */
public record WriteFileOptions(FileEncoding encoding, boolean createDirs, boolean backup) {

    public WriteFileOptions {
        encoding = encoding != null ? encoding : FileEncoding.UTF_8;
    }

    public static WriteFileOptions defaults() {
        return new WriteFileOptions(FileEncoding.UTF_8, true, false);
    }
}
