package com.auraide.sandbox.model;

/**
 * @param maxSize byte limit, null for the provider's configured maximum
 */
public record ReadFileOptions(FileEncoding encoding, Long maxSize) {

    public ReadFileOptions {
        encoding = encoding != null ? encoding : FileEncoding.UTF_8;
    }

    public static ReadFileOptions defaults() {
        return new ReadFileOptions(FileEncoding.UTF_8, null);
    }
}
