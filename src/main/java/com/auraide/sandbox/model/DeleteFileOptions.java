package com.auraide.sandbox.model;

/**
 * @param force treat a missing path as already deleted
 */
public record DeleteFileOptions(boolean recursive, boolean force) {

    public static DeleteFileOptions defaults() {
        return new DeleteFileOptions(false, false);
    }
}
