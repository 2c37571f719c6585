package com.auraide.sandbox.model;

/**
 * @param permissions octal mode such as {@code 755}, null to keep the umask default
 */
public record CreateDirectoryOptions(boolean recursive, String permissions) {

    public static CreateDirectoryOptions defaults() {
        return new CreateDirectoryOptions(true, null);
    }
}
