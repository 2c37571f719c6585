package com.auraide.sandbox.model;

public record ListFilesOptions(boolean recursive, boolean includeHidden, Integer maxDepth) {

    public static ListFilesOptions defaults() {
        return new ListFilesOptions(false, false, null);
    }

    public static ListFilesOptions recursively() {
        return new ListFilesOptions(true, false, null);
    }

    public int effectiveDepth() {
        if (!recursive) {
            return 1;
        }
        return maxDepth != null && maxDepth > 0 ? maxDepth : Integer.MAX_VALUE;
    }
}
