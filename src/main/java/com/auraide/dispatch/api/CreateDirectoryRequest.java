package com.auraide.dispatch.api;

import com.auraide.sandbox.model.CreateDirectoryOptions;

public record CreateDirectoryRequest(String path, Boolean recursive, String permissions) {

    public CreateDirectoryOptions toOptions() {
        return new CreateDirectoryOptions(recursive == null || recursive, permissions);
    }
}
