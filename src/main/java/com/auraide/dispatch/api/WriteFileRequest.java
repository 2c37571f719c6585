package com.auraide.dispatch.api;

import com.auraide.sandbox.model.FileEncoding;
import com.auraide.sandbox.model.WriteFileOptions;

public record WriteFileRequest(String path, String content, FileEncoding encoding, Boolean createDirs, Boolean backup) {

    public WriteFileOptions toOptions() {
        return new WriteFileOptions(encoding, createDirs == null || createDirs, backup != null && backup);
    }
}
