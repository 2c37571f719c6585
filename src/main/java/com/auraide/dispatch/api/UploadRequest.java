package com.auraide.dispatch.api;

import com.auraide.sandbox.model.UploadFile;
import com.auraide.sandbox.model.UploadOptions;

import java.util.List;

public record UploadRequest(List<UploadFile> files, String baseDir, Boolean overwrite, Boolean createDirs) {

    public List<UploadFile> filesOrEmpty() {
        return files != null ? files : List.of();
    }

    public UploadOptions toOptions() {
        return new UploadOptions(baseDir, overwrite == null || overwrite, createDirs == null || createDirs);
    }
}
