package com.auraide.sandbox.model;

public record UploadFile(String path, String content, FileEncoding encoding) {

    public UploadFile {
        encoding = encoding != null ? encoding : FileEncoding.UTF_8;
    }
}
