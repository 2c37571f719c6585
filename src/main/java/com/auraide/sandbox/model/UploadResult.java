package com.auraide.sandbox.model;

import java.util.List;

public record UploadResult(List<String> uploaded, List<Failure> failed) {

    public UploadResult {
        uploaded = List.copyOf(uploaded);
        failed = List.copyOf(failed);
    }

    public record Failure(String path, String error) {}
}
