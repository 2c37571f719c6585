package com.auraide.dispatch.api;

import java.util.List;

public record DownloadRequest(List<String> paths, String baseDir) {}
