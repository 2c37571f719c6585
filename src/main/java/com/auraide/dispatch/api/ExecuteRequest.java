package com.auraide.dispatch.api;

import com.auraide.sandbox.model.ExecOptions;

import java.time.Duration;
import java.util.Map;

public record ExecuteRequest(String command, String workingDir, Long timeoutMs, Map<String, String> environment) {

    public ExecOptions toOptions() {
        return new ExecOptions(workingDir, timeoutMs != null ? Duration.ofMillis(timeoutMs) : null, environment);
    }
}
