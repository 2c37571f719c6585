package com.auraide.sandbox.model;

import java.time.Duration;
import java.util.Map;

/**
 * @param workingDir  directory relative to the sandbox root, null for the root
 * @param timeout     hard limit, null for the provider default
 * @param environment variables overlaid on the provider's environment
 */
public record ExecOptions(String workingDir, Duration timeout, Map<String, String> environment) {

    public ExecOptions {
        environment = environment != null ? Map.copyOf(environment) : Map.of();
    }

    public static ExecOptions defaults() {
        return new ExecOptions(null, null, Map.of());
    }

    public static ExecOptions withTimeout(Duration timeout) {
        return new ExecOptions(null, timeout, Map.of());
    }
}
