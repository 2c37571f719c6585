package com.auraide.sandbox.model;

import java.time.Instant;

/**
 * Outcome of a command. A non-zero exit or a timeout is reported here rather than thrown.
 *
 * @param durationMs wall-clock time spent running the command
 */
public record ExecutionResult(
    boolean success,
    String output,
    String error,
    int exitCode,
    long durationMs,
    Instant timestamp
) {
    /** Exit code reported for commands killed at their timeout. */
    public static final int TIMEOUT_EXIT_CODE = 124;

    public static ExecutionResult completed(int exitCode, String output, String error, long durationMs) {
        return new ExecutionResult(exitCode == 0, output, blankToNull(error), exitCode, durationMs, Instant.now());
    }

    public static ExecutionResult failed(int exitCode, String output, String error, long durationMs) {
        return new ExecutionResult(false, output, error, exitCode, durationMs, Instant.now());
    }

    public static ExecutionResult timedOut(String output, long timeoutMs, long durationMs) {
        return failed(TIMEOUT_EXIT_CODE, output, "Command timed out after " + timeoutMs + "ms", durationMs);
    }

    private static String blankToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
