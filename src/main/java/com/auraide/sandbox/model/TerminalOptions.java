package com.auraide.sandbox.model;

public record TerminalOptions(String shell, String workingDir, int rows, int cols) {

    public TerminalOptions {
        shell = shell != null ? shell : "/bin/bash";
        rows = rows > 0 ? rows : 24;
        cols = cols > 0 ? cols : 80;
    }

    public static TerminalOptions defaults() {
        return new TerminalOptions(null, null, 24, 80);
    }
}
