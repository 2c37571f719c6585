package com.auraide.dispatch.cli;

import com.auraide.sandbox.model.ExecutionResult;
import com.auraide.sandbox.model.SandboxEnvironment;
import com.auraide.sandbox.model.SandboxStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AURA SANDBOX v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AURA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void sandbox(SandboxEnvironment env) {
        String color = env.status() == SandboxStatus.RUNNING ? "fg(green)"
                : env.status() == SandboxStatus.ERROR ? "fg(red)" : "fg(yellow)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [" + env.provider().wireName() + "]|@ " + env.id() +
                "  @|" + color + " " + env.status().wireName() + "|@" +
                (env.name() != null ? "  " + env.name() : "")));
    }

    public static void execution(ExecutionResult result) {
        if (result.output() != null && !result.output().isEmpty()) {
            System.out.print(result.output());
        }
        if (result.error() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) " + result.error() + "|@"));
        }
        String status = result.success() ? "@|fg(green) exit " + result.exitCode() + "|@"
                                         : "@|fg(red) exit " + result.exitCode() + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) [EXEC]|@ " + status + " (" + formatDuration(result.durationMs()) + ")"));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
