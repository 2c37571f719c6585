package com.auraide.dispatch.cli;

import com.auraide.core.health.HealthCheckService;
import com.auraide.core.health.HealthStatus;
import com.auraide.sandbox.ProviderCapabilities;
import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.SandboxNotFoundException;
import com.auraide.sandbox.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Tests for the aura CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private SandboxManager sandboxManager;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        sandboxManager = mock(SandboxManager.class);
        healthCheckService = mock(HealthCheckService.class);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == ProvidersCommand.class) {
                    return (K) new ProvidersCommand(sandboxManager);
                }
                if (cls == SandboxesCommand.class) {
                    return (K) new SandboxesCommand(sandboxManager);
                }
                if (cls == ExecCommand.class) {
                    return (K) new ExecCommand(sandboxManager);
                }
                // Default: use picocli's default factory for other classes
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new AuraCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static SandboxEnvironment environment(String id, SandboxStatus status) {
        Instant now = Instant.now();
        return new SandboxEnvironment(id, "demo-" + id, ProviderType.LOCAL, status, null, "node",
                null, new NetworkInfo(List.of(), null), Map.of(), now, now, null);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpOutput {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            var result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String sub : List.of("serve", "health", "providers", "sandboxes", "exec")) {
                assertTrue(result.output().contains(sub), "help should list " + sub);
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            var result = execute("--version");

            assertTrue(result.output().contains("0.1.0"));
        }

        @Test
        @DisplayName("exec --help shows exec options")
        void execHelpOutput() {
            var result = execute("exec", "--help");

            assertTrue(result.output().contains("--workdir"));
            assertTrue(result.output().contains("--timeout"));
        }
    }

    // =====================================================================
    //  Health command tests
    // =====================================================================

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("exits 0 when a provider is up")
        void healthUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("provider:local", HealthStatus.Status.UP, "Provider healthy", Map.of()),
                    new HealthStatus("sessions", HealthStatus.Status.UP, "0 active session(s)", Map.of())));

            var result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("provider:local: Provider healthy"));
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("exits 1 when no provider is up")
        void healthDown() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("provider:docker", HealthStatus.Status.DOWN, "daemon unreachable", Map.of())));

            var result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("daemon unreachable"));
        }
    }

    // =====================================================================
    //  Provider and sandbox listing tests
    // =====================================================================

    @Nested
    @DisplayName("listing")
    class ListingTests {

        @Test
        @DisplayName("providers prints version, load and capabilities")
        void providers() {
            when(sandboxManager.getAvailableProviders()).thenReturn(List.of(ProviderType.LOCAL));
            when(sandboxManager.getProviderLoads()).thenReturn(Map.of(ProviderType.LOCAL, 2));
            when(sandboxManager.getProviderInfo(ProviderType.LOCAL)).thenReturn(new ProviderInfo(
                    ProviderType.LOCAL, "1.0.0", ProviderInfo.Status.HEALTHY,
                    new ProviderInfo.Limits(10, 10, -1, 30_000),
                    new ProviderInfo.Usage(2, 3, 0, 0, 0)));
            when(sandboxManager.getProviderCapabilities(ProviderType.LOCAL)).thenReturn(
                    new ProviderCapabilities(true, true, false, true, false, 10, List.of("node", "python")));

            var result = execute("providers");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("local 1.0.0 (healthy, 2 active)"));
            assertTrue(result.output().contains("fileSystem terminal snapshots runtimes=node,python"));
        }

        @Test
        @DisplayName("sandboxes passes filters to the manager")
        void sandboxesFiltered() {
            when(sandboxManager.listSandboxes(new SandboxFilters("u1", null, SandboxStatus.RUNNING, null), null))
                    .thenReturn(List.of(environment("sb-1", SandboxStatus.RUNNING)));

            var result = execute("sandboxes", "--user", "u1", "--status", "running");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("sb-1"));
            assertTrue(result.output().contains("1 sandbox"));
        }

        @Test
        @DisplayName("sandboxes reports an empty result")
        void sandboxesEmpty() {
            when(sandboxManager.listSandboxes(any(), isNull())).thenReturn(List.of());

            var result = execute("sandboxes");

            assertTrue(result.output().contains("No sandboxes found."));
        }
    }

    // =====================================================================
    //  Exec command tests
    // =====================================================================

    @Nested
    @DisplayName("exec")
    class ExecTests {

        @Test
        @DisplayName("joins the command words and exits with the command's exit code")
        void execExitCode() {
            when(sandboxManager.executeCommand(eq("sb-1"), eq("ls -la"), any(), isNull()))
                    .thenReturn(ExecutionResult.completed(3, "listing\n", null, 12));

            var result = execute("exec", "sb-1", "--", "ls", "-la");

            assertEquals(3, result.exitCode());
            assertTrue(result.output().contains("listing"));
            assertTrue(result.output().contains("[EXEC]"));
            assertTrue(result.output().contains("exit 3"));
        }

        @Test
        @DisplayName("passes working directory and timeout")
        void execOptions() {
            when(sandboxManager.executeCommand(any(), any(), any(), any()))
                    .thenReturn(ExecutionResult.completed(0, "", null, 1));

            execute("exec", "-w", "src", "-t", "5", "--provider", "docker", "sb-1", "make");

            verify(sandboxManager).executeCommand(eq("sb-1"), eq("make"),
                    eq(new ExecOptions("src", Duration.ofSeconds(5), Map.of())), eq(ProviderType.DOCKER));
        }

        @Test
        @DisplayName("exits 1 for an unknown sandbox")
        void execUnknownSandbox() {
            when(sandboxManager.executeCommand(eq("ghost"), any(), any(), isNull()))
                    .thenThrow(new SandboxNotFoundException("ghost"));

            var result = execute("exec", "ghost", "true");

            assertEquals(1, result.exitCode());
        }

        @Test
        @DisplayName("exits 1 for an unknown provider")
        void execUnknownProvider() {
            var result = execute("exec", "--provider", "mainframe", "sb-1", "true");

            assertEquals(1, result.exitCode());
            verifyNoInteractions(sandboxManager);
        }
    }

    @Test
    @DisplayName("formatDuration renders ms, seconds and minutes")
    void formatDuration() {
        assertEquals("250ms", ConsoleOutput.formatDuration(250));
        assertEquals("4s", ConsoleOutput.formatDuration(4_200));
        assertEquals("2m 5s", ConsoleOutput.formatDuration(125_000));
    }
}
