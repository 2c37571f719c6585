package com.auraide.sandbox.docker;

import com.auraide.core.events.SandboxEvent;
import com.auraide.core.events.SandboxEventType;
import com.auraide.sandbox.SandboxException;
import com.auraide.sandbox.SandboxNotFoundException;
import com.auraide.sandbox.model.*;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.*;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.ContainerConfig;
import com.github.dockerjava.api.model.HostConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DockerSandboxProvider.
 * Uses manual mock chaining for the docker-java fluent builders instead of RETURNS_DEEP_STUBS,
 * which does not play well with the generic self-returning command types.
 */
class DockerSandboxProviderTest {

    private DockerClient dockerClient;
    private DockerProperties properties;
    private DockerSandboxProvider provider;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        properties = new DockerProperties();
        properties.setEnabled(true);
        provider = new DockerSandboxProvider(dockerClient, properties, Duration.ZERO);
        mockInspectImageSuccess();
        mockListContainers();
    }

    // -- Initialization tests ------------------------------------------------

    @Test
    @DisplayName("initialize pings the daemon")
    void initializePings() {
        var pingCmd = mock(PingCmd.class);
        when(dockerClient.pingCmd()).thenReturn(pingCmd);

        provider.initialize();

        verify(pingCmd).exec();
    }

    @Test
    @DisplayName("initialize fails when the daemon is unreachable")
    void initializeFailsWhenUnreachable() {
        var pingCmd = mock(PingCmd.class);
        when(dockerClient.pingCmd()).thenReturn(pingCmd);
        when(pingCmd.exec()).thenThrow(new RuntimeException("connection refused"));

        var ex = assertThrows(SandboxException.class, () -> provider.initialize());
        assertTrue(ex.getMessage().contains("connection refused"));
    }

    @Test
    @DisplayName("only the file system capability is advertised")
    void capabilities() {
        var caps = provider.capabilities();

        assertTrue(caps.supportsFileSystem());
        assertFalse(caps.supportsTerminal());
        assertFalse(caps.supportsSnapshots());
        assertEquals(properties.getMaxContainers(), caps.maxConcurrentSessions());
    }

    // -- Lifecycle tests -----------------------------------------------------

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("createSandbox labels the container, starts it and emits sandbox:created")
        void createSandbox() {
            var createCmd = mockCreateContainerCmd("container-abc123");
            var startCmd = mock(StartContainerCmd.class);
            when(dockerClient.startContainerCmd("container-abc123")).thenReturn(startCmd);
            mockInspectContainer("container-abc123", "running",
                    Map.of(DockerSandboxProvider.SANDBOX_LABEL, "true",
                            DockerSandboxProvider.NAME_LABEL, "my-box",
                            DockerSandboxProvider.META_PREFIX + "userId", "u1"));
            List<SandboxEvent> events = new ArrayList<>();
            provider.onAny(events::add);

            SandboxEnvironment env = provider.createSandbox(SandboxCreateOptions.builder()
                    .name("my-box")
                    .runtime("node")
                    .userId("u1")
                    .environment(Map.of("FOO", "bar"))
                    .build());

            assertEquals("container-abc123", env.id());
            assertEquals("my-box", env.name());
            assertEquals(SandboxStatus.RUNNING, env.status());
            assertEquals("u1", env.metadata().get("userId"));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, String>> labels = ArgumentCaptor.forClass(Map.class);
            verify(createCmd).withLabels(labels.capture());
            assertEquals("true", labels.getValue().get(DockerSandboxProvider.SANDBOX_LABEL));
            assertEquals("node", labels.getValue().get(DockerSandboxProvider.RUNTIME_LABEL));
            assertEquals("u1", labels.getValue().get(DockerSandboxProvider.META_PREFIX + "userId"));
            verify(createCmd).withEnv(List.of("FOO=bar"));
            verify(createCmd).withWorkingDir("/workspace");
            verify(createCmd).withCmd("sleep", "infinity");
            verify(startCmd).exec();
            assertEquals(1, events.size());
            assertEquals(SandboxEventType.SANDBOX_CREATED, events.get(0).type());
        }

        @Test
        @DisplayName("memory and CPU come from the requested resources")
        void createSandboxAppliesResources() {
            var createCmd = mockCreateContainerCmd("container-res");
            when(dockerClient.startContainerCmd(anyString())).thenReturn(mock(StartContainerCmd.class));
            mockInspectContainer("container-res", "running", Map.of(DockerSandboxProvider.SANDBOX_LABEL, "true"));

            provider.createSandbox(SandboxCreateOptions.builder()
                    .resources(new ResourceSpec(2.0, 512L, null))
                    .build());

            var captor = ArgumentCaptor.forClass(HostConfig.class);
            verify(createCmd).withHostConfig(captor.capture());
            assertEquals(512L * 1024 * 1024, captor.getValue().getMemory());
            assertEquals(2L, captor.getValue().getCpuCount());
        }

        @Test
        @DisplayName("a container that fails to start is removed")
        void createSandboxRemovesOnStartFailure() {
            mockCreateContainerCmd("container-bad");
            var startCmd = mock(StartContainerCmd.class);
            when(dockerClient.startContainerCmd("container-bad")).thenReturn(startCmd);
            when(startCmd.exec()).thenThrow(new RuntimeException("port already allocated"));
            var removeCmd = mock(RemoveContainerCmd.class);
            when(dockerClient.removeContainerCmd("container-bad")).thenReturn(removeCmd);
            when(removeCmd.withForce(true)).thenReturn(removeCmd);

            assertThrows(SandboxException.class,
                    () -> provider.createSandbox(SandboxCreateOptions.builder().build()));
            verify(removeCmd).exec();
        }

        @Test
        @DisplayName("getSandbox returns null for an unknown container")
        void getSandboxNotFound() {
            var inspectCmd = mock(InspectContainerCmd.class);
            when(dockerClient.inspectContainerCmd("missing")).thenReturn(inspectCmd);
            when(inspectCmd.exec()).thenThrow(new NotFoundException("not found"));

            assertNull(provider.getSandbox("missing"));
        }

        @Test
        @DisplayName("getSandbox ignores containers this service did not create")
        void getSandboxIgnoresForeignContainers() {
            mockInspectContainer("other", "running", Map.of("com.example", "x"));

            assertNull(provider.getSandbox("other"));
        }

        @Test
        @DisplayName("deleteSandbox force-removes the container and emits sandbox:deleted")
        void deleteSandbox() {
            mockInspectContainer("container-123", "exited", Map.of(DockerSandboxProvider.SANDBOX_LABEL, "true"));
            var removeCmd = mock(RemoveContainerCmd.class);
            when(dockerClient.removeContainerCmd("container-123")).thenReturn(removeCmd);
            when(removeCmd.withForce(true)).thenReturn(removeCmd);
            when(removeCmd.withRemoveVolumes(true)).thenReturn(removeCmd);
            List<SandboxEvent> events = new ArrayList<>();
            provider.onAny(events::add);

            assertTrue(provider.deleteSandbox("container-123"));

            verify(removeCmd).exec();
            assertEquals(SandboxEventType.SANDBOX_DELETED, events.get(0).type());
        }

        @Test
        @DisplayName("deleteSandbox returns false for an unknown container")
        void deleteSandboxUnknown() {
            var inspectCmd = mock(InspectContainerCmd.class);
            when(dockerClient.inspectContainerCmd("missing")).thenReturn(inspectCmd);
            when(inspectCmd.exec()).thenThrow(new NotFoundException("not found"));

            assertFalse(provider.deleteSandbox("missing"));
            verify(dockerClient, never()).removeContainerCmd(anyString());
        }

        @Test
        @DisplayName("updating environment variables is rejected")
        void updateEnvironmentUnsupported() {
            var options = new SandboxUpdateOptions(null, Map.of("A", "1"), null, null, null);

            assertThrows(UnsupportedOperationException.class,
                    () -> provider.updateSandbox("container-123", options));
        }

        @Test
        @DisplayName("metrics are not sampled")
        void metricsAreNull() {
            assertNull(provider.getMetrics("container-123"));
        }
    }

    // -- File operation tests ------------------------------------------------

    @Nested
    @DisplayName("files")
    class Files {

        private final List<List<String>> scripts = new ArrayList<>();
        private final Map<String, ExecutionResult> responses = new HashMap<>();
        private DockerSandboxProvider scripted;

        @BeforeEach
        void setUp() {
            mockInspectContainer("c1", "running", Map.of(DockerSandboxProvider.SANDBOX_LABEL, "true"));
            scripted = new DockerSandboxProvider(dockerClient, properties, Duration.ZERO) {
                @Override
                ExecutionResult execInContainer(String containerId, List<String> command, String workingDir,
                                                Map<String, String> environment, Duration timeout) {
                    scripts.add(command);
                    String script = command.get(command.size() - 1);
                    for (var entry : responses.entrySet()) {
                        if (script.startsWith(entry.getKey())) {
                            return entry.getValue();
                        }
                    }
                    return ExecutionResult.completed(0, "", null, 1);
                }
            };
        }

        @Test
        @DisplayName("readFile returns null when the file does not exist")
        void readMissingFile() {
            responses.put("[ -e ", ExecutionResult.failed(DockerSandboxProvider.MISSING_EXIT_CODE, "", null, 1));

            assertNull(scripted.readFile("c1", "nope.txt", ReadFileOptions.defaults()));
        }

        @Test
        @DisplayName("readFile decodes base64 output")
        void readFile() {
            responses.put("[ -e ", ExecutionResult.completed(0, "5 1700000000\n", null, 1));
            responses.put("base64 -w0", ExecutionResult.completed(0, "aGVsbG8=", null, 1));

            SandboxFile file = scripted.readFile("c1", "hello.txt", ReadFileOptions.defaults());

            assertEquals("hello", file.asText());
            assertEquals(5, file.size());
        }

        @Test
        @DisplayName("readFile enforces the size limit")
        void readFileTooLarge() {
            responses.put("[ -e ", ExecutionResult.completed(0, "2048 1700000000", null, 1));

            assertThrows(SandboxException.class,
                    () -> scripted.readFile("c1", "big.bin", new ReadFileOptions(FileEncoding.UTF_8, 1024L)));
        }

        @Test
        @DisplayName("writeFile streams content into a temp file and moves it into place")
        void writeFile() {
            List<SandboxEvent> events = new ArrayList<>();
            scripted.onAny(events::add);

            scripted.writeFile("c1", "src/app.js", "console.log(1)", WriteFileOptions.defaults());

            List<String> bodies = scripts.stream().map(cmd -> cmd.get(cmd.size() - 1)).toList();
            assertTrue(bodies.stream().anyMatch(s -> s.contains("base64 -d >> '/workspace/src/app.js.aura-tmp'")));
            assertTrue(bodies.get(bodies.size() - 1).startsWith("mv -f "));
            assertEquals(SandboxEventType.FILE_CHANGED, events.get(0).type());
            assertEquals("modified", events.get(0).payload().get("type"));
        }

        @Test
        @DisplayName("writeFile fails when a write step fails")
        void writeFileFailure() {
            responses.put("mv -f", ExecutionResult.failed(1, "", "read-only file system", 1));

            var ex = assertThrows(SandboxException.class,
                    () -> scripted.writeFile("c1", "a.txt", "x", WriteFileOptions.defaults()));
            assertTrue(ex.getMessage().contains("read-only file system"));
        }

        @Test
        @DisplayName("deleting a missing file returns the force flag")
        void deleteMissingFile() {
            responses.put("[ -e ", ExecutionResult.failed(DockerSandboxProvider.MISSING_EXIT_CODE, "", null, 1));

            assertFalse(scripted.deleteFile("c1", "gone.txt", new DeleteFileOptions(false, false)));
            assertTrue(scripted.deleteFile("c1", "gone.txt", new DeleteFileOptions(false, true)));
        }

        @Test
        @DisplayName("deleting the sandbox root is refused")
        void deleteRootRefused() {
            assertThrows(IllegalArgumentException.class,
                    () -> scripted.deleteFile("c1", "", new DeleteFileOptions(true, true)));
        }

        @Test
        @DisplayName("listFiles parses find output relative to the requested path")
        void listFiles() {
            responses.put("find ", ExecutionResult.completed(0,
                    "f\t12\t1700000000.5\t644\tindex.js\nd\t4096\t1700000000.0\t755\tlib\n", null, 1));

            List<FileSystemEntry> entries = scripted.listFiles("c1", "src", ListFilesOptions.defaults());

            assertEquals(2, entries.size());
            assertEquals("src/index.js", entries.get(0).path());
            assertEquals(12L, entries.get(0).size());
            assertEquals(FileSystemEntry.EntryType.DIRECTORY, entries.get(1).type());
            assertNull(entries.get(1).size());
        }

        @Test
        @DisplayName("file operations on an unknown sandbox throw not found")
        void unknownSandbox() {
            var inspectCmd = mock(InspectContainerCmd.class);
            when(dockerClient.inspectContainerCmd("ghost")).thenReturn(inspectCmd);
            when(inspectCmd.exec()).thenThrow(new NotFoundException("not found"));

            assertThrows(SandboxNotFoundException.class,
                    () -> scripted.readFile("ghost", "a.txt", ReadFileOptions.defaults()));
        }
    }

    @Test
    @DisplayName("quote escapes embedded single quotes")
    void quote() {
        assertEquals("'plain'", DockerSandboxProvider.quote("plain"));
        assertEquals("'it'\\''s'", DockerSandboxProvider.quote("it's"));
    }

    @Test
    @DisplayName("healthCheck reports an unreachable daemon as unhealthy")
    void healthCheckUnhealthy() {
        var pingCmd = mock(PingCmd.class);
        when(dockerClient.pingCmd()).thenReturn(pingCmd);
        when(pingCmd.exec()).thenThrow(new RuntimeException("down"));

        ProviderHealth health = provider.healthCheck();

        assertFalse(health.healthy());
        assertEquals("down", health.error());
    }

    // -- Helper methods ------------------------------------------------------

    /**
     * Creates a mock for the createContainerCmd fluent chain.
     * Each fluent method returns the same mock (self-referential).
     */
    private CreateContainerCmd mockCreateContainerCmd(String containerId) {
        var createCmd = mock(CreateContainerCmd.class, RETURNS_SELF);
        when(dockerClient.createContainerCmd(anyString())).thenReturn(createCmd);

        var createResponse = mock(CreateContainerResponse.class);
        when(createResponse.getId()).thenReturn(containerId);
        when(createCmd.exec()).thenReturn(createResponse);
        return createCmd;
    }

    private void mockInspectContainer(String containerId, String state, Map<String, String> labels) {
        var inspectCmd = mock(InspectContainerCmd.class);
        when(dockerClient.inspectContainerCmd(containerId)).thenReturn(inspectCmd);

        var response = mock(InspectContainerResponse.class);
        var config = mock(ContainerConfig.class);
        var containerState = mock(InspectContainerResponse.ContainerState.class);
        when(response.getId()).thenReturn(containerId);
        when(response.getConfig()).thenReturn(config);
        when(config.getLabels()).thenReturn(labels);
        when(response.getState()).thenReturn(containerState);
        when(containerState.getStatus()).thenReturn(state);
        when(inspectCmd.exec()).thenReturn(response);
    }

    private void mockListContainers() {
        var listCmd = mock(ListContainersCmd.class, RETURNS_SELF);
        when(dockerClient.listContainersCmd()).thenReturn(listCmd);
        when(listCmd.exec()).thenReturn(List.of());
    }

    private void mockInspectImageSuccess() {
        var inspectCmd = mock(InspectImageCmd.class);
        when(dockerClient.inspectImageCmd(anyString())).thenReturn(inspectCmd);
        when(inspectCmd.exec()).thenReturn(mock(InspectImageResponse.class));
    }
}
