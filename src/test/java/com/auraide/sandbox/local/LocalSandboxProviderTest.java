package com.auraide.sandbox.local;

import com.auraide.core.events.SandboxEvent;
import com.auraide.core.events.SandboxEventType;
import com.auraide.sandbox.SandboxException;
import com.auraide.sandbox.SandboxNotFoundException;
import com.auraide.sandbox.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LocalSandboxProviderTest {

    @TempDir
    Path tempDir;

    private LocalProperties properties;
    private LocalSandboxProvider provider;
    private final List<SandboxEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new LocalProperties();
        properties.setBasePath(tempDir.toString());
        properties.setCleanupInterval(Duration.ZERO);
        provider = new LocalSandboxProvider(properties, Duration.ZERO);
        provider.initialize();
        provider.onAny(events::add);
    }

    @AfterEach
    void tearDown() {
        provider.cleanup();
    }

    private SandboxEnvironment create(String template) {
        return provider.createSandbox(SandboxCreateOptions.builder()
                .name("demo")
                .template(template)
                .userId("user-1")
                .projectId("project-1")
                .build());
    }

    private Path rootOf(SandboxEnvironment env) {
        return tempDir.resolve(env.id());
    }

    private List<SandboxEventType> eventTypes() {
        return events.stream().map(SandboxEvent::type).toList();
    }

    // -- Lifecycle tests ------------------------------------------------------

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("createSandbox lays down the directory, sidecar and template")
        void createsSandbox() {
            SandboxEnvironment env = create("node");

            assertTrue(env.id().matches("local-\\d+-[0-9a-z]{1,9}"), env.id());
            assertEquals(SandboxStatus.RUNNING, env.status());
            assertEquals("node", env.runtime());
            assertEquals(new ResourceSpec(1.0, 1024L, 10240L), env.resources());
            assertEquals("user-1", env.metadataValue("userId"));
            assertEquals("project-1", env.metadataValue("projectId"));
            assertEquals("local-provider", env.metadataValue("createdBy"));
            assertTrue(Files.isRegularFile(rootOf(env).resolve(LocalSandboxProvider.METADATA_FILE)));
            assertTrue(Files.isRegularFile(rootOf(env).resolve("package.json")));
            assertTrue(Files.isRegularFile(rootOf(env).resolve("index.js")));
            assertEquals(List.of(SandboxEventType.SANDBOX_CREATED), eventTypes());
        }

        @Test
        @DisplayName("unknown template creates an empty sandbox")
        void unknownTemplate() throws IOException {
            SandboxEnvironment env = create("rust");
            try (var children = Files.list(rootOf(env))) {
                assertTrue(children.allMatch(p -> p.getFileName().toString().startsWith(".")));
            }
        }

        @Test
        @DisplayName("refuses to exceed the concurrent sandbox limit")
        void concurrencyLimit() {
            properties.setMaxConcurrentSandboxes(1);
            create(null);
            assertThrows(SandboxException.class, () -> create(null));
        }

        @Test
        @DisplayName("stop and start persist the status")
        void stopAndStart() {
            SandboxEnvironment env = create(null);

            assertEquals(SandboxStatus.STOPPED, provider.stopSandbox(env.id()).status());
            assertEquals(SandboxStatus.STOPPED, provider.getSandbox(env.id()).status());
            assertEquals(SandboxStatus.RUNNING, provider.restartSandbox(env.id()).status());
            assertTrue(eventTypes().containsAll(List.of(SandboxEventType.SANDBOX_STOPPED, SandboxEventType.SANDBOX_STARTED)));
        }

        @Test
        @DisplayName("deleteSandbox removes the tree and reports false the second time")
        void deletes() {
            SandboxEnvironment env = create(null);

            assertTrue(provider.deleteSandbox(env.id()));
            assertFalse(Files.exists(rootOf(env)));
            assertNull(provider.getSandbox(env.id()));
            assertFalse(provider.deleteSandbox(env.id()));
            assertEquals(SandboxEventType.SANDBOX_DELETED, events.get(events.size() - 1).type());
        }

        @Test
        @DisplayName("concurrent deletes of one sandbox succeed exactly once")
        void concurrentDeletes() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                for (int round = 0; round < 50; round++) {
                    SandboxEnvironment env = create(null);
                    CyclicBarrier barrier = new CyclicBarrier(2);
                    Future<Boolean> first = pool.submit(() -> {
                        barrier.await();
                        return provider.deleteSandbox(env.id());
                    });
                    Future<Boolean> second = pool.submit(() -> {
                        barrier.await();
                        return provider.deleteSandbox(env.id());
                    });

                    boolean a = first.get(10, TimeUnit.SECONDS);
                    boolean b = second.get(10, TimeUnit.SECONDS);

                    assertTrue(a ^ b, "exactly one delete wins in round " + round);
                    assertFalse(Files.exists(rootOf(env)));
                    assertNull(provider.getSandbox(env.id()));
                    long deletedEvents = events.stream()
                            .filter(e -> e.type() == SandboxEventType.SANDBOX_DELETED && env.id().equals(e.sandboxId()))
                            .count();
                    assertEquals(1, deletedEvents);
                }
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("resource updates are unsupported, metadata updates merge")
        void updates() {
            SandboxEnvironment env = create(null);

            assertThrows(UnsupportedOperationException.class, () -> provider.updateSandbox(env.id(),
                    new SandboxUpdateOptions(new ResourceSpec(4.0, null, null), null, null, null, null)));

            SandboxEnvironment updated = provider.updateSandbox(env.id(),
                    new SandboxUpdateOptions(null, null, null, 30, Map.of("branch", "main")));
            assertEquals("main", updated.metadataValue("branch"));
            assertEquals("user-1", updated.metadataValue("userId"));
            assertNotNull(updated.expiresAt());
        }

        @Test
        @DisplayName("operations on an unknown sandbox raise SandboxNotFoundException")
        void unknownSandbox() {
            assertNull(provider.getSandbox("local-missing"));
            assertThrows(SandboxNotFoundException.class, () -> provider.startSandbox("local-missing"));
            assertThrows(SandboxNotFoundException.class,
                    () -> provider.executeCommand("local-missing", "true", ExecOptions.defaults()));
        }

        @Test
        @DisplayName("listSandboxes applies owner filters")
        void listsWithFilters() {
            create(null);
            provider.createSandbox(SandboxCreateOptions.builder().userId("user-2").build());

            assertEquals(2, provider.listSandboxes(SandboxFilters.none()).size());
            assertEquals(1, provider.listSandboxes(new SandboxFilters("user-2", null, null, null)).size());
        }
    }

    // -- Persistence tests ----------------------------------------------------

    @Nested
    @DisplayName("persistence")
    class PersistenceTests {

        @Test
        @DisplayName("a new provider instance rehydrates sandboxes from their sidecars")
        void rehydrates() throws IOException {
            SandboxEnvironment env = create("python");
            Files.createDirectories(tempDir.resolve("not-a-sandbox"));
            Path broken = Files.createDirectories(tempDir.resolve("local-broken"));
            Files.writeString(broken.resolve(LocalSandboxProvider.METADATA_FILE), "{not json");

            var reloaded = new LocalSandboxProvider(properties, Duration.ZERO);
            reloaded.initialize();
            try {
                SandboxEnvironment found = reloaded.getSandbox(env.id());
                assertNotNull(found);
                assertEquals("python", found.template());
                assertEquals("user-1", found.metadataValue("userId"));
                assertEquals(1, reloaded.listSandboxes(SandboxFilters.none()).size());
            } finally {
                reloaded.cleanup();
            }
        }

        @Test
        @DisplayName("expired sandboxes are removed by the cleanup pass")
        void removesExpired() {
            SandboxEnvironment env = create(null);
            properties.setMaxAge(Duration.ofHours(24));

            Clock later = Clock.fixed(Instant.now().plus(Duration.ofHours(25)), ZoneOffset.UTC);
            var reloaded = new LocalSandboxProvider(properties, Duration.ZERO, later);
            reloaded.initialize();
            try {
                assertEquals(1, reloaded.cleanupExpired());
                assertFalse(Files.exists(rootOf(env)));
            } finally {
                reloaded.cleanup();
            }
        }

        @Test
        @DisplayName("recent sandboxes survive the cleanup pass")
        void keepsRecent() {
            create(null);
            assertEquals(0, provider.cleanupExpired());
        }
    }

    // -- Execution tests ------------------------------------------------------

    @Nested
    @DisplayName("executeCommand")
    @DisabledOnOs(OS.WINDOWS)
    class ExecutionTests {

        @Test
        @DisplayName("captures stdout and exit code 0")
        void capturesOutput() {
            SandboxEnvironment env = create(null);

            ExecutionResult result = provider.executeCommand(env.id(), "echo hello", ExecOptions.defaults());

            assertTrue(result.success());
            assertEquals(0, result.exitCode());
            assertEquals("hello\n", result.output());
            assertNull(result.error());
        }

        @Test
        @DisplayName("a non-zero exit is returned, not thrown")
        void nonZeroExit() {
            SandboxEnvironment env = create(null);

            ExecutionResult result = provider.executeCommand(env.id(), "echo oops >&2; exit 7", ExecOptions.defaults());

            assertFalse(result.success());
            assertEquals(7, result.exitCode());
            assertEquals("oops\n", result.error());
        }

        @Test
        @DisplayName("a command past its timeout reports exit 124")
        void timesOut() {
            SandboxEnvironment env = create(null);

            ExecutionResult result = provider.executeCommand(env.id(), "sleep 5",
                    ExecOptions.withTimeout(Duration.ofMillis(300)));

            assertFalse(result.success());
            assertEquals(ExecutionResult.TIMEOUT_EXIT_CODE, result.exitCode());
            assertTrue(result.durationMs() < 5000);
        }

        @Test
        @DisplayName("runs in the sandbox with SANDBOX_ID and overlaid environment")
        void environmentAndWorkingDir() throws IOException {
            SandboxEnvironment env = create(null);
            Files.createDirectories(rootOf(env).resolve("src"));

            ExecutionResult result = provider.executeCommand(env.id(), "echo $SANDBOX_ID $GREETING; pwd",
                    new ExecOptions("src", null, Map.of("GREETING", "hi")));

            String[] lines = result.output().split("\n");
            assertEquals(env.id() + " hi", lines[0]);
            assertTrue(lines[1].endsWith("/src"), lines[1]);
        }

        @Test
        @DisplayName("missing working directory fails with exit 1")
        void missingWorkingDir() {
            SandboxEnvironment env = create(null);

            ExecutionResult result = provider.executeCommand(env.id(), "true",
                    new ExecOptions("nope", null, null));

            assertEquals(1, result.exitCode());
            assertTrue(result.error().contains("nope"));
        }

        @Test
        @DisplayName("executions are appended to the sandbox log")
        void logsExecutions() {
            SandboxEnvironment env = create(null);
            provider.executeCommand(env.id(), "true", ExecOptions.defaults());

            List<String> all = provider.getLogs(env.id(), LogOptions.all());
            assertTrue(all.get(0).contains("[lifecycle] created"));
            List<String> last = provider.getLogs(env.id(), LogOptions.tail(1));
            assertEquals(1, last.size());
            assertTrue(last.get(0).contains("[exec] true (exit 0"));
            assertTrue(provider.getLogs(env.id(),
                    new LogOptions(Instant.now().plus(Duration.ofHours(1)), null, null)).isEmpty());
        }
    }

    // -- File tests -----------------------------------------------------------

    @Nested
    @DisplayName("files")
    class FileTests {

        private SandboxEnvironment env;

        @BeforeEach
        void createSandbox() {
            env = create(null);
            events.clear();
        }

        @Test
        @DisplayName("write then read returns the content and emits created, then modified")
        void writeAndRead() {
            provider.writeFile(env.id(), "src/app.js", "let a = 1;", WriteFileOptions.defaults());
            provider.writeFile(env.id(), "src/app.js", "let a = 2;", WriteFileOptions.defaults());

            SandboxFile file = provider.readFile(env.id(), "src/app.js", ReadFileOptions.defaults());
            assertEquals("let a = 2;", file.asText());
            assertEquals(10, file.size());
            assertEquals(List.of("created", "modified"),
                    events.stream().map(e -> e.payload().get("type")).toList());
        }

        @Test
        @DisplayName("base64 writes are decoded to bytes")
        void base64Write() {
            byte[] bytes = {0, 1, 2, (byte) 0xff};
            provider.writeFile(env.id(), "blob.bin", Base64.getEncoder().encodeToString(bytes),
                    new WriteFileOptions(FileEncoding.BASE64, true, false));

            SandboxFile file = provider.readFile(env.id(), "blob.bin", new ReadFileOptions(FileEncoding.BASE64, null));
            assertArrayEquals(bytes, file.content());
            assertEquals(Base64.getEncoder().encodeToString(bytes), file.encodedContent());
        }

        @Test
        @DisplayName("backup keeps the previous version")
        void backup() throws IOException {
            provider.writeFile(env.id(), "notes.txt", "v1", WriteFileOptions.defaults());
            provider.writeFile(env.id(), "notes.txt", "v2", new WriteFileOptions(FileEncoding.UTF_8, true, true));

            assertEquals("v1", Files.readString(rootOf(env).resolve("notes.txt.backup")));
            assertEquals("v2", Files.readString(rootOf(env).resolve("notes.txt")));
        }

        @Test
        @DisplayName("write without createDirs fails when the parent is missing")
        void noCreateDirs() {
            assertThrows(SandboxException.class, () -> provider.writeFile(env.id(), "deep/x.txt", "x",
                    new WriteFileOptions(FileEncoding.UTF_8, false, false)));
        }

        @Test
        @DisplayName("reading a missing file returns null; an oversized file is rejected")
        void readLimits() {
            assertNull(provider.readFile(env.id(), "missing.txt", ReadFileOptions.defaults()));

            provider.writeFile(env.id(), "big.txt", "0123456789", WriteFileOptions.defaults());
            assertThrows(SandboxException.class,
                    () -> provider.readFile(env.id(), "big.txt", new ReadFileOptions(FileEncoding.UTF_8, 5L)));
        }

        @Test
        @DisplayName("paths escaping the sandbox root are rejected")
        void pathEscape() {
            assertThrows(IllegalArgumentException.class,
                    () -> provider.writeFile(env.id(), "../escape.txt", "x", WriteFileOptions.defaults()));
            assertThrows(IllegalArgumentException.class,
                    () -> provider.readFile(env.id(), "a/../../escape.txt", ReadFileOptions.defaults()));
            assertFalse(Files.exists(tempDir.resolve("escape.txt")));
        }

        @Test
        @DisplayName("listFiles hides dot files unless asked and recurses on request")
        void listFiles() {
            provider.writeFile(env.id(), "README.md", "# demo", WriteFileOptions.defaults());
            provider.writeFile(env.id(), "src/index.js", "", WriteFileOptions.defaults());
            provider.writeFile(env.id(), ".env", "A=1", WriteFileOptions.defaults());

            var top = provider.listFiles(env.id(), "", ListFilesOptions.defaults());
            assertEquals(List.of("README.md", "src"), top.stream().map(FileSystemEntry::path).toList());
            assertTrue(top.get(1).isDirectory());
            assertNull(top.get(1).size());

            var recursive = provider.listFiles(env.id(), "/", ListFilesOptions.recursively());
            assertTrue(recursive.stream().anyMatch(e -> e.path().equals("src/index.js")));

            var hidden = provider.listFiles(env.id(), "", new ListFilesOptions(false, true, null));
            assertTrue(hidden.stream().anyMatch(e -> e.path().equals(".env")));
            assertTrue(hidden.stream().anyMatch(e -> e.path().equals(LocalSandboxProvider.METADATA_FILE)));
        }

        @Test
        @DisplayName("deleteFile honours recursive and force")
        void deleteFile() {
            provider.writeFile(env.id(), "dir/a.txt", "a", WriteFileOptions.defaults());

            assertThrows(SandboxException.class,
                    () -> provider.deleteFile(env.id(), "dir", new DeleteFileOptions(false, false)));
            assertTrue(provider.deleteFile(env.id(), "dir", new DeleteFileOptions(true, false)));
            assertFalse(Files.exists(rootOf(env).resolve("dir")));

            assertFalse(provider.deleteFile(env.id(), "ghost.txt", DeleteFileOptions.defaults()));
            assertTrue(provider.deleteFile(env.id(), "ghost.txt", new DeleteFileOptions(false, true)));
            assertThrows(IllegalArgumentException.class,
                    () -> provider.deleteFile(env.id(), "/", new DeleteFileOptions(true, true)));
        }

        @Test
        @DisplayName("createDirectory builds nested directories")
        void createDirectory() {
            provider.createDirectory(env.id(), "a/b/c", CreateDirectoryOptions.defaults());
            assertTrue(Files.isDirectory(rootOf(env).resolve("a/b/c")));

            assertThrows(SandboxException.class, () -> provider.createDirectory(env.id(), "x/y",
                    new CreateDirectoryOptions(false, null)));
        }

        @Test
        @DisplayName("upload and download go through the default batch operations")
        void uploadAndDownload() {
            UploadResult result = provider.uploadFiles(env.id(), List.of(
                    new UploadFile("one.txt", "1", FileEncoding.UTF_8),
                    new UploadFile("two.txt", "2", FileEncoding.UTF_8)),
                    new UploadOptions("docs", true, true));

            assertEquals(List.of("docs/one.txt", "docs/two.txt"), result.uploaded());
            assertTrue(result.failed().isEmpty());

            Map<String, byte[]> downloaded = provider.downloadFiles(env.id(), List.of("one.txt", "nope.txt"), "docs");
            assertEquals("1", new String(downloaded.get("one.txt"), StandardCharsets.UTF_8));
            assertFalse(downloaded.containsKey("nope.txt"));
        }
    }

    // -- Snapshot tests -------------------------------------------------------

    @Nested
    @DisplayName("snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("restore brings back snapshot content but keeps preserved files")
        void restorePreservesFiles() throws IOException {
            SandboxEnvironment env = create(null);
            Path root = rootOf(env);
            provider.writeFile(env.id(), "app.js", "v1", WriteFileOptions.defaults());
            provider.writeFile(env.id(), ".env", "SECRET=old", WriteFileOptions.defaults());

            SnapshotInfo snapshot = provider.createSnapshot(env.id(), "before", SnapshotOptions.defaults()).value();
            assertTrue(snapshot.snapshotId().startsWith("snapshot-" + env.id() + "-"));
            assertTrue(snapshot.size() > 0);

            provider.writeFile(env.id(), "app.js", "v2", WriteFileOptions.defaults());
            provider.writeFile(env.id(), ".env", "SECRET=new", WriteFileOptions.defaults());
            provider.writeFile(env.id(), "extra.js", "later", WriteFileOptions.defaults());

            var result = provider.restoreSnapshot(env.id(), snapshot.snapshotId(),
                    new RestoreOptions(List.of(".env"), false));

            assertTrue(result.value());
            assertEquals("v1", Files.readString(root.resolve("app.js")));
            assertEquals("SECRET=new", Files.readString(root.resolve(".env")));
            assertFalse(Files.exists(root.resolve("extra.js")));
            assertFalse(Files.exists(root.resolve(LocalSandboxProvider.SNAPSHOT_METADATA_FILE)));
            assertTrue(Files.isRegularFile(root.resolve(LocalSandboxProvider.METADATA_FILE)));
            assertNotNull(provider.getSandbox(env.id()));
        }

        @Test
        @DisplayName("snapshot metadata is written next to the copy")
        void snapshotMetadata() {
            SandboxEnvironment env = create(null);
            SnapshotInfo snapshot = provider.createSnapshot(env.id(), "s1",
                    new SnapshotOptions("first", false, false)).value();

            Path dir = provider.basePath().resolve(LocalSandboxProvider.SNAPSHOTS_DIR).resolve(snapshot.snapshotId());
            assertTrue(Files.isRegularFile(dir.resolve(LocalSandboxProvider.SNAPSHOT_METADATA_FILE)));
            assertEquals("first", snapshot.description());
        }

        @Test
        @DisplayName("snapshots taken in the same millisecond get distinct ids and keep their own content")
        void sameInstantSnapshots() throws IOException {
            LocalProperties fixedProperties = new LocalProperties();
            fixedProperties.setBasePath(tempDir.resolve("fixed").toString());
            fixedProperties.setCleanupInterval(Duration.ZERO);
            Clock fixed = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
            var fixedProvider = new LocalSandboxProvider(fixedProperties, Duration.ZERO, fixed);
            fixedProvider.initialize();
            try {
                SandboxEnvironment env = fixedProvider.createSandbox(SandboxCreateOptions.builder().build());
                fixedProvider.writeFile(env.id(), "a.txt", "v1", WriteFileOptions.defaults());
                SnapshotInfo first = fixedProvider.createSnapshot(env.id(), "one", SnapshotOptions.defaults()).value();
                fixedProvider.writeFile(env.id(), "a.txt", "v2", WriteFileOptions.defaults());
                SnapshotInfo second = fixedProvider.createSnapshot(env.id(), "two", SnapshotOptions.defaults()).value();

                assertNotEquals(first.snapshotId(), second.snapshotId());

                fixedProvider.restoreSnapshot(env.id(), first.snapshotId(), RestoreOptions.defaults());
                assertEquals("v1", new String(fixedProvider.readFile(env.id(), "a.txt", ReadFileOptions.defaults())
                        .content(), StandardCharsets.UTF_8));
            } finally {
                fixedProvider.cleanup();
            }
        }

        @Test
        @DisplayName("restoring an unknown snapshot fails")
        void unknownSnapshot() {
            SandboxEnvironment env = create(null);
            assertThrows(SandboxException.class,
                    () -> provider.restoreSnapshot(env.id(), "snapshot-none", RestoreOptions.defaults()));
        }
    }

    // -- Terminal and health tests --------------------------------------------

    @Test
    @DisplayName("terminal sessions connect and disconnect once")
    void terminals() {
        SandboxEnvironment env = create(null);

        TerminalSession session = provider.connectTerminal(env.id(), TerminalOptions.defaults()).value();

        assertTrue(session.sessionId().startsWith("terminal-" + env.id()));
        assertNull(session.wsUrl());
        assertTrue(provider.disconnectTerminal(env.id(), session.sessionId()).value());
        assertFalse(provider.disconnectTerminal(env.id(), session.sessionId()).value());
        assertTrue(eventTypes().containsAll(
                List.of(SandboxEventType.TERMINAL_CONNECTED, SandboxEventType.TERMINAL_DISCONNECTED)));
    }

    @Test
    @DisplayName("healthCheck probes the base path and getProviderInfo reports usage")
    void healthAndInfo() {
        create(null);

        ProviderHealth health = provider.healthCheck();
        assertTrue(health.healthy());
        assertFalse(Files.exists(tempDir.resolve(".health-check")));

        ProviderInfo info = provider.getProviderInfo();
        assertEquals(ProviderInfo.Status.HEALTHY, info.status());
        assertEquals(1, info.usage().activeSandboxes());
        assertEquals(1024, info.usage().memory());
    }

    @Test
    @DisplayName("getMetrics reports storage and uptime")
    void metrics() {
        SandboxEnvironment env = create("node");

        SandboxMetrics metrics = provider.getMetrics(env.id());

        assertNotNull(metrics);
        assertTrue(metrics.storage().usage() > 0);
        assertEquals(10240, metrics.storage().limit());
        assertNull(provider.getMetrics("local-missing"));
    }
}
