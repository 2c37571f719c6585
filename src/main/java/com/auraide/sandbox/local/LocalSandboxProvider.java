package com.auraide.sandbox.local;

import com.auraide.core.events.SandboxEventType;
import com.auraide.sandbox.AbstractSandboxProvider;
import com.auraide.sandbox.Capability;
import com.auraide.sandbox.CapabilityResult;
import com.auraide.sandbox.ProviderCapabilities;
import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.SandboxException;
import com.auraide.sandbox.SandboxNotFoundException;
import com.auraide.sandbox.model.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeroturnaround.exec.ProcessExecutor;
import org.zeroturnaround.exec.ProcessResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reference provider that keeps each sandbox as a directory on the local filesystem.
 *
 * <p>Layout under {@link LocalProperties#getBasePath()}:
 * <pre>
 *   local-&lt;ts&gt;-&lt;rand&gt;/                 sandbox root
 *   local-&lt;ts&gt;-&lt;rand&gt;/.sandbox-metadata.json
 *   local-&lt;ts&gt;-&lt;rand&gt;/.logs/sandbox.log
 *   snapshots/snapshot-&lt;id&gt;-&lt;ts&gt;/       snapshot copies
 * </pre>
 *
 * <p>Commands run on the host through a shell with no isolation; this provider is for
 * development and as a fallback.
 */
public class LocalSandboxProvider extends AbstractSandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalSandboxProvider.class);

    static final String METADATA_FILE = ".sandbox-metadata.json";
    static final String SNAPSHOT_METADATA_FILE = ".snapshot-metadata.json";
    static final String SNAPSHOTS_DIR = "snapshots";
    private static final String LOG_FILE = ".logs/sandbox.log";
    private static final String HEALTH_CHECK_FILE = ".health-check";
    private static final String VERSION = "1.0.0";

    private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(
            true, true, false, true, false, 5, List.of("node", "python", "shell", "static"));

    private final LocalProperties properties;
    private final Duration restartSettleDelay;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Path basePath;

    private final Map<String, LocalSandboxMetadata> sandboxes = new ConcurrentHashMap<>();
    private final Map<String, String> terminals = new ConcurrentHashMap<>();

    private ScheduledExecutorService cleanupScheduler;
    private ExecutorService ioExecutor;

    public LocalSandboxProvider(LocalProperties properties, Duration restartSettleDelay) {
        this(properties, restartSettleDelay, Clock.systemUTC());
    }

    LocalSandboxProvider(LocalProperties properties, Duration restartSettleDelay, Clock clock) {
        this.properties = properties;
        this.restartSettleDelay = restartSettleDelay != null ? restartSettleDelay : Duration.ZERO;
        this.clock = clock;
        this.basePath = Path.of(properties.getBasePath()).toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public ProviderType type() {
        return ProviderType.LOCAL;
    }

    @Override
    public ProviderCapabilities capabilities() {
        return new ProviderCapabilities(CAPABILITIES.supportsFileSystem(), CAPABILITIES.supportsTerminal(),
                CAPABILITIES.supportsPortForwarding(), CAPABILITIES.supportsSnapshots(),
                CAPABILITIES.supportsResourceScaling(), properties.getMaxConcurrentSandboxes(),
                CAPABILITIES.supportedRuntimes());
    }

    /**
     * Creates the base directory and rehydrates every sandbox whose sidecar parses.
     */
    @Override
    public void initialize() {
        try {
            Files.createDirectories(basePath);
        } catch (IOException e) {
            throw new SandboxException("Cannot create local sandbox base path " + basePath, e);
        }
        try (var children = Files.list(basePath)) {
            for (Path dir : children.filter(Files::isDirectory).toList()) {
                if (SNAPSHOTS_DIR.equals(dir.getFileName().toString())) {
                    continue;
                }
                Path sidecar = dir.resolve(METADATA_FILE);
                if (!Files.isRegularFile(sidecar)) {
                    continue;
                }
                try {
                    LocalSandboxMetadata metadata = objectMapper.readValue(sidecar.toFile(), LocalSandboxMetadata.class);
                    sandboxes.put(metadata.id(), metadata);
                } catch (IOException e) {
                    log.warn("Skipping local sandbox {} with unreadable metadata: {}", dir.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new SandboxException("Cannot scan local sandbox base path " + basePath, e);
        }

        ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "local-sandbox-io");
            t.setDaemon(true);
            return t;
        });
        Duration interval = properties.getCleanupInterval();
        if (interval != null && !interval.isZero() && !interval.isNegative()) {
            cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "local-sandbox-cleanup");
                t.setDaemon(true);
                return t;
            });
            cleanupScheduler.scheduleAtFixedRate(() -> {
                try {
                    cleanupExpired();
                } catch (RuntimeException e) {
                    log.warn("Local sandbox cleanup failed: {}", e.getMessage(), e);
                }
            }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Local provider initialized at {} ({} existing sandbox(es))", basePath, sandboxes.size());
    }

    @Override
    public void cleanup() {
        if (cleanupScheduler != null) {
            cleanupScheduler.shutdownNow();
            cleanupScheduler = null;
        }
        if (ioExecutor != null) {
            ioExecutor.shutdownNow();
            ioExecutor = null;
        }
        terminals.clear();
    }

    // -- Lifecycle -----------------------------------------------------------

    @Override
    public SandboxEnvironment createSandbox(SandboxCreateOptions options) {
        if (sandboxes.size() >= properties.getMaxConcurrentSandboxes()) {
            throw new SandboxException("Maximum concurrent local sandboxes ("
                    + properties.getMaxConcurrentSandboxes() + ") reached");
        }
        Instant now = clock.instant();
        String id = "local-" + now.toEpochMilli() + "-" + randomSuffix();
        Path root = basePath.resolve(id);
        String runtime = options.runtime() != null ? options.runtime() : "node";

        Map<String, String> metadata = new LinkedHashMap<>(options.metadata());
        putIfNotNull(metadata, "projectId", options.projectId());
        putIfNotNull(metadata, "userId", options.userId());
        putIfNotNull(metadata, "description", options.description());
        putIfNotNull(metadata, "template", options.template());
        metadata.put("runtime", runtime);
        metadata.put("createdBy", "local-provider");

        ResourceSpec requested = options.resources() != null ? options.resources() : new ResourceSpec(null, null, null);
        var sandbox = new LocalSandboxMetadata(
                id,
                options.name() != null ? options.name() : id,
                root.toString(),
                SandboxStatus.RUNNING,
                options.template(),
                runtime,
                requested.orDefaults(1, 1024, 10240),
                options.ports(),
                options.environment(),
                metadata,
                options.timeoutMinutes(),
                now,
                now);

        try {
            Files.createDirectories(root);
            StarterTemplate.fromName(options.template()).ifPresent(template -> {
                try {
                    template.writeTo(root);
                } catch (IOException e) {
                    throw new SandboxException("Failed to write template '" + template.templateName() + "'", e);
                }
            });
            save(sandbox);
            appendLog(root, "[lifecycle] created");
        } catch (IOException | RuntimeException e) {
            try {
                LocalFiles.deleteRecursively(root);
            } catch (IOException cleanupError) {
                e.addSuppressed(cleanupError);
            }
            throw e instanceof SandboxException se ? se
                    : new SandboxException("Failed to create local sandbox: " + e.getMessage(), e);
        }

        sandboxes.put(id, sandbox);
        SandboxEnvironment environment = toEnvironment(sandbox);
        emit(SandboxEventType.SANDBOX_CREATED, environment);
        log.info("Created local sandbox {} at {}", id, root);
        return environment;
    }

    @Override
    public SandboxEnvironment getSandbox(String sandboxId) {
        LocalSandboxMetadata sandbox = sandboxes.get(sandboxId);
        if (sandbox == null) {
            return null;
        }
        LocalSandboxMetadata touched = sandbox.withLastActivity(clock.instant());
        try {
            persist(touched);
        } catch (SandboxNotFoundException e) {
            log.debug("Sandbox {} was deleted during lookup", sandboxId);
            return null;
        }
        return toEnvironment(touched);
    }

    @Override
    public List<SandboxEnvironment> listSandboxes(SandboxFilters filters) {
        return sandboxes.values().stream()
                .sorted(Comparator.comparing(LocalSandboxMetadata::createdAt))
                .map(this::toEnvironment)
                .filter(filters::matches)
                .toList();
    }

    @Override
    public SandboxEnvironment updateSandbox(String sandboxId, SandboxUpdateOptions options) {
        LocalSandboxMetadata sandbox = require(sandboxId);
        if (options.requestsResources()) {
            requireCapability(Capability.RESOURCE_SCALING);
        }
        Map<String, String> mergedMetadata = null;
        if (options.metadata() != null) {
            mergedMetadata = new LinkedHashMap<>(sandbox.metadata());
            mergedMetadata.putAll(options.metadata());
        }
        LocalSandboxMetadata updated = sandbox.withUpdates(options.ports(), options.environment(), mergedMetadata,
                options.timeoutMinutes(), clock.instant());
        persist(updated);
        return toEnvironment(updated);
    }

    @Override
    public SandboxEnvironment startSandbox(String sandboxId) {
        return transition(sandboxId, SandboxStatus.RUNNING, SandboxEventType.SANDBOX_STARTED);
    }

    @Override
    public SandboxEnvironment stopSandbox(String sandboxId) {
        return transition(sandboxId, SandboxStatus.STOPPED, SandboxEventType.SANDBOX_STOPPED);
    }

    @Override
    public SandboxEnvironment restartSandbox(String sandboxId) {
        stopSandbox(sandboxId);
        try {
            Thread.sleep(restartSettleDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while restarting sandbox " + sandboxId, e);
        }
        return startSandbox(sandboxId);
    }

    /**
     * Claims the sandbox before touching the disk, so concurrent callers (the
     * expiry timer and the manager's reaper) see {@code false} instead of a
     * second delete.
     */
    @Override
    public boolean deleteSandbox(String sandboxId) {
        LocalSandboxMetadata sandbox = sandboxes.remove(sandboxId);
        if (sandbox == null) {
            return false;
        }
        Path root = Path.of(sandbox.path());
        LocalSandboxMetadata stopped = sandbox.withStatus(SandboxStatus.STOPPED, clock.instant());
        try {
            save(stopped);
        } catch (IOException e) {
            log.debug("Could not record stopped status for {} before delete: {}", sandboxId, e.getMessage());
        }
        emit(SandboxEventType.SANDBOX_STOPPED, toEnvironment(stopped));
        try {
            LocalFiles.deleteRecursively(root);
        } catch (IOException e) {
            sandboxes.putIfAbsent(sandboxId, stopped);
            throw new SandboxException("Failed to delete local sandbox " + sandboxId, e);
        }
        terminals.values().removeIf(sandboxId::equals);
        emit(SandboxEventType.SANDBOX_DELETED, sandboxId,
                toEnvironment(stopped.withStatus(SandboxStatus.TERMINATED, clock.instant())), Map.of());
        log.info("Deleted local sandbox {}", sandboxId);
        return true;
    }

    @Override
    public SandboxMetrics getMetrics(String sandboxId) {
        LocalSandboxMetadata sandbox = sandboxes.get(sandboxId);
        if (sandbox == null) {
            return null;
        }
        Instant now = clock.instant();
        double storageMb = LocalFiles.sizeOf(Path.of(sandbox.path())) / (1024.0 * 1024.0);
        ResourceSpec resources = sandbox.resources();
        return new SandboxMetrics(
                new SandboxMetrics.Cpu(0, resources.cpu()),
                SandboxMetrics.Usage.of(0, resources.memory()),
                SandboxMetrics.Usage.of(storageMb, resources.storage()),
                SandboxMetrics.Network.idle(),
                Duration.between(sandbox.createdAt(), now).getSeconds(),
                now);
    }

    // -- Execution -----------------------------------------------------------

    @Override
    public ExecutionResult executeCommand(String sandboxId, String command, ExecOptions options) {
        LocalSandboxMetadata sandbox = require(sandboxId);
        Path root = Path.of(sandbox.path());
        Path workingDir = LocalFiles.resolveWithin(root, options.workingDir());
        Duration timeout = options.timeout() != null ? options.timeout() : properties.getDefaultCommandTimeout();
        long started = System.nanoTime();

        if (!Files.isDirectory(workingDir)) {
            return ExecutionResult.failed(1, "", "Working directory does not exist: " + options.workingDir(), 0);
        }

        Map<String, String> environment = new LinkedHashMap<>(sandbox.environment());
        environment.putAll(options.environment());
        environment.put("SANDBOX_ID", sandboxId);

        var stdout = new BoundedOutputStream(properties.getMaxOutputBytes());
        var stderr = new BoundedOutputStream(properties.getMaxOutputBytes());
        ExecutionResult result;
        try {
            ProcessResult processResult = new ProcessExecutor()
                    .command(shellCommand(command))
                    .directory(workingDir.toFile())
                    .environment(environment)
                    .redirectOutput(stdout)
                    .redirectError(stderr)
                    .timeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .destroyOnExit()
                    .execute();
            long elapsed = elapsedMs(started);
            if (stdout.overflowed() || stderr.overflowed()) {
                result = ExecutionResult.failed(processResult.getExitValue() != 0 ? processResult.getExitValue() : 1,
                        stdout.text(),
                        "Output exceeded " + properties.getMaxOutputBytes() + " bytes",
                        elapsed);
            } else {
                result = ExecutionResult.completed(processResult.getExitValue(), stdout.text(), stderr.text(), elapsed);
            }
        } catch (TimeoutException e) {
            result = ExecutionResult.timedOut(stdout.text(), timeout.toMillis(), elapsedMs(started));
        } catch (IOException e) {
            result = ExecutionResult.failed(1, stdout.text(), "Failed to start command: " + e.getMessage(),
                    elapsedMs(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while running command in sandbox " + sandboxId, e);
        }

        appendLog(root, "[exec] " + command + " (exit " + result.exitCode() + ", " + result.durationMs() + "ms)");
        log.debug("Command in {} exited {} after {}ms", sandboxId, result.exitCode(), result.durationMs());
        return result;
    }

    private static List<String> shellCommand(String command) {
        if (System.getProperty("os.name", "").toLowerCase().contains("win")) {
            return List.of("cmd", "/c", command);
        }
        return List.of("bash", "-c", command);
    }

    // -- Files ---------------------------------------------------------------

    @Override
    public List<FileSystemEntry> listFiles(String sandboxId, String path, ListFilesOptions options) {
        Path root = Path.of(require(sandboxId).path());
        Path dir = LocalFiles.resolveWithin(root, path);
        if (!Files.isDirectory(dir)) {
            throw new SandboxException("Not a directory: " + (path == null || path.isBlank() ? "/" : path));
        }
        List<FileSystemEntry> entries = new ArrayList<>();
        int depth = options.effectiveDepth();
        try {
            Files.walkFileTree(dir, EnumSet.noneOf(FileVisitOption.class), depth,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                            if (d.equals(dir)) {
                                return FileVisitResult.CONTINUE;
                            }
                            if (!options.includeHidden() && isHidden(d)) {
                                return FileVisitResult.SKIP_SUBTREE;
                            }
                            entries.add(entry(root, d, attrs));
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                            if (options.includeHidden() || !isHidden(file)) {
                                entries.add(entry(root, file, attrs));
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(Path file, IOException exc) {
                            log.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException e) {
            throw new SandboxException("Failed to list " + path + " in sandbox " + sandboxId, e);
        }
        entries.sort(Comparator.comparing(FileSystemEntry::path));
        return entries;
    }

    private static boolean isHidden(Path path) {
        return path.getFileName().toString().startsWith(".");
    }

    private static FileSystemEntry entry(Path root, Path path, BasicFileAttributes attrs) {
        boolean directory = attrs.isDirectory();
        return new FileSystemEntry(
                LocalFiles.relativize(root, path),
                directory ? FileSystemEntry.EntryType.DIRECTORY : FileSystemEntry.EntryType.FILE,
                directory ? null : attrs.size(),
                attrs.lastModifiedTime().toInstant(),
                LocalFiles.permissions(path, directory));
    }

    @Override
    public SandboxFile readFile(String sandboxId, String path, ReadFileOptions options) {
        Path file = LocalFiles.resolveWithin(Path.of(require(sandboxId).path()), path);
        if (!Files.exists(file)) {
            return null;
        }
        if (Files.isDirectory(file)) {
            throw new SandboxException("Cannot read a directory: " + path);
        }
        long limit = options.maxSize() != null ? options.maxSize() : properties.getMaxFileSize().toBytes();
        try {
            long size = Files.size(file);
            if (size > limit) {
                throw new SandboxException("File " + path + " is " + size + " bytes, exceeding the " + limit + " byte limit");
            }
            return new SandboxFile(path, Files.readAllBytes(file), options.encoding(), size,
                    Files.getLastModifiedTime(file).toInstant());
        } catch (IOException e) {
            throw new SandboxException("Failed to read " + path + " in sandbox " + sandboxId, e);
        }
    }

    @Override
    public void writeFile(String sandboxId, String path, String content, WriteFileOptions options) {
        Path file = LocalFiles.resolveWithin(Path.of(require(sandboxId).path()), path);
        byte[] bytes = options.encoding().decode(content);
        if (bytes.length > properties.getMaxFileSize().toBytes()) {
            throw new SandboxException("Content for " + path + " exceeds the maximum file size");
        }
        boolean existed = Files.exists(file);
        try {
            Path parent = file.getParent();
            if (options.createDirs()) {
                Files.createDirectories(parent);
            } else if (!Files.isDirectory(parent)) {
                throw new SandboxException("Parent directory does not exist for " + path);
            }
            if (options.backup() && existed) {
                Files.copy(file, file.resolveSibling(file.getFileName() + ".backup"), StandardCopyOption.REPLACE_EXISTING);
            }
            Files.write(file, bytes);
        } catch (IOException e) {
            throw new SandboxException("Failed to write " + path + " in sandbox " + sandboxId, e);
        }
        emit(SandboxEventType.FILE_CHANGED, sandboxId, null,
                Map.of("path", path, "type", existed ? "modified" : "created", "size", bytes.length));
    }

    @Override
    public boolean deleteFile(String sandboxId, String path, DeleteFileOptions options) {
        Path root = Path.of(require(sandboxId).path());
        Path target = LocalFiles.resolveWithin(root, path);
        if (target.equals(root)) {
            throw new IllegalArgumentException("Refusing to delete the sandbox root");
        }
        if (!Files.exists(target)) {
            return options.force();
        }
        try {
            if (Files.isDirectory(target)) {
                if (options.recursive()) {
                    LocalFiles.deleteRecursively(target);
                } else {
                    try (var children = Files.list(target)) {
                        if (children.findAny().isPresent()) {
                            throw new SandboxException("Directory " + path + " is not empty; use recursive delete");
                        }
                    }
                    Files.delete(target);
                }
            } else {
                Files.delete(target);
            }
        } catch (IOException e) {
            throw new SandboxException("Failed to delete " + path + " in sandbox " + sandboxId, e);
        }
        emit(SandboxEventType.FILE_CHANGED, sandboxId, null, Map.of("path", path, "type", "deleted"));
        return true;
    }

    @Override
    public void createDirectory(String sandboxId, String path, CreateDirectoryOptions options) {
        Path dir = LocalFiles.resolveWithin(Path.of(require(sandboxId).path()), path);
        try {
            if (options.recursive()) {
                Files.createDirectories(dir);
            } else {
                Files.createDirectory(dir);
            }
            if (options.permissions() != null) {
                LocalFiles.applyPermissions(dir, options.permissions());
            }
        } catch (IOException e) {
            throw new SandboxException("Failed to create directory " + path + " in sandbox " + sandboxId, e);
        }
        emit(SandboxEventType.FILE_CHANGED, sandboxId, null,
                Map.of("path", path, "type", "created", "directory", true));
    }

    // -- Snapshots -----------------------------------------------------------

    @Override
    public CapabilityResult<SnapshotInfo> createSnapshot(String sandboxId, String name, SnapshotOptions options) {
        Path root = Path.of(require(sandboxId).path());
        Instant now = clock.instant();
        String snapshotId = "snapshot-" + sandboxId + "-" + now.toEpochMilli() + "-" + randomSuffix();
        Path snapshotDir = basePath.resolve(SNAPSHOTS_DIR).resolve(snapshotId);
        try {
            Files.createDirectories(snapshotDir.getParent());
            Files.createDirectory(snapshotDir);
        } catch (IOException e) {
            throw new SandboxException("Failed to create snapshot directory " + snapshotId, e);
        }
        try {
            runBounded("snapshot " + snapshotId, () -> {
                LocalFiles.copyTree(root, snapshotDir, p -> true);
                return null;
            });
            long size = LocalFiles.sizeOf(snapshotDir);
            var info = new SnapshotInfo(snapshotId, sandboxId, name, options.description(), size, now);
            objectMapper.writeValue(snapshotDir.resolve(SNAPSHOT_METADATA_FILE).toFile(), info);
            log.info("Created snapshot {} of sandbox {} ({} bytes)", snapshotId, sandboxId, size);
            return CapabilityResult.of(info);
        } catch (IOException | RuntimeException e) {
            try {
                LocalFiles.deleteRecursively(snapshotDir);
            } catch (IOException cleanupError) {
                e.addSuppressed(cleanupError);
            }
            throw e instanceof SandboxException se ? se
                    : new SandboxException("Failed to snapshot sandbox " + sandboxId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Replaces the sandbox contents with the snapshot. Files named in
     * {@link RestoreOptions#preserveFiles()} keep their current content.
     */
    @Override
    public CapabilityResult<Boolean> restoreSnapshot(String sandboxId, String snapshotId, RestoreOptions options) {
        LocalSandboxMetadata sandbox = require(sandboxId);
        Path root = Path.of(sandbox.path());
        Path snapshotDir = LocalFiles.resolveWithin(basePath.resolve(SNAPSHOTS_DIR), snapshotId);
        if (snapshotId == null || snapshotId.isBlank() || !Files.isDirectory(snapshotDir)) {
            throw new SandboxException("Snapshot " + snapshotId + " not found");
        }

        Map<String, byte[]> preserved = new LinkedHashMap<>();
        try {
            for (String path : options.preserveFiles()) {
                Path file = LocalFiles.resolveWithin(root, path);
                if (Files.isRegularFile(file)) {
                    preserved.put(path, Files.readAllBytes(file));
                }
            }
            runBounded("restore " + snapshotId, () -> {
                LocalFiles.clearDirectory(root);
                LocalFiles.copyTree(snapshotDir, root,
                        p -> !p.getFileName().toString().equals(SNAPSHOT_METADATA_FILE));
                return null;
            });
            for (var entry : preserved.entrySet()) {
                Path file = LocalFiles.resolveWithin(root, entry.getKey());
                Files.createDirectories(file.getParent());
                Files.write(file, entry.getValue(), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            }
        } catch (IOException e) {
            throw new SandboxException("Failed to restore snapshot " + snapshotId + " into " + sandboxId, e);
        }

        persist(sandbox.withLastActivity(clock.instant()));
        log.info("Restored sandbox {} from {} (preserved {} file(s))", sandboxId, snapshotId, preserved.size());
        if (options.restartAfter()) {
            restartSandbox(sandboxId);
        }
        return CapabilityResult.of(true);
    }

    // -- Terminal ------------------------------------------------------------

    /**
     * Registers a terminal session. The local provider has no websocket bridge, so the URL is null.
     */
    @Override
    public CapabilityResult<TerminalSession> connectTerminal(String sandboxId, TerminalOptions options) {
        require(sandboxId);
        String terminalId = "terminal-" + sandboxId + "-" + clock.millis();
        terminals.put(terminalId, sandboxId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("terminalSessionId", terminalId);
        payload.put("shell", options.shell());
        payload.put("rows", options.rows());
        payload.put("cols", options.cols());
        emit(SandboxEventType.TERMINAL_CONNECTED, sandboxId, null, payload);
        return CapabilityResult.of(new TerminalSession(terminalId, sandboxId, null));
    }

    @Override
    public CapabilityResult<Boolean> disconnectTerminal(String sandboxId, String terminalSessionId) {
        boolean removed = terminals.remove(terminalSessionId) != null;
        if (removed) {
            emit(SandboxEventType.TERMINAL_DISCONNECTED, sandboxId, null,
                    Map.of("terminalSessionId", terminalSessionId));
        }
        return CapabilityResult.of(removed);
    }

    // -- Observability -------------------------------------------------------

    /**
     * Reads {@code .logs/sandbox.log}. Lines start with an ISO-8601 timestamp, which the
     * {@code since}/{@code until} filters compare against.
     */
    @Override
    public List<String> getLogs(String sandboxId, LogOptions options) {
        Path logFile = Path.of(require(sandboxId).path()).resolve(LOG_FILE);
        if (!Files.isRegularFile(logFile)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SandboxException("Failed to read logs for sandbox " + sandboxId, e);
        }
        List<String> filtered = new ArrayList<>();
        for (String line : lines) {
            if (options.since() == null && options.until() == null) {
                filtered.add(line);
                continue;
            }
            Instant at = parseLeadingTimestamp(line);
            if (at == null) {
                continue;
            }
            if (options.since() != null && at.isBefore(options.since())) continue;
            if (options.until() != null && at.isAfter(options.until())) continue;
            filtered.add(line);
        }
        if (options.tail() != null && options.tail() >= 0 && filtered.size() > options.tail()) {
            return List.copyOf(filtered.subList(filtered.size() - options.tail(), filtered.size()));
        }
        return filtered;
    }

    private static Instant parseLeadingTimestamp(String line) {
        int space = line.indexOf(' ');
        if (space <= 0) {
            return null;
        }
        try {
            return Instant.parse(line.substring(0, space));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Override
    public ProviderInfo getProviderInfo() {
        int active = 0;
        double cpu = 0;
        long memory = 0;
        for (LocalSandboxMetadata sandbox : sandboxes.values()) {
            if (sandbox.status() == SandboxStatus.RUNNING) {
                active++;
                cpu += sandbox.resources().cpu();
                memory += sandbox.resources().memory();
            }
        }
        long storageMb = LocalFiles.sizeOf(basePath) / (1024 * 1024);
        return new ProviderInfo(
                ProviderType.LOCAL,
                VERSION,
                ProviderInfo.Status.HEALTHY,
                new ProviderInfo.Limits(properties.getMaxConcurrentSandboxes(), properties.getMaxConcurrentSandboxes(),
                        properties.getMaxFileSize().toBytes(), properties.getMaxExecutionTime().toMillis()),
                new ProviderInfo.Usage(active, sandboxes.size(), cpu, memory, storageMb));
    }

    @Override
    public ProviderHealth healthCheck() {
        long started = System.nanoTime();
        Path probe = basePath.resolve(HEALTH_CHECK_FILE);
        try {
            Files.writeString(probe, clock.instant().toString());
            Files.delete(probe);
            return ProviderHealth.healthy(elapsedMs(started),
                    Map.of("basePath", basePath.toString(), "sandboxes", sandboxes.size()));
        } catch (IOException e) {
            return ProviderHealth.unhealthy(elapsedMs(started), "Base path not writable: " + e.getMessage());
        }
    }

    /**
     * Deletes sandboxes idle for longer than {@link LocalProperties#getMaxAge()}.
     *
     * @return number of sandboxes removed
     */
    int cleanupExpired() {
        Instant cutoff = clock.instant().minus(properties.getMaxAge());
        int removed = 0;
        for (LocalSandboxMetadata sandbox : List.copyOf(sandboxes.values())) {
            if (sandbox.lastActivity().isBefore(cutoff)) {
                try {
                    if (deleteSandbox(sandbox.id())) {
                        removed++;
                    }
                } catch (RuntimeException e) {
                    log.warn("Failed to remove expired local sandbox {}: {}", sandbox.id(), e.getMessage());
                }
            }
        }
        if (removed > 0) {
            log.info("Removed {} expired local sandbox(es)", removed);
        }
        return removed;
    }

    Path basePath() {
        return basePath;
    }

    // -- Internals -----------------------------------------------------------

    private LocalSandboxMetadata require(String sandboxId) {
        LocalSandboxMetadata sandbox = sandboxes.get(sandboxId);
        if (sandbox == null) {
            throw new SandboxNotFoundException(sandboxId, ProviderType.LOCAL);
        }
        return sandbox;
    }

    private SandboxEnvironment transition(String sandboxId, SandboxStatus status, SandboxEventType event) {
        LocalSandboxMetadata updated = require(sandboxId).withStatus(status, clock.instant());
        persist(updated);
        appendLog(Path.of(updated.path()), "[lifecycle] " + status.wireName());
        SandboxEnvironment environment = toEnvironment(updated);
        emit(event, environment);
        return environment;
    }

    // Never re-registers a sandbox that a concurrent delete has already claimed.
    private void persist(LocalSandboxMetadata sandbox) {
        if (sandboxes.replace(sandbox.id(), sandbox) == null) {
            throw new SandboxNotFoundException(sandbox.id(), ProviderType.LOCAL);
        }
        try {
            save(sandbox);
        } catch (IOException e) {
            throw new SandboxException("Failed to save metadata for sandbox " + sandbox.id(), e);
        }
    }

    private void save(LocalSandboxMetadata sandbox) throws IOException {
        objectMapper.writeValue(Path.of(sandbox.path()).resolve(METADATA_FILE).toFile(), sandbox);
    }

    private void appendLog(Path root, String message) {
        Path logFile = root.resolve(LOG_FILE);
        try {
            Files.createDirectories(logFile.getParent());
            Files.writeString(logFile, clock.instant() + " " + message + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.debug("Could not append to sandbox log {}: {}", logFile, e.getMessage());
        }
    }

    private SandboxEnvironment toEnvironment(LocalSandboxMetadata sandbox) {
        Instant expiresAt = sandbox.timeoutMinutes() != null
                ? sandbox.lastActivity().plus(Duration.ofMinutes(sandbox.timeoutMinutes()))
                : null;
        return new SandboxEnvironment(
                sandbox.id(),
                sandbox.name(),
                ProviderType.LOCAL,
                sandbox.status(),
                sandbox.template(),
                sandbox.runtime(),
                sandbox.resources(),
                new NetworkInfo(sandbox.ports(), null),
                sandbox.metadata(),
                sandbox.createdAt(),
                sandbox.lastActivity(),
                expiresAt);
    }

    /**
     * Runs a filesystem task on the I/O executor, failing if it exceeds the snapshot timeout.
     */
    private void runBounded(String description, IoTask task) throws IOException {
        if (ioExecutor == null) {
            throw new SandboxException("Local provider is not initialized");
        }
        Future<Void> future = ioExecutor.submit(() -> {
            task.run();
            return null;
        });
        try {
            future.get(properties.getSnapshotTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SandboxException(description + " timed out after " + properties.getSnapshotTimeout(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SandboxException(description + " interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new SandboxException(description + " failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    @FunctionalInterface
    private interface IoTask {
        Void run() throws IOException;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    private static String randomSuffix() {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return random.substring(0, Math.min(9, random.length()));
    }

    private static void putIfNotNull(Map<String, String> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
