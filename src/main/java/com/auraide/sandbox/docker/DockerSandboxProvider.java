package com.auraide.sandbox.docker;

import com.auraide.core.events.SandboxEventType;
import com.auraide.sandbox.AbstractSandboxProvider;
import com.auraide.sandbox.Capability;
import com.auraide.sandbox.ProviderCapabilities;
import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.SandboxException;
import com.auraide.sandbox.SandboxNotFoundException;
import com.auraide.sandbox.model.*;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs each sandbox as a long-lived Docker container kept alive with {@code sleep infinity}.
 *
 * <p>Containers are labelled {@value #SANDBOX_LABEL}{@code =true}; sandbox metadata travels in
 * {@code aura.meta.*} labels so it survives a restart of this service. Commands and file
 * operations go through Docker exec; file content is moved base64-encoded.
 */
public class DockerSandboxProvider extends AbstractSandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    static final String SANDBOX_LABEL = "aura.sandbox";
    static final String NAME_LABEL = "aura.sandbox.name";
    static final String TEMPLATE_LABEL = "aura.sandbox.template";
    static final String RUNTIME_LABEL = "aura.sandbox.runtime";
    static final String META_PREFIX = "aura.meta.";

    /** Exit code the file scripts use for "path does not exist". */
    static final int MISSING_EXIT_CODE = 44;

    /** Base64 characters per write chunk; stays well under the kernel's single-argument limit. */
    private static final int WRITE_CHUNK_CHARS = 64 * 1024;

    private final DockerClient dockerClient;
    private final DockerProperties properties;
    private final Duration restartSettleDelay;
    private final Clock clock;

    /** Metadata updates applied after creation; container labels are immutable. */
    private final Map<String, Map<String, String>> metadataOverrides = new ConcurrentHashMap<>();

    public DockerSandboxProvider(DockerClient dockerClient, DockerProperties properties, Duration restartSettleDelay) {
        this(dockerClient, properties, restartSettleDelay, Clock.systemUTC());
    }

    DockerSandboxProvider(DockerClient dockerClient, DockerProperties properties, Duration restartSettleDelay,
                          Clock clock) {
        this.dockerClient = dockerClient;
        this.properties = properties;
        this.restartSettleDelay = restartSettleDelay != null ? restartSettleDelay : Duration.ZERO;
        this.clock = clock;
    }

    @Override
    public ProviderType type() {
        return ProviderType.DOCKER;
    }

    @Override
    public ProviderCapabilities capabilities() {
        return new ProviderCapabilities(true, false, false, false, false,
                properties.getMaxContainers(), List.copyOf(properties.getRuntimeImages().keySet()));
    }

    @Override
    public void initialize() {
        try {
            dockerClient.pingCmd().exec();
        } catch (RuntimeException e) {
            throw new SandboxException("Docker daemon not reachable at " + properties.getHost() + ": " + e.getMessage(), e);
        }
        log.info("Docker provider connected to {}", properties.getHost());
    }

    @Override
    public void cleanup() {
        try {
            dockerClient.close();
        } catch (IOException e) {
            log.debug("Error closing Docker client: {}", e.getMessage());
        }
    }

    // -- Lifecycle -----------------------------------------------------------

    @Override
    public SandboxEnvironment createSandbox(SandboxCreateOptions options) {
        if (countSandboxes() >= properties.getMaxContainers()) {
            throw new SandboxException("Maximum Docker sandboxes (" + properties.getMaxContainers() + ") reached");
        }
        String image = properties.imageFor(options.runtime());
        ensureImage(image);

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(SANDBOX_LABEL, "true");
        if (options.name() != null) labels.put(NAME_LABEL, options.name());
        if (options.template() != null) labels.put(TEMPLATE_LABEL, options.template());
        if (options.runtime() != null) labels.put(RUNTIME_LABEL, options.runtime());
        options.metadata().forEach((k, v) -> labels.put(META_PREFIX + k, v));
        if (options.userId() != null) labels.put(META_PREFIX + "userId", options.userId());
        if (options.projectId() != null) labels.put(META_PREFIX + "projectId", options.projectId());
        if (options.description() != null) labels.put(META_PREFIX + "description", options.description());

        ResourceSpec resources = options.resources() != null ? options.resources() : new ResourceSpec(null, null, null);
        long memoryMb = resources.memory() != null ? resources.memory() : properties.getMemoryLimitMb();
        double cpus = resources.cpu() != null ? resources.cpu() : properties.getCpuCount();
        var hostConfig = HostConfig.newHostConfig()
                .withMemory(memoryMb * 1024 * 1024)
                .withCpuCount((long) Math.ceil(cpus));

        List<ExposedPort> exposed = new ArrayList<>();
        var bindings = new Ports();
        for (PortMapping port : options.ports()) {
            ExposedPort exposedPort = "udp".equalsIgnoreCase(port.protocol())
                    ? ExposedPort.udp(port.internal())
                    : ExposedPort.tcp(port.internal());
            exposed.add(exposedPort);
            bindings.bind(exposedPort, port.external() != null
                    ? Ports.Binding.bindPort(port.external())
                    : Ports.Binding.empty());
        }
        hostConfig.withPortBindings(bindings);

        List<String> env = new ArrayList<>();
        options.environment().forEach((k, v) -> env.add(k + "=" + v));

        String containerId = dockerClient.createContainerCmd(image)
                .withLabels(labels)
                .withEnv(env)
                .withExposedPorts(exposed)
                .withHostConfig(hostConfig)
                .withWorkingDir(properties.getWorkingDir())
                .withCmd("sleep", "infinity")
                .exec()
                .getId();
        try {
            dockerClient.startContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            removeQuietly(containerId);
            throw new SandboxException("Failed to start container for new sandbox: " + e.getMessage(), e);
        }

        SandboxEnvironment environment = describe(containerId);
        emit(SandboxEventType.SANDBOX_CREATED, environment);
        log.info("Created Docker sandbox {} from image {}", containerId, image);
        return environment;
    }

    @Override
    public SandboxEnvironment getSandbox(String sandboxId) {
        try {
            InspectContainerResponse container = dockerClient.inspectContainerCmd(sandboxId).exec();
            if (!isSandbox(container.getConfig().getLabels())) {
                return null;
            }
            return toEnvironment(container);
        } catch (NotFoundException e) {
            return null;
        }
    }

    @Override
    public List<SandboxEnvironment> listSandboxes(SandboxFilters filters) {
        List<SandboxEnvironment> result = new ArrayList<>();
        for (Container container : listContainers()) {
            SandboxEnvironment environment = toEnvironment(container);
            if (filters.matches(environment)) {
                result.add(environment);
            }
        }
        return result;
    }

    @Override
    public SandboxEnvironment updateSandbox(String sandboxId, SandboxUpdateOptions options) {
        if (options.requestsResources()) {
            requireCapability(Capability.RESOURCE_SCALING);
        }
        if (options.environment() != null || options.ports() != null) {
            throw new UnsupportedOperationException("Docker sandboxes cannot change environment or ports after creation");
        }
        require(sandboxId);
        Map<String, String> overrides = new LinkedHashMap<>(metadataOverrides.getOrDefault(sandboxId, Map.of()));
        if (options.metadata() != null) {
            overrides.putAll(options.metadata());
        }
        if (options.timeoutMinutes() != null) {
            overrides.put("timeoutMinutes", options.timeoutMinutes().toString());
        }
        metadataOverrides.put(sandboxId, Map.copyOf(overrides));
        return describe(sandboxId);
    }

    @Override
    public SandboxEnvironment startSandbox(String sandboxId) {
        require(sandboxId);
        try {
            dockerClient.startContainerCmd(sandboxId).exec();
        } catch (NotModifiedException e) {
            log.debug("Container {} already running", sandboxId);
        }
        SandboxEnvironment environment = describe(sandboxId);
        emit(SandboxEventType.SANDBOX_STARTED, environment);
        return environment;
    }

    @Override
    public SandboxEnvironment stopSandbox(String sandboxId) {
        require(sandboxId);
        try {
            dockerClient.stopContainerCmd(sandboxId).withTimeout(properties.getStopTimeoutSeconds()).exec();
        } catch (NotModifiedException e) {
            log.debug("Container {} already stopped", sandboxId);
        }
        SandboxEnvironment environment = describe(sandboxId);
        emit(SandboxEventType.SANDBOX_STOPPED, environment);
        return environment;
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

    @Override
    public boolean deleteSandbox(String sandboxId) {
        SandboxEnvironment environment = getSandbox(sandboxId);
        if (environment == null) {
            return false;
        }
        try {
            dockerClient.removeContainerCmd(sandboxId).withForce(true).withRemoveVolumes(true).exec();
        } catch (NotFoundException e) {
            return false;
        }
        metadataOverrides.remove(sandboxId);
        emit(SandboxEventType.SANDBOX_DELETED, sandboxId, environment, Map.of());
        log.info("Deleted Docker sandbox {}", sandboxId);
        return true;
    }

    /**
     * Always null; container stats are not sampled.
     */
    @Override
    public SandboxMetrics getMetrics(String sandboxId) {
        return null;
    }

    // -- Execution -----------------------------------------------------------

    @Override
    public ExecutionResult executeCommand(String sandboxId, String command, ExecOptions options) {
        require(sandboxId);
        String workingDir = containerPath(options.workingDir());
        Duration timeout = options.timeout() != null ? options.timeout() : properties.getDefaultCommandTimeout();
        return execInContainer(sandboxId, List.of("sh", "-c", command), workingDir, options.environment(), timeout);
    }

    /**
     * Runs a command through Docker exec and collects its output.
     */
    ExecutionResult execInContainer(String containerId, List<String> command, String workingDir,
                                    Map<String, String> environment, Duration timeout) {
        long started = System.nanoTime();
        List<String> env = new ArrayList<>();
        environment.forEach((k, v) -> env.add(k + "=" + v));

        String execId;
        try {
            execId = dockerClient.execCreateCmd(containerId)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withWorkingDir(workingDir)
                    .withEnv(env)
                    .withCmd(command.toArray(new String[0]))
                    .exec()
                    .getId();
        } catch (NotFoundException e) {
            throw new SandboxNotFoundException(containerId, ProviderType.DOCKER);
        } catch (ConflictException e) {
            throw new SandboxException("Sandbox " + containerId + " is not running", e);
        }

        var output = new ExecOutput(properties.getMaxOutputBytes());
        try {
            dockerClient.execStartCmd(execId).exec(output);
            if (!output.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                closeQuietly(output, containerId);
                return ExecutionResult.timedOut(output.stdout(), timeout.toMillis(), elapsedMs(started));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(output, containerId);
            throw new SandboxException("Interrupted while running command in sandbox " + containerId, e);
        }

        Long exitCode = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
        int exit = exitCode != null ? exitCode.intValue() : -1;
        if (output.overflowed()) {
            return ExecutionResult.failed(exit != 0 ? exit : 1, output.stdout(),
                    "Output exceeded " + properties.getMaxOutputBytes() + " bytes", elapsedMs(started));
        }
        return ExecutionResult.completed(exit, output.stdout(), output.stderr(), elapsedMs(started));
    }

    // -- Files ---------------------------------------------------------------

    @Override
    public List<FileSystemEntry> listFiles(String sandboxId, String path, ListFilesOptions options) {
        require(sandboxId);
        String dir = containerPath(path);
        String relativeBase = normalizeRelativePath(path);
        StringBuilder script = new StringBuilder("find ").append(quote(dir)).append(" -mindepth 1");
        if (options.effectiveDepth() != Integer.MAX_VALUE) {
            script.append(" -maxdepth ").append(options.effectiveDepth());
        }
        if (!options.includeHidden()) {
            script.append(" \\( -name '.*' -prune \\) -o");
        }
        script.append(" -printf '%y\\t%s\\t%T@\\t%m\\t%P\\n'");

        ExecutionResult result = shell(sandboxId, script.toString());
        if (!result.success()) {
            throw new SandboxException("Failed to list " + path + " in sandbox " + sandboxId + ": " + result.error());
        }
        List<FileSystemEntry> entries = new ArrayList<>();
        for (String line : result.output().split("\n")) {
            String[] parts = line.split("\t", 5);
            if (parts.length < 5) {
                continue;
            }
            boolean directory = "d".equals(parts[0]);
            String relative = relativeBase.isEmpty() ? parts[4] : relativeBase + "/" + parts[4];
            entries.add(new FileSystemEntry(
                    relative,
                    directory ? FileSystemEntry.EntryType.DIRECTORY : FileSystemEntry.EntryType.FILE,
                    directory ? null : Long.parseLong(parts[1]),
                    epochSeconds(parts[2]),
                    parts[3]));
        }
        return entries;
    }

    @Override
    public SandboxFile readFile(String sandboxId, String path, ReadFileOptions options) {
        require(sandboxId);
        String file = quote(containerPath(path));
        ExecutionResult stat = shell(sandboxId,
                "[ -e " + file + " ] || exit " + MISSING_EXIT_CODE + "; [ -f " + file + " ] || exit 1; stat -c '%s %Y' " + file);
        if (stat.exitCode() == MISSING_EXIT_CODE) {
            return null;
        }
        if (!stat.success()) {
            throw new SandboxException("Cannot read " + path + " in sandbox " + sandboxId + ": "
                    + (stat.error() != null ? stat.error() : "not a regular file"));
        }
        String[] sizeAndTime = stat.output().trim().split(" ");
        long size = Long.parseLong(sizeAndTime[0]);
        if (options.maxSize() != null && size > options.maxSize()) {
            throw new SandboxException("File " + path + " is " + size + " bytes, exceeding the "
                    + options.maxSize() + " byte limit");
        }
        ExecutionResult content = shell(sandboxId, "base64 -w0 " + file);
        if (!content.success()) {
            throw new SandboxException("Failed to read " + path + " in sandbox " + sandboxId + ": " + content.error());
        }
        byte[] bytes = Base64.getDecoder().decode(content.output().trim());
        return new SandboxFile(path, bytes, options.encoding(), size, epochSeconds(sizeAndTime[1]));
    }

    @Override
    public void writeFile(String sandboxId, String path, String content, WriteFileOptions options) {
        require(sandboxId);
        String target = containerPath(path);
        String file = quote(target);
        String temp = quote(target + ".aura-tmp");
        byte[] bytes = options.encoding().decode(content);
        boolean existed = shell(sandboxId, "[ -e " + file + " ]").success();

        StringBuilder prepare = new StringBuilder();
        if (options.createDirs()) {
            prepare.append("mkdir -p \"$(dirname ").append(file).append(")\" && ");
        }
        if (options.backup()) {
            prepare.append("{ [ ! -f ").append(file).append(" ] || cp ").append(file).append(' ')
                    .append(quote(target + ".backup")).append("; } && ");
        }
        prepare.append(": > ").append(temp);
        requireSuccess(shell(sandboxId, prepare.toString()), "write " + path);

        String encoded = Base64.getEncoder().encodeToString(bytes);
        for (int offset = 0; offset < encoded.length(); offset += WRITE_CHUNK_CHARS) {
            String chunk = encoded.substring(offset, Math.min(encoded.length(), offset + WRITE_CHUNK_CHARS));
            requireSuccess(shell(sandboxId, "printf '%s' '" + chunk + "' | base64 -d >> " + temp), "write " + path);
        }
        requireSuccess(shell(sandboxId, "mv -f " + temp + " " + file), "write " + path);

        emit(SandboxEventType.FILE_CHANGED, sandboxId, null,
                Map.of("path", path, "type", existed ? "modified" : "created", "size", bytes.length));
    }

    @Override
    public boolean deleteFile(String sandboxId, String path, DeleteFileOptions options) {
        require(sandboxId);
        if (normalizeRelativePath(path).isEmpty()) {
            throw new IllegalArgumentException("Refusing to delete the sandbox root");
        }
        String file = quote(containerPath(path));
        String script = "[ -e " + file + " ] || exit " + MISSING_EXIT_CODE + "; "
                + (options.recursive()
                    ? "rm -rf " + file
                    : "if [ -d " + file + " ]; then rmdir " + file + "; else rm -f " + file + "; fi");
        ExecutionResult result = shell(sandboxId, script);
        if (result.exitCode() == MISSING_EXIT_CODE) {
            return options.force();
        }
        requireSuccess(result, "delete " + path);
        emit(SandboxEventType.FILE_CHANGED, sandboxId, null, Map.of("path", path, "type", "deleted"));
        return true;
    }

    @Override
    public void createDirectory(String sandboxId, String path, CreateDirectoryOptions options) {
        require(sandboxId);
        String dir = quote(containerPath(path));
        String script = (options.recursive() ? "mkdir -p " : "mkdir ") + dir;
        if (options.permissions() != null) {
            if (!options.permissions().matches("[0-7]{3,4}")) {
                throw new IllegalArgumentException("Invalid permissions: " + options.permissions());
            }
            script += " && chmod " + options.permissions() + " " + dir;
        }
        requireSuccess(shell(sandboxId, script), "create directory " + path);
        emit(SandboxEventType.FILE_CHANGED, sandboxId, null,
                Map.of("path", path, "type", "created", "directory", true));
    }

    // -- Observability -------------------------------------------------------

    @Override
    public List<String> getLogs(String sandboxId, LogOptions options) {
        require(sandboxId);
        var cmd = dockerClient.logContainerCmd(sandboxId)
                .withStdOut(true)
                .withStdErr(true)
                .withTimestamps(true)
                .withFollowStream(false);
        if (options.since() != null) {
            cmd.withSince((int) options.since().getEpochSecond());
        }
        if (options.tail() != null && options.until() == null) {
            cmd.withTail(options.tail());
        }

        var sb = new StringBuilder();
        try {
            cmd.exec(new ResultCallback.Adapter<Frame>() {
                @Override
                public void onNext(Frame frame) {
                    sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                }
            }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while reading logs for sandbox " + sandboxId, e);
        }

        List<String> lines = new ArrayList<>();
        for (String line : sb.toString().split("\n")) {
            if (line.isEmpty()) continue;
            if (options.until() != null) {
                Instant at = leadingTimestamp(line);
                if (at != null && at.isAfter(options.until())) continue;
            }
            lines.add(line);
        }
        if (options.tail() != null && options.until() != null && lines.size() > options.tail()) {
            return List.copyOf(lines.subList(lines.size() - options.tail(), lines.size()));
        }
        return lines;
    }

    @Override
    public ProviderInfo getProviderInfo() {
        String version;
        ProviderInfo.Status status;
        try {
            version = dockerClient.versionCmd().exec().getVersion();
            status = ProviderInfo.Status.HEALTHY;
        } catch (RuntimeException e) {
            log.debug("Docker version lookup failed: {}", e.getMessage());
            version = "unknown";
            status = ProviderInfo.Status.UNAVAILABLE;
        }
        int active = 0;
        int total = 0;
        if (status == ProviderInfo.Status.HEALTHY) {
            for (Container container : listContainers()) {
                total++;
                if ("running".equalsIgnoreCase(container.getState())) {
                    active++;
                }
            }
        }
        return new ProviderInfo(
                ProviderType.DOCKER,
                version,
                status,
                new ProviderInfo.Limits(properties.getMaxContainers(), properties.getMaxContainers(),
                        -1, properties.getDefaultCommandTimeout().toMillis()),
                new ProviderInfo.Usage(active, total, (double) active * properties.getCpuCount(),
                        (long) active * properties.getMemoryLimitMb(), 0));
    }

    @Override
    public ProviderHealth healthCheck() {
        long started = System.nanoTime();
        try {
            dockerClient.pingCmd().exec();
            return ProviderHealth.healthy(elapsedMs(started), Map.of("host", properties.getHost()));
        } catch (RuntimeException e) {
            return ProviderHealth.unhealthy(elapsedMs(started), e.getMessage());
        }
    }

    // -- Internals -----------------------------------------------------------

    private void ensureImage(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return;
        } catch (NotFoundException e) {
            log.info("Pulling image {}", image);
        }
        int colon = image.lastIndexOf(':');
        boolean tagged = colon > image.lastIndexOf('/');
        var pull = dockerClient.pullImageCmd(tagged ? image.substring(0, colon) : image)
                .withTag(tagged ? image.substring(colon + 1) : "latest");
        try {
            boolean done = pull.exec(new PullImageResultCallback())
                    .awaitCompletion(properties.getPullTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!done) {
                throw new SandboxException("Timed out pulling image " + image);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while pulling image " + image, e);
        }
    }

    private List<Container> listContainers() {
        return dockerClient.listContainersCmd()
                .withShowAll(true)
                .withLabelFilter(Map.of(SANDBOX_LABEL, "true"))
                .exec();
    }

    private int countSandboxes() {
        return listContainers().size();
    }

    private void require(String sandboxId) {
        if (getSandbox(sandboxId) == null) {
            throw new SandboxNotFoundException(sandboxId, ProviderType.DOCKER);
        }
    }

    private SandboxEnvironment describe(String containerId) {
        SandboxEnvironment environment = getSandbox(containerId);
        if (environment == null) {
            throw new SandboxNotFoundException(containerId, ProviderType.DOCKER);
        }
        return environment;
    }

    private void removeQuietly(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
        } catch (RuntimeException e) {
            log.warn("Failed to remove container {} after a failed start: {}", containerId, e.getMessage());
        }
    }

    private static void closeQuietly(ExecOutput output, String containerId) {
        try {
            output.close();
        } catch (IOException e) {
            log.debug("Error closing exec stream for {}: {}", containerId, e.getMessage());
        }
    }

    private ExecutionResult shell(String sandboxId, String script) {
        return execInContainer(sandboxId, List.of("sh", "-c", script), properties.getWorkingDir(), Map.of(),
                properties.getDefaultCommandTimeout());
    }

    private static void requireSuccess(ExecutionResult result, String action) {
        if (!result.success()) {
            throw new SandboxException("Failed to " + action + ": "
                    + (result.error() != null ? result.error().trim() : "exit " + result.exitCode()));
        }
    }

    private String containerPath(String path) {
        String relative = normalizeRelativePath(path);
        String root = properties.getWorkingDir();
        return relative.isEmpty() ? root : root + "/" + relative;
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private static boolean isSandbox(Map<String, String> labels) {
        return labels != null && "true".equals(labels.get(SANDBOX_LABEL));
    }

    private SandboxEnvironment toEnvironment(InspectContainerResponse container) {
        Map<String, String> labels = container.getConfig().getLabels();
        List<PortMapping> ports = new ArrayList<>();
        if (container.getNetworkSettings() != null && container.getNetworkSettings().getPorts() != null) {
            container.getNetworkSettings().getPorts().getBindings().forEach((exposed, bound) -> {
                Integer external = null;
                if (bound != null && bound.length > 0 && bound[0].getHostPortSpec() != null
                        && !bound[0].getHostPortSpec().isBlank()) {
                    external = Integer.valueOf(bound[0].getHostPortSpec());
                }
                ports.add(new PortMapping(exposed.getPort(), external, exposed.getProtocol().toString(), false, null));
            });
        }
        HostConfig hostConfig = container.getHostConfig();
        ResourceSpec resources = new ResourceSpec(
                hostConfig != null && hostConfig.getCpuCount() != null ? hostConfig.getCpuCount().doubleValue() : null,
                hostConfig != null && hostConfig.getMemory() != null ? hostConfig.getMemory() / (1024 * 1024) : null,
                null);
        Instant created = parseInstant(container.getCreated());
        Instant started = container.getState() != null ? parseInstant(container.getState().getStartedAt()) : null;
        String status = container.getState() != null ? container.getState().getStatus() : null;
        return environment(container.getId(), labels, SandboxStatus.fromWire(status), resources, ports,
                created, started != null && started.isAfter(created) ? started : created);
    }

    private SandboxEnvironment toEnvironment(Container container) {
        Instant created = container.getCreated() != null ? Instant.ofEpochSecond(container.getCreated()) : clock.instant();
        return environment(container.getId(), container.getLabels(), SandboxStatus.fromWire(container.getState()),
                null, List.of(), created, created);
    }

    private SandboxEnvironment environment(String id, Map<String, String> labels, SandboxStatus status,
                                           ResourceSpec resources, List<PortMapping> ports,
                                           Instant created, Instant lastActivity) {
        Map<String, String> safeLabels = labels != null ? labels : Map.of();
        Map<String, String> metadata = new LinkedHashMap<>();
        safeLabels.forEach((k, v) -> {
            if (k.startsWith(META_PREFIX)) {
                metadata.put(k.substring(META_PREFIX.length()), v);
            }
        });
        metadata.putAll(metadataOverrides.getOrDefault(id, Map.of()));
        String runtime = safeLabels.get(RUNTIME_LABEL);
        return new SandboxEnvironment(
                id,
                safeLabels.getOrDefault(NAME_LABEL, id),
                ProviderType.DOCKER,
                status,
                safeLabels.get(TEMPLATE_LABEL),
                runtime,
                resources,
                new NetworkInfo(ports, null),
                metadata,
                created,
                lastActivity,
                null);
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank() || value.startsWith("0001-")) {
            return clock.instant();
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return clock.instant();
        }
    }

    private static Instant leadingTimestamp(String line) {
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

    private static Instant epochSeconds(String value) {
        double seconds = Double.parseDouble(value);
        return Instant.ofEpochMilli((long) (seconds * 1000));
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    /**
     * Splits the multiplexed exec stream into stdout and stderr, capped at a byte limit.
     */
    static class ExecOutput extends ResultCallback.Adapter<Frame> {

        private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        private final int limit;
        private volatile boolean overflowed;

        ExecOutput(int limit) {
            this.limit = limit;
        }

        @Override
        public synchronized void onNext(Frame frame) {
            ByteArrayOutputStream target = frame.getStreamType() == StreamType.STDERR ? stderr : stdout;
            byte[] payload = frame.getPayload();
            int room = limit - stdout.size() - stderr.size();
            if (payload.length > room) {
                overflowed = true;
                target.write(payload, 0, Math.max(0, room));
            } else {
                target.write(payload, 0, payload.length);
            }
        }

        synchronized String stdout() {
            return stdout.toString(StandardCharsets.UTF_8);
        }

        synchronized String stderr() {
            return stderr.toString(StandardCharsets.UTF_8);
        }

        boolean overflowed() {
            return overflowed;
        }
    }
}
