package com.auraide.sandbox.workspace;

import com.auraide.core.events.SandboxEventType;
import com.auraide.sandbox.AbstractSandboxProvider;
import com.auraide.sandbox.CapabilityResult;
import com.auraide.sandbox.ProviderCapabilities;
import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.SandboxException;
import com.auraide.sandbox.SandboxNotFoundException;
import com.auraide.sandbox.model.*;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Adapter for the remote workspace service. Each sandbox is a workspace addressed as
 * {@code /workspaces/{id}}; a 404 on lookups is reported as "not found" rather than thrown.
 */
public class WorkspaceSandboxProvider extends AbstractSandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceSandboxProvider.class);

    private final WorkspaceApiClient client;
    private final WorkspaceProperties properties;

    public WorkspaceSandboxProvider(WorkspaceApiClient client, WorkspaceProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    @Override
    public ProviderType type() {
        return ProviderType.WORKSPACE;
    }

    @Override
    public ProviderCapabilities capabilities() {
        return new ProviderCapabilities(true, true, true, false, true,
                properties.getMaxSandboxes(), properties.getRuntimes());
    }

    @Override
    public void initialize() {
        if (!properties.hasApiKey()) {
            throw new SandboxException("Workspace API key is not configured");
        }
        JsonNode health = client.get("/health");
        log.info("Workspace provider connected to {} (version {})", properties.getApiUrl(),
                health.path("version").asText("unknown"));
    }

    @Override
    public void cleanup() {
        log.debug("Workspace provider released");
    }

    // -- Lifecycle -----------------------------------------------------------

    @Override
    public SandboxEnvironment createSandbox(SandboxCreateOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", options.name());
        body.put("description", options.description());
        body.put("template", options.template());
        body.put("runtime", options.runtime());
        body.put("resources", options.resources());
        body.put("env", options.environment());
        body.put("ports", options.ports());
        body.put("timeoutMinutes", options.timeoutMinutes());
        body.put("persistent", options.persistent());
        Map<String, String> metadata = new LinkedHashMap<>(options.metadata());
        if (options.userId() != null) metadata.put("userId", options.userId());
        if (options.projectId() != null) metadata.put("projectId", options.projectId());
        body.put("metadata", metadata);

        SandboxEnvironment environment = toEnvironment(client.post("/workspaces", body));
        emit(SandboxEventType.SANDBOX_CREATED, environment);
        log.info("Created workspace sandbox {}", environment.id());
        return environment;
    }

    @Override
    public SandboxEnvironment getSandbox(String sandboxId) {
        try {
            return toEnvironment(client.get(workspace(sandboxId)));
        } catch (WorkspaceApiException e) {
            if (e.isNotFound()) {
                return null;
            }
            throw e;
        }
    }

    @Override
    public List<SandboxEnvironment> listSandboxes(SandboxFilters filters) {
        Map<String, Object> params = WorkspaceApiClient.params();
        params.put("userId", filters.userId());
        params.put("projectId", filters.projectId());
        params.put("status", filters.status() != null ? filters.status().wireName() : null);
        params.put("template", filters.template());
        JsonNode response = client.get("/workspaces" + WorkspaceApiClient.query(params));

        JsonNode items = response.isArray() ? response : response.path("items");
        List<SandboxEnvironment> result = new ArrayList<>();
        for (JsonNode item : items) {
            SandboxEnvironment environment = toEnvironment(item);
            if (filters.matches(environment)) {
                result.add(environment);
            }
        }
        return result;
    }

    @Override
    public SandboxEnvironment updateSandbox(String sandboxId, SandboxUpdateOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (options.resources() != null) body.put("resources", options.resources());
        if (options.environment() != null) body.put("env", options.environment());
        if (options.ports() != null) body.put("ports", options.ports());
        if (options.timeoutMinutes() != null) body.put("timeoutMinutes", options.timeoutMinutes());
        if (options.metadata() != null) body.put("metadata", options.metadata());
        return toEnvironment(call(sandboxId, () -> client.patch(workspace(sandboxId), body)));
    }

    @Override
    public SandboxEnvironment startSandbox(String sandboxId) {
        SandboxEnvironment environment = toEnvironment(
                call(sandboxId, () -> client.post(workspace(sandboxId) + "/start", Map.of())));
        emit(SandboxEventType.SANDBOX_STARTED, environment);
        return environment;
    }

    @Override
    public SandboxEnvironment stopSandbox(String sandboxId) {
        SandboxEnvironment environment = toEnvironment(
                call(sandboxId, () -> client.post(workspace(sandboxId) + "/stop", Map.of())));
        emit(SandboxEventType.SANDBOX_STOPPED, environment);
        return environment;
    }

    /**
     * The workspace service restarts server-side, including its own settle delay.
     */
    @Override
    public SandboxEnvironment restartSandbox(String sandboxId) {
        SandboxEnvironment environment = toEnvironment(
                call(sandboxId, () -> client.post(workspace(sandboxId) + "/restart", Map.of())));
        emit(SandboxEventType.SANDBOX_STARTED, environment);
        return environment;
    }

    @Override
    public boolean deleteSandbox(String sandboxId) {
        try {
            client.delete(workspace(sandboxId));
        } catch (WorkspaceApiException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
        emit(SandboxEventType.SANDBOX_DELETED, sandboxId, null, Map.of());
        log.info("Deleted workspace sandbox {}", sandboxId);
        return true;
    }

    @Override
    public SandboxMetrics getMetrics(String sandboxId) {
        try {
            JsonNode node = client.get(workspace(sandboxId) + "/metrics");
            return node.isMissingNode() ? null : convert(node, SandboxMetrics.class);
        } catch (WorkspaceApiException e) {
            if (e.isNotFound()) {
                return null;
            }
            throw e;
        }
    }

    // -- Execution -----------------------------------------------------------

    @Override
    public ExecutionResult executeCommand(String sandboxId, String command, ExecOptions options) {
        Duration timeout = options.timeout() != null ? options.timeout() : properties.getDefaultCommandTimeout();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("command", command);
        body.put("workingDir", options.workingDir());
        body.put("timeoutMs", timeout.toMillis());
        body.put("env", options.environment());

        long started = System.nanoTime();
        JsonNode node = call(sandboxId, () -> client.post(workspace(sandboxId) + "/exec", body, timeout));
        long elapsed = node.path("durationMs").asLong((System.nanoTime() - started) / 1_000_000);
        if (node.path("timedOut").asBoolean(false)) {
            return ExecutionResult.timedOut(node.path("stdout").asText(""), timeout.toMillis(), elapsed);
        }
        return ExecutionResult.completed(node.path("exitCode").asInt(1),
                node.path("stdout").asText(""), node.path("stderr").asText(""), elapsed);
    }

    // -- Files ---------------------------------------------------------------

    @Override
    public List<FileSystemEntry> listFiles(String sandboxId, String path, ListFilesOptions options) {
        Map<String, Object> params = WorkspaceApiClient.params();
        params.put("path", normalizeRelativePath(path));
        params.put("recursive", options.recursive());
        params.put("includeHidden", options.includeHidden());
        params.put("maxDepth", options.maxDepth());
        JsonNode node = call(sandboxId, () -> client.get(workspace(sandboxId) + "/files" + WorkspaceApiClient.query(params)));

        List<FileSystemEntry> entries = new ArrayList<>();
        for (JsonNode item : node.isArray() ? node : node.path("entries")) {
            entries.add(convert(item, FileSystemEntry.class));
        }
        return entries;
    }

    @Override
    public SandboxFile readFile(String sandboxId, String path, ReadFileOptions options) {
        Map<String, Object> params = WorkspaceApiClient.params();
        params.put("path", normalizeRelativePath(path));
        params.put("encoding", FileEncoding.BASE64.wireName());
        JsonNode node;
        try {
            node = client.get(workspace(sandboxId) + "/files/content" + WorkspaceApiClient.query(params));
        } catch (WorkspaceApiException e) {
            if (e.isNotFound()) {
                return null;
            }
            throw e;
        }
        byte[] content = FileEncoding.BASE64.decode(node.path("content").asText(""));
        if (options.maxSize() != null && content.length > options.maxSize()) {
            throw new SandboxException("File " + path + " is " + content.length + " bytes, exceeding the "
                    + options.maxSize() + " byte limit");
        }
        Instant modified = node.hasNonNull("modified") ? Instant.parse(node.get("modified").asText()) : null;
        return new SandboxFile(path, content, options.encoding(), content.length, modified);
    }

    @Override
    public void writeFile(String sandboxId, String path, String content, WriteFileOptions options) {
        byte[] bytes = options.encoding().decode(content);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", normalizeRelativePath(path));
        body.put("content", FileEncoding.BASE64.encode(bytes));
        body.put("encoding", FileEncoding.BASE64.wireName());
        body.put("createDirs", options.createDirs());
        body.put("backup", options.backup());
        call(sandboxId, () -> client.put(workspace(sandboxId) + "/files/content", body));
        emit(SandboxEventType.FILE_CHANGED, sandboxId, null, Map.of("path", path, "size", bytes.length));
    }

    @Override
    public boolean deleteFile(String sandboxId, String path, DeleteFileOptions options) {
        Map<String, Object> params = WorkspaceApiClient.params();
        params.put("path", normalizeRelativePath(path));
        params.put("recursive", options.recursive());
        try {
            client.delete(workspace(sandboxId) + "/files" + WorkspaceApiClient.query(params));
        } catch (WorkspaceApiException e) {
            if (e.isNotFound()) {
                return options.force();
            }
            throw e;
        }
        emit(SandboxEventType.FILE_CHANGED, sandboxId, null, Map.of("path", path, "type", "deleted"));
        return true;
    }

    @Override
    public void createDirectory(String sandboxId, String path, CreateDirectoryOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", normalizeRelativePath(path));
        body.put("recursive", options.recursive());
        body.put("permissions", options.permissions());
        call(sandboxId, () -> client.post(workspace(sandboxId) + "/directories", body));
    }

    // -- Optional capabilities -------------------------------------------------

    @Override
    public CapabilityResult<TerminalSession> connectTerminal(String sandboxId, TerminalOptions options) {
        JsonNode node = call(sandboxId, () -> client.post(workspace(sandboxId) + "/terminals", options));
        var session = new TerminalSession(node.path("sessionId").asText(), sandboxId,
                node.hasNonNull("wsUrl") ? node.get("wsUrl").asText() : null);
        emit(SandboxEventType.TERMINAL_CONNECTED, sandboxId, null, Map.of("terminalSessionId", session.sessionId()));
        return CapabilityResult.of(session);
    }

    @Override
    public CapabilityResult<Boolean> disconnectTerminal(String sandboxId, String terminalSessionId) {
        try {
            client.delete(workspace(sandboxId) + "/terminals/" + WorkspaceApiClient.encode(terminalSessionId));
        } catch (WorkspaceApiException e) {
            if (e.isNotFound()) {
                return CapabilityResult.of(false);
            }
            throw e;
        }
        emit(SandboxEventType.TERMINAL_DISCONNECTED, sandboxId, null, Map.of("terminalSessionId", terminalSessionId));
        return CapabilityResult.of(true);
    }

    @Override
    public CapabilityResult<PortForward> forwardPort(String sandboxId, int port, PortForwardOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("port", port);
        body.put("externalPort", options.externalPort());
        body.put("protocol", options.protocol());
        body.put("public", options.isPublic());
        JsonNode node = call(sandboxId, () -> client.post(workspace(sandboxId) + "/ports", body));
        return CapabilityResult.of(new PortForward(port, node.path("externalPort").asInt(port),
                node.hasNonNull("url") ? node.get("url").asText() : null));
    }

    @Override
    public CapabilityResult<Boolean> removePortForward(String sandboxId, int externalPort) {
        try {
            client.delete(workspace(sandboxId) + "/ports/" + externalPort);
        } catch (WorkspaceApiException e) {
            if (e.isNotFound()) {
                return CapabilityResult.of(false);
            }
            throw e;
        }
        return CapabilityResult.of(true);
    }

    // -- Observability -------------------------------------------------------

    @Override
    public List<String> getLogs(String sandboxId, LogOptions options) {
        Map<String, Object> params = WorkspaceApiClient.params();
        params.put("since", options.since());
        params.put("until", options.until());
        params.put("tail", options.tail());
        JsonNode node = call(sandboxId, () -> client.get(workspace(sandboxId) + "/logs" + WorkspaceApiClient.query(params)));
        List<String> lines = new ArrayList<>();
        for (JsonNode line : node.isArray() ? node : node.path("lines")) {
            lines.add(line.asText());
        }
        return lines;
    }

    @Override
    public ProviderInfo getProviderInfo() {
        JsonNode health;
        ProviderInfo.Status status;
        try {
            health = client.get("/health");
            status = "degraded".equalsIgnoreCase(health.path("status").asText())
                    ? ProviderInfo.Status.DEGRADED
                    : ProviderInfo.Status.HEALTHY;
        } catch (SandboxException e) {
            log.debug("Workspace health lookup failed: {}", e.getMessage());
            health = MissingNode.getInstance();
            status = ProviderInfo.Status.UNAVAILABLE;
        }
        JsonNode usage = health.path("usage");
        return new ProviderInfo(
                ProviderType.WORKSPACE,
                health.path("version").asText("unknown"),
                status,
                new ProviderInfo.Limits(properties.getMaxSandboxes(), properties.getMaxSandboxes(),
                        health.path("limits").path("maxFileSize").asLong(-1),
                        properties.getDefaultCommandTimeout().toMillis()),
                new ProviderInfo.Usage(
                        usage.path("activeSandboxes").asInt(0),
                        usage.path("totalSandboxes").asInt(0),
                        usage.path("cpu").asDouble(0),
                        usage.path("memory").asLong(0),
                        usage.path("storage").asLong(0)));
    }

    @Override
    public ProviderHealth healthCheck() {
        long started = System.nanoTime();
        try {
            JsonNode health = client.get("/health");
            return ProviderHealth.healthy((System.nanoTime() - started) / 1_000_000,
                    Map.of("apiUrl", properties.getApiUrl(), "version", health.path("version").asText("unknown")));
        } catch (SandboxException e) {
            return ProviderHealth.unhealthy((System.nanoTime() - started) / 1_000_000, e.getMessage());
        }
    }

    // -- Internals -----------------------------------------------------------

    private static String workspace(String sandboxId) {
        return "/workspaces/" + WorkspaceApiClient.encode(sandboxId);
    }

    /**
     * Runs a call against an existing workspace, turning a 404 into {@link SandboxNotFoundException}.
     */
    private JsonNode call(String sandboxId, Supplier<JsonNode> request) {
        try {
            return request.get();
        } catch (WorkspaceApiException e) {
            if (e.isNotFound()) {
                throw new SandboxNotFoundException(sandboxId, ProviderType.WORKSPACE);
            }
            throw e;
        }
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return client.objectMapper().treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new SandboxException("Unexpected workspace response for " + type.getSimpleName(), e);
        }
    }

    SandboxEnvironment toEnvironment(JsonNode node) {
        WorkspaceDto dto = convert(node, WorkspaceDto.class);
        return new SandboxEnvironment(
                dto.id(),
                dto.name() != null ? dto.name() : dto.id(),
                ProviderType.WORKSPACE,
                SandboxStatus.fromWire(dto.status()),
                dto.template(),
                dto.runtime(),
                dto.resources(),
                new NetworkInfo(dto.ports(), dto.publicUrl()),
                dto.metadata(),
                dto.createdAt(),
                dto.lastActivity() != null ? dto.lastActivity() : dto.createdAt(),
                dto.expiresAt());
    }

    /**
     * Workspace representation on the wire; unknown fields are ignored.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record WorkspaceDto(
        String id,
        String name,
        String status,
        String template,
        String runtime,
        ResourceSpec resources,
        List<PortMapping> ports,
        String publicUrl,
        Map<String, String> metadata,
        Instant createdAt,
        Instant lastActivity,
        Instant expiresAt
    ) {}
}
