package com.auraide.sandbox;

import com.auraide.broadcast.FileChangeBroadcaster;
import com.auraide.broadcast.FileChangeEvent;
import com.auraide.broadcast.FileChangeType;
import com.auraide.core.events.EventBus;
import com.auraide.core.events.SandboxEvent;
import com.auraide.core.events.SandboxEventType;
import com.auraide.core.logging.MdcContext;
import com.auraide.core.metrics.AuraMetrics;
import com.auraide.sandbox.model.*;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Single entry point for sandbox operations across providers.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>resolving which provider owns a sandbox (explicit override, session, or probing)</li>
 *   <li>choosing a provider for new sandboxes (default or load-balanced) with one-shot failover</li>
 *   <li>session bookkeeping and per-provider load counts</li>
 *   <li>relaying provider events onto the application {@link EventBus}</li>
 *   <li>background metrics polling, health polling and idle-session reaping</li>
 *   <li>notifying the {@link FileChangeBroadcaster} of writes and deletes</li>
 * </ul>
 *
 * <p>Calls block the caller. Session and load state is guarded by one lock and only
 * ever handed out as immutable copies.
 */
@Service
public class SandboxManager {

    private static final Logger log = LoggerFactory.getLogger(SandboxManager.class);

    private final SandboxProviderRegistry registry;
    private final SandboxProperties properties;
    private final FileChangeBroadcaster broadcaster;
    private final EventBus eventBus;
    private final AuraMetrics metrics;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, SandboxSession> sessions = new LinkedHashMap<>();
    private final Map<String, String> sessionIdsBySandbox = new HashMap<>();
    private final Map<ProviderType, Integer> providerLoads = new EnumMap<>(ProviderType.class);
    private final Map<ProviderType, ProviderHealth> lastHealth = new EnumMap<>(ProviderType.class);
    private final LoadBalancer loadBalancer;

    private final List<EventBus.Subscription> relaySubscriptions = new ArrayList<>();
    private volatile boolean initialized;
    private ScheduledExecutorService scheduler;

    @Autowired
    public SandboxManager(SandboxProviderRegistry registry,
                          SandboxProperties properties,
                          FileChangeBroadcaster broadcaster,
                          EventBus eventBus,
                          @Autowired(required = false) AuraMetrics metrics) {
        this(registry, properties, broadcaster, eventBus, metrics, Clock.systemUTC(),
                new LoadBalancer(properties.getLoadBalancing().getStrategy()));
    }

    SandboxManager(SandboxProviderRegistry registry,
                   SandboxProperties properties,
                   FileChangeBroadcaster broadcaster,
                   EventBus eventBus,
                   AuraMetrics metrics,
                   Clock clock,
                   LoadBalancer loadBalancer) {
        this.registry = registry;
        this.properties = properties;
        this.broadcaster = broadcaster;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.loadBalancer = loadBalancer;
        if (metrics != null) {
            metrics.registerActiveSessionsGauge(this::activeSessionCount);
        }
    }

    // -- Lifecycle -----------------------------------------------------------

    /**
     * Initializes providers, wires event relay and starts the background timers.
     */
    @PostConstruct
    public void start() {
        ensureInitialized();
        startTimers();
    }

    /**
     * Initializes every provider and subscribes to their events. Idempotent; also
     * invoked lazily by every public operation.
     */
    public void ensureInitialized() {
        if (initialized) {
            return;
        }
        synchronized (lock) {
            if (initialized) {
                return;
            }
            Map<ProviderType, Boolean> outcome = registry.initializeAll();
            for (ProviderType type : registry.getAvailableProviders()) {
                SandboxProvider provider = registry.getProvider(type);
                relaySubscriptions.add(provider.onAny(this::relay));
            }
            initialized = true;
            log.info("Sandbox manager initialized (providers: {})", outcome);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
        synchronized (lock) {
            relaySubscriptions.forEach(EventBus.Subscription::unsubscribe);
            relaySubscriptions.clear();
            initialized = false;
        }
        registry.cleanupAll();
        log.info("Sandbox manager shut down");
    }

    private void startTimers() {
        var monitoring = properties.getMonitoring();
        var sessionConfig = properties.getSessions();
        boolean anyTimer = monitoring.isMetricsEnabled()
                || isPositive(monitoring.getHealthCheckInterval())
                || sessionConfig.isAutoCleanup();
        if (!anyTimer || scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sandbox-manager-timer");
            t.setDaemon(true);
            return t;
        });
        if (monitoring.isMetricsEnabled() && isPositive(monitoring.getMetricsInterval())) {
            long ms = monitoring.getMetricsInterval().toMillis();
            scheduler.scheduleAtFixedRate(guarded("metrics poll", this::pollMetrics), ms, ms, TimeUnit.MILLISECONDS);
        }
        if (isPositive(monitoring.getHealthCheckInterval())) {
            long ms = monitoring.getHealthCheckInterval().toMillis();
            scheduler.scheduleAtFixedRate(guarded("health poll", this::healthCheckProviders), 0, ms, TimeUnit.MILLISECONDS);
        }
        if (sessionConfig.isAutoCleanup() && isPositive(sessionConfig.getCleanupInterval())) {
            long ms = sessionConfig.getCleanupInterval().toMillis();
            scheduler.scheduleAtFixedRate(
                    guarded("idle reaper", () -> cleanupInactiveSessions(sessionConfig.getMaxInactive())),
                    ms, ms, TimeUnit.MILLISECONDS);
        }
        log.info("Sandbox manager timers started (metrics={}, health={}, reaper={})",
                monitoring.isMetricsEnabled() ? monitoring.getMetricsInterval() : "off",
                monitoring.getHealthCheckInterval(),
                sessionConfig.isAutoCleanup() ? sessionConfig.getCleanupInterval() : "off");
    }

    private static Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Background {} failed: {}", name, e.getMessage(), e);
            }
        };
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }

    // -- Sandbox lifecycle ---------------------------------------------------

    /**
     * Creates a sandbox on the explicit provider, or on the selected one with a single
     * failover attempt when that fails.
     *
     * @param provider explicit provider, or null to let the manager choose
     */
    public SandboxEnvironment createSandbox(SandboxCreateOptions options, ProviderType provider) {
        if (options == null) {
            throw new IllegalArgumentException("Create options must not be null");
        }
        ensureInitialized();
        ProviderType selected = provider != null ? provider : selectProvider();
        SandboxEnvironment environment;
        try {
            MdcContext.setSandbox(null, selected.wireName());
            environment = registry.getProvider(selected).createSandbox(options);
        } catch (RuntimeException e) {
            if (provider != null || !properties.getFailover().isEnabled()) {
                log.error("Sandbox creation on '{}' failed: {}", selected, e.getMessage());
                throw e;
            }
            ProviderType fallback = chooseFallback(selected);
            if (fallback == null) {
                log.error("Sandbox creation on '{}' failed and no fallback provider is available: {}",
                        selected, e.getMessage());
                throw e;
            }
            log.warn("Sandbox creation on '{}' failed ({}); failing over to '{}'", selected, e.getMessage(), fallback);
            try {
                MdcContext.setSandbox(null, fallback.wireName());
                environment = registry.getProvider(fallback).createSandbox(options);
            } catch (RuntimeException fallbackError) {
                recordFailover(selected, fallback, false);
                fallbackError.addSuppressed(e);
                throw fallbackError;
            }
            recordFailover(selected, fallback, true);
            selected = fallback;
        } finally {
            MdcContext.clear();
        }

        SandboxSession session = registerSession(environment, selected, options.userId(), options.projectId(),
                options.metadata());
        if (metrics != null) {
            metrics.recordSandboxCreated(selected.wireName());
        }
        log.info("Sandbox {} created on '{}' (session {})", environment.id(), selected, session.id());
        return environment;
    }

    public SandboxEnvironment getSandbox(String sandboxId, ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        SandboxEnvironment environment = target.getSandbox(sandboxId);
        if (environment != null) {
            touch(sandboxId);
        }
        return environment;
    }

    /**
     * Lists sandboxes on one provider, or on every available provider when none is given.
     * With no provider given, a failing provider is skipped.
     */
    public List<SandboxEnvironment> listSandboxes(SandboxFilters filters, ProviderType provider) {
        ensureInitialized();
        SandboxFilters effective = filters != null ? filters : SandboxFilters.none();
        if (provider != null) {
            return registry.getProvider(provider).listSandboxes(effective);
        }
        List<SandboxEnvironment> all = new ArrayList<>();
        for (ProviderType type : registry.getAvailableProviders()) {
            try {
                all.addAll(registry.getProvider(type).listSandboxes(effective));
            } catch (RuntimeException e) {
                log.warn("Listing sandboxes on '{}' failed: {}", type, e.getMessage());
            }
        }
        return all;
    }

    /**
     * Applies an update. A resource change on a provider that cannot scale is reported
     * unsupported without calling the provider.
     */
    public CapabilityResult<SandboxEnvironment> updateSandbox(String sandboxId, SandboxUpdateOptions options,
                                                              ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        if (options.requestsResources() && !target.capabilities().supportsResourceScaling()) {
            return CapabilityResult.unsupported(target.type(), Capability.RESOURCE_SCALING);
        }
        SandboxEnvironment updated = guard(sandboxId, target, "update", p -> p.updateSandbox(sandboxId, options));
        touch(sandboxId);
        return CapabilityResult.of(updated);
    }

    public SandboxEnvironment startSandbox(String sandboxId, ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        SandboxEnvironment environment = guard(sandboxId, target, "start", p -> p.startSandbox(sandboxId));
        touch(sandboxId);
        return environment;
    }

    public SandboxEnvironment stopSandbox(String sandboxId, ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        SandboxEnvironment environment = guard(sandboxId, target, "stop", p -> p.stopSandbox(sandboxId));
        touch(sandboxId);
        return environment;
    }

    public SandboxEnvironment restartSandbox(String sandboxId, ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        SandboxEnvironment environment = guard(sandboxId, target, "restart", p -> p.restartSandbox(sandboxId));
        touch(sandboxId);
        return environment;
    }

    /**
     * Deletes a sandbox and drops its session. A provider answering "not found" also
     * drops the session, since the sandbox is gone either way.
     *
     * @return whether the provider deleted something
     */
    public boolean deleteSandbox(String sandboxId, ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        try {
            MdcContext.setSandbox(sandboxId, target.type().wireName());
            boolean deleted = guard(sandboxId, target, "delete", p -> p.deleteSandbox(sandboxId));
            removeSession(sandboxId);
            if (deleted) {
                if (metrics != null) {
                    metrics.recordSandboxDeleted(target.type().wireName());
                }
                log.info("Sandbox {} deleted from '{}'", sandboxId, target.type());
            } else {
                log.info("Sandbox {} was already gone from '{}'", sandboxId, target.type());
            }
            return deleted;
        } finally {
            MdcContext.clear();
        }
    }

    public SandboxMetrics getMetrics(String sandboxId, ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        SandboxMetrics sandboxMetrics = target.getMetrics(sandboxId);
        touch(sandboxId);
        return sandboxMetrics;
    }

    // -- Execution -----------------------------------------------------------

    public ExecutionResult executeCommand(String sandboxId, String command, ExecOptions options,
                                          ProviderType provider) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Command must not be blank");
        }
        SandboxProvider target = resolve(sandboxId, provider);
        ExecOptions effective = options != null ? options : ExecOptions.defaults();
        ExecutionResult result = guard(sandboxId, target, "execute",
                p -> p.executeCommand(sandboxId, command, effective));
        if (metrics != null) {
            metrics.recordCommandExecution(target.type().wireName(), result.success(), result.durationMs());
        }
        touch(sandboxId);
        return result;
    }

    // -- Files ---------------------------------------------------------------

    public List<FileSystemEntry> listFiles(String sandboxId, String path, ListFilesOptions options,
                                           ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        List<FileSystemEntry> entries = guard(sandboxId, target, "listFiles",
                p -> p.listFiles(sandboxId, path, options != null ? options : ListFilesOptions.defaults()));
        touch(sandboxId);
        return entries;
    }

    public SandboxFile readFile(String sandboxId, String path, ReadFileOptions options, ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        SandboxFile file = guard(sandboxId, target, "readFile",
                p -> p.readFile(sandboxId, path, options != null ? options : ReadFileOptions.defaults()));
        touch(sandboxId);
        return file;
    }

    /**
     * Writes a file and broadcasts one {@code created} change carrying the content.
     */
    public void writeFile(String sandboxId, String path, String content, WriteFileOptions options,
                          ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        WriteFileOptions effective = options != null ? options : WriteFileOptions.defaults();
        guard(sandboxId, target, "writeFile", p -> {
            p.writeFile(sandboxId, path, content, effective);
            return null;
        });
        SandboxSession session = touch(sandboxId);
        broadcastChange(FileChangeType.CREATED, sandboxId, path, content, effective.encoding(), session);
    }

    /**
     * Deletes a file; a successful delete broadcasts one {@code deleted} change.
     */
    public boolean deleteFile(String sandboxId, String path, DeleteFileOptions options, ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        boolean deleted = guard(sandboxId, target, "deleteFile",
                p -> p.deleteFile(sandboxId, path, options != null ? options : DeleteFileOptions.defaults()));
        SandboxSession session = touch(sandboxId);
        if (deleted) {
            broadcastChange(FileChangeType.DELETED, sandboxId, path, null, null, session);
        }
        return deleted;
    }

    public void createDirectory(String sandboxId, String path, CreateDirectoryOptions options,
                                ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        guard(sandboxId, target, "createDirectory", p -> {
            p.createDirectory(sandboxId, path, options != null ? options : CreateDirectoryOptions.defaults());
            return null;
        });
        touch(sandboxId);
    }

    public UploadResult uploadFiles(String sandboxId, List<UploadFile> files, UploadOptions options,
                                    ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        UploadResult result = guard(sandboxId, target, "uploadFiles",
                p -> p.uploadFiles(sandboxId, files, options != null ? options : UploadOptions.defaults()));
        touch(sandboxId);
        return result;
    }

    public Map<String, byte[]> downloadFiles(String sandboxId, List<String> paths, String baseDir,
                                             ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        Map<String, byte[]> files = guard(sandboxId, target, "downloadFiles",
                p -> p.downloadFiles(sandboxId, paths, baseDir));
        touch(sandboxId);
        return files;
    }

    // -- Capability-gated operations -----------------------------------------

    public CapabilityResult<SnapshotInfo> createSnapshot(String sandboxId, String name, SnapshotOptions options,
                                                         ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        if (!target.capabilities().supportsSnapshots()) {
            return CapabilityResult.unsupported(target.type(), Capability.SNAPSHOTS);
        }
        var result = guard(sandboxId, target, "createSnapshot", p -> p.createSnapshot(sandboxId, name,
                options != null ? options : SnapshotOptions.defaults()));
        touch(sandboxId);
        return result;
    }

    public CapabilityResult<Boolean> restoreSnapshot(String sandboxId, String snapshotId, RestoreOptions options,
                                                     ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        if (!target.capabilities().supportsSnapshots()) {
            return CapabilityResult.unsupported(target.type(), Capability.SNAPSHOTS);
        }
        var result = guard(sandboxId, target, "restoreSnapshot", p -> p.restoreSnapshot(sandboxId, snapshotId,
                options != null ? options : RestoreOptions.defaults()));
        touch(sandboxId);
        return result;
    }

    public CapabilityResult<TerminalSession> connectTerminal(String sandboxId, TerminalOptions options,
                                                             ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        if (!target.capabilities().supportsTerminal()) {
            return CapabilityResult.unsupported(target.type(), Capability.TERMINAL);
        }
        var result = target.connectTerminal(sandboxId, options != null ? options : TerminalOptions.defaults());
        touch(sandboxId);
        return result;
    }

    public CapabilityResult<Boolean> disconnectTerminal(String sandboxId, String terminalSessionId,
                                                        ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        if (!target.capabilities().supportsTerminal()) {
            return CapabilityResult.unsupported(target.type(), Capability.TERMINAL);
        }
        return target.disconnectTerminal(sandboxId, terminalSessionId);
    }

    public CapabilityResult<PortForward> forwardPort(String sandboxId, int port, PortForwardOptions options,
                                                     ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        if (!target.capabilities().supportsPortForwarding()) {
            return CapabilityResult.unsupported(target.type(), Capability.PORT_FORWARDING);
        }
        var result = target.forwardPort(sandboxId, port, options != null ? options : PortForwardOptions.defaults());
        touch(sandboxId);
        return result;
    }

    public CapabilityResult<Boolean> removePortForward(String sandboxId, int externalPort, ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        if (!target.capabilities().supportsPortForwarding()) {
            return CapabilityResult.unsupported(target.type(), Capability.PORT_FORWARDING);
        }
        return target.removePortForward(sandboxId, externalPort);
    }

    public List<String> getLogs(String sandboxId, LogOptions options, ProviderType provider) {
        SandboxProvider target = resolve(sandboxId, provider);
        return target.getLogs(sandboxId, options != null ? options : LogOptions.all());
    }

    // -- Sessions ------------------------------------------------------------

    public List<SandboxSession> getActiveSessions(SessionFilters filters) {
        SessionFilters effective = filters != null ? filters : SessionFilters.none();
        synchronized (lock) {
            return sessions.values().stream().filter(effective::matches).toList();
        }
    }

    public Optional<SandboxSession> getSessionById(String sessionId) {
        synchronized (lock) {
            return Optional.ofNullable(sessions.get(sessionId));
        }
    }

    public Optional<SandboxSession> getSessionForSandbox(String sandboxId) {
        synchronized (lock) {
            String sessionId = sessionIdsBySandbox.get(sandboxId);
            return sessionId != null ? Optional.ofNullable(sessions.get(sessionId)) : Optional.empty();
        }
    }

    public int activeSessionCount() {
        synchronized (lock) {
            return sessions.size();
        }
    }

    public Map<ProviderType, Integer> getProviderLoads() {
        synchronized (lock) {
            return Map.copyOf(providerLoads);
        }
    }

    /**
     * Deletes the sandbox behind every session idle longer than {@code maxInactive}.
     * Failures are logged and skipped.
     *
     * @return number of sandboxes actually deleted
     */
    public int cleanupInactiveSessions(Duration maxInactive) {
        Instant cutoff = clock.instant().minus(maxInactive);
        List<SandboxSession> idle;
        synchronized (lock) {
            idle = sessions.values().stream()
                    .filter(session -> session.lastActivity().isBefore(cutoff))
                    .toList();
        }
        int deleted = 0;
        for (SandboxSession session : idle) {
            try {
                MdcContext.setSession(session.id(), session.sandboxId(), session.provider().wireName());
                if (deleteSandbox(session.sandboxId(), session.provider())) {
                    deleted++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to reap idle sandbox {} on '{}': {}",
                        session.sandboxId(), session.provider(), e.getMessage());
            } finally {
                MdcContext.clear();
            }
        }
        if (!idle.isEmpty()) {
            log.info("Idle session cleanup: {} of {} idle sandbox(es) deleted", deleted, idle.size());
        }
        if (metrics != null) {
            metrics.recordSessionsReaped(deleted);
        }
        return deleted;
    }

    // -- Providers -----------------------------------------------------------

    public List<ProviderType> getAvailableProviders() {
        ensureInitialized();
        return registry.getAvailableProviders();
    }

    public ProviderCapabilities getProviderCapabilities(ProviderType provider) {
        return registry.getCapabilities(provider);
    }

    public ProviderInfo getProviderInfo(ProviderType provider) {
        ensureInitialized();
        return registry.getProviderInfo(provider);
    }

    /**
     * Runs a health check against every registered provider and caches the outcome
     * for health-aware load balancing.
     */
    public Map<ProviderType, ProviderHealth> healthCheckProviders() {
        ensureInitialized();
        Map<ProviderType, ProviderHealth> results = registry.healthCheckAll();
        synchronized (lock) {
            lastHealth.putAll(results);
        }
        results.forEach((type, health) -> {
            if (!health.healthy()) {
                log.warn("Provider '{}' unhealthy: {}", type, health.error());
            }
        });
        return results;
    }

    /**
     * @throws SandboxNotFoundException if no provider knows the sandbox
     */
    public ProviderType getProviderForSandbox(String sandboxId) {
        return resolve(sandboxId, null).type();
    }

    // -- Events --------------------------------------------------------------

    public EventBus.Subscription on(SandboxEventType type, Consumer<SandboxEvent> listener) {
        return eventBus.subscribe(type, listener);
    }

    public EventBus.Subscription onAny(Consumer<SandboxEvent> listener) {
        return eventBus.subscribeAll(listener);
    }

    public void off(SandboxEventType type, Consumer<SandboxEvent> listener) {
        eventBus.unsubscribe(type, listener);
    }

    /**
     * Polls metrics for every live session and publishes them as {@code sandbox:metrics}.
     * Failures are discarded per sandbox.
     */
    public void pollMetrics() {
        List<SandboxSession> snapshot = getActiveSessions(SessionFilters.none());
        for (SandboxSession session : snapshot) {
            try {
                SandboxMetrics sandboxMetrics = registry.getProvider(session.provider()).getMetrics(session.sandboxId());
                if (sandboxMetrics != null) {
                    eventBus.publish(SandboxEvent.of(SandboxEventType.SANDBOX_METRICS, session.provider(),
                            session.sandboxId(), null, Map.of("metrics", sandboxMetrics)));
                }
            } catch (RuntimeException e) {
                log.debug("Metrics poll for sandbox {} failed: {}", session.sandboxId(), e.getMessage());
                if (metrics != null) {
                    metrics.recordMetricsPollFailure(session.provider().wireName());
                }
            }
        }
    }

    // -- Internals -----------------------------------------------------------

    /**
     * Resolution order: explicit provider, session, then probing available providers
     * in registry order. A probe hit is cached as a new session.
     */
    private SandboxProvider resolve(String sandboxId, ProviderType explicit) {
        ensureInitialized();
        if (sandboxId == null || sandboxId.isBlank()) {
            throw new IllegalArgumentException("Sandbox id must not be blank");
        }
        if (explicit != null) {
            return registry.getProvider(explicit);
        }
        Optional<SandboxSession> session = getSessionForSandbox(sandboxId);
        if (session.isPresent()) {
            return registry.getProvider(session.get().provider());
        }
        for (ProviderType type : registry.getAvailableProviders()) {
            SandboxProvider candidate = registry.getProvider(type);
            try {
                SandboxEnvironment found = candidate.getSandbox(sandboxId);
                if (found != null) {
                    log.debug("Discovered untracked sandbox {} on '{}'", sandboxId, type);
                    registerSession(found, type, found.metadataValue("userId"), found.metadataValue("projectId"),
                            Map.of());
                    return candidate;
                }
            } catch (RuntimeException e) {
                log.debug("Probe of '{}' for sandbox {} failed: {}", type, sandboxId, e.getMessage());
            }
        }
        throw new SandboxNotFoundException(sandboxId);
    }

    private ProviderType selectProvider() {
        if (!properties.getLoadBalancing().isEnabled()) {
            return properties.getDefaultProvider();
        }
        List<ProviderType> candidates = registry.getAvailableProviders();
        if (candidates.isEmpty()) {
            return properties.getDefaultProvider();
        }
        synchronized (lock) {
            if (properties.getLoadBalancing().isHealthCheckRequired() && !lastHealth.isEmpty()) {
                List<ProviderType> healthy = candidates.stream()
                        .filter(type -> {
                            ProviderHealth health = lastHealth.get(type);
                            return health == null || health.healthy();
                        })
                        .toList();
                if (!healthy.isEmpty()) {
                    candidates = healthy;
                }
            }
            ProviderType selected = loadBalancer.select(candidates, providerLoads);
            log.debug("Load balancer ({}) selected '{}' from {}", loadBalancer.strategy(), selected, candidates);
            return selected;
        }
    }

    /**
     * Configured fallback when available and distinct from the failed provider,
     * else the first other available provider, else null.
     */
    private ProviderType chooseFallback(ProviderType failed) {
        List<ProviderType> remaining = new ArrayList<>(registry.getAvailableProviders());
        remaining.remove(failed);
        if (remaining.isEmpty()) {
            return null;
        }
        ProviderType configured = properties.getFallbackProvider();
        if (configured != null && remaining.contains(configured)) {
            return configured;
        }
        return remaining.get(0);
    }

    private void recordFailover(ProviderType from, ProviderType to, boolean recovered) {
        if (metrics != null) {
            metrics.recordFailover(from.wireName(), to.wireName(), recovered);
        }
    }

    private SandboxSession registerSession(SandboxEnvironment environment, ProviderType provider, String userId,
                                           String projectId, Map<String, String> metadata) {
        synchronized (lock) {
            String existing = sessionIdsBySandbox.get(environment.id());
            if (existing != null) {
                return sessions.get(existing);
            }
            Instant now = clock.instant();
            var session = new SandboxSession(newSessionId(now), environment.id(), provider, userId, projectId,
                    now, now, metadata);
            sessions.put(session.id(), session);
            sessionIdsBySandbox.put(environment.id(), session.id());
            providerLoads.merge(provider, 1, Integer::sum);
            return session;
        }
    }

    /**
     * Idempotent: the second removal for a sandbox is a no-op, so a relayed
     * {@code sandbox:deleted} and an explicit delete never decrement twice.
     */
    private boolean removeSession(String sandboxId) {
        synchronized (lock) {
            String sessionId = sessionIdsBySandbox.remove(sandboxId);
            if (sessionId == null) {
                return false;
            }
            SandboxSession removed = sessions.remove(sessionId);
            if (removed != null) {
                providerLoads.computeIfPresent(removed.provider(), (type, load) -> Math.max(0, load - 1));
            }
            return true;
        }
    }

    private SandboxSession touch(String sandboxId) {
        synchronized (lock) {
            String sessionId = sessionIdsBySandbox.get(sandboxId);
            if (sessionId == null) {
                return null;
            }
            SandboxSession touched = sessions.get(sessionId).touchedAt(clock.instant());
            sessions.put(sessionId, touched);
            return touched;
        }
    }

    private String newSessionId(Instant now) {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "session-" + now.toEpochMilli() + "-" + random.substring(0, Math.min(9, random.length()));
    }

    /**
     * Runs a provider operation, publishing {@code sandbox:error} before rethrowing a failure.
     */
    private <T> T guard(String sandboxId, SandboxProvider target, String operation, Function<SandboxProvider, T> call) {
        try {
            return call.apply(target);
        } catch (RuntimeException e) {
            if (!(e instanceof IllegalArgumentException) && !(e instanceof SandboxNotFoundException)) {
                eventBus.publish(SandboxEvent.of(SandboxEventType.SANDBOX_ERROR, target.type(), sandboxId, null,
                        Map.of("operation", operation, "error", String.valueOf(e.getMessage()))));
            }
            throw e;
        }
    }

    private void relay(SandboxEvent event) {
        if (event.type() == SandboxEventType.SANDBOX_DELETED && event.sandboxId() != null) {
            removeSession(event.sandboxId());
        }
        eventBus.publish(event);
    }

    private void broadcastChange(FileChangeType type, String sandboxId, String path, String content,
                                 FileEncoding encoding, SandboxSession session) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (encoding != null) {
            metadata.put("encoding", encoding.wireName());
        }
        metadata.put("source", "agent");
        var event = new FileChangeEvent(type, path, content, null, clock.instant(),
                session != null ? session.projectId() : null,
                sandboxId,
                session != null ? session.userId() : null,
                metadata);
        try {
            broadcaster.broadcast(event);
        } catch (RuntimeException e) {
            log.warn("File change broadcast for {} in sandbox {} failed: {}", path, sandboxId, e.getMessage());
        }
    }
}
