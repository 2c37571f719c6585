package com.auraide.broadcast;

import com.auraide.core.metrics.AuraMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Pushes {@link FileChangeEvent}s to editor clients over Server-Sent Events.
 * <p>
 * Each client may narrow the stream by project, sandbox or user. The most recent
 * {@value #MAX_RECENT_EVENTS} events are kept and replayed to a client when it connects,
 * so an editor that opens mid-session sees what the agent just wrote.
 * <p>
 * A heartbeat comment is sent every {@value #HEARTBEAT_INTERVAL_SECONDS} seconds to keep
 * idle connections open through proxies.
 */
@Service
public class SseFileChangeBroadcaster implements FileChangeBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SseFileChangeBroadcaster.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    static final int MAX_RECENT_EVENTS = 100;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final long timeoutMs;
    private final AuraMetrics metrics;

    private final CopyOnWriteArrayList<ClientRegistration> clients = new CopyOnWriteArrayList<>();

    /** Guarded by itself. */
    private final Deque<FileChangeEvent> recentEvents = new ArrayDeque<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "file-change-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseFileChangeBroadcaster(@Autowired(required = false) AuraMetrics metrics) {
        this(DEFAULT_TIMEOUT_MS, metrics);
    }

    SseFileChangeBroadcaster(long timeoutMs, AuraMetrics metrics) {
        this.timeoutMs = timeoutMs;
        this.metrics = metrics;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        clients.forEach(registration -> registration.emitter().complete());
        clients.clear();
    }

    /**
     * Opens a stream for a client. Recent events matching the filter are sent immediately.
     *
     * @param filter which events the client wants; {@link ClientFilter#all()} for everything
     */
    public SseEmitter connect(ClientFilter filter) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var registration = new ClientRegistration(UUID.randomUUID().toString(), filter, emitter);
        clients.add(registration);

        emitter.onCompletion(() -> remove(registration));
        emitter.onTimeout(() -> remove(registration));
        emitter.onError(ex -> {
            log.debug("File change stream error for client {}: {}", registration.id(), ex.getMessage());
            remove(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
            for (FileChangeEvent event : recentEvents()) {
                if (filter.matches(event)) {
                    emitter.send(toSseEvent(event));
                }
            }
        } catch (IOException e) {
            log.warn("Failed to send initial events to client {}: {}", registration.id(), e.getMessage());
            remove(registration);
        }

        log.info("File change client {} connected (project={}, sandbox={}, user={})",
                registration.id(), filter.projectId(), filter.sandboxId(), filter.userId());
        return emitter;
    }

    @Override
    public void broadcast(FileChangeEvent event) {
        synchronized (recentEvents) {
            recentEvents.addLast(event);
            while (recentEvents.size() > MAX_RECENT_EVENTS) {
                recentEvents.removeFirst();
            }
        }
        if (metrics != null) {
            metrics.recordFileChange(event.type().wireName());
        }

        int delivered = 0;
        for (ClientRegistration registration : clients) {
            if (!registration.filter().matches(event)) {
                continue;
            }
            try {
                registration.emitter().send(toSseEvent(event));
                delivered++;
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping file change client {}: {}", registration.id(), e.getMessage());
                remove(registration);
            }
        }
        log.debug("Broadcast {} {} to {} client(s)", event.type().wireName(), event.path(), delivered);
    }

    public int clientCount() {
        return clients.size();
    }

    public List<FileChangeEvent> recentEvents() {
        synchronized (recentEvents) {
            return List.copyOf(recentEvents);
        }
    }

    private void sendHeartbeats() {
        for (ClientRegistration registration : clients) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for client {}: {}", registration.id(), e.getMessage());
                remove(registration);
            }
        }
    }

    private void remove(ClientRegistration registration) {
        if (clients.remove(registration)) {
            log.debug("File change client {} disconnected", registration.id());
        }
    }

    private static SseEmitter.SseEventBuilder toSseEvent(FileChangeEvent event) {
        return SseEmitter.event()
                .name("file-change")
                .data(event);
    }

    /**
     * Narrows a client's stream; null fields match anything.
     */
    public record ClientFilter(String projectId, String sandboxId, String userId) {

        public static ClientFilter all() {
            return new ClientFilter(null, null, null);
        }

        public boolean matches(FileChangeEvent event) {
            if (projectId != null && !projectId.equals(event.projectId())) return false;
            if (sandboxId != null && !sandboxId.equals(event.sandboxId())) return false;
            return userId == null || userId.equals(event.userId());
        }
    }

    private record ClientRegistration(String id, ClientFilter filter, SseEmitter emitter) {}
}
