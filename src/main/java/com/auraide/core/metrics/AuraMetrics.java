package com.auraide.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for sandbox orchestration.
 */
@Service
public class AuraMetrics {

    private final MeterRegistry registry;

    public AuraMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSandboxCreated(String provider) {
        Counter.builder("aura.sandbox.created")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    public void recordSandboxDeleted(String provider) {
        Counter.builder("aura.sandbox.deleted")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * Records a creation that was retried on another provider.
     *
     * @param from     provider whose create failed
     * @param to       fallback provider tried next
     * @param recovered whether the fallback succeeded
     */
    public void recordFailover(String from, String to, boolean recovered) {
        Counter.builder("aura.sandbox.failovers")
                .description("Sandbox creations retried on a fallback provider")
                .tag("from", from)
                .tag("to", to)
                .tag("recovered", String.valueOf(recovered))
                .register(registry)
                .increment();
    }

    public void recordCommandExecution(String provider, boolean success, long ms) {
        Timer.builder("aura.command.duration")
                .tag("provider", provider)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSessionsReaped(int count) {
        DistributionSummary.builder("aura.sessions.reaped")
                .description("Idle sessions deleted per cleanup pass")
                .register(registry)
                .record(count);
    }

    public void recordFileChange(String type) {
        Counter.builder("aura.files.changes")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordMetricsPollFailure(String provider) {
        Counter.builder("aura.metrics.poll_failures")
                .description("Sandbox metrics polls that failed and were discarded")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    public void registerActiveSessionsGauge(Supplier<Number> activeSessions) {
        Gauge.builder("aura.sessions.active", activeSessions)
                .description("Sandboxes currently tracked by the manager")
                .register(registry);
    }
}
