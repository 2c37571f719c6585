package com.auraide.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of {@link HealthCheckService}. DEGRADED is reported as a custom status.
 */
@Component("sandboxProvidersHealthIndicator")
public class SandboxProvidersHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public SandboxProvidersHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var checks = healthCheckService.checkAll();
        var builder = switch (HealthCheckService.overall(checks)) {
            case UP -> Health.up();
            case DOWN -> Health.down();
            case DEGRADED -> Health.status("DEGRADED");
        };
        for (HealthStatus check : checks) {
            builder.withDetail(check.component(), check.status() + ": " + check.detail());
        }
        return builder.build();
    }
}
