package com.auraide.dispatch.cli;

import com.auraide.core.health.HealthCheckService;
import com.auraide.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: aura health
 * <p>
 * Runs every provider health check and prints the results. Exits 1 when no provider is usable.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check provider health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }

        System.out.println("──────────────────────────────────");
        HealthStatus.Status overall = HealthCheckService.overall(checks);
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: all systems operational");
            case DEGRADED -> ConsoleOutput.warn("Overall: degraded");
            case DOWN -> ConsoleOutput.error("Overall: no sandbox provider available");
        }
        return overall == HealthStatus.Status.DOWN ? 1 : 0;
    }
}
