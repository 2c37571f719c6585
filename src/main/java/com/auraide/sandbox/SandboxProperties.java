package com.auraide.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "aura.sandbox")
public class SandboxProperties {

    private ProviderType defaultProvider = ProviderType.LOCAL;
    private ProviderType fallbackProvider = ProviderType.LOCAL;
    private Duration restartSettleDelay = Duration.ofSeconds(1);
    private LoadBalancing loadBalancing = new LoadBalancing();
    private Failover failover = new Failover();
    private Sessions sessions = new Sessions();
    private Monitoring monitoring = new Monitoring();

    public ProviderType getDefaultProvider() { return defaultProvider; }
    public void setDefaultProvider(ProviderType defaultProvider) { this.defaultProvider = defaultProvider; }
    public ProviderType getFallbackProvider() { return fallbackProvider; }
    public void setFallbackProvider(ProviderType fallbackProvider) { this.fallbackProvider = fallbackProvider; }
    public Duration getRestartSettleDelay() { return restartSettleDelay; }
    public void setRestartSettleDelay(Duration restartSettleDelay) { this.restartSettleDelay = restartSettleDelay; }
    public LoadBalancing getLoadBalancing() { return loadBalancing; }
    public void setLoadBalancing(LoadBalancing loadBalancing) { this.loadBalancing = loadBalancing; }
    public Failover getFailover() { return failover; }
    public void setFailover(Failover failover) { this.failover = failover; }
    public Sessions getSessions() { return sessions; }
    public void setSessions(Sessions sessions) { this.sessions = sessions; }
    public Monitoring getMonitoring() { return monitoring; }
    public void setMonitoring(Monitoring monitoring) { this.monitoring = monitoring; }

    public static class LoadBalancing {
        private boolean enabled = false;
        private LoadBalancingStrategy strategy = LoadBalancingStrategy.ROUND_ROBIN;
        private boolean healthCheckRequired = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public LoadBalancingStrategy getStrategy() { return strategy; }
        public void setStrategy(LoadBalancingStrategy strategy) { this.strategy = strategy; }
        public boolean isHealthCheckRequired() { return healthCheckRequired; }
        public void setHealthCheckRequired(boolean healthCheckRequired) { this.healthCheckRequired = healthCheckRequired; }
    }

    public static class Failover {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Sessions {
        private Duration maxInactive = Duration.ofMinutes(60);
        private Duration cleanupInterval = Duration.ofMinutes(15);
        private boolean autoCleanup = true;

        public Duration getMaxInactive() { return maxInactive; }
        public void setMaxInactive(Duration maxInactive) { this.maxInactive = maxInactive; }
        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
        public boolean isAutoCleanup() { return autoCleanup; }
        public void setAutoCleanup(boolean autoCleanup) { this.autoCleanup = autoCleanup; }
    }

    public static class Monitoring {
        private boolean metricsEnabled = true;
        private Duration metricsInterval = Duration.ofSeconds(30);
        private Duration healthCheckInterval = Duration.ofSeconds(60);

        public boolean isMetricsEnabled() { return metricsEnabled; }
        public void setMetricsEnabled(boolean metricsEnabled) { this.metricsEnabled = metricsEnabled; }
        public Duration getMetricsInterval() { return metricsInterval; }
        public void setMetricsInterval(Duration metricsInterval) { this.metricsInterval = metricsInterval; }
        public Duration getHealthCheckInterval() { return healthCheckInterval; }
        public void setHealthCheckInterval(Duration healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }
    }
}
