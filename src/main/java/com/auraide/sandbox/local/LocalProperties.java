package com.auraide.sandbox.local;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "aura.sandbox.local")
public class LocalProperties {

    private boolean enabled = true;
    private String basePath = System.getProperty("java.io.tmpdir") + "/aura-sandboxes";
    private int maxConcurrentSandboxes = 5;
    private DataSize maxFileSize = DataSize.ofMegabytes(100);
    private Duration defaultCommandTimeout = Duration.ofSeconds(30);
    private Duration maxExecutionTime = Duration.ofSeconds(60);
    private int maxOutputBytes = 1024 * 1024;
    private Duration snapshotTimeout = Duration.ofMinutes(5);
    private Duration cleanupInterval = Duration.ofMinutes(60);
    private Duration maxAge = Duration.ofHours(24);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getBasePath() { return basePath; }
    public void setBasePath(String basePath) { this.basePath = basePath; }
    public int getMaxConcurrentSandboxes() { return maxConcurrentSandboxes; }
    public void setMaxConcurrentSandboxes(int maxConcurrentSandboxes) { this.maxConcurrentSandboxes = maxConcurrentSandboxes; }
    public DataSize getMaxFileSize() { return maxFileSize; }
    public void setMaxFileSize(DataSize maxFileSize) { this.maxFileSize = maxFileSize; }
    public Duration getDefaultCommandTimeout() { return defaultCommandTimeout; }
    public void setDefaultCommandTimeout(Duration defaultCommandTimeout) { this.defaultCommandTimeout = defaultCommandTimeout; }
    public Duration getMaxExecutionTime() { return maxExecutionTime; }
    public void setMaxExecutionTime(Duration maxExecutionTime) { this.maxExecutionTime = maxExecutionTime; }
    public int getMaxOutputBytes() { return maxOutputBytes; }
    public void setMaxOutputBytes(int maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }
    public Duration getSnapshotTimeout() { return snapshotTimeout; }
    public void setSnapshotTimeout(Duration snapshotTimeout) { this.snapshotTimeout = snapshotTimeout; }
    public Duration getCleanupInterval() { return cleanupInterval; }
    public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
    public Duration getMaxAge() { return maxAge; }
    public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }
}
