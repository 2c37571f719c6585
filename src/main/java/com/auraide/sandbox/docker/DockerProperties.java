package com.auraide.sandbox.docker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "aura.sandbox.docker")
public class DockerProperties {

    private boolean enabled = false;

    /** Docker daemon endpoint; {@code DOCKER_HOST} wins when set. */
    private String host = "unix:///var/run/docker.sock";

    private String defaultImage = "ubuntu:22.04";

    /** Image per runtime; runtimes not listed here use {@link #defaultImage}. */
    private Map<String, String> runtimeImages = new LinkedHashMap<>(Map.of(
            "node", "node:20-bookworm",
            "python", "python:3.11-bookworm",
            "shell", "ubuntu:22.04"));

    private int memoryLimitMb = 1024;
    private int cpuCount = 1;
    private int maxContainers = 10;
    private String workingDir = "/workspace";
    private Duration defaultCommandTimeout = Duration.ofSeconds(30);
    private Duration pullTimeout = Duration.ofMinutes(5);
    private int stopTimeoutSeconds = 10;
    private int maxOutputBytes = 1024 * 1024;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public String getDefaultImage() { return defaultImage; }
    public void setDefaultImage(String defaultImage) { this.defaultImage = defaultImage; }
    public Map<String, String> getRuntimeImages() { return runtimeImages; }
    public void setRuntimeImages(Map<String, String> runtimeImages) { this.runtimeImages = runtimeImages; }
    public int getMemoryLimitMb() { return memoryLimitMb; }
    public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
    public int getCpuCount() { return cpuCount; }
    public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
    public int getMaxContainers() { return maxContainers; }
    public void setMaxContainers(int maxContainers) { this.maxContainers = maxContainers; }
    public String getWorkingDir() { return workingDir; }
    public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
    public Duration getDefaultCommandTimeout() { return defaultCommandTimeout; }
    public void setDefaultCommandTimeout(Duration defaultCommandTimeout) { this.defaultCommandTimeout = defaultCommandTimeout; }
    public Duration getPullTimeout() { return pullTimeout; }
    public void setPullTimeout(Duration pullTimeout) { this.pullTimeout = pullTimeout; }
    public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
    public void setStopTimeoutSeconds(int stopTimeoutSeconds) { this.stopTimeoutSeconds = stopTimeoutSeconds; }
    public int getMaxOutputBytes() { return maxOutputBytes; }
    public void setMaxOutputBytes(int maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }

    public String imageFor(String runtime) {
        if (runtime == null) {
            return defaultImage;
        }
        return runtimeImages.getOrDefault(runtime, defaultImage);
    }
}
