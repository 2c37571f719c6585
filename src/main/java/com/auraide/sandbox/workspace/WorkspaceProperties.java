package com.auraide.sandbox.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings for the remote workspace service.
 */
@Component
@ConfigurationProperties(prefix = "aura.sandbox.workspace")
public class WorkspaceProperties {

    private boolean enabled = false;
    private String apiUrl = "http://localhost:3986/api";
    private String apiKey;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration defaultCommandTimeout = Duration.ofSeconds(30);
    private int maxSandboxes = 50;
    private List<String> runtimes = new ArrayList<>(List.of("node", "python", "java", "go", "shell"));

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getApiUrl() { return apiUrl; }
    public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public Duration getDefaultCommandTimeout() { return defaultCommandTimeout; }
    public void setDefaultCommandTimeout(Duration defaultCommandTimeout) { this.defaultCommandTimeout = defaultCommandTimeout; }
    public int getMaxSandboxes() { return maxSandboxes; }
    public void setMaxSandboxes(int maxSandboxes) { this.maxSandboxes = maxSandboxes; }
    public List<String> getRuntimes() { return runtimes; }
    public void setRuntimes(List<String> runtimes) { this.runtimes = runtimes; }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
