package com.auraide.sandbox;

import com.auraide.sandbox.docker.DockerProperties;
import com.auraide.sandbox.docker.DockerSandboxProvider;
import com.auraide.sandbox.local.LocalProperties;
import com.auraide.sandbox.local.LocalSandboxProvider;
import com.auraide.sandbox.workspace.WorkspaceApiClient;
import com.auraide.sandbox.workspace.WorkspaceProperties;
import com.auraide.sandbox.workspace.WorkspaceSandboxProvider;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One provider bean per enabled backend. {@link SandboxProviderRegistry} collects whatever is present.
 */
@Configuration
public class SandboxConfig {

    @Bean
    @ConditionalOnProperty(name = "aura.sandbox.local.enabled", havingValue = "true", matchIfMissing = true)
    public SandboxProvider localSandboxProvider(LocalProperties localProperties, SandboxProperties properties) {
        return new LocalSandboxProvider(localProperties, properties.getRestartSettleDelay());
    }

    @Bean
    @ConditionalOnProperty(name = "aura.sandbox.docker.enabled", havingValue = "true")
    public DockerClient dockerClient(DockerProperties dockerProperties) {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", dockerProperties.getHost());
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // Zerodep speaks to the unix socket directly
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "aura.sandbox.docker.enabled", havingValue = "true")
    public SandboxProvider dockerSandboxProvider(DockerClient dockerClient, DockerProperties dockerProperties,
                                                 SandboxProperties properties) {
        return new DockerSandboxProvider(dockerClient, dockerProperties, properties.getRestartSettleDelay());
    }

    @Bean
    @ConditionalOnProperty(name = "aura.sandbox.workspace.enabled", havingValue = "true")
    public WorkspaceApiClient workspaceApiClient(WorkspaceProperties workspaceProperties) {
        return new WorkspaceApiClient(workspaceProperties);
    }

    @Bean
    @ConditionalOnProperty(name = "aura.sandbox.workspace.enabled", havingValue = "true")
    public SandboxProvider workspaceSandboxProvider(WorkspaceApiClient client, WorkspaceProperties workspaceProperties) {
        return new WorkspaceSandboxProvider(client, workspaceProperties);
    }
}
