package com.auraide.dispatch.api;

import com.auraide.sandbox.Capability;
import com.auraide.sandbox.CapabilityResult;
import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.ProviderUnavailableException;
import com.auraide.sandbox.SandboxException;
import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.model.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest({SandboxController.class, SandboxFileController.class, SandboxCapabilityController.class,
        SessionController.class})
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SandboxControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private SandboxManager sandboxManager;

    private static SandboxEnvironment environment(String id) {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        return new SandboxEnvironment(id, "demo", ProviderType.LOCAL, SandboxStatus.RUNNING, "node", "node",
                null, new NetworkInfo(List.of(), null), Map.of("userId", "u1"), now, now, null);
    }

    // ── POST /api/v1/sandboxes ───────────────────────────────────────

    @Test
    @DisplayName("POST /sandboxes returns 201 with the created sandbox")
    void createSandbox() throws Exception {
        when(sandboxManager.createSandbox(any(), eq(ProviderType.DOCKER))).thenReturn(environment("sb-1"));

        String body = objectMapper.writeValueAsString(Map.of("name", "demo", "runtime", "node", "provider", "docker"));

        mockMvc.perform(post("/api/v1/sandboxes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("sb-1"))
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    @DisplayName("POST /sandboxes with an unknown provider returns 400")
    void createSandboxUnknownProvider() throws Exception {
        mockMvc.perform(post("/api/v1/sandboxes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"mainframe\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    @DisplayName("POST /sandboxes answers 503 when no provider can take the sandbox")
    void createSandboxUnavailable() throws Exception {
        when(sandboxManager.createSandbox(any(), isNull()))
                .thenThrow(new ProviderUnavailableException(ProviderType.DOCKER, "No healthy sandbox provider available"));

        mockMvc.perform(post("/api/v1/sandboxes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isServiceUnavailable());
    }

    // ── GET /api/v1/sandboxes/{id} ───────────────────────────────────

    @Test
    @DisplayName("GET /sandboxes/{id} returns 404 for an unknown sandbox")
    void getSandboxNotFound() throws Exception {
        when(sandboxManager.getSandbox("ghost", null)).thenReturn(null);

        mockMvc.perform(get("/api/v1/sandboxes/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    @DisplayName("GET /sandboxes passes filters through")
    void listSandboxes() throws Exception {
        when(sandboxManager.listSandboxes(new SandboxFilters("u1", null, SandboxStatus.RUNNING, null), null))
                .thenReturn(List.of(environment("sb-1")));

        mockMvc.perform(get("/api/v1/sandboxes").param("userId", "u1").param("status", "running"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("sb-1"));
    }

    @Test
    @DisplayName("DELETE /sandboxes/{id} returns 204, or 404 when nothing was deleted")
    void deleteSandbox() throws Exception {
        when(sandboxManager.deleteSandbox("sb-1", null)).thenReturn(true);
        when(sandboxManager.deleteSandbox("ghost", null)).thenReturn(false);

        mockMvc.perform(delete("/api/v1/sandboxes/sb-1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/sandboxes/ghost")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /sandboxes/{id}/metrics returns 204 when the provider cannot measure")
    void metricsUnavailable() throws Exception {
        when(sandboxManager.getMetrics("sb-1", null)).thenReturn(null);

        mockMvc.perform(get("/api/v1/sandboxes/sb-1/metrics")).andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("PATCH /sandboxes/{id} returns 501 when resource scaling is unsupported")
    void updateUnsupported() throws Exception {
        when(sandboxManager.updateSandbox(eq("sb-1"), any(), isNull()))
                .thenReturn(CapabilityResult.unsupported(ProviderType.DOCKER, Capability.RESOURCE_SCALING));

        mockMvc.perform(patch("/api/v1/sandboxes/sb-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resources\":{\"cpu\":4}}"))
                .andExpect(status().isNotImplemented())
                .andExpect(jsonPath("$.capability").value("resourceScaling"));
    }

    // ── POST /api/v1/sandboxes/{id}/execute ──────────────────────────

    @Test
    @DisplayName("a failing command still answers 200 with its exit code")
    void executeFailingCommand() throws Exception {
        when(sandboxManager.executeCommand(eq("sb-1"), eq("false"), any(), isNull()))
                .thenReturn(ExecutionResult.completed(1, "", "boom", 4));

        mockMvc.perform(post("/api/v1/sandboxes/sb-1/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\":\"false\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.exitCode").value(1))
                .andExpect(jsonPath("$.error").value("boom"));
    }

    @Test
    @DisplayName("a blank command returns 400")
    void executeBlankCommand() throws Exception {
        when(sandboxManager.executeCommand(eq("sb-1"), eq(" "), any(), isNull()))
                .thenThrow(new IllegalArgumentException("Command must not be blank"));

        mockMvc.perform(post("/api/v1/sandboxes/sb-1/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Command must not be blank"));
    }

    @Test
    @DisplayName("provider failures map to 502")
    void providerFailure() throws Exception {
        when(sandboxManager.startSandbox("sb-1", null)).thenThrow(new SandboxException("daemon went away"));

        mockMvc.perform(post("/api/v1/sandboxes/sb-1/start"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("daemon went away"));
    }

    // ── Files ────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /files/content returns 404 for a missing file")
    void readMissingFile() throws Exception {
        when(sandboxManager.readFile(eq("sb-1"), eq("nope.txt"), any(), isNull())).thenReturn(null);

        mockMvc.perform(get("/api/v1/sandboxes/sb-1/files/content").param("path", "nope.txt"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /files/content returns the encoded content")
    void readFile() throws Exception {
        var file = new SandboxFile("a.txt", "hello".getBytes(StandardCharsets.UTF_8), FileEncoding.UTF_8, 5, null);
        when(sandboxManager.readFile(eq("sb-1"), eq("a.txt"), any(), isNull())).thenReturn(file);

        mockMvc.perform(get("/api/v1/sandboxes/sb-1/files/content").param("path", "a.txt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("hello"))
                .andExpect(jsonPath("$.size").value(5));
    }

    @Test
    @DisplayName("PUT /files/content writes and returns 204")
    void writeFile() throws Exception {
        mockMvc.perform(put("/api/v1/sandboxes/sb-1/files/content")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"src/app.js\",\"content\":\"x\"}"))
                .andExpect(status().isNoContent());

        verify(sandboxManager).writeFile(eq("sb-1"), eq("src/app.js"), eq("x"), any(), isNull());
    }

    // ── Capabilities ─────────────────────────────────────────────────

    @Test
    @DisplayName("POST /snapshots defaults the name and returns the snapshot")
    void createSnapshot() throws Exception {
        var info = new SnapshotInfo("snap-1", "sb-1", "snapshot", null, 42, Instant.parse("2026-03-01T10:00:00Z"));
        when(sandboxManager.createSnapshot(eq("sb-1"), eq("snapshot"), any(), isNull()))
                .thenReturn(CapabilityResult.of(info));

        mockMvc.perform(post("/api/v1/sandboxes/sb-1/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.snapshotId").value("snap-1"));
    }

    @Test
    @DisplayName("POST /terminals returns 501 when terminals are unsupported")
    void terminalUnsupported() throws Exception {
        when(sandboxManager.connectTerminal(eq("sb-1"), any(), isNull()))
                .thenReturn(CapabilityResult.unsupported(ProviderType.DOCKER, Capability.TERMINAL));

        mockMvc.perform(post("/api/v1/sandboxes/sb-1/terminals"))
                .andExpect(status().isNotImplemented())
                .andExpect(jsonPath("$.capability").value("terminal"));
    }

    // ── Sessions ─────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /sessions/{id} returns 404 when unknown")
    void unknownSession() throws Exception {
        when(sandboxManager.getSessionById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/sessions/nope")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /sessions/cleanup reports how many sessions were reaped")
    void cleanupSessions() throws Exception {
        when(sandboxManager.cleanupInactiveSessions(java.time.Duration.ofMinutes(10))).thenReturn(3);

        mockMvc.perform(post("/api/v1/sessions/cleanup").param("maxInactiveMinutes", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(3));
    }
}
