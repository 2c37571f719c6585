package com.auraide.dispatch.api;

import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.SandboxNotFoundException;
import com.auraide.sandbox.model.ExecutionResult;
import com.auraide.sandbox.model.LogOptions;
import com.auraide.sandbox.model.SandboxEnvironment;
import com.auraide.sandbox.model.SandboxFilters;
import com.auraide.sandbox.model.SandboxMetrics;
import com.auraide.sandbox.model.SandboxStatus;
import com.auraide.sandbox.model.SandboxUpdateOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for sandbox lifecycle, command execution, metrics and logs.
 * Every endpoint accepts an optional {@code provider} parameter that bypasses resolution.
 */
@RestController
@RequestMapping("/api/v1/sandboxes")
public class SandboxController {

    private static final Logger log = LoggerFactory.getLogger(SandboxController.class);

    private final SandboxManager sandboxManager;

    public SandboxController(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    /**
     * POST /api/v1/sandboxes: Create a sandbox.
     */
    @PostMapping
    public ResponseEntity<SandboxEnvironment> createSandbox(@RequestBody CreateSandboxRequest request) {
        SandboxEnvironment environment = sandboxManager.createSandbox(
                request.toOptions(), ApiResponses.provider(request.provider()));
        return ResponseEntity.status(HttpStatus.CREATED).body(environment);
    }

    /**
     * GET /api/v1/sandboxes: List sandboxes, optionally narrowed by owner, status or template.
     */
    @GetMapping
    public List<SandboxEnvironment> listSandboxes(@RequestParam(required = false) String userId,
                                                  @RequestParam(required = false) String projectId,
                                                  @RequestParam(required = false) String status,
                                                  @RequestParam(required = false) String template,
                                                  @RequestParam(required = false) String provider) {
        var filters = new SandboxFilters(userId, projectId,
                status != null ? SandboxStatus.fromWire(status) : null, template);
        return sandboxManager.listSandboxes(filters, ApiResponses.provider(provider));
    }

    @GetMapping("/{sandboxId}")
    public SandboxEnvironment getSandbox(@PathVariable String sandboxId,
                                         @RequestParam(required = false) String provider) {
        SandboxEnvironment environment = sandboxManager.getSandbox(sandboxId, ApiResponses.provider(provider));
        if (environment == null) {
            throw new SandboxNotFoundException(sandboxId);
        }
        return environment;
    }

    @PatchMapping("/{sandboxId}")
    public ResponseEntity<Object> updateSandbox(@PathVariable String sandboxId,
                                                @RequestBody SandboxUpdateOptions options,
                                                @RequestParam(required = false) String provider) {
        return ApiResponses.capability(
                sandboxManager.updateSandbox(sandboxId, options, ApiResponses.provider(provider)));
    }

    @PostMapping("/{sandboxId}/start")
    public SandboxEnvironment startSandbox(@PathVariable String sandboxId,
                                           @RequestParam(required = false) String provider) {
        return sandboxManager.startSandbox(sandboxId, ApiResponses.provider(provider));
    }

    @PostMapping("/{sandboxId}/stop")
    public SandboxEnvironment stopSandbox(@PathVariable String sandboxId,
                                          @RequestParam(required = false) String provider) {
        return sandboxManager.stopSandbox(sandboxId, ApiResponses.provider(provider));
    }

    @PostMapping("/{sandboxId}/restart")
    public SandboxEnvironment restartSandbox(@PathVariable String sandboxId,
                                             @RequestParam(required = false) String provider) {
        return sandboxManager.restartSandbox(sandboxId, ApiResponses.provider(provider));
    }

    /**
     * DELETE /api/v1/sandboxes/{id}: 204 when deleted, 404 when the provider had nothing to delete.
     */
    @DeleteMapping("/{sandboxId}")
    public ResponseEntity<Void> deleteSandbox(@PathVariable String sandboxId,
                                              @RequestParam(required = false) String provider) {
        boolean deleted = sandboxManager.deleteSandbox(sandboxId, ApiResponses.provider(provider));
        log.info("Delete of sandbox {} requested (deleted={})", sandboxId, deleted);
        return deleted ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    /**
     * 204 when the provider cannot measure usage.
     */
    @GetMapping("/{sandboxId}/metrics")
    public ResponseEntity<SandboxMetrics> getMetrics(@PathVariable String sandboxId,
                                                     @RequestParam(required = false) String provider) {
        SandboxMetrics metrics = sandboxManager.getMetrics(sandboxId, ApiResponses.provider(provider));
        return metrics != null ? ResponseEntity.ok(metrics) : ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/sandboxes/{id}/execute: Run a shell command. A failing command still answers 200.
     */
    @PostMapping("/{sandboxId}/execute")
    public ExecutionResult execute(@PathVariable String sandboxId,
                                   @RequestBody ExecuteRequest request,
                                   @RequestParam(required = false) String provider) {
        return sandboxManager.executeCommand(sandboxId, request.command(), request.toOptions(),
                ApiResponses.provider(provider));
    }

    @GetMapping("/{sandboxId}/logs")
    public Map<String, List<String>> getLogs(
            @PathVariable String sandboxId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant until,
            @RequestParam(required = false) Integer tail,
            @RequestParam(required = false) String provider) {
        List<String> lines = sandboxManager.getLogs(sandboxId, new LogOptions(since, until, tail),
                ApiResponses.provider(provider));
        return Map.of("lines", lines);
    }
}
