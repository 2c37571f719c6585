package com.auraide.dispatch.api;

import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.model.RestoreOptions;
import com.auraide.sandbox.model.TerminalOptions;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Snapshots, terminals and port forwarding. A provider without the capability answers 501.
 */
@RestController
@RequestMapping("/api/v1/sandboxes/{sandboxId}")
public class SandboxCapabilityController {

    private final SandboxManager sandboxManager;

    public SandboxCapabilityController(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @PostMapping("/snapshots")
    public ResponseEntity<Object> createSnapshot(@PathVariable String sandboxId,
                                                 @RequestBody SnapshotRequest request,
                                                 @RequestParam(required = false) String provider) {
        String name = request.name() != null ? request.name() : "snapshot";
        return ApiResponses.capability(sandboxManager.createSnapshot(sandboxId, name, request.toOptions(),
                ApiResponses.provider(provider)));
    }

    @PostMapping("/snapshots/{snapshotId}/restore")
    public ResponseEntity<Object> restoreSnapshot(@PathVariable String sandboxId,
                                                  @PathVariable String snapshotId,
                                                  @RequestBody(required = false) RestoreOptions options,
                                                  @RequestParam(required = false) String provider) {
        return ApiResponses.capability(sandboxManager.restoreSnapshot(sandboxId, snapshotId,
                options != null ? options : RestoreOptions.defaults(), ApiResponses.provider(provider)));
    }

    @PostMapping("/terminals")
    public ResponseEntity<Object> connectTerminal(@PathVariable String sandboxId,
                                                  @RequestBody(required = false) TerminalOptions options,
                                                  @RequestParam(required = false) String provider) {
        return ApiResponses.capability(sandboxManager.connectTerminal(sandboxId,
                options != null ? options : TerminalOptions.defaults(), ApiResponses.provider(provider)));
    }

    @DeleteMapping("/terminals/{terminalSessionId}")
    public ResponseEntity<Object> disconnectTerminal(@PathVariable String sandboxId,
                                                     @PathVariable String terminalSessionId,
                                                     @RequestParam(required = false) String provider) {
        return ApiResponses.capability(sandboxManager.disconnectTerminal(sandboxId, terminalSessionId,
                ApiResponses.provider(provider)));
    }

    @PostMapping("/ports")
    public ResponseEntity<Object> forwardPort(@PathVariable String sandboxId,
                                              @RequestBody PortForwardRequest request,
                                              @RequestParam(required = false) String provider) {
        return ApiResponses.capability(sandboxManager.forwardPort(sandboxId, request.port(), request.toOptions(),
                ApiResponses.provider(provider)));
    }

    @DeleteMapping("/ports/{externalPort}")
    public ResponseEntity<Object> removePortForward(@PathVariable String sandboxId,
                                                    @PathVariable int externalPort,
                                                    @RequestParam(required = false) String provider) {
        return ApiResponses.capability(sandboxManager.removePortForward(sandboxId, externalPort,
                ApiResponses.provider(provider)));
    }
}
