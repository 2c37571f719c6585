package com.auraide.dispatch.api;

import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.SandboxSession;
import com.auraide.sandbox.SessionFilters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the manager's session table.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SandboxManager sandboxManager;

    public SessionController(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @GetMapping
    public List<SandboxSession> listSessions(@RequestParam(required = false) String userId,
                                             @RequestParam(required = false) String projectId,
                                             @RequestParam(required = false) String provider) {
        return sandboxManager.getActiveSessions(
                new SessionFilters(userId, projectId, ApiResponses.provider(provider)));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SandboxSession> getSession(@PathVariable String sessionId) {
        return ResponseEntity.of(sandboxManager.getSessionById(sessionId));
    }

    @GetMapping("/by-sandbox/{sandboxId}")
    public ResponseEntity<SandboxSession> getSessionForSandbox(@PathVariable String sandboxId) {
        return ResponseEntity.of(sandboxManager.getSessionForSandbox(sandboxId));
    }

    /**
     * POST /api/v1/sessions/cleanup: Delete sandboxes idle for longer than the given number of minutes.
     */
    @PostMapping("/cleanup")
    public Map<String, Integer> cleanup(@RequestParam(defaultValue = "30") long maxInactiveMinutes) {
        if (maxInactiveMinutes < 0) {
            throw new IllegalArgumentException("maxInactiveMinutes must not be negative");
        }
        int deleted = sandboxManager.cleanupInactiveSessions(Duration.ofMinutes(maxInactiveMinutes));
        log.info("Manual session cleanup removed {} sandbox(es)", deleted);
        return Map.of("deleted", deleted);
    }
}
