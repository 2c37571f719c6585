package com.auraide.dispatch.api;

import com.auraide.broadcast.FileChangeEvent;
import com.auraide.broadcast.SseFileChangeBroadcaster;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * Streams file changes made inside sandboxes to editor clients.
 */
@RestController
@RequestMapping("/api/v1/files")
public class FileChangeController {

    private final SseFileChangeBroadcaster broadcaster;

    public FileChangeController(SseFileChangeBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestParam(required = false) String projectId,
                             @RequestParam(required = false) String sandboxId,
                             @RequestParam(required = false) String userId) {
        return broadcaster.connect(new SseFileChangeBroadcaster.ClientFilter(projectId, sandboxId, userId));
    }

    @GetMapping("/events/recent")
    public List<FileChangeEvent> recent() {
        return broadcaster.recentEvents();
    }
}
