package com.auraide.broadcast;

/**
 * Sink for file changes made through the sandbox manager. Fire and forget:
 * implementations must not block the caller on slow clients.
 */
public interface FileChangeBroadcaster {

    void broadcast(FileChangeEvent event);
}
