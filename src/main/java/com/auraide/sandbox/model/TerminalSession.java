package com.auraide.sandbox.model;

/**
 * @param wsUrl websocket endpoint for the terminal stream, null when the provider has none
 */
public record TerminalSession(String sessionId, String sandboxId, String wsUrl) {}
