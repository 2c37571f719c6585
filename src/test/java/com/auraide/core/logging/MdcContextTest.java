package com.auraide.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setSandbox puts sandboxId and provider in MDC")
    void setSandbox() {
        MdcContext.setSandbox("local-1", "local");
        assertEquals("local-1", MDC.get("sandboxId"));
        assertEquals("local", MDC.get("provider"));
    }

    @Test
    @DisplayName("setSandbox skips null values")
    void setSandboxSkipsNulls() {
        MdcContext.setSandbox(null, "docker");
        assertNull(MDC.get("sandboxId"));
        assertEquals("docker", MDC.get("provider"));
    }

    @Test
    @DisplayName("setSession adds sessionId on top of the sandbox keys")
    void setSession() {
        MdcContext.setSession("session-1", "local-1", "local");
        assertEquals("session-1", MDC.get("sessionId"));
        assertEquals("local-1", MDC.get("sandboxId"));
    }

    @Test
    @DisplayName("clear removes all sandbox MDC keys")
    void clear() {
        MdcContext.setSession("session-1", "local-1", "local");
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("sandboxId"));
        assertNull(MDC.get("provider"));
    }
}
