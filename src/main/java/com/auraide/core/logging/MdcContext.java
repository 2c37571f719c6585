package com.auraide.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing sandbox-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSandbox(String sandboxId, String provider) {
        if (sandboxId != null) {
            MDC.put("sandboxId", sandboxId);
        }
        if (provider != null) {
            MDC.put("provider", provider);
        }
    }

    public static void setSession(String sessionId, String sandboxId, String provider) {
        MDC.put("sessionId", sessionId);
        setSandbox(sandboxId, provider);
    }

    public static void clear() {
        MDC.remove("sandboxId");
        MDC.remove("provider");
        MDC.remove("sessionId");
    }
}
