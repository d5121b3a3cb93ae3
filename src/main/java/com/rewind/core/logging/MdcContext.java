package com.rewind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Rewind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId, String projectId) {
        MDC.put("sessionId", sessionId);
        MDC.put("projectId", projectId);
    }

    public static void setCheckpoint(String sessionId, String projectId, String checkpointId) {
        setSession(sessionId, projectId);
        MDC.put("checkpointId", checkpointId);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("projectId");
        MDC.remove("checkpointId");
    }
}
