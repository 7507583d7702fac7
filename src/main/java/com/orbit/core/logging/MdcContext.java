package com.orbit.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing agent-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void setCycle(String agentId, long cycle) {
        MDC.put("agentId", agentId);
        MDC.put("cycle", String.valueOf(cycle));
    }

    public static void setPlan(String planId) {
        MDC.put("planId", planId);
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("cycle");
        MDC.remove("planId");
    }
}
