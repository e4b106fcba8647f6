package com.swarmmind.core.logging;

import org.slf4j.MDC;

/**
 * Swarm-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String AGENT_ID = "agentId";
    public static final String AGENT_NAME = "agentName";
    public static final String TICK = "tick";

    private MdcContext() {}

    public static void setTick(long tick) {
        MDC.put(TICK, String.valueOf(tick));
    }

    public static void setAgent(String agentId, String agentName, long tick) {
        MDC.put(AGENT_ID, agentId);
        MDC.put(AGENT_NAME, agentName);
        MDC.put(TICK, String.valueOf(tick));
    }

    public static void clearAgent() {
        MDC.remove(AGENT_ID);
        MDC.remove(AGENT_NAME);
    }

    public static void clear() {
        MDC.remove(AGENT_ID);
        MDC.remove(AGENT_NAME);
        MDC.remove(TICK);
    }
}
