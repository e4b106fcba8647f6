package com.swarmmind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while the swarm runs, used for SSE streaming and CLI output.
 *
 * @param eventType event type (e.g. "pheromone.emitted", "phase.transition")
 * @param agentId   the agent this event relates to (nullable for swarm-level events)
 * @param tick      global tick the event happened in
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SwarmEvent(
    String eventType,
    String agentId,
    long tick,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String PHEROMONE_EMITTED = "pheromone.emitted";
    public static final String AGENT_SYNCHRONIZED = "agent.synchronized";
    public static final String PHASE_TRANSITION = "phase.transition";
    public static final String DECISION_SELECTED = "decision.selected";
    public static final String DECISION_COMPLETED = "decision.completed";
    public static final String DECISION_FAILED = "decision.failed";
    public static final String COLLABORATION_PROPOSED = "collaboration.proposed";
    public static final String TICK_COMPLETED = "tick.completed";

    public static SwarmEvent of(String eventType, String agentId, long tick, Map<String, Object> payload) {
        return new SwarmEvent(eventType, agentId, tick, payload, Instant.now());
    }
}
