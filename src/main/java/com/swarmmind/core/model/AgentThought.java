package com.swarmmind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A structured thought produced by reasoning over an observation.
 *
 * @param id               unique identifier
 * @param agentId          agent that formed the thought
 * @param trigger          what prompted it (e.g. "exploration", "knowledge_synthesis")
 * @param observation      what the agent noticed
 * @param reasoning        chain of thought
 * @param conclusion       final takeaway
 * @param suggestedActions free-text next steps, parsed later into {@link AgentAction}s
 * @param confidence       0-1
 * @param timestamp        when it was formed
 */
public record AgentThought(
    String id,
    String agentId,
    String trigger,
    String observation,
    String reasoning,
    String conclusion,
    List<String> suggestedActions,
    double confidence,
    Instant timestamp
) implements Serializable {

    public AgentThought {
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
