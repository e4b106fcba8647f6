package com.swarmmind.core.external;

import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.AgentThought;
import com.swarmmind.core.model.DecisionResult;
import com.swarmmind.core.model.DecisionStatus;

import java.util.List;

/**
 * Best-effort persistence of thoughts and decisions. Callers log and ignore
 * failures.
 */
public interface DecisionStore {

    void saveThought(AgentThought thought);

    void saveDecision(AgentDecision decision);

    void updateStatus(String decisionId, DecisionStatus status, DecisionResult result);

    /** Most recent first. */
    List<AgentThought> recentThoughts(int limit);

    /** Most recent first. */
    List<DecisionRecord> recentDecisions(int limit);
}
