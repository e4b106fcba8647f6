package com.swarmmind.core.external;

import com.swarmmind.core.agent.AutonomousAgentState;
import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.DecisionResult;

/**
 * Carries out one attempt of a decision. Never throws; a failed attempt is
 * a {@link DecisionResult} with {@code success == false}.
 * <p>
 * An executor backed by a source-control collaborator reports opened pull
 * requests as {@code PR_URL} artifacts; the agent records their URLs and
 * emits a {@code pr} pheromone. The sandbox executor never opens one.
 */
public interface DecisionExecutor {

    DecisionResult execute(AgentDecision decision, AutonomousAgentState agent);
}
