package com.swarmmind.core.external;

import com.swarmmind.core.agent.AutonomousAgentState;
import com.swarmmind.core.model.AgentPersonality;

/**
 * What the reasoning collaborator is told about the agent and the situation.
 *
 * @param agentName       display name of the agent
 * @param specialization  specialization label
 * @param personality     the agent's traits
 * @param reposStudied    number of repositories studied so far
 * @param remainingBudget tokens still available
 * @param trigger         what prompted the request
 * @param observation     what the agent noticed
 * @param context         free-form supporting detail
 */
public record ReasoningContext(
    String agentName,
    String specialization,
    AgentPersonality personality,
    int reposStudied,
    int remainingBudget,
    String trigger,
    String observation,
    String context
) {

    public static ReasoningContext of(AutonomousAgentState agent, String trigger, String observation, String context) {
        return new ReasoningContext(agent.name(), agent.specialization().label(), agent.personality(),
                agent.reposStudied().size(), agent.remainingBudget(), trigger, observation, context);
    }
}
