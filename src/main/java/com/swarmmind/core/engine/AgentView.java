package com.swarmmind.core.engine;

import com.swarmmind.core.agent.AutonomousAgentState;
import com.swarmmind.core.external.DecisionRecord;
import com.swarmmind.core.model.AgentPersonality;

import java.io.Serializable;
import java.util.List;

/**
 * Read-only snapshot of one agent.
 */
public record AgentView(
    String id,
    String name,
    double x,
    double y,
    double energy,
    boolean synchronizedWithCollective,
    int stepCount,
    int discoveries,
    int absorbedCount,
    String explorationTarget,
    String specialization,
    AgentPersonality personality,
    int tokensUsed,
    int tokenBudget,
    String currentAction,
    DecisionRecord currentDecision,
    List<String> reposStudied,
    int thoughtCount,
    int decisionCount
) implements Serializable {

    public static AgentView of(AutonomousAgentState s) {
        return new AgentView(s.id(), s.name(), s.x(), s.y(), s.energy(), s.isSynchronized(), s.stepCount(),
                s.discoveries(), s.absorbedCount(), s.explorationTarget(), s.specialization().label(),
                s.personality(), s.tokensUsed(), s.tokenBudget(), s.currentAction(),
                s.currentDecision() == null ? null : DecisionRecord.from(s.currentDecision()),
                s.reposStudied(), s.thoughts().size(), s.decisions().size());
    }
}
