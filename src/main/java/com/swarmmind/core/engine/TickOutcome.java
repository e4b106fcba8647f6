package com.swarmmind.core.engine;

import com.swarmmind.core.channel.Pheromone;
import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.AgentThought;

/**
 * What one agent did during one tick.
 *
 * @param emission        pheromone to append to the channel, or null
 * @param absorbedCount   pheromones absorbed this tick
 * @param synchronizedNow true if the agent synchronized this tick
 * @param thought         thought formed this tick, or null
 * @param selected        decision selected and started this tick, or null
 * @param resolved        decision that left the executing state this tick, or null
 * @param abandoned       true if {@code resolved} was abandoned rather than finished
 */
record TickOutcome(
    Pheromone emission,
    int absorbedCount,
    boolean synchronizedNow,
    AgentThought thought,
    AgentDecision selected,
    AgentDecision resolved,
    boolean abandoned
) {

    static TickOutcome idle() {
        return new TickOutcome(null, 0, false, null, null, null, false);
    }
}
