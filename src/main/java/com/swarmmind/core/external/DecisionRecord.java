package com.swarmmind.core.external;

import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.DecisionResult;
import com.swarmmind.core.model.DecisionStatus;

import java.io.Serializable;
import java.time.Instant;

/**
 * Immutable persisted view of an {@link AgentDecision}.
 */
public record DecisionRecord(
    String id,
    String agentId,
    String actionType,
    String description,
    double priority,
    int estimatedTokens,
    String riskLevel,
    DecisionStatus status,
    DecisionResult result,
    Instant createdAt,
    Instant completedAt
) implements Serializable {

    public static DecisionRecord from(AgentDecision decision) {
        return new DecisionRecord(decision.id(), decision.agentId(), decision.action().type().wireName(),
                decision.action().describe(), decision.priority(), decision.cost().estimatedTokens(),
                decision.cost().riskLevel().name().toLowerCase(), decision.status(), decision.result(),
                decision.createdAt(), decision.completedAt());
    }

    public DecisionRecord withStatus(DecisionStatus newStatus, DecisionResult newResult) {
        return new DecisionRecord(id, agentId, actionType, description, priority, estimatedTokens, riskLevel,
                newStatus, newResult == null ? result : newResult, createdAt,
                newStatus.isTerminal() ? Instant.now() : completedAt);
    }
}
