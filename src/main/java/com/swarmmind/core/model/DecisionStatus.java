package com.swarmmind.core.model;

/**
 * Lifecycle of an {@link AgentDecision}.
 */
public enum DecisionStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
