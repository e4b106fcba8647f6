package com.swarmmind.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A decision an agent makes about what to do next.
 * <p>
 * Created {@link DecisionStatus#PENDING} with priority 0, scored, and at most one
 * per agent moved to {@link DecisionStatus#EXECUTING}. Execution resolves it to
 * {@link DecisionStatus#COMPLETED} or {@link DecisionStatus#FAILED}; a terminal
 * decision is never reopened.
 */
public class AgentDecision {

    private final String id;
    private final String agentId;
    private final AgentAction action;
    private final DecisionCost cost;
    private final Instant createdAt;

    private double priority;
    private DecisionStatus status = DecisionStatus.PENDING;
    private DecisionResult result;
    private Instant completedAt;

    public AgentDecision(String agentId, AgentAction action, DecisionCost cost) {
        this(UUID.randomUUID().toString(), agentId, action, cost, Instant.now());
    }

    public AgentDecision(String id, String agentId, AgentAction action, DecisionCost cost, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.action = Objects.requireNonNull(action, "action");
        this.cost = Objects.requireNonNull(cost, "cost");
        this.createdAt = createdAt;
    }

    public String id() { return id; }
    public String agentId() { return agentId; }
    public AgentAction action() { return action; }
    public DecisionCost cost() { return cost; }
    public Instant createdAt() { return createdAt; }
    public double priority() { return priority; }
    public DecisionStatus status() { return status; }
    public DecisionResult result() { return result; }
    public Instant completedAt() { return completedAt; }

    public void setPriority(double priority) {
        this.priority = priority;
    }

    public void markExecuting() {
        if (status != DecisionStatus.PENDING) {
            throw new IllegalStateException("Decision " + id + " cannot start from " + status);
        }
        status = DecisionStatus.EXECUTING;
    }

    /** Records the latest attempt without resolving the decision. */
    public void recordAttempt(DecisionResult attempt) {
        this.result = attempt;
    }

    public void complete(DecisionResult outcome) {
        resolve(DecisionStatus.COMPLETED, outcome);
    }

    public void fail(DecisionResult outcome) {
        resolve(DecisionStatus.FAILED, outcome);
    }

    private void resolve(DecisionStatus terminal, DecisionResult outcome) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Decision " + id + " already " + status);
        }
        this.status = terminal;
        if (outcome != null) {
            this.result = outcome;
        }
        this.completedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "AgentDecision[" + id + ", " + action.type() + ", " + status
                + ", priority=" + String.format("%.3f", priority) + "]";
    }
}
