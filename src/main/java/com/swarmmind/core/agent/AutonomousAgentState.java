package com.swarmmind.core.agent;

import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.AgentPersonality;
import com.swarmmind.core.model.AgentThought;
import com.swarmmind.core.model.DecisionStatus;
import com.swarmmind.core.model.Specialization;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Agent state extended with the engineering side: personality, token budget,
 * thought and decision logs, and the single decision in flight.
 * <p>
 * Thought and decision logs keep the most recent {@code historyLimit} entries.
 */
public class AutonomousAgentState extends AgentState {

    private final Specialization specialization;
    private final AgentPersonality personality;
    private final int tokenBudget;
    private final int historyLimit;

    private volatile int tokensUsed;
    private final Deque<AgentThought> thoughts = new ArrayDeque<>();
    private final Deque<AgentDecision> decisions = new ArrayDeque<>();
    private volatile AgentDecision currentDecision;
    private final Set<String> reposStudied = new LinkedHashSet<>();
    private final List<String> prsCreated = new ArrayList<>();
    private volatile String currentAction = "initializing";

    public AutonomousAgentState(String id, String name, double x, double y, double dx, double dy,
                                String explorationTarget, double energy, Specialization specialization,
                                AgentPersonality personality, int tokenBudget, int historyLimit) {
        super(id, name, x, y, dx, dy, explorationTarget, energy);
        if (tokenBudget < 0) {
            throw new IllegalArgumentException("tokenBudget must not be negative: " + tokenBudget);
        }
        this.specialization = specialization;
        this.personality = personality;
        this.tokenBudget = tokenBudget;
        this.historyLimit = Math.max(1, historyLimit);
    }

    public Specialization specialization() { return specialization; }
    public AgentPersonality personality() { return personality; }
    public int tokenBudget() { return tokenBudget; }
    public int tokensUsed() { return tokensUsed; }
    public AgentDecision currentDecision() { return currentDecision; }
    public String currentAction() { return currentAction; }

    public int remainingBudget() {
        return Math.max(0, tokenBudget - tokensUsed);
    }

    public boolean budgetExhausted() {
        return tokensUsed >= tokenBudget;
    }

    public synchronized void spendTokens(int tokens) {
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must not be negative: " + tokens);
        }
        tokensUsed += tokens;
    }

    public void setCurrentAction(String currentAction) {
        this.currentAction = currentAction;
    }

    public synchronized void addThought(AgentThought thought) {
        thoughts.addLast(thought);
        while (thoughts.size() > historyLimit) {
            thoughts.removeFirst();
        }
    }

    public synchronized List<AgentThought> thoughts() {
        return List.copyOf(thoughts);
    }

    public synchronized List<AgentThought> recentThoughts(int limit) {
        return tail(new ArrayList<>(thoughts), limit);
    }

    /**
     * Puts a decision in flight. Only one decision may be executing at a time.
     */
    public synchronized void startDecision(AgentDecision decision) {
        AgentDecision inFlight = currentDecision;
        if (inFlight != null && inFlight.status() == DecisionStatus.EXECUTING) {
            throw new IllegalStateException("Agent " + id() + " already executing " + inFlight.id());
        }
        decision.markExecuting();
        currentDecision = decision;
    }

    /**
     * Moves the current decision into the decision log. The decision must
     * already be resolved.
     */
    public synchronized AgentDecision finishCurrentDecision() {
        AgentDecision done = currentDecision;
        if (done == null) {
            return null;
        }
        if (!done.status().isTerminal()) {
            throw new IllegalStateException("Decision " + done.id() + " is still " + done.status());
        }
        decisions.addLast(done);
        while (decisions.size() > historyLimit) {
            decisions.removeFirst();
        }
        currentDecision = null;
        return done;
    }

    public synchronized List<AgentDecision> decisions() {
        return List.copyOf(decisions);
    }

    public synchronized List<AgentDecision> recentDecisions(int limit) {
        return tail(new ArrayList<>(decisions), limit);
    }

    public synchronized void markRepoStudied(String fullName) {
        reposStudied.add(fullName);
    }

    public synchronized boolean hasStudied(String fullName) {
        return reposStudied.contains(fullName);
    }

    public synchronized List<String> reposStudied() {
        return List.copyOf(reposStudied);
    }

    /** URL of a pull request an executor reported as opened. */
    public synchronized void recordPullRequest(String url) {
        prsCreated.add(url);
    }

    public synchronized List<String> prsCreated() {
        return List.copyOf(prsCreated);
    }

    private static <T> List<T> tail(List<T> items, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int from = Math.max(0, items.size() - limit);
        return List.copyOf(items.subList(from, items.size()));
    }
}
