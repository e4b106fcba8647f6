package com.swarmmind.core.engine;

import com.swarmmind.core.agent.AgentStateMachine;
import com.swarmmind.core.decision.DecisionEngine;
import com.swarmmind.core.external.DecisionExecutor;
import com.swarmmind.core.external.DecisionStore;
import com.swarmmind.core.external.IssueDiscovery;
import com.swarmmind.core.external.ReasoningService;
import com.swarmmind.core.external.RepositoryDiscovery;
import com.swarmmind.core.metrics.SwarmmindMetrics;

import java.util.random.RandomGenerator;

/**
 * Collaborators shared by every {@link SwarmAgent} in a swarm.
 */
record AgentServices(
    AgentStateMachine stateMachine,
    DecisionEngine decisionEngine,
    RepositoryDiscovery repositoryDiscovery,
    IssueDiscovery issueDiscovery,
    ReasoningService reasoning,
    DecisionExecutor executor,
    DecisionStore store,
    FallbackInsights fallbackInsights,
    SwarmmindMetrics metrics,
    RandomGenerator random
) {}
