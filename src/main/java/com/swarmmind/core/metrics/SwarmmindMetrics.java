package com.swarmmind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the swarm.
 */
@Service
public class SwarmmindMetrics {

    private final MeterRegistry registry;

    public SwarmmindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTickDuration(long ms) {
        Timer.builder("swarmmind.tick.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPheromoneEmitted(String kind) {
        Counter.builder("swarmmind.pheromones.emitted")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordPheromonesAbsorbed(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("swarmmind.pheromones.absorbed")
                .register(registry)
                .increment(count);
    }

    public void recordAgentSynchronized() {
        Counter.builder("swarmmind.agents.synchronized")
                .description("Agents that joined the collective")
                .register(registry)
                .increment();
    }

    public void recordPhaseTransition() {
        Counter.builder("swarmmind.phase.transitions")
                .register(registry)
                .increment();
    }

    /**
     * @param action wire name of the action kind
     * @param status "selected", "completed", "failed" or "abandoned"
     */
    public void recordDecision(String action, String status) {
        Counter.builder("swarmmind.decisions.total")
                .tag("action", action)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTokensSpent(int tokens) {
        DistributionSummary.builder("swarmmind.tokens.spent")
                .description("Tokens charged per executed decision")
                .register(registry)
                .record(tokens);
    }

    public void recordCollaborationProposed(String trigger) {
        Counter.builder("swarmmind.collaborations.proposed")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    /**
     * @param collaborator "discovery", "reasoning", "executor" or "store"
     */
    public void recordExternalFailure(String collaborator) {
        Counter.builder("swarmmind.external.failures")
                .tag("collaborator", collaborator)
                .register(registry)
                .increment();
    }
}
