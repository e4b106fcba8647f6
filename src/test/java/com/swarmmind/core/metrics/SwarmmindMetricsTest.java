package com.swarmmind.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SwarmmindMetricsTest {

    private SimpleMeterRegistry registry;
    private SwarmmindMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SwarmmindMetrics(registry);
    }

    @Test
    @DisplayName("recordTickDuration creates a timer")
    void recordTickDuration() {
        metrics.recordTickDuration(25);
        var timer = registry.find("swarmmind.tick.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordPheromoneEmitted counts by kind")
    void recordPheromoneEmitted() {
        metrics.recordPheromoneEmitted("knowledge");
        metrics.recordPheromoneEmitted("knowledge");
        metrics.recordPheromoneEmitted("technique");

        assertEquals(2.0, registry.find("swarmmind.pheromones.emitted").tag("kind", "knowledge").counter().count());
        assertEquals(1.0, registry.find("swarmmind.pheromones.emitted").tag("kind", "technique").counter().count());
    }

    @Test
    @DisplayName("recordPheromonesAbsorbed ignores zero")
    void recordPheromonesAbsorbed() {
        metrics.recordPheromonesAbsorbed(0);
        assertNull(registry.find("swarmmind.pheromones.absorbed").counter());

        metrics.recordPheromonesAbsorbed(3);
        assertEquals(3.0, registry.find("swarmmind.pheromones.absorbed").counter().count());
    }

    @Test
    @DisplayName("recordDecision tags action and status")
    void recordDecision() {
        metrics.recordDecision("study_repo", "selected");
        metrics.recordDecision("study_repo", "completed");
        metrics.recordDecision("study_repo", "completed");

        var completed = registry.find("swarmmind.decisions.total")
                .tag("action", "study_repo").tag("status", "completed").counter();
        assertNotNull(completed);
        assertEquals(2.0, completed.count());
    }

    @Test
    @DisplayName("recordTokensSpent feeds a distribution summary")
    void recordTokensSpent() {
        metrics.recordTokensSpent(800);
        metrics.recordTokensSpent(3000);

        var summary = registry.find("swarmmind.tokens.spent").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(3800.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordExternalFailure counts by collaborator")
    void recordExternalFailure() {
        metrics.recordExternalFailure("discovery");

        var counter = registry.find("swarmmind.external.failures").tag("collaborator", "discovery").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("swarm-level counters increment")
    void swarmCounters() {
        metrics.recordAgentSynchronized();
        metrics.recordPhaseTransition();
        metrics.recordCollaborationProposed("repo_overlap");

        assertEquals(1.0, registry.find("swarmmind.agents.synchronized").counter().count());
        assertEquals(1.0, registry.find("swarmmind.phase.transitions").counter().count());
        assertEquals(1.0, registry.find("swarmmind.collaborations.proposed")
                .tag("trigger", "repo_overlap").counter().count());
    }
}
