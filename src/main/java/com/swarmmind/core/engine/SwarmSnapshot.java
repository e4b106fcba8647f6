package com.swarmmind.core.engine;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable view of the whole swarm at one point in time.
 *
 * @param step                    ticks run so far
 * @param density                 channel density as of the last recompute
 * @param criticalThreshold       density at which the phase transition happens
 * @param phaseTransitionOccurred whether the transition has happened
 * @param transitionStep          tick of the transition, or null
 * @param agents                  per-agent views
 * @param stats                   aggregates
 */
public record SwarmSnapshot(
    long step,
    double density,
    double criticalThreshold,
    boolean phaseTransitionOccurred,
    Long transitionStep,
    List<AgentView> agents,
    SwarmStats stats
) implements Serializable {}
