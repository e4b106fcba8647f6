package com.swarmmind.core.engine;

import java.io.Serializable;

/**
 * Swarm-wide aggregates shown after every tick.
 */
public record SwarmStats(
    int totalPheromones,
    int totalDiscoveries,
    int synchronizedCount,
    double averageEnergy,
    double density,
    int collaborationCount,
    int uniqueDomains
) implements Serializable {}
