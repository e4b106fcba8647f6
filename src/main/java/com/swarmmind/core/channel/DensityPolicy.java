package com.swarmmind.core.channel;

/**
 * Maps channel contents to a density in [0,1]. Implementations must be
 * monotone non-decreasing in both pheromone count and mean strength.
 */
@FunctionalInterface
public interface DensityPolicy {

    double density(int pheromoneCount, double meanStrength);
}
