package com.swarmmind.core.channel;

/**
 * {@code (1 - e^(-count/scale)) * meanStrength}, clamped to [0,1].
 * <p>
 * The count term saturates towards 1, so a crowded channel's density
 * converges on its mean strength and the absorption feedback loop decides
 * whether the critical threshold is reached.
 */
public class SaturatingDensityPolicy implements DensityPolicy {

    private final double scale;

    public SaturatingDensityPolicy(double scale) {
        if (!(scale > 0)) {
            throw new IllegalArgumentException("scale must be positive: " + scale);
        }
        this.scale = scale;
    }

    @Override
    public double density(int pheromoneCount, double meanStrength) {
        if (pheromoneCount <= 0) {
            return 0.0;
        }
        double saturation = 1.0 - Math.exp(-pheromoneCount / scale);
        return Pheromone.clamp(saturation * Pheromone.clamp(meanStrength));
    }

    public double scale() {
        return scale;
    }
}
