package com.swarmmind.core.model;

/**
 * Risk of an action, used to penalize risky work as an agent's budget drains.
 */
public enum RiskLevel {
    LOW(0.0),
    MEDIUM(0.1),
    HIGH(0.2);

    private final double multiplier;

    RiskLevel(double multiplier) {
        this.multiplier = multiplier;
    }

    public double multiplier() {
        return multiplier;
    }
}
