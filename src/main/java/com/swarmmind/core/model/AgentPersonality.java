package com.swarmmind.core.model;

import java.io.Serializable;

/**
 * Personality traits of an agent, each in [0,1].
 */
public record AgentPersonality(
    double curiosity,
    double diligence,
    double boldness,
    double sociability
) implements Serializable {

    public AgentPersonality {
        curiosity = clamp(curiosity);
        diligence = clamp(diligence);
        boldness = clamp(boldness);
        sociability = clamp(sociability);
    }

    /**
     * The trait that drives how well an agent fits the given action kind.
     */
    public double fitFor(ActionType type) {
        return switch (type) {
            case STUDY_REPO, EXPLORE_TOPIC -> curiosity;
            case FIX_ISSUE, CONTRIBUTE_PR -> boldness;
            case SHARE_TECHNIQUE -> sociability;
            case REFACTOR, DOCUMENT -> diligence;
            case WRITE_CODE -> 0.0;
        };
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
