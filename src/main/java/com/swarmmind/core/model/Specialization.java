package com.swarmmind.core.model;

/**
 * Preset agent archetypes. Each carries the personality an agent of that kind
 * starts from before its one-time jitter.
 */
public enum Specialization {
    EXPLORER("Explorer", new AgentPersonality(0.9, 0.4, 0.3, 0.6)),
    SYNTHESIZER("Synthesizer", new AgentPersonality(0.7, 0.5, 0.4, 0.9)),
    BUILDER("Builder", new AgentPersonality(0.5, 0.6, 0.9, 0.3));

    private final String label;
    private final AgentPersonality basePersonality;

    Specialization(String label, AgentPersonality basePersonality) {
        this.label = label;
        this.basePersonality = basePersonality;
    }

    public String label() {
        return label;
    }

    public AgentPersonality basePersonality() {
        return basePersonality;
    }

    @Override
    public String toString() {
        return label;
    }
}
