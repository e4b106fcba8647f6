package com.swarmmind.core.agent;

import com.swarmmind.core.model.AgentPersonality;
import com.swarmmind.core.model.Specialization;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.random.RandomGenerator;

/**
 * Creates the agent population: names, starting positions on a ring around
 * the centre (clipped to the bounded space), exploration domains and
 * jittered personality presets.
 */
@Service
public class AgentFactory {

    public static final List<String> DOMAINS = List.of(
            "data structures and algorithms",
            "distributed systems architecture",
            "cryptographic primitives",
            "network protocols and security",
            "database optimization patterns",
            "compiler design techniques",
            "operating system internals",
            "machine learning optimization",
            "consensus mechanisms",
            "memory management strategies");

    private static final List<String> NAMES = List.of("Neuron-A", "Neuron-B", "Neuron-C");

    static final double PERSONALITY_JITTER = 0.1;

    private final RandomGenerator random;

    public AgentFactory(RandomGenerator random) {
        this.random = random;
    }

    public AutonomousAgentState create(int index, int tokenBudget, int historyLimit) {
        double angle = (index / 8.0) * Math.PI * 2;
        double radius = 300 + random.nextDouble() * 200;
        Specialization specialization = Specialization.values()[index % Specialization.values().length];

        return new AutonomousAgentState(
                UUID.randomUUID().toString(),
                index < NAMES.size() ? NAMES.get(index) : "Neuron-" + index,
                AgentStateMachine.clampX(AgentStateMachine.CENTER_X + Math.cos(angle) * radius),
                AgentStateMachine.clampY(AgentStateMachine.CENTER_Y + Math.sin(angle) * radius),
                (random.nextDouble() - 0.5) * 8,
                (random.nextDouble() - 0.5) * 8,
                DOMAINS.get(index % DOMAINS.size()),
                0.3 + random.nextDouble() * 0.3,
                specialization,
                jitter(specialization.basePersonality()),
                tokenBudget,
                historyLimit);
    }

    /** Perturbs every trait by at most +/-0.05; the record clamps to [0,1]. */
    AgentPersonality jitter(AgentPersonality base) {
        return new AgentPersonality(
                base.curiosity() + perturbation(),
                base.diligence() + perturbation(),
                base.boldness() + perturbation(),
                base.sociability() + perturbation());
    }

    private double perturbation() {
        return (random.nextDouble() - 0.5) * PERSONALITY_JITTER;
    }
}
