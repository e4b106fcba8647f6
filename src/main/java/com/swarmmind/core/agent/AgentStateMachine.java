package com.swarmmind.core.agent;

import com.swarmmind.core.channel.Pheromone;
import com.swarmmind.core.channel.PheromoneChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Per-agent movement, absorption and synchronization.
 * <p>
 * Unsynchronized agents wander with random noise and are jostled by strong,
 * unabsorbed pheromones from others. Synchronized agents are pulled towards
 * the collective centre and orbit it. Velocity is damped every tick and
 * position is clamped to the bounded space.
 */
@Service
public class AgentStateMachine {

    private static final Logger log = LoggerFactory.getLogger(AgentStateMachine.class);

    public static final double CENTER_X = 500;
    public static final double CENTER_Y = 400;
    public static final double MIN_X = 50;
    public static final double MAX_X = 950;
    public static final double MIN_Y = 50;
    public static final double MAX_Y = 750;

    static final double PULL_FACTOR = 0.05;
    static final double ORBIT_FACTOR = 0.01;
    static final double NOISE_SCALE = 4.0;
    static final double ATTRACTION_SCALE = 3.0;
    static final double ATTRACTION_MIN_STRENGTH = 0.5;
    static final double DAMPING = 0.85;

    static final double ABSORPTION_MIN_STRENGTH = 0.2;
    static final double ABSORPTION_FACTOR = 0.6;
    static final double ABSORPTION_ENERGY_GAIN = 0.05;
    static final double REINFORCEMENT = 0.1;

    static final int SYNC_MIN_ABSORBED = 3;
    static final double SYNC_MIN_ENERGY = 0.5;

    private final RandomGenerator random;

    public AgentStateMachine(RandomGenerator random) {
        this.random = random;
    }

    public void move(AgentState agent, PheromoneChannel channel) {
        double dx = agent.dx();
        double dy = agent.dy();
        double x = agent.x();
        double y = agent.y();

        if (agent.isSynchronized()) {
            dx += (CENTER_X - x) * PULL_FACTOR;
            dy += (CENTER_Y - y) * PULL_FACTOR;
            dx += (y - CENTER_Y) * ORBIT_FACTOR;
            dy += -(x - CENTER_X) * ORBIT_FACTOR;
        } else {
            dx += (random.nextDouble() - 0.5) * NOISE_SCALE;
            dy += (random.nextDouble() - 0.5) * NOISE_SCALE;
            for (Pheromone p : channel.pheromones()) {
                if (p.agentId().equals(agent.id()) || agent.hasAbsorbed(p.id())) {
                    continue;
                }
                double strength = p.strength();
                if (strength > ATTRACTION_MIN_STRENGTH) {
                    dx += (random.nextDouble() - 0.5) * strength * ATTRACTION_SCALE;
                    dy += (random.nextDouble() - 0.5) * strength * ATTRACTION_SCALE;
                }
            }
        }

        dx *= DAMPING;
        dy *= DAMPING;

        agent.setVelocity(dx, dy);
        agent.setPosition(clampX(x + dx), clampY(y + dy));
    }

    static double clampX(double x) {
        return Math.max(MIN_X, Math.min(MAX_X, x));
    }

    static double clampY(double y) {
        return Math.max(MIN_Y, Math.min(MAX_Y, y));
    }

    /**
     * Picks up pheromones emitted by others. Each absorption raises the
     * agent's energy and reinforces the source pheromone in the channel.
     *
     * @return pheromones absorbed during this call
     */
    public List<Pheromone> absorbPheromones(AgentState agent, PheromoneChannel channel) {
        var absorbed = new ArrayList<Pheromone>();
        for (Pheromone p : channel.pheromones()) {
            if (p.agentId().equals(agent.id()) || agent.hasAbsorbed(p.id())) {
                continue;
            }
            double strength = p.strength();
            if (strength > ABSORPTION_MIN_STRENGTH && random.nextDouble() < strength * ABSORPTION_FACTOR) {
                if (!agent.markAbsorbed(p.id())) {
                    continue;
                }
                agent.addEnergy(ABSORPTION_ENERGY_GAIN);
                channel.reinforce(p.id(), REINFORCEMENT);
                absorbed.add(p);
            }
        }
        if (!absorbed.isEmpty()) {
            log.debug("Agent {} absorbed {} pheromone(s), energy now {}",
                    agent.name(), absorbed.size(), String.format("%.2f", agent.energy()));
        }
        return absorbed;
    }

    /**
     * Synchronizes the agent with the collective once the channel is dense
     * enough and the agent is both well-informed and energetic.
     *
     * @return true if the agent synchronized during this call
     */
    public boolean checkSync(AgentState agent, PheromoneChannel channel) {
        if (agent.isSynchronized()) {
            return false;
        }
        if (channel.density() >= channel.criticalThreshold()
                && agent.absorbedCount() >= SYNC_MIN_ABSORBED
                && agent.energy() > SYNC_MIN_ENERGY) {
            agent.synchronize();
            log.info("Agent {} synchronized with collective (absorbed {} pheromones)",
                    agent.name(), agent.absorbedCount());
            return true;
        }
        return false;
    }
}
