package com.swarmmind.core.agent;

import com.swarmmind.core.channel.Pheromone;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Position, energy and signal memory of an agent moving through the abstract
 * exploration space.
 * <p>
 * Owned by a single agent; only that agent's tick mutates it. {@code synchronized}
 * is monotone and {@code absorbed} only grows.
 */
public class AgentState {

    private final String id;
    private final String name;

    private volatile double x;
    private volatile double y;
    private volatile double dx;
    private volatile double dy;

    private final List<Pheromone> knowledge = new ArrayList<>();
    private final Set<String> absorbed = new HashSet<>();
    private volatile String explorationTarget;
    private volatile double energy;
    private volatile boolean synchronizedWithCollective;
    private volatile int stepCount;
    private volatile int discoveries;

    public AgentState(String id, String name, double x, double y, double dx, double dy,
                      String explorationTarget, double energy) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.x = x;
        this.y = y;
        this.dx = dx;
        this.dy = dy;
        this.explorationTarget = explorationTarget;
        this.energy = clamp(energy);
    }

    public String id() { return id; }
    public String name() { return name; }
    public double x() { return x; }
    public double y() { return y; }
    public double dx() { return dx; }
    public double dy() { return dy; }
    public String explorationTarget() { return explorationTarget; }
    public double energy() { return energy; }
    public boolean isSynchronized() { return synchronizedWithCollective; }
    public int stepCount() { return stepCount; }
    public int discoveries() { return discoveries; }

    public void setPosition(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void setVelocity(double dx, double dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public void setExplorationTarget(String explorationTarget) {
        this.explorationTarget = explorationTarget;
    }

    public void addEnergy(double delta) {
        this.energy = clamp(energy + delta);
    }

    public int incrementStep() {
        return ++stepCount;
    }

    /**
     * Joins the collective. Energy is restored to full on the first call;
     * later calls change nothing.
     *
     * @return true if the agent was not yet synchronized
     */
    public boolean synchronize() {
        if (synchronizedWithCollective) {
            return false;
        }
        synchronizedWithCollective = true;
        energy = 1.0;
        return true;
    }

    /**
     * @return true if the pheromone had not been absorbed before
     */
    public synchronized boolean markAbsorbed(String pheromoneId) {
        return absorbed.add(pheromoneId);
    }

    public synchronized boolean hasAbsorbed(String pheromoneId) {
        return absorbed.contains(pheromoneId);
    }

    public synchronized int absorbedCount() {
        return absorbed.size();
    }

    public synchronized Set<String> absorbed() {
        return Set.copyOf(absorbed);
    }

    public synchronized void recordDiscovery(Pheromone pheromone) {
        knowledge.add(pheromone);
        discoveries++;
    }

    public synchronized List<Pheromone> knowledge() {
        return Collections.unmodifiableList(new ArrayList<>(knowledge));
    }

    static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
