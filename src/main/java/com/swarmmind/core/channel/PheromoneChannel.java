package com.swarmmind.core.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The shared signal pool every agent reads from and writes to.
 * <p>
 * Pheromones are appended in emission order and never removed. All mutation
 * (append, strength change) happens under one write lock so that concurrent
 * reinforcement from agents processed on parallel workers accumulates exactly.
 * Density is a derived value refreshed by {@link #recomputeDensity()} at the
 * start of every tick. Once the phase transition has occurred it stays
 * occurred, and its step is recorded once.
 */
public class PheromoneChannel {

    private static final Logger log = LoggerFactory.getLogger(PheromoneChannel.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Pheromone> pheromones = new ArrayList<>();
    private final Map<String, Pheromone> byId = new HashMap<>();
    private final DensityPolicy densityPolicy;
    private final double criticalThreshold;

    private volatile double density;
    private volatile boolean phaseTransitionOccurred;
    private volatile long transitionStep = -1;

    public PheromoneChannel(DensityPolicy densityPolicy, double criticalThreshold) {
        if (criticalThreshold < 0.0 || criticalThreshold > 1.0) {
            throw new IllegalArgumentException("criticalThreshold must be in [0,1]: " + criticalThreshold);
        }
        this.densityPolicy = densityPolicy;
        this.criticalThreshold = criticalThreshold;
    }

    /**
     * Appends a pheromone. Emitting the same id twice is rejected.
     */
    public void emit(Pheromone pheromone) {
        lock.writeLock().lock();
        try {
            if (byId.putIfAbsent(pheromone.id(), pheromone) != null) {
                throw new IllegalArgumentException("Pheromone already emitted: " + pheromone.id());
            }
            pheromones.add(pheromone);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Emitted {} from agent {}", pheromone, pheromone.agentId());
    }

    /**
     * Point-in-time copy of the channel contents, in emission order.
     */
    public List<Pheromone> pheromones() {
        lock.readLock().lock();
        try {
            return List.copyOf(pheromones);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return pheromones.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Pheromone> find(String pheromoneId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byId.get(pheromoneId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Atomically raises a pheromone's strength by {@code delta}, capped at 1.0.
     *
     * @return the new strength
     * @throws IllegalArgumentException if the pheromone is not in this channel
     */
    public double reinforce(String pheromoneId, double delta) {
        lock.writeLock().lock();
        try {
            Pheromone p = byId.get(pheromoneId);
            if (p == null) {
                throw new IllegalArgumentException("Unknown pheromone: " + pheromoneId);
            }
            p.setStrength(p.strength() + delta);
            return p.strength();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Ages every pheromone by multiplying its strength by {@code factor}.
     * The simulation loop does not call this; hosts that want decay do.
     */
    public void decay(double factor) {
        if (factor < 0.0 || factor > 1.0) {
            throw new IllegalArgumentException("decay factor must be in [0,1]: " + factor);
        }
        lock.writeLock().lock();
        try {
            for (Pheromone p : pheromones) {
                p.setStrength(p.strength() * factor);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public double meanStrength() {
        lock.readLock().lock();
        try {
            return meanStrengthLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    private double meanStrengthLocked() {
        if (pheromones.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (Pheromone p : pheromones) {
            total += p.strength();
        }
        return total / pheromones.size();
    }

    /**
     * Refreshes {@link #density()} from the current contents.
     */
    public double recomputeDensity() {
        lock.readLock().lock();
        try {
            density = Pheromone.clamp(densityPolicy.density(pheromones.size(), meanStrengthLocked()));
        } finally {
            lock.readLock().unlock();
        }
        return density;
    }

    public double density() {
        return density;
    }

    public double criticalThreshold() {
        return criticalThreshold;
    }

    /**
     * Triggers the phase transition the first time density reaches the
     * critical threshold.
     *
     * @return true only on the call that triggered the transition
     */
    public synchronized boolean checkPhaseTransition(long step) {
        if (phaseTransitionOccurred || density < criticalThreshold) {
            return false;
        }
        phaseTransitionOccurred = true;
        transitionStep = step;
        log.info("Phase transition at step {} (density {} >= threshold {})",
                step, String.format("%.3f", density), criticalThreshold);
        return true;
    }

    public boolean phaseTransitionOccurred() {
        return phaseTransitionOccurred;
    }

    public OptionalLong transitionStep() {
        long step = transitionStep;
        return step < 0 ? OptionalLong.empty() : OptionalLong.of(step);
    }
}
