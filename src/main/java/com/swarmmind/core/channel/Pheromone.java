package com.swarmmind.core.channel;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A knowledge signal emitted by an agent into the shared channel.
 * <p>
 * Everything except {@code strength} is fixed at emission. Strength only moves
 * through the owning {@link PheromoneChannel}, which clamps it to [0,1] and
 * serializes the read-modify-write.
 */
public class Pheromone {

    private final String id;
    private final String agentId;
    private final String content;
    private final String domain;
    private final double confidence;
    private final Set<String> connections;
    private final Instant timestamp;
    private final String attestation;

    private volatile double strength;

    public Pheromone(String id, String agentId, String content, String domain, double confidence,
                     double strength, Set<String> connections, Instant timestamp, String attestation) {
        this.id = Objects.requireNonNull(id, "id");
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.content = content == null ? "" : content;
        this.domain = domain == null ? "" : domain;
        this.confidence = clamp(confidence);
        this.strength = clamp(strength);
        this.connections = connections == null ? Set.of() : Set.copyOf(connections);
        this.timestamp = timestamp == null ? Instant.now() : timestamp;
        this.attestation = attestation;
    }

    /**
     * Creates a knowledge pheromone with a fresh id and attestation.
     */
    public static Pheromone emit(String agentId, String content, String domain, double confidence,
                                 double strength, Set<String> connections) {
        Instant now = Instant.now();
        return new Pheromone(UUID.randomUUID().toString(), agentId, content, domain, confidence, strength,
                connections, now, Attestation.sha256(content + agentId + now.toEpochMilli()));
    }

    public String id() { return id; }
    public String agentId() { return agentId; }
    public String content() { return content; }
    public String domain() { return domain; }
    public double confidence() { return confidence; }
    public double strength() { return strength; }
    public Set<String> connections() { return connections; }
    public Instant timestamp() { return timestamp; }
    public String attestation() { return attestation; }

    public PheromoneKind kind() {
        return PheromoneKind.KNOWLEDGE;
    }

    // Only PheromoneChannel calls this, under its write lock.
    void setStrength(double value) {
        this.strength = clamp(value);
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }

    @Override
    public String toString() {
        return "Pheromone[" + id + ", " + kind() + ", domain=" + domain
                + ", strength=" + String.format("%.2f", strength) + "]";
    }
}
