package com.swarmmind.core.channel;

import com.swarmmind.core.model.Artifact;
import com.swarmmind.core.model.ArtifactKind;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Pheromone emitted from a completed engineering decision. Carries the
 * artifacts it produced and the repositories it touched.
 */
public class EngineeringPheromone extends Pheromone {

    private static final int SNIPPET_LENGTH = 200;

    private final PheromoneKind kind;
    private final List<Artifact> artifacts;
    private final List<String> repoRefs;
    private final List<String> codeSnippets;

    public EngineeringPheromone(String id, String agentId, String content, String domain, double confidence,
                                double strength, Set<String> connections, Instant timestamp, String attestation,
                                PheromoneKind kind, List<Artifact> artifacts, List<String> repoRefs,
                                List<String> codeSnippets) {
        super(id, agentId, content, domain, confidence, strength, connections, timestamp, attestation);
        this.kind = kind;
        this.artifacts = List.copyOf(artifacts);
        this.repoRefs = List.copyOf(repoRefs);
        this.codeSnippets = List.copyOf(codeSnippets);
    }

    public static EngineeringPheromone emit(String agentId, String content, String domain, double confidence,
                                            double strength, PheromoneKind kind, List<Artifact> artifacts,
                                            List<String> repoRefs) {
        Instant now = Instant.now();
        List<String> snippets = artifacts.stream()
                .filter(a -> a.kind() == ArtifactKind.CODE_CHANGE)
                .map(a -> a.content().length() > SNIPPET_LENGTH ? a.content().substring(0, SNIPPET_LENGTH) : a.content())
                .toList();
        return new EngineeringPheromone(UUID.randomUUID().toString(), agentId, content, domain, confidence,
                strength, Set.of(), now, Attestation.sha256(content + agentId + now.toEpochMilli()),
                kind, artifacts, repoRefs, snippets);
    }

    @Override
    public PheromoneKind kind() {
        return kind;
    }

    public List<Artifact> artifacts() { return artifacts; }
    public List<String> repoRefs() { return repoRefs; }
    public List<String> codeSnippets() { return codeSnippets; }
}
