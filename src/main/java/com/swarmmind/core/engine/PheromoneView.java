package com.swarmmind.core.engine;

import com.swarmmind.core.channel.EngineeringPheromone;
import com.swarmmind.core.channel.Pheromone;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Read-only snapshot of one pheromone. Repository references and code
 * snippets are empty for knowledge pheromones.
 */
public record PheromoneView(
    String id,
    String agentId,
    String kind,
    String content,
    String domain,
    double confidence,
    double strength,
    Set<String> connections,
    Instant timestamp,
    String attestation,
    List<String> repoRefs,
    List<String> codeSnippets
) implements Serializable {

    public static PheromoneView of(Pheromone p) {
        List<String> repoRefs = List.of();
        List<String> snippets = List.of();
        if (p instanceof EngineeringPheromone e) {
            repoRefs = e.repoRefs();
            snippets = e.codeSnippets();
        }
        return new PheromoneView(p.id(), p.agentId(), p.kind().name().toLowerCase(), p.content(), p.domain(),
                p.confidence(), p.strength(), p.connections(), p.timestamp(), p.attestation(), repoRefs, snippets);
    }
}
