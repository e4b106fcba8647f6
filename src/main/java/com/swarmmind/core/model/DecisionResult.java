package com.swarmmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of one execution attempt of a decision.
 *
 * @param success    whether the attempt achieved its objective
 * @param summary    one-line description of what happened
 * @param artifacts  produced artifacts (empty on failure)
 * @param tokensUsed tokens charged against the agent's budget
 */
public record DecisionResult(
    boolean success,
    String summary,
    List<Artifact> artifacts,
    int tokensUsed
) implements Serializable {

    public DecisionResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public static DecisionResult failure(String summary, int tokensUsed) {
        return new DecisionResult(false, summary, List.of(), tokensUsed);
    }

    public boolean hasArtifacts() {
        return !artifacts.isEmpty();
    }
}
