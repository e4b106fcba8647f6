package com.swarmmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An open issue returned by issue discovery.
 */
public record DiscoveredIssue(
    String owner,
    String repo,
    int number,
    String title,
    String body,
    List<String> labels,
    IssueDifficulty difficulty
) implements Serializable {

    public DiscoveredIssue {
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        labels = labels == null ? List.of() : List.copyOf(labels);
        difficulty = difficulty == null ? IssueDifficulty.MEDIUM : difficulty;
    }
}
