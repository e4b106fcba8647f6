package com.swarmmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A repository returned by repository discovery.
 */
public record DiscoveredRepo(
    String owner,
    String repo,
    String description,
    String language,
    int stars,
    List<String> topics
) implements Serializable {

    public DiscoveredRepo {
        description = description == null ? "" : description;
        language = language == null ? "" : language;
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    public String fullName() {
        return owner + "/" + repo;
    }
}
