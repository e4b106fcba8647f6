package com.swarmmind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A joint project proposed when several agents overlap in what they work on.
 *
 * @param id           unique identifier
 * @param title        short title, also used to avoid proposing the same project twice
 * @param description  why the collaboration was proposed
 * @param participants agent ids
 * @param repos        {@code owner/repo} identifiers involved (may be empty)
 * @param status       always {@link ProjectStatus#PROPOSED} when created by the detector
 * @param createdAt    when it was proposed
 */
public record CollaborativeProject(
    String id,
    String title,
    String description,
    List<String> participants,
    List<String> repos,
    ProjectStatus status,
    Instant createdAt
) implements Serializable {

    public CollaborativeProject {
        participants = List.copyOf(participants);
        repos = List.copyOf(repos);
    }
}
