package com.swarmmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of a self-review of proposed patches.
 *
 * @param passed      whether the patches meet the objective
 * @param issues      problems found
 * @param suggestions improvement hints
 * @param score       0-10
 */
public record ReviewFeedback(
    boolean passed,
    List<String> issues,
    List<String> suggestions,
    int score
) implements Serializable {

    public ReviewFeedback {
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        score = Math.max(0, Math.min(10, score));
    }

    public static ReviewFeedback unavailable(String reason) {
        return new ReviewFeedback(false, List.of(reason), List.of(), 3);
    }
}
