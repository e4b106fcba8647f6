package com.swarmmind.core.external;

import java.util.List;

/**
 * Structured result of a reasoning call.
 *
 * @param reasoning        chain of thought
 * @param conclusion       key takeaway
 * @param suggestedActions free-text next steps
 * @param confidence       0-1
 * @param degraded         true when the collaborator failed and this is a stand-in
 */
public record ReasoningOutcome(
    String reasoning,
    String conclusion,
    List<String> suggestedActions,
    double confidence,
    boolean degraded
) {

    static final double DEGRADED_CONFIDENCE = 0.3;

    public ReasoningOutcome {
        reasoning = reasoning == null ? "" : reasoning;
        conclusion = conclusion == null ? "" : conclusion;
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
    }

    /** Low-confidence stand-in with no suggested actions. */
    public static ReasoningOutcome degraded(String reason) {
        return new ReasoningOutcome(reason, "Could not form structured thought", List.of(), DEGRADED_CONFIDENCE, true);
    }
}
