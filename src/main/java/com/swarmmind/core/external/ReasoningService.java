package com.swarmmind.core.external;

import com.swarmmind.core.model.CodePatch;
import com.swarmmind.core.model.ReviewFeedback;

import java.util.List;

/**
 * Natural-language reasoning used by agents to form thoughts and write code.
 * <p>
 * None of these methods throw: failures come back as a degraded outcome,
 * an empty patch list, or {@link ReviewFeedback#unavailable(String)}.
 */
public interface ReasoningService {

    ReasoningOutcome reason(ReasoningContext context);

    List<CodePatch> generatePatch(ReasoningContext context);

    ReviewFeedback review(List<CodePatch> patches, String objective);

    /** Whether calls reach a real model rather than degrading immediately. */
    boolean isAvailable();
}
