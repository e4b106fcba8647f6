package com.swarmmind.core.external;

import com.swarmmind.core.llm.LlmEmptyResponseException;
import com.swarmmind.core.llm.LlmParseException;
import com.swarmmind.core.llm.LlmProperties;
import com.swarmmind.core.llm.LlmService;
import com.swarmmind.core.metrics.SwarmmindMetrics;
import com.swarmmind.core.model.AgentPersonality;
import com.swarmmind.core.model.CodePatch;
import com.swarmmind.core.model.ReviewFeedback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link ReasoningService} backed by the chat model through {@link LlmService}.
 * <p>
 * When the model is disabled or unconfigured, or a call fails, the result
 * degrades instead of propagating: a low-confidence outcome, no patches, or
 * an unavailable review.
 */
@Service
public class LlmReasoningService implements ReasoningService {

    private static final Logger log = LoggerFactory.getLogger(LlmReasoningService.class);

    static final int MAX_REVIEWED_PATCHES = 3;
    static final int PATCH_EXCERPT = 500;

    private final LlmService llmService;
    private final LlmProperties properties;
    private final SwarmmindMetrics metrics;

    public LlmReasoningService(LlmService llmService, LlmProperties properties, SwarmmindMetrics metrics) {
        this.llmService = llmService;
        this.properties = properties;
        this.metrics = metrics;
    }

    /** Structured reply for {@link #reason}. */
    public record ThoughtResponse(String reasoning, String conclusion, List<String> suggestedActions,
                                  Double confidence) {}

    /** One proposed change in a {@link PatchResponse}. */
    public record PatchItem(String filePath, String original, String modified, String explanation) {}

    /** Structured reply for {@link #generatePatch}. */
    public record PatchResponse(List<PatchItem> changes) {}

    /** Structured reply for {@link #review}. */
    public record ReviewResponse(Boolean passed, List<String> issues, List<String> suggestions, Integer score) {}

    @Override
    public boolean isAvailable() {
        return properties.isUsable();
    }

    @Override
    public ReasoningOutcome reason(ReasoningContext context) {
        if (!isAvailable()) {
            return ReasoningOutcome.degraded("Reasoning unavailable; observed: " + context.observation());
        }
        String userPrompt = """
                You observed something. Form a structured engineering thought.

                Trigger: %s
                Observation: %s
                Context: %s

                Suggested actions use the forms "study_repo:owner/repo", "share_technique:description",
                "explore_topic:topic", "refactor:owner/repo" or "document:owner/repo".
                """.formatted(context.trigger(), context.observation(), context.context());
        try {
            ThoughtResponse response = llmService.structuredCall(systemPrompt(context), userPrompt,
                    ThoughtResponse.class);
            double confidence = response.confidence() == null ? 0.5 : response.confidence();
            return new ReasoningOutcome(response.reasoning(), response.conclusion(), response.suggestedActions(),
                    confidence, false);
        } catch (LlmEmptyResponseException | LlmParseException e) {
            recordFailure("reason", e);
            return ReasoningOutcome.degraded("Malformed reasoning response: " + e.getMessage());
        } catch (RuntimeException e) {
            recordFailure("reason", e);
            return ReasoningOutcome.degraded("Reasoning failed: " + e.getMessage());
        }
    }

    @Override
    public List<CodePatch> generatePatch(ReasoningContext context) {
        if (!isAvailable()) {
            return List.of();
        }
        String userPrompt = """
                Generate code changes to accomplish this objective.

                Objective: %s
                Constraints: %s

                Each change has a filePath, the original code to replace (empty for a new file),
                the modified code and an explanation.
                """.formatted(context.observation(), context.context());
        try {
            PatchResponse response = llmService.structuredCall(systemPrompt(context), userPrompt,
                    PatchResponse.class);
            if (response.changes() == null) {
                return List.of();
            }
            List<CodePatch> patches = new ArrayList<>();
            for (PatchItem item : response.changes()) {
                if (item == null || item.filePath() == null || item.filePath().isBlank()) {
                    continue;
                }
                patches.add(new CodePatch(item.filePath(), nullToEmpty(item.original()),
                        nullToEmpty(item.modified()), nullToEmpty(item.explanation())));
            }
            return patches;
        } catch (RuntimeException e) {
            recordFailure("generatePatch", e);
            return List.of();
        }
    }

    @Override
    public ReviewFeedback review(List<CodePatch> patches, String objective) {
        if (patches.isEmpty()) {
            return new ReviewFeedback(false, List.of("No changes to review"), List.of(), 0);
        }
        if (!isAvailable()) {
            return ReviewFeedback.unavailable("Review unavailable");
        }
        String changes = patches.stream()
                .limit(MAX_REVIEWED_PATCHES)
                .map(p -> "File: %s\nExplanation: %s\n--- Original ---\n%s\n--- Modified ---\n%s".formatted(
                        p.path(), p.explanation(), excerpt(p.original()), excerpt(p.modified())))
                .collect(Collectors.joining("\n---\n"));
        String userPrompt = """
                Review these code changes against the objective.

                Objective: %s

                Changes:
                %s
                """.formatted(objective, changes);
        try {
            ReviewResponse response = llmService.structuredCall(
                    "You are a meticulous code reviewer. Score from 0 to 10.", userPrompt, ReviewResponse.class);
            return new ReviewFeedback(Boolean.TRUE.equals(response.passed()), response.issues(),
                    response.suggestions(), response.score() == null ? 5 : response.score());
        } catch (RuntimeException e) {
            recordFailure("review", e);
            return ReviewFeedback.unavailable("Review parsing failed");
        }
    }

    private void recordFailure(String call, RuntimeException e) {
        log.warn("Reasoning call {} failed: {}", call, e.getMessage());
        metrics.recordExternalFailure("reasoning");
    }

    static String systemPrompt(ReasoningContext context) {
        return """
                You are %s, an autonomous software engineering agent in a swarm collective.
                Your specialization: %s.
                Your personality: %s.

                You think independently, form engineering opinions, and act on them.
                You have studied %d repos. Token budget remaining: %d.

                Respond concisely. Focus on actionable engineering insight.
                """.formatted(context.agentName(), context.specialization(), traits(context.personality()),
                context.reposStudied(), context.remainingBudget());
    }

    static String traits(AgentPersonality p) {
        List<String> traits = new ArrayList<>();
        if (p.curiosity() > 0.7) {
            traits.add("deeply curious, loves exploring new codebases");
        } else if (p.curiosity() < 0.3) {
            traits.add("focused, prefers depth over breadth");
        }
        if (p.diligence() > 0.7) {
            traits.add("meticulous, writes thorough reviews");
        } else if (p.diligence() < 0.3) {
            traits.add("pragmatic, favors speed over perfection");
        }
        if (p.boldness() > 0.7) {
            traits.add("bold, tackles hard problems");
        } else if (p.boldness() < 0.3) {
            traits.add("cautious, prefers safe improvements");
        }
        if (p.sociability() > 0.7) {
            traits.add("collaborative, shares discoveries freely");
        } else if (p.sociability() < 0.3) {
            traits.add("independent, works alone before sharing");
        }
        return traits.isEmpty() ? "balanced across all traits" : String.join("; ", traits);
    }

    private static String excerpt(String text) {
        return text.length() > PATCH_EXCERPT ? text.substring(0, PATCH_EXCERPT) : text;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
