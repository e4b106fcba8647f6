package com.swarmmind.core.external;

import com.swarmmind.core.agent.AutonomousAgentState;
import com.swarmmind.core.metrics.SwarmmindMetrics;
import com.swarmmind.core.model.AgentAction;
import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.AgentThought;
import com.swarmmind.core.model.Artifact;
import com.swarmmind.core.model.CodePatch;
import com.swarmmind.core.model.DecisionResult;
import com.swarmmind.core.model.DiscoveredIssue;
import com.swarmmind.core.model.DiscoveredRepo;
import com.swarmmind.core.model.ReviewFeedback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Executes decisions without writing anywhere outside the process: studying
 * and exploring produce analyses, sharing produces a technique, and code
 * actions produce reviewed patches as artifacts. Issue fixes and pull
 * requests are refused.
 * <p>
 * Every attempt is charged the decision's estimated token cost, except
 * refused ones, which cost nothing.
 */
@Service
public class SandboxDecisionExecutor implements DecisionExecutor {

    private static final Logger log = LoggerFactory.getLogger(SandboxDecisionExecutor.class);

    static final int ISSUE_LIMIT = 5;
    static final int EXPLORE_REPO_LIMIT = 3;

    private final RepositoryDiscovery repositoryDiscovery;
    private final IssueDiscovery issueDiscovery;
    private final ReasoningService reasoning;
    private final SwarmmindMetrics metrics;

    public SandboxDecisionExecutor(RepositoryDiscovery repositoryDiscovery, IssueDiscovery issueDiscovery,
                                   ReasoningService reasoning, SwarmmindMetrics metrics) {
        this.repositoryDiscovery = repositoryDiscovery;
        this.issueDiscovery = issueDiscovery;
        this.reasoning = reasoning;
        this.metrics = metrics;
    }

    @Override
    public DecisionResult execute(AgentDecision decision, AutonomousAgentState agent) {
        AgentAction action = decision.action();
        int tokens = decision.cost().estimatedTokens();
        try {
            return switch (action.type()) {
                case STUDY_REPO -> studyRepo((AgentAction.StudyRepo) action, agent, tokens);
                case EXPLORE_TOPIC -> exploreTopic((AgentAction.ExploreTopic) action, agent, tokens);
                case SHARE_TECHNIQUE -> shareTechnique((AgentAction.ShareTechnique) action, agent, tokens);
                case WRITE_CODE, REFACTOR, DOCUMENT -> changeCode(action, agent, tokens);
                case FIX_ISSUE, CONTRIBUTE_PR -> DecisionResult.failure(
                        action.type() + " is not executed autonomously", 0);
            };
        } catch (RuntimeException e) {
            log.warn("Executing {} for {} failed: {}", action.describe(), agent.name(), e.getMessage());
            metrics.recordExternalFailure("executor");
            return DecisionResult.failure("Execution error: " + e.getMessage(), tokens);
        }
    }

    private DecisionResult studyRepo(AgentAction.StudyRepo action, AutonomousAgentState agent, int tokens) {
        String fullName = action.owner() + "/" + action.repo();
        List<DiscoveredIssue> issues = issueDiscovery.listIssues(action.owner(), action.repo(), ISSUE_LIMIT);
        String issueList = issues.stream()
                .map(i -> "#" + i.number() + ": " + i.title() + " [" + i.difficulty().name().toLowerCase() + "]")
                .collect(Collectors.joining("\n"));
        ReasoningOutcome outcome = reasoning.reason(ReasoningContext.of(agent, "repo_analysis",
                "Studying " + fullName + (action.topic() == null ? "" : " for " + action.topic()),
                issueList.isEmpty() ? "No open issues listed" : "Open issues:\n" + issueList));

        if (outcome.degraded() && issues.isEmpty()) {
            return DecisionResult.failure("Could not study " + fullName, tokens);
        }
        StringBuilder analysis = new StringBuilder("Analysis of ").append(fullName).append('\n');
        if (!outcome.degraded()) {
            analysis.append(outcome.conclusion()).append('\n').append(outcome.reasoning()).append('\n');
        }
        if (!issueList.isEmpty()) {
            analysis.append("Open issues:\n").append(issueList);
        }
        return new DecisionResult(true, "Studied " + fullName + summarySuffix(outcome),
                List.of(Artifact.analysis(analysis.toString().trim())), tokens);
    }

    private DecisionResult exploreTopic(AgentAction.ExploreTopic action, AutonomousAgentState agent, int tokens) {
        List<DiscoveredRepo> repos = repositoryDiscovery.discover(action.topic(),
                DiscoveryFilters.limit(EXPLORE_REPO_LIMIT));
        String repoList = repos.stream()
                .map(r -> r.fullName() + " (" + r.stars() + " stars) " + r.description())
                .collect(Collectors.joining("\n"));
        ReasoningOutcome outcome = reasoning.reason(ReasoningContext.of(agent, "exploration",
                "Exploring " + action.topic(),
                repoList.isEmpty() ? "No repositories found" : "Related repositories:\n" + repoList));

        if (outcome.degraded() && repos.isEmpty()) {
            return DecisionResult.failure("Nothing found while exploring " + action.topic(), tokens);
        }
        StringBuilder analysis = new StringBuilder("Exploration of ").append(action.topic()).append('\n');
        if (!outcome.degraded()) {
            analysis.append(outcome.conclusion()).append('\n');
        }
        if (!repoList.isEmpty()) {
            analysis.append(repoList);
        }
        return new DecisionResult(true, "Explored " + action.topic() + summarySuffix(outcome),
                List.of(Artifact.analysis(analysis.toString().trim())), tokens);
    }

    private DecisionResult shareTechnique(AgentAction.ShareTechnique action, AutonomousAgentState agent,
                                          int tokens) {
        StringBuilder technique = new StringBuilder(action.technique());
        if (action.sourceRepo() != null) {
            technique.append(" (from ").append(action.sourceRepo()).append(')');
        }
        List<AgentThought> recent = agent.recentThoughts(1);
        if (!recent.isEmpty() && !recent.get(0).conclusion().isBlank()) {
            technique.append(": ").append(recent.get(0).conclusion());
        }
        return new DecisionResult(true, "Shared technique: " + action.technique(),
                List.of(Artifact.technique(technique.toString())), tokens);
    }

    private DecisionResult changeCode(AgentAction action, AutonomousAgentState agent, int tokens) {
        String objective = action.describe();
        List<CodePatch> patches = reasoning.generatePatch(ReasoningContext.of(agent, action.type().wireName(),
                objective, "Keep changes minimal and self-contained"));
        if (patches.isEmpty()) {
            return DecisionResult.failure("No changes generated for " + objective, tokens);
        }
        ReviewFeedback review = reasoning.review(patches, objective);
        if (!review.passed()) {
            return DecisionResult.failure("Self-review rejected changes (score " + review.score() + "): "
                    + String.join("; ", review.issues()), tokens);
        }
        List<Artifact> artifacts = new ArrayList<>();
        for (CodePatch patch : patches) {
            artifacts.add(Artifact.codeChange(patch.path(), patch.modified()));
        }
        return new DecisionResult(true, "Prepared " + patches.size() + " change(s) for " + objective
                + " (review score " + review.score() + ")", artifacts, tokens);
    }

    private static String summarySuffix(ReasoningOutcome outcome) {
        return outcome.degraded() || outcome.conclusion().isBlank() ? "" : ": " + outcome.conclusion();
    }
}
