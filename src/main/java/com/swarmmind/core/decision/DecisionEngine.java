package com.swarmmind.core.decision;

import com.swarmmind.core.agent.AutonomousAgentState;
import com.swarmmind.core.channel.PheromoneChannel;
import com.swarmmind.core.model.ActionType;
import com.swarmmind.core.model.AgentAction;
import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.AgentThought;
import com.swarmmind.core.model.DecisionCost;
import com.swarmmind.core.model.DecisionResult;
import com.swarmmind.core.model.DiscoveredIssue;
import com.swarmmind.core.model.DiscoveredRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Generates, scores and selects the engineering decisions an agent can take.
 * <p>
 * Candidates come from the agent's recent thoughts, freshly discovered
 * repositories, the state of the channel, and a guaranteed exploration
 * fallback. Anything the agent cannot afford, and anything that would touch
 * the outside world (fixing issues, opening pull requests), is dropped
 * before scoring.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final int THOUGHT_WINDOW = 5;
    static final int REPO_CANDIDATES = 3;
    static final int SHARE_MIN_PHEROMONES = 5;
    static final double SHARE_MIN_SOCIABILITY = 0.5;
    static final int STALENESS_WINDOW = 10;

    static final double WEIGHT_BASE = 0.20;
    static final double WEIGHT_COST = 0.25;
    static final double WEIGHT_NOVELTY = 0.15;
    static final double WEIGHT_RISK = 0.20;
    static final double WEIGHT_COLLECTIVE = 0.10;
    static final double WEIGHT_FIT = 0.10;

    static final double SWITCH_AFTER_SUCCESS = 0.3;
    static final double SWITCH_AFTER_FAILURE = 0.7;

    private final SuggestedActionParser parser;
    private final RandomGenerator random;

    public DecisionEngine(SuggestedActionParser parser, RandomGenerator random) {
        this.parser = parser;
        this.random = random;
    }

    public DecisionCost estimateCost(AgentAction action) {
        ActionType type = action.type();
        return new DecisionCost(type.estimatedTokens(), type.estimatedTimeMs(), type.riskLevel());
    }

    /**
     * Builds the scored candidate list for an agent, highest priority first.
     * The list is empty only when the agent's budget is fully spent.
     */
    public List<AgentDecision> generateCandidateDecisions(AutonomousAgentState agent, PheromoneChannel channel,
                                                          List<DiscoveredRepo> repos, List<DiscoveredIssue> issues,
                                                          List<AgentThought> recentThoughts) {
        int remaining = agent.remainingBudget();
        List<AgentDecision> candidates = new ArrayList<>();

        List<AgentThought> window = recentThoughts.size() > THOUGHT_WINDOW
                ? recentThoughts.subList(recentThoughts.size() - THOUGHT_WINDOW, recentThoughts.size())
                : recentThoughts;
        for (AgentThought thought : window) {
            for (String suggestion : thought.suggestedActions()) {
                parser.parse(suggestion, repos, issues)
                        .ifPresent(action -> offer(candidates, agent, action, remaining));
            }
        }

        repos.stream()
                .filter(r -> !agent.hasStudied(r.fullName()))
                .limit(REPO_CANDIDATES)
                .forEach(r -> offer(candidates, agent, new AgentAction.StudyRepo(r.owner(), r.repo()), remaining));

        if (channel.size() > SHARE_MIN_PHEROMONES && agent.personality().sociability() > SHARE_MIN_SOCIABILITY) {
            offer(candidates, agent,
                    new AgentAction.ShareTechnique("Cross-domain synthesis from " + agent.specialization().label()),
                    remaining);
        }

        if (remaining > 0) {
            candidates.add(explorationFallback(agent, remaining));
        }

        for (AgentDecision candidate : candidates) {
            candidate.setPriority(scoreDecision(candidate, agent, channel));
        }
        candidates.sort(Comparator.comparingDouble(AgentDecision::priority).reversed());

        log.debug("Agent {} has {} candidate(s) with {} tokens remaining", agent.name(), candidates.size(), remaining);
        return candidates;
    }

    private void offer(List<AgentDecision> candidates, AutonomousAgentState agent, AgentAction action, int remaining) {
        if (!action.type().isAutonomous()) {
            log.debug("Dropping non-autonomous action {} for agent {}", action.type(), agent.name());
            return;
        }
        DecisionCost cost = estimateCost(action);
        if (cost.estimatedTokens() > remaining) {
            return;
        }
        candidates.add(new AgentDecision(agent.id(), action, cost));
    }

    // Offered whenever any budget remains; its estimate is capped at what is left.
    private AgentDecision explorationFallback(AutonomousAgentState agent, int remaining) {
        AgentAction explore = new AgentAction.ExploreTopic(agent.specialization().label());
        DecisionCost cost = estimateCost(explore);
        if (cost.estimatedTokens() > remaining) {
            cost = new DecisionCost(remaining, cost.estimatedTimeMs(), cost.riskLevel());
        }
        return new AgentDecision(agent.id(), explore, cost);
    }

    /**
     * Weighted priority of a decision for this agent. Pure apart from reading
     * the agent's recent decisions and the channel's transition flag.
     */
    public double scoreDecision(AgentDecision decision, AutonomousAgentState agent, PheromoneChannel channel) {
        ActionType type = decision.action().type();
        int remaining = agent.remainingBudget();

        double base = type.basePriority() * WEIGHT_BASE;

        double costEfficiency = remaining > 0
                ? Math.max(0.0, 1.0 - (double) decision.cost().estimatedTokens() / remaining) * WEIGHT_COST
                : 0.0;

        Set<ActionType> recentKinds = EnumSet.noneOf(ActionType.class);
        agent.recentDecisions(STALENESS_WINDOW).forEach(d -> recentKinds.add(d.action().type()));
        double novelty = recentKinds.contains(type) ? 0.0 : WEIGHT_NOVELTY;

        double budgetRatio = agent.tokenBudget() > 0 ? (double) remaining / agent.tokenBudget() : 0.0;
        double riskPenalty = decision.cost().riskLevel().multiplier() * (1.0 - budgetRatio) * WEIGHT_RISK;

        double collective = channel.phaseTransitionOccurred() && type != ActionType.EXPLORE_TOPIC
                ? WEIGHT_COLLECTIVE : 0.0;

        double fit = agent.personality().fitFor(type) * WEIGHT_FIT;

        return base + costEfficiency + novelty - riskPenalty + collective + fit;
    }

    /**
     * Picks one candidate. Temperature 0 is greedy (first of equal maxima);
     * higher temperatures sample from a softmax over priorities.
     */
    public Optional<AgentDecision> selectDecision(List<AgentDecision> candidates, double temperature) {
        if (temperature < 0 || Double.isNaN(temperature)) {
            throw new IllegalArgumentException("temperature must be >= 0, got " + temperature);
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        AgentDecision best = candidates.get(0);
        for (AgentDecision candidate : candidates) {
            if (candidate.priority() > best.priority()) {
                best = candidate;
            }
        }
        if (temperature == 0) {
            return Optional.of(best);
        }

        double max = best.priority();
        double[] weights = new double[candidates.size()];
        double total = 0;
        for (int i = 0; i < weights.length; i++) {
            weights[i] = Math.exp((candidates.get(i).priority() - max) / temperature);
            total += weights[i];
        }
        double roll = random.nextDouble() * total;
        for (int i = 0; i < weights.length; i++) {
            roll -= weights[i];
            if (roll <= 0) {
                return Optional.of(candidates.get(i));
            }
        }
        return Optional.of(candidates.get(0));
    }

    /**
     * Whether the agent should abandon its current line of work and pick a
     * new decision. A null result means the current decision is still running.
     */
    public boolean shouldSwitch(AutonomousAgentState agent, DecisionResult lastResult) {
        if (agent.currentDecision() == null || agent.budgetExhausted()) {
            return true;
        }
        if (lastResult == null) {
            return false;
        }
        double threshold = lastResult.success() ? SWITCH_AFTER_SUCCESS : SWITCH_AFTER_FAILURE;
        return random.nextDouble() < threshold;
    }
}
