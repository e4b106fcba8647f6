package com.swarmmind.core.engine;

import com.swarmmind.core.agent.AutonomousAgentState;
import com.swarmmind.core.channel.EngineeringPheromone;
import com.swarmmind.core.channel.Pheromone;
import com.swarmmind.core.channel.PheromoneChannel;
import com.swarmmind.core.channel.PheromoneKind;
import com.swarmmind.core.config.SwarmProperties;
import com.swarmmind.core.external.DiscoveryFilters;
import com.swarmmind.core.external.ReasoningContext;
import com.swarmmind.core.external.ReasoningOutcome;
import com.swarmmind.core.logging.MdcContext;
import com.swarmmind.core.model.ActionType;
import com.swarmmind.core.model.AgentAction;
import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.AgentThought;
import com.swarmmind.core.model.Artifact;
import com.swarmmind.core.model.ArtifactKind;
import com.swarmmind.core.model.DecisionResult;
import com.swarmmind.core.model.DecisionStatus;
import com.swarmmind.core.model.DiscoveredIssue;
import com.swarmmind.core.model.DiscoveredRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs one agent's tick: move, absorb, then an engineering or exploration
 * step, then the synchronization check.
 * <p>
 * Engineering becomes more likely as the agent ages. Exploration emits
 * knowledge pheromones built from discovered repositories, or from canned
 * domain knowledge when discovery returns nothing.
 */
public class SwarmAgent {

    private static final Logger log = LoggerFactory.getLogger(SwarmAgent.class);

    static final double MAX_ENGINEERING_PROBABILITY = 0.8;
    static final double ENGINEERING_RAMP_STEPS = 50.0;
    static final double SYNTHESIS_MIN_SOCIABILITY = 0.4;
    static final int THOUGHT_WINDOW = 10;
    static final int DISCOVERY_TARGET = 5;
    static final double TRENDING_PROBABILITY = 0.3;
    static final int TRENDING_DAYS = 7;
    static final int MIN_DISCOVERY_STARS = 10;
    static final int SYNTHESIS_SAMPLE = 8;
    static final int MAX_DISCOVERED_REPOS = 25;
    static final int MAX_DISCOVERED_ISSUES = 25;

    static final double EMIT_PROBABILITY_SYNCED = 0.7;
    static final double EMIT_PROBABILITY_EXPLORING = 0.4;
    static final double CROSS_POLLINATION_PROBABILITY = 0.6;
    static final double CROSS_POLLINATION_CONFIDENCE_GAIN = 0.1;
    static final double RETARGET_MIN_STRENGTH = 0.6;

    /** Kinds whose failed attempts stay in flight for another try. */
    static final Set<ActionType> RETRYABLE = EnumSet.of(ActionType.WRITE_CODE, ActionType.REFACTOR,
            ActionType.DOCUMENT);

    private final AutonomousAgentState state;
    private final AgentServices services;
    private final SwarmProperties properties;

    private final List<DiscoveredRepo> discoveredRepos = new ArrayList<>();
    private final List<DiscoveredIssue> discoveredIssues = new ArrayList<>();

    SwarmAgent(AutonomousAgentState state, AgentServices services, SwarmProperties properties) {
        this.state = state;
        this.services = services;
        this.properties = properties;
    }

    public AutonomousAgentState state() {
        return state;
    }

    List<DiscoveredRepo> discoveredRepos() {
        return List.copyOf(discoveredRepos);
    }

    List<DiscoveredIssue> discoveredIssues() {
        return List.copyOf(discoveredIssues);
    }

    TickOutcome tick(PheromoneChannel channel, long tick) {
        MdcContext.setAgent(state.id(), state.name(), tick);
        try {
            var out = new Step();
            state.incrementStep();

            services.stateMachine().move(state, channel);
            List<Pheromone> absorbed = services.stateMachine().absorbPheromones(state, channel);
            out.absorbedCount = absorbed.size();

            AgentDecision current = state.currentDecision();
            boolean inFlight = current != null && current.status() == DecisionStatus.EXECUTING;
            if (inFlight && (state.budgetExhausted() || shouldDoEngineering())) {
                continueExecution(current, out);
            } else if (!inFlight && shouldDoEngineering()) {
                engineeringStep(channel, absorbed, out);
            } else {
                out.emission = explore(absorbed);
            }

            out.synchronizedNow = services.stateMachine().checkSync(state, channel);
            return out.build();
        } finally {
            MdcContext.clearAgent();
        }
    }

    boolean shouldDoEngineering() {
        if (!properties.isEngineeringEnabled() || state.budgetExhausted()) {
            return false;
        }
        double probability = Math.min(MAX_ENGINEERING_PROBABILITY, state.stepCount() / ENGINEERING_RAMP_STEPS);
        return services.random().nextDouble() < probability;
    }

    private void engineeringStep(PheromoneChannel channel, List<Pheromone> absorbed, Step out) {
        state.setCurrentAction("thinking");
        try {
            AgentThought thought = formThought(absorbed);
            state.addThought(thought);
            out.thought = thought;
            persist(() -> services.store().saveThought(thought));

            topUpDiscovery();

            state.setCurrentAction("deciding");
            List<AgentDecision> candidates = services.decisionEngine().generateCandidateDecisions(
                    state, channel, discoveredRepos, discoveredIssues, state.recentThoughts(THOUGHT_WINDOW));
            Optional<AgentDecision> selected = services.decisionEngine()
                    .selectDecision(candidates, properties.getSelectionTemperature());
            if (selected.isEmpty()) {
                state.setCurrentAction("idle (no candidates)");
                return;
            }

            AgentDecision decision = selected.get();
            state.startDecision(decision);
            out.selected = decision;
            state.setCurrentAction(decision.action().describe());
            persist(() -> services.store().saveDecision(decision));

            DecisionResult result = attempt(decision);
            if (result.success() || !RETRYABLE.contains(decision.action().type())) {
                resolve(decision, result, out);
            } else {
                log.info("{} attempt failed, will retry: {}", decision.action().type(), result.summary());
            }
        } catch (RuntimeException e) {
            log.warn("Engineering step failed: {}", e.getMessage(), e);
            state.setCurrentAction("recovering from error");
        }
    }

    private void continueExecution(AgentDecision decision, Step out) {
        // another attempt is charged in full, so it must fit what is left
        if (decision.cost().estimatedTokens() > state.remainingBudget()
                || services.decisionEngine().shouldSwitch(state, decision.result())) {
            abandon(decision, out);
            return;
        }
        try {
            DecisionResult result = attempt(decision);
            if (result.success()) {
                resolve(decision, result, out);
            }
        } catch (RuntimeException e) {
            log.warn("Continuing {} failed: {}", decision.action().describe(), e.getMessage(), e);
        }
    }

    private void abandon(AgentDecision decision, Step out) {
        decision.complete(null);
        state.finishCurrentDecision();
        out.resolved = decision;
        out.abandoned = true;
        persist(() -> services.store().updateStatus(decision.id(), decision.status(), decision.result()));
        log.info("Abandoned {} after {}", decision.action().describe(),
                decision.result() == null ? "no result" : decision.result().summary());
        state.setCurrentAction("switching tasks");
    }

    private DecisionResult attempt(AgentDecision decision) {
        DecisionResult result = services.executor().execute(decision, state);
        state.spendTokens(result.tokensUsed());
        services.metrics().recordTokensSpent(result.tokensUsed());
        decision.recordAttempt(result);
        return result;
    }

    private void resolve(AgentDecision decision, DecisionResult result, Step out) {
        if (result.success()) {
            decision.complete(result);
        } else {
            decision.fail(result);
        }
        state.finishCurrentDecision();
        out.resolved = decision;
        persist(() -> services.store().updateStatus(decision.id(), decision.status(), result));
        log.info("{}: {}", decision.action().type(), result.summary());
        state.setCurrentAction("idle");

        if (!result.success()) {
            return;
        }
        if (decision.action() instanceof AgentAction.StudyRepo study) {
            state.markRepoStudied(study.owner() + "/" + study.repo());
        }
        for (Artifact artifact : result.artifacts()) {
            if (artifact.kind() == ArtifactKind.PR_URL && artifact.url() != null) {
                state.recordPullRequest(artifact.url());
            }
        }
        if (result.hasArtifacts()) {
            out.emission = engineeringPheromone(decision, result);
        }
    }

    private AgentThought formThought(List<Pheromone> absorbed) {
        ReasoningContext context;
        if (!absorbed.isEmpty() && state.personality().sociability() > SYNTHESIS_MIN_SOCIABILITY) {
            String shared = absorbed.stream()
                    .limit(SYNTHESIS_SAMPLE)
                    .map(p -> "[" + p.domain() + "] " + truncate(p.content(), 150))
                    .collect(Collectors.joining("\n"));
            context = ReasoningContext.of(state, "knowledge_synthesis",
                    "Synthesized " + absorbed.size() + " pheromones across domains", shared);
        } else if (!discoveredRepos.isEmpty()) {
            context = ReasoningContext.of(state, "repo_analysis",
                    "Have studied " + state.reposStudied().size() + " repos. Discovered "
                            + discoveredIssues.size() + " issues.",
                    specializationContext());
        } else {
            context = ReasoningContext.of(state, "exploration",
                    "Step " + state.stepCount() + ", exploring " + state.explorationTarget(),
                    specializationContext());
        }
        ReasoningOutcome outcome = services.reasoning().reason(context);
        return new AgentThought(UUID.randomUUID().toString(), state.id(), context.trigger(), context.observation(),
                outcome.reasoning(), outcome.conclusion(), outcome.suggestedActions(), outcome.confidence(),
                Instant.now());
    }

    private String specializationContext() {
        return "Specialization: " + state.specialization().label()
                + ", energy: " + String.format("%.2f", state.energy());
    }

    private void topUpDiscovery() {
        if (discoveredRepos.size() < DISCOVERY_TARGET
                && services.random().nextDouble() < state.personality().curiosity()) {
            String topic = randomTopic();
            addRepos(services.repositoryDiscovery().discover(topic,
                    DiscoveryFilters.popular(MIN_DISCOVERY_STARS, DISCOVERY_TARGET)));
            if (services.random().nextDouble() < TRENDING_PROBABILITY) {
                addRepos(services.repositoryDiscovery().trending(topic, TRENDING_DAYS));
            }
        }
        if (discoveredIssues.size() < DISCOVERY_TARGET && !discoveredRepos.isEmpty()) {
            DiscoveredRepo repo = discoveredRepos.get(services.random().nextInt(discoveredRepos.size()));
            addIssues(services.issueDiscovery().listIssues(repo.owner(), repo.repo(), DISCOVERY_TARGET));
        }
    }

    private Pheromone explore(List<Pheromone> absorbed) {
        state.setCurrentAction("exploring");
        double emitProbability = state.isSynchronized() ? EMIT_PROBABILITY_SYNCED : EMIT_PROBABILITY_EXPLORING;
        if (services.random().nextDouble() > emitProbability) {
            return null;
        }

        String content;
        String domain = state.explorationTarget();
        Set<String> connections = Set.of();
        double confidence;

        if (!absorbed.isEmpty() && services.random().nextDouble() < CROSS_POLLINATION_PROBABILITY) {
            Pheromone source = absorbed.get(services.random().nextInt(absorbed.size()));
            connections = Set.of(source.id());
            confidence = Math.min(1.0, source.confidence() + CROSS_POLLINATION_CONFIDENCE_GAIN);
            domain = source.domain();

            String keywords = Arrays.stream(source.content().split("\\s+"))
                    .filter(w -> w.length() > 4)
                    .limit(3)
                    .collect(Collectors.joining(" "));
            List<DiscoveredRepo> repos = services.repositoryDiscovery().discover(
                    keywords.isEmpty() ? state.explorationTarget() : keywords, DiscoveryFilters.limit(3));
            if (!repos.isEmpty()) {
                DiscoveredRepo repo = repos.get(0);
                addRepos(List.of(repo));
                content = "github:" + repo.fullName() + " - " + repo.description();
            } else {
                content = services.fallbackInsights().insight(source.domain());
            }
            if (source.strength() > RETARGET_MIN_STRENGTH) {
                state.setExplorationTarget(source.domain());
            }
        } else {
            List<DiscoveredRepo> repos = services.repositoryDiscovery().discover(randomTopic(),
                    DiscoveryFilters.popular(MIN_DISCOVERY_STARS, DISCOVERY_TARGET));
            confidence = 0.4 + services.random().nextDouble() * 0.4;
            if (!repos.isEmpty()) {
                DiscoveredRepo repo = repos.get(services.random().nextInt(repos.size()));
                addRepos(List.of(repo));
                content = "github:" + repo.fullName() + " (" + repo.stars() + " stars, " + repo.language()
                        + ") - " + repo.description();
            } else {
                content = services.fallbackInsights().discovery(state.explorationTarget());
                confidence = 0.3 + services.random().nextDouble() * 0.4;
            }
        }

        Pheromone pheromone = Pheromone.emit(state.id(), content, domain, confidence, 0.5 + confidence * 0.3,
                connections);
        state.recordDiscovery(pheromone);
        return pheromone;
    }

    private EngineeringPheromone engineeringPheromone(AgentDecision decision, DecisionResult result) {
        PheromoneKind kind = PheromoneKind.KNOWLEDGE;
        if (hasArtifact(result, ArtifactKind.PR_URL)) {
            kind = PheromoneKind.PR;
        } else if (hasArtifact(result, ArtifactKind.CODE_CHANGE)) {
            kind = PheromoneKind.CODE;
        } else if (hasArtifact(result, ArtifactKind.TECHNIQUE)) {
            kind = PheromoneKind.TECHNIQUE;
        }
        double priority = decision.priority();
        EngineeringPheromone pheromone = EngineeringPheromone.emit(state.id(), result.summary(),
                state.explorationTarget(), priority, 0.6 + priority * 0.3, kind, result.artifacts(),
                decision.action().repository().map(List::of).orElse(List.of()));
        state.recordDiscovery(pheromone);
        return pheromone;
    }

    private static boolean hasArtifact(DecisionResult result, ArtifactKind kind) {
        return result.artifacts().stream().anyMatch(a -> a.kind() == kind);
    }

    private void addRepos(List<DiscoveredRepo> repos) {
        for (DiscoveredRepo repo : repos) {
            boolean known = discoveredRepos.stream().anyMatch(r -> r.fullName().equals(repo.fullName()));
            if (!known) {
                discoveredRepos.add(repo);
            }
        }
        // oldest first out
        while (discoveredRepos.size() > MAX_DISCOVERED_REPOS) {
            discoveredRepos.remove(0);
        }
    }

    private void addIssues(List<DiscoveredIssue> issues) {
        for (DiscoveredIssue issue : issues) {
            boolean known = discoveredIssues.stream().anyMatch(i -> i.number() == issue.number()
                    && i.owner().equalsIgnoreCase(issue.owner()) && i.repo().equalsIgnoreCase(issue.repo()));
            if (!known) {
                discoveredIssues.add(issue);
            }
        }
        while (discoveredIssues.size() > MAX_DISCOVERED_ISSUES) {
            discoveredIssues.remove(0);
        }
    }

    private String randomTopic() {
        List<String> topics = properties.getDiscoveryTopics();
        if (topics == null || topics.isEmpty()) {
            return state.explorationTarget();
        }
        return topics.get(services.random().nextInt(topics.size())).trim();
    }

    private void persist(Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.warn("Persisting agent state failed: {}", e.getMessage());
            services.metrics().recordExternalFailure("store");
        }
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }

    /** Mutable accumulator for one tick. */
    private static final class Step {
        Pheromone emission;
        int absorbedCount;
        boolean synchronizedNow;
        AgentThought thought;
        AgentDecision selected;
        AgentDecision resolved;
        boolean abandoned;

        TickOutcome build() {
            return new TickOutcome(emission, absorbedCount, synchronizedNow, thought, selected, resolved, abandoned);
        }
    }
}
