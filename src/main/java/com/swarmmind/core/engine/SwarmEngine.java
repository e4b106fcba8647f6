package com.swarmmind.core.engine;

import com.swarmmind.core.agent.AgentFactory;
import com.swarmmind.core.agent.AgentStateMachine;
import com.swarmmind.core.agent.AutonomousAgentState;
import com.swarmmind.core.channel.DensityPolicy;
import com.swarmmind.core.channel.Pheromone;
import com.swarmmind.core.channel.PheromoneChannel;
import com.swarmmind.core.collab.CollaborationDetector;
import com.swarmmind.core.config.SwarmProperties;
import com.swarmmind.core.decision.DecisionEngine;
import com.swarmmind.core.events.EventBus;
import com.swarmmind.core.events.SwarmEvent;
import com.swarmmind.core.external.DecisionExecutor;
import com.swarmmind.core.external.DecisionRecord;
import com.swarmmind.core.external.DecisionStore;
import com.swarmmind.core.external.IssueDiscovery;
import com.swarmmind.core.external.ReasoningService;
import com.swarmmind.core.external.RepositoryDiscovery;
import com.swarmmind.core.logging.MdcContext;
import com.swarmmind.core.metrics.SwarmmindMetrics;
import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.AgentThought;
import com.swarmmind.core.model.CollaborativeProject;
import com.swarmmind.core.model.DecisionStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.random.RandomGenerator;

/**
 * Owns the channel and the agent population and advances them in discrete
 * global ticks.
 * <p>
 * Each tick recomputes channel density, checks the phase transition, runs
 * every agent (sequentially, or on a fixed worker pool), appends emitted
 * pheromones, and every few ticks scans for collaboration opportunities.
 * Ticks are serialized: {@link #tick()} is not re-entrant.
 */
@Service
public class SwarmEngine {

    private static final Logger log = LoggerFactory.getLogger(SwarmEngine.class);

    private final SwarmProperties properties;
    private final AgentFactory agentFactory;
    private final CollaborationDetector collaborationDetector;
    private final DensityPolicy densityPolicy;
    private final EventBus eventBus;
    private final SwarmmindMetrics metrics;
    private final RandomGenerator random;
    private final AgentServices services;

    private PheromoneChannel channel;
    private List<SwarmAgent> agents = List.of();
    private long step;
    private final Deque<AgentThought> thoughtStream = new ArrayDeque<>();
    private final Deque<AgentDecision> decisionLog = new ArrayDeque<>();
    private final List<CollaborativeProject> projects = new ArrayList<>();
    private final Set<String> proposedTitles = new HashSet<>();
    private ExecutorService workers;

    public SwarmEngine(SwarmProperties properties, AgentFactory agentFactory, AgentStateMachine stateMachine,
                       DecisionEngine decisionEngine, CollaborationDetector collaborationDetector,
                       DensityPolicy densityPolicy, RepositoryDiscovery repositoryDiscovery,
                       IssueDiscovery issueDiscovery, ReasoningService reasoning, DecisionExecutor executor,
                       DecisionStore store, FallbackInsights fallbackInsights, EventBus eventBus,
                       SwarmmindMetrics metrics, RandomGenerator random) {
        this.properties = properties;
        this.agentFactory = agentFactory;
        this.collaborationDetector = collaborationDetector;
        this.densityPolicy = densityPolicy;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.random = random;
        this.services = new AgentServices(stateMachine, decisionEngine, repositoryDiscovery, issueDiscovery,
                reasoning, executor, store, fallbackInsights, metrics, random);
        reset(properties.getAgentCount(), null);
    }

    /**
     * Discards the current swarm and creates a fresh one. A seed re-seeds the
     * shared random source when it supports seeding.
     */
    public synchronized void reset(int agentCount, Long seed) {
        if (agentCount < 1) {
            throw new IllegalArgumentException("agentCount must be at least 1, got " + agentCount);
        }
        if (seed != null && random instanceof Random seedable) {
            seedable.setSeed(seed);
        }
        channel = new PheromoneChannel(densityPolicy, properties.getCriticalThreshold());
        List<SwarmAgent> created = new ArrayList<>();
        for (int i = 0; i < agentCount; i++) {
            AutonomousAgentState state = agentFactory.create(i, properties.getTokenBudgetPerAgent(),
                    properties.getHistoryLimit());
            created.add(new SwarmAgent(state, services, properties));
        }
        agents = List.copyOf(created);
        step = 0;
        thoughtStream.clear();
        decisionLog.clear();
        projects.clear();
        proposedTitles.clear();
        shutdownWorkers();
        log.info("Swarm initialized with {} agent(s), critical threshold {}", agentCount,
                properties.getCriticalThreshold());
    }

    /**
     * Advances the whole swarm by one tick.
     *
     * @return aggregates after the tick
     */
    public synchronized SwarmStats tick() {
        long start = System.currentTimeMillis();
        long tick = ++step;
        MdcContext.setTick(tick);
        try {
            channel.recomputeDensity();
            if (channel.checkPhaseTransition(tick)) {
                log.info("Phase transition at tick {} (density {})", tick, String.format("%.3f", channel.density()));
                metrics.recordPhaseTransition();
                publish(SwarmEvent.PHASE_TRANSITION, null, tick, Map.of(
                        "density", channel.density(),
                        "criticalThreshold", channel.criticalThreshold()));
            }

            if (properties.isParallel() && agents.size() > 1) {
                tickInParallel(tick);
            } else {
                for (SwarmAgent agent : agents) {
                    apply(agent, runAgent(agent, tick), tick);
                }
            }

            int interval = properties.getCollaborationInterval();
            if (interval > 0 && tick % interval == 0) {
                scanForCollaboration(tick);
            }

            SwarmStats stats = stats();
            metrics.recordTickDuration(System.currentTimeMillis() - start);
            publish(SwarmEvent.TICK_COMPLETED, null, tick, Map.of(
                    "pheromones", stats.totalPheromones(),
                    "synchronized", stats.synchronizedCount(),
                    "density", stats.density()));
            return stats;
        } finally {
            MdcContext.clear();
        }
    }

    /** Runs {@code ticks} ticks and returns the aggregates after the last one. */
    public SwarmStats run(int ticks) {
        SwarmStats last = stats();
        for (int i = 0; i < ticks; i++) {
            last = tick();
        }
        return last;
    }

    private void tickInParallel(long tick) {
        ExecutorService pool = workers();
        List<Callable<TickOutcome>> jobs = new ArrayList<>();
        for (SwarmAgent agent : agents) {
            jobs.add(() -> runAgent(agent, tick));
        }
        try {
            List<Future<TickOutcome>> results = pool.invokeAll(jobs);
            for (int i = 0; i < agents.size(); i++) {
                apply(agents.get(i), outcomeOf(results.get(i)), tick);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Tick {} interrupted while waiting for agents", tick);
        }
    }

    private TickOutcome outcomeOf(Future<TickOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Agent tick failed: {}", e.getCause().getMessage(), e.getCause());
            return TickOutcome.idle();
        }
    }

    private TickOutcome runAgent(SwarmAgent agent, long tick) {
        try {
            return agent.tick(channel, tick);
        } catch (RuntimeException e) {
            log.error("Agent {} failed during tick {}: {}", agent.state().name(), tick, e.getMessage(), e);
            return TickOutcome.idle();
        }
    }

    private void apply(SwarmAgent agent, TickOutcome outcome, long tick) {
        AutonomousAgentState state = agent.state();
        metrics.recordPheromonesAbsorbed(outcome.absorbedCount());

        if (outcome.thought() != null) {
            append(thoughtStream, outcome.thought());
        }
        if (outcome.selected() != null) {
            AgentDecision d = outcome.selected();
            metrics.recordDecision(d.action().type().wireName(), "selected");
            publish(SwarmEvent.DECISION_SELECTED, state.id(), tick, Map.of(
                    "decisionId", d.id(),
                    "action", d.action().type().wireName(),
                    "description", d.action().describe(),
                    "priority", d.priority()));
        }
        if (outcome.resolved() != null) {
            AgentDecision d = outcome.resolved();
            append(decisionLog, d);
            boolean completed = d.status() == DecisionStatus.COMPLETED;
            metrics.recordDecision(d.action().type().wireName(),
                    outcome.abandoned() ? "abandoned" : d.status().name().toLowerCase());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("decisionId", d.id());
            payload.put("action", d.action().type().wireName());
            payload.put("abandoned", outcome.abandoned());
            if (d.result() != null) {
                payload.put("summary", d.result().summary());
            }
            publish(completed ? SwarmEvent.DECISION_COMPLETED : SwarmEvent.DECISION_FAILED, state.id(), tick, payload);
        }
        if (outcome.emission() != null) {
            Pheromone p = outcome.emission();
            channel.emit(p);
            metrics.recordPheromoneEmitted(p.kind().name().toLowerCase());
            publish(SwarmEvent.PHEROMONE_EMITTED, state.id(), tick, Map.of(
                    "pheromoneId", p.id(),
                    "kind", p.kind().name().toLowerCase(),
                    "domain", p.domain(),
                    "strength", p.strength()));
        }
        if (outcome.synchronizedNow()) {
            metrics.recordAgentSynchronized();
            publish(SwarmEvent.AGENT_SYNCHRONIZED, state.id(), tick, Map.of(
                    "agentName", state.name(),
                    "absorbed", state.absorbedCount()));
        }
    }

    private void scanForCollaboration(long tick) {
        List<AutonomousAgentState> states = agents.stream().map(SwarmAgent::state).toList();
        Optional<CollaborativeProject> proposal = collaborationDetector.detect(states, channel)
                .filter(p -> !proposedTitles.contains(p.title()));
        proposal.ifPresent(project -> {
            proposedTitles.add(project.title());
            projects.add(project);
            metrics.recordCollaborationProposed(CollaborationDetector.triggerOf(project));
            publish(SwarmEvent.COLLABORATION_PROPOSED, null, tick, Map.of(
                    "projectId", project.id(),
                    "title", project.title(),
                    "participants", project.participants(),
                    "repos", project.repos()));
            log.info("Proposed collaboration '{}' with {} participant(s)", project.title(),
                    project.participants().size());
        });
    }

    public synchronized SwarmSnapshot snapshot() {
        return new SwarmSnapshot(step, channel.density(), channel.criticalThreshold(),
                channel.phaseTransitionOccurred(),
                channel.transitionStep().isPresent() ? channel.transitionStep().getAsLong() : null,
                agents.stream().map(a -> AgentView.of(a.state())).toList(),
                stats());
    }

    public synchronized SwarmStats stats() {
        int discoveries = 0;
        int synced = 0;
        double energy = 0;
        for (SwarmAgent agent : agents) {
            AutonomousAgentState s = agent.state();
            discoveries += s.discoveries();
            energy += s.energy();
            if (s.isSynchronized()) {
                synced++;
            }
        }
        List<Pheromone> pheromones = channel.pheromones();
        long domains = pheromones.stream().map(Pheromone::domain).distinct().count();
        return new SwarmStats(pheromones.size(), discoveries, synced,
                agents.isEmpty() ? 0.0 : energy / agents.size(), channel.density(), projects.size(),
                (int) domains);
    }

    public synchronized List<AgentView> agents() {
        return agents.stream().map(a -> AgentView.of(a.state())).toList();
    }

    public synchronized Optional<AgentView> findAgent(String agentId) {
        return agents.stream()
                .filter(a -> a.state().id().equals(agentId))
                .findFirst()
                .map(a -> AgentView.of(a.state()));
    }

    /** Most recent first. */
    public synchronized List<PheromoneView> pheromones(int limit) {
        List<Pheromone> all = channel.pheromones();
        List<PheromoneView> result = new ArrayList<>();
        for (int i = all.size() - 1; i >= 0 && result.size() < limit; i--) {
            result.add(PheromoneView.of(all.get(i)));
        }
        return result;
    }

    /** Most recent first. */
    public synchronized List<AgentThought> thoughts(int limit) {
        List<AgentThought> result = new ArrayList<>();
        var it = thoughtStream.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    /** Resolved decisions, most recent first. */
    public synchronized List<DecisionRecord> resolvedDecisions(int limit) {
        List<DecisionRecord> result = new ArrayList<>();
        var it = decisionLog.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(DecisionRecord.from(it.next()));
        }
        return result;
    }

    public synchronized List<CollaborativeProject> collaborations() {
        return List.copyOf(projects);
    }

    public synchronized long step() {
        return step;
    }

    synchronized PheromoneChannel channel() {
        return channel;
    }

    synchronized List<SwarmAgent> swarmAgents() {
        return agents;
    }

    private <T> void append(Deque<T> history, T item) {
        history.addLast(item);
        while (history.size() > properties.getHistoryLimit()) {
            history.removeFirst();
        }
    }

    private void publish(String type, String agentId, long tick, Map<String, Object> payload) {
        eventBus.publish(SwarmEvent.of(type, agentId, tick, payload));
    }

    private ExecutorService workers() {
        if (workers == null) {
            int threads = Math.max(1, Math.min(agents.size(), Runtime.getRuntime().availableProcessors()));
            workers = Executors.newFixedThreadPool(threads, r -> {
                Thread t = new Thread(r, "swarm-agent");
                t.setDaemon(true);
                return t;
            });
        }
        return workers;
    }

    @PreDestroy
    public synchronized void shutdownWorkers() {
        if (workers != null) {
            workers.shutdownNow();
            workers = null;
        }
    }
}
