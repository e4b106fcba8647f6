package com.swarmmind.core.collab;

import com.swarmmind.core.agent.AutonomousAgentState;
import com.swarmmind.core.channel.PheromoneChannel;
import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.CollaborativeProject;
import com.swarmmind.core.model.DecisionStatus;
import com.swarmmind.core.model.ProjectStatus;
import com.swarmmind.core.model.Specialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Scans the population for agents whose work overlaps and proposes a joint
 * project. Stateless: callers re-run the scan periodically.
 */
@Service
public class CollaborationDetector {

    private static final Logger log = LoggerFactory.getLogger(CollaborationDetector.class);

    public static final String TRIGGER_REPO_OVERLAP = "repo_overlap";
    public static final String TRIGGER_CROSS_DOMAIN = "cross_domain";

    static final int MIN_AGENTS_PER_REPO = 2;
    static final int MIN_SYNCHRONIZED = 3;
    static final int MIN_SPECIALIZATIONS = 2;

    /**
     * Proposes a project for the first repository two or more agents are
     * executing against; failing that, a cross-domain project once enough
     * synchronized agents with different specializations exist.
     */
    public Optional<CollaborativeProject> detect(List<AutonomousAgentState> agents, PheromoneChannel channel) {
        Map<String, List<String>> agentsByRepo = new LinkedHashMap<>();
        for (AutonomousAgentState agent : agents) {
            AgentDecision decision = agent.currentDecision();
            if (decision == null || decision.status() != DecisionStatus.EXECUTING) {
                continue;
            }
            decision.action().repository().ifPresent(repo ->
                    agentsByRepo.computeIfAbsent(repo, r -> new ArrayList<>()).add(agent.id()));
        }
        for (Map.Entry<String, List<String>> entry : agentsByRepo.entrySet()) {
            if (entry.getValue().size() >= MIN_AGENTS_PER_REPO) {
                log.info("Repository overlap on {} between {} agents", entry.getKey(), entry.getValue().size());
                return Optional.of(propose(
                        "Joint work on " + entry.getKey(),
                        entry.getValue().size() + " agents are working on " + entry.getKey()
                                + " at the same time; coordinate instead of duplicating effort",
                        entry.getValue(),
                        List.of(entry.getKey())));
            }
        }

        List<AutonomousAgentState> synced = agents.stream().filter(AutonomousAgentState::isSynchronized).toList();
        if (synced.size() < MIN_SYNCHRONIZED) {
            return Optional.empty();
        }
        Set<Specialization> specializations = new LinkedHashSet<>();
        synced.forEach(a -> specializations.add(a.specialization()));
        if (specializations.size() < MIN_SPECIALIZATIONS) {
            return Optional.empty();
        }
        List<String> labels = specializations.stream().limit(2).map(Specialization::label).toList();
        log.info("Cross-domain opportunity among {} synchronized agents (density {})",
                synced.size(), String.format("%.2f", channel.density()));
        return Optional.of(propose(
                "Cross-domain collaboration: " + String.join(" + ", labels),
                "Synchronized agents with complementary specializations can combine their findings",
                synced.stream().map(AutonomousAgentState::id).toList(),
                List.of()));
    }

    /** Metrics tag for a project proposed by {@link #detect}. */
    public static String triggerOf(CollaborativeProject project) {
        return project.repos().isEmpty() ? TRIGGER_CROSS_DOMAIN : TRIGGER_REPO_OVERLAP;
    }

    private static CollaborativeProject propose(String title, String description, List<String> participants,
                                                List<String> repos) {
        return new CollaborativeProject(UUID.randomUUID().toString(), title, description, participants, repos,
                ProjectStatus.PROPOSED, Instant.now());
    }
}
