package com.swarmmind.core.health;

import com.swarmmind.core.engine.SwarmEngine;
import com.swarmmind.core.engine.SwarmSnapshot;
import com.swarmmind.core.external.ReasoningService;
import com.swarmmind.core.external.github.GitHubClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports the swarm itself and its two external collaborators. The
 * collaborators are never DOWN: without them the swarm keeps running on
 * degraded results, so they report DEGRADED instead.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SwarmEngine swarmEngine;
    private final ReasoningService reasoningService;
    private final GitHubClient gitHubClient;

    public HealthCheckService(SwarmEngine swarmEngine, ReasoningService reasoningService,
                              GitHubClient gitHubClient) {
        this.swarmEngine = swarmEngine;
        this.reasoningService = reasoningService;
        this.gitHubClient = gitHubClient;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSwarm());
        results.add(checkReasoning());
        results.add(checkDiscovery());
        return results;
    }

    private HealthStatus checkSwarm() {
        try {
            SwarmSnapshot snapshot = swarmEngine.snapshot();
            return HealthStatus.up("swarm",
                    snapshot.agents().size() + " agent(s) at tick " + snapshot.step(),
                    Map.of("step", String.valueOf(snapshot.step()),
                            "density", String.format("%.3f", snapshot.density()),
                            "phaseTransition", String.valueOf(snapshot.phaseTransitionOccurred())));
        } catch (RuntimeException e) {
            log.warn("Swarm health check failed: {}", e.getMessage());
            return HealthStatus.down("swarm", "Swarm error: " + e.getMessage());
        }
    }

    private HealthStatus checkReasoning() {
        if (reasoningService.isAvailable()) {
            return HealthStatus.up("reasoning", "Chat model configured", Map.of());
        }
        return HealthStatus.degraded("reasoning",
                "Chat model disabled or API key not set; thoughts degrade to low confidence");
    }

    private HealthStatus checkDiscovery() {
        if (!gitHubClient.isEnabled()) {
            return HealthStatus.degraded("discovery", "GitHub discovery disabled; using fallback content");
        }
        String lastFailure = gitHubClient.lastFailure();
        if (lastFailure != null) {
            return HealthStatus.degraded("discovery", "Last GitHub call failed: " + lastFailure);
        }
        return HealthStatus.up("discovery", "GitHub discovery enabled", Map.of());
    }
}
