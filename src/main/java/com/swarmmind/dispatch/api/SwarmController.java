package com.swarmmind.dispatch.api;

import com.swarmmind.core.engine.AgentView;
import com.swarmmind.core.engine.PheromoneView;
import com.swarmmind.core.engine.SwarmEngine;
import com.swarmmind.core.engine.SwarmSnapshot;
import com.swarmmind.core.external.DecisionRecord;
import com.swarmmind.core.external.DecisionStore;
import com.swarmmind.core.model.AgentThought;
import com.swarmmind.core.model.CollaborativeProject;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * Read-only dashboard API over the running swarm.
 */
@RestController
@RequestMapping("/api/v1/swarm")
public class SwarmController {

    static final int MAX_LIMIT = 500;

    private final SwarmEngine swarmEngine;
    private final DecisionStore decisionStore;
    private final SseStreamingService sseStreamingService;

    public SwarmController(SwarmEngine swarmEngine, DecisionStore decisionStore,
                           SseStreamingService sseStreamingService) {
        this.swarmEngine = swarmEngine;
        this.decisionStore = decisionStore;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/swarm: step, density, phase transition, agents and aggregates.
     */
    @GetMapping
    public SwarmSnapshot state() {
        return swarmEngine.snapshot();
    }

    @GetMapping("/agents")
    public List<AgentView> agents() {
        return swarmEngine.agents();
    }

    @GetMapping("/agents/{agentId}")
    public ResponseEntity<AgentView> agent(@PathVariable String agentId) {
        return swarmEngine.findAgent(agentId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/swarm/pheromones?limit=N, most recent first.
     */
    @GetMapping("/pheromones")
    public List<PheromoneView> pheromones(@RequestParam(defaultValue = "50") int limit) {
        return swarmEngine.pheromones(clamp(limit));
    }

    @GetMapping("/thoughts")
    public List<AgentThought> thoughts(@RequestParam(defaultValue = "50") int limit) {
        return swarmEngine.thoughts(clamp(limit));
    }

    /**
     * GET /api/v1/swarm/decisions?limit=N, from the decision store, most recent first.
     */
    @GetMapping("/decisions")
    public List<DecisionRecord> decisions(@RequestParam(defaultValue = "50") int limit) {
        return decisionStore.recentDecisions(clamp(limit));
    }

    @GetMapping("/collaborations")
    public List<CollaborativeProject> collaborations() {
        return swarmEngine.collaborations();
    }

    /**
     * GET /api/v1/swarm/events[?agentId=...]: SSE stream of swarm events,
     * optionally narrowed to one agent.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestParam(required = false) String agentId) {
        return sseStreamingService.createEmitter(agentId);
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
