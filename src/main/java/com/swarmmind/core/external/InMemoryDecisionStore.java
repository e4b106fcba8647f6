package com.swarmmind.core.external;

import com.swarmmind.core.config.SwarmProperties;
import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.AgentThought;
import com.swarmmind.core.model.DecisionResult;
import com.swarmmind.core.model.DecisionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded in-process store. Keeps the newest {@code history-limit} thoughts
 * and decisions; older entries are evicted first.
 */
@Service
public class InMemoryDecisionStore implements DecisionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDecisionStore.class);

    private final int capacity;
    private final Deque<AgentThought> thoughts = new ArrayDeque<>();
    private final LinkedHashMap<String, DecisionRecord> decisions = new LinkedHashMap<>();

    public InMemoryDecisionStore(SwarmProperties properties) {
        this(properties.getHistoryLimit());
    }

    InMemoryDecisionStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void saveThought(AgentThought thought) {
        thoughts.addLast(thought);
        while (thoughts.size() > capacity) {
            thoughts.removeFirst();
        }
    }

    @Override
    public synchronized void saveDecision(AgentDecision decision) {
        decisions.put(decision.id(), DecisionRecord.from(decision));
        Iterator<Map.Entry<String, DecisionRecord>> it = decisions.entrySet().iterator();
        while (decisions.size() > capacity && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    @Override
    public synchronized void updateStatus(String decisionId, DecisionStatus status, DecisionResult result) {
        DecisionRecord existing = decisions.get(decisionId);
        if (existing == null) {
            log.debug("Ignoring status update for unknown or evicted decision {}", decisionId);
            return;
        }
        decisions.put(decisionId, existing.withStatus(status, result));
    }

    @Override
    public synchronized List<AgentThought> recentThoughts(int limit) {
        List<AgentThought> result = new ArrayList<>();
        Iterator<AgentThought> it = thoughts.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    @Override
    public synchronized List<DecisionRecord> recentDecisions(int limit) {
        List<DecisionRecord> all = new ArrayList<>(decisions.values());
        List<DecisionRecord> result = new ArrayList<>();
        for (int i = all.size() - 1; i >= 0 && result.size() < limit; i--) {
            result.add(all.get(i));
        }
        return result;
    }
}
