package com.swarmmind.core.engine;

import com.swarmmind.core.agent.AgentFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Canned knowledge used for pheromone content when repository discovery
 * returns nothing. Two pools per domain: independent discoveries, and
 * insights that build on a pheromone absorbed from another agent.
 */
@Component
public class FallbackInsights {

    private static final String DEFAULT_DOMAIN = AgentFactory.DOMAINS.get(0);

    private static final Map<String, List<String>> DISCOVERIES = Map.of(
            "data structures and algorithms", List.of(
                    "Cache-oblivious B-trees reach optimal I/O behaviour without knowing block sizes.",
                    "Finger trees annotated with a monoid support logarithmic split and concatenation.",
                    "Cuckoo hashing with a small stash keeps worst-case lookups constant at high load."),
            "distributed systems architecture", List.of(
                    "Leader leases let a Raft leader serve linearizable reads without a log round.",
                    "Delta-state CRDTs ship only recent mutations instead of the whole state."),
            "cryptographic primitives", List.of(
                    "Arithmetic-friendly hashes cut constraint counts inside zero-knowledge circuits.",
                    "Vector commitments shrink proofs compared to wide Merkle trees."),
            "network protocols and security", List.of(
                    "Receive-side scaling spreads packet processing across cores without locks.",
                    "Model-based congestion control holds throughput under random packet loss."),
            "database optimization patterns", List.of(
                    "Adaptive radix trees switch node sizes to keep sparse key spaces compact.",
                    "Morsel-driven scheduling adapts query parallelism to NUMA layout."),
            "compiler design techniques", List.of(
                    "A sea-of-nodes IR merges control and data flow into one graph.",
                    "Straight-line SIMD packing finds vector work that loop vectorizers miss."),
            "operating system internals", List.of(
                    "Batched submission rings amortize one syscall across hundreds of I/O requests.",
                    "Verified in-kernel bytecode runs tracing probes close to native speed."),
            "machine learning optimization", List.of(
                    "Speculative decoding with a small draft model speeds up generation losslessly.",
                    "Sharding attention by sequence chunks keeps memory linear in context length."),
            "consensus mechanisms", List.of(
                    "Separating data dissemination from ordering lets a DAG mempool scale throughput.",
                    "Pipelined BFT rounds overlap phases so each block needs one round in steady state."),
            "memory management strategies", List.of(
                    "Per-thread caches in the allocator avoid locks for most small allocations.",
                    "Hazard pointers reclaim memory in lock-free structures with bounded overhead."));

    private static final Map<String, List<String>> INSIGHTS = Map.of(
            "data structures and algorithms", List.of(
                    "Pairing a skip list with a bloom filter gives fast negative lookups for distributed caches.",
                    "Path-copying persistent structures combine well with CAS for wait-free snapshots."),
            "distributed systems architecture", List.of(
                    "Monotonic state here fits a lattice, so merges need no coordination.",
                    "Gossip dissemination reaches the whole cluster in a logarithmic number of rounds."),
            "cryptographic primitives", List.of(
                    "This construction behaves like a sponge; a duplex mode would add authentication.",
                    "Append-only commitments with mountain ranges keep proofs logarithmic."),
            "network protocols and security", List.of(
                    "Zero round-trip resumption removes a handshake from mesh channel setup.",
                    "Kernel-bypass packet paths move this optimization out of the hot syscall path."),
            "database optimization patterns", List.of(
                    "Fractional cascading between LSM levels reduces read amplification.",
                    "Zone maps let predicate pushdown skip most irrelevant pages."),
            "compiler design techniques", List.of(
                    "This pass is a form of partial evaluation and belongs at the SSA level.",
                    "Profile data makes speculative devirtualization far more accurate."),
            "operating system internals", List.of(
                    "Adaptive polling cuts syscall overhead for mixed I/O workloads.",
                    "Huge pages remove TLB pressure for very large working sets."),
            "machine learning optimization", List.of(
                    "Sign-based momentum updates halve optimizer memory.",
                    "Sparse expert routing keeps quality while spending a fraction of compute per token."),
            "consensus mechanisms", List.of(
                    "A verifiable random leader plus threshold signatures gives constant expected rounds.",
                    "Pipelining votes across heights brings common-case latency down to one round trip."),
            "memory management strategies", List.of(
                    "Size classes tuned to observed allocations nearly eliminate internal fragmentation.",
                    "Scoped arenas with deferred cleanup make region-based management cheap."));

    private final RandomGenerator random;

    public FallbackInsights(RandomGenerator random) {
        this.random = random;
    }

    public String discovery(String domain) {
        return pick(DISCOVERIES.getOrDefault(domain, DISCOVERIES.get(DEFAULT_DOMAIN)));
    }

    public String insight(String domain) {
        return pick(INSIGHTS.getOrDefault(domain, INSIGHTS.get(DEFAULT_DOMAIN)));
    }

    private String pick(List<String> pool) {
        return pool.get(random.nextInt(pool.size()));
    }
}
