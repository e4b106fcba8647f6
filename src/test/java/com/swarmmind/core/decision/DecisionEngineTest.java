package com.swarmmind.core.decision;

import com.swarmmind.core.agent.AutonomousAgentState;
import com.swarmmind.core.channel.Attestation;
import com.swarmmind.core.channel.Pheromone;
import com.swarmmind.core.channel.PheromoneChannel;
import com.swarmmind.core.model.ActionType;
import com.swarmmind.core.model.AgentAction;
import com.swarmmind.core.model.AgentDecision;
import com.swarmmind.core.model.AgentPersonality;
import com.swarmmind.core.model.AgentThought;
import com.swarmmind.core.model.DecisionResult;
import com.swarmmind.core.model.DiscoveredIssue;
import com.swarmmind.core.model.DiscoveredRepo;
import com.swarmmind.core.model.IssueDifficulty;
import com.swarmmind.core.model.Specialization;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DecisionEngine}.
 */
class DecisionEngineTest {

    private static final RandomGenerator LOW_ROLL = () -> 0L;
    private static final RandomGenerator HIGH_ROLL = () -> -1L;

    /** A generator whose nextDouble() always returns (approximately) {@code value}. */
    private static RandomGenerator roll(double value) {
        long bits = ((long) (value * (1L << 53))) << 11;
        return () -> bits;
    }

    private static final DiscoveredRepo WIDGET = new DiscoveredRepo("octo", "widget", "widgets", "Rust", 120, List.of());
    private static final DiscoveredRepo GADGET = new DiscoveredRepo("octo", "gadget", "gadgets", "Go", 80, List.of());

    private static DecisionEngine engine(RandomGenerator random) {
        return new DecisionEngine(new SuggestedActionParser(), random);
    }

    private static AutonomousAgentState agent(int budget, AgentPersonality personality) {
        return new AutonomousAgentState("a-1", "Neuron-A", 500, 400, 0, 0, "consensus mechanisms", 0.5,
                Specialization.EXPLORER, personality, budget, 50);
    }

    private static AutonomousAgentState agent(int budget) {
        return agent(budget, new AgentPersonality(0.9, 0.4, 0.3, 0.6));
    }

    private static PheromoneChannel channel() {
        return new PheromoneChannel((count, mean) -> 0.0, 0.6);
    }

    private static AgentThought thought(String... suggestions) {
        return new AgentThought("t-1", "a-1", "exploration", "obs", "reasoning", "conclusion",
                List.of(suggestions), 0.7, Instant.now());
    }

    @Nested
    @DisplayName("generateCandidateDecisions")
    class CandidateTests {

        @Test
        @DisplayName("with 500 tokens left only the exploration fallback survives")
        void nearlyExhaustedBudget() {
            var agent = agent(50_000);
            agent.spendTokens(49_500);

            var candidates = engine(LOW_ROLL).generateCandidateDecisions(agent, channel(), List.of(WIDGET),
                    List.of(), List.of(thought("study_repo octo/widget")));

            assertEquals(1, candidates.size());
            assertEquals(ActionType.EXPLORE_TOPIC, candidates.get(0).action().type());
            assertTrue(candidates.get(0).cost().estimatedTokens() <= agent.remainingBudget());
        }

        @Test
        @DisplayName("no candidates once the budget is spent")
        void exhaustedBudget() {
            var agent = agent(1_000);
            agent.spendTokens(1_000);

            assertTrue(engine(LOW_ROLL).generateCandidateDecisions(agent, channel(), List.of(WIDGET),
                    List.of(), List.of()).isEmpty());
        }

        @Test
        @DisplayName("never offers fix_issue or contribute_pr")
        void noOutwardFacingActions() {
            var issue = new DiscoveredIssue("octo", "gadget", 12, "crash", "", List.of(), IssueDifficulty.EASY);
            var candidates = engine(LOW_ROLL).generateCandidateDecisions(agent(50_000), channel(),
                    List.of(WIDGET, GADGET), List.of(issue),
                    List.of(thought("fix_issue #12", "contribute_pr octo/widget", "open a pull request")));

            assertFalse(candidates.isEmpty());
            for (AgentDecision candidate : candidates) {
                assertTrue(candidate.action().type().isAutonomous(), candidate.toString());
            }
        }

        @Test
        @DisplayName("offers unstudied repositories, skipping studied ones")
        void unstudiedRepos() {
            var agent = agent(50_000);
            agent.markRepoStudied("octo/widget");

            var candidates = engine(LOW_ROLL).generateCandidateDecisions(agent, channel(),
                    List.of(WIDGET, GADGET), List.of(), List.of());

            var studied = candidates.stream()
                    .filter(c -> c.action() instanceof AgentAction.StudyRepo)
                    .map(c -> c.action().repository().orElseThrow())
                    .toList();
            assertEquals(List.of("octo/gadget"), studied);
        }

        @Test
        @DisplayName("sociable agents offer to share once the channel is busy")
        void shareWhenSociable() {
            var channel = channel();
            for (int i = 0; i < 6; i++) {
                channel.emit(new Pheromone("p" + i, "other", "c", "rust", 0.5, 0.5, Set.of(), Instant.now(),
                        Attestation.sha256("p" + i)));
            }

            var sociable = engine(LOW_ROLL).generateCandidateDecisions(
                    agent(50_000, new AgentPersonality(0.5, 0.5, 0.5, 0.9)), channel, List.of(), List.of(), List.of());
            var shy = engine(LOW_ROLL).generateCandidateDecisions(
                    agent(50_000, new AgentPersonality(0.5, 0.5, 0.5, 0.3)), channel, List.of(), List.of(), List.of());

            assertTrue(sociable.stream().anyMatch(c -> c.action().type() == ActionType.SHARE_TECHNIQUE));
            assertTrue(shy.stream().noneMatch(c -> c.action().type() == ActionType.SHARE_TECHNIQUE));
        }

        @Test
        @DisplayName("candidates are sorted by descending priority")
        void sortedByPriority() {
            var candidates = engine(LOW_ROLL).generateCandidateDecisions(agent(50_000), channel(),
                    List.of(WIDGET, GADGET), List.of(), List.of(thought("explore_topic: CRDTs")));

            for (int i = 1; i < candidates.size(); i++) {
                assertTrue(candidates.get(i - 1).priority() >= candidates.get(i).priority());
            }
        }

        @Test
        @DisplayName("only the last five thoughts are parsed")
        void thoughtWindow() {
            List<AgentThought> thoughts = new java.util.ArrayList<>();
            thoughts.add(thought("refactor octo/widget"));
            for (int i = 0; i < 5; i++) {
                thoughts.add(thought("nothing actionable"));
            }

            var candidates = engine(LOW_ROLL).generateCandidateDecisions(agent(50_000), channel(),
                    List.of(), List.of(), thoughts);

            assertTrue(candidates.stream().noneMatch(c -> c.action().type() == ActionType.REFACTOR));
        }
    }

    @Nested
    @DisplayName("scoreDecision")
    class ScoreTests {

        @Test
        @DisplayName("is deterministic for identical inputs")
        void deterministic() {
            var engine = engine(LOW_ROLL);
            var agent = agent(50_000);
            var decision = new AgentDecision("a-1", new AgentAction.StudyRepo("octo", "widget"),
                    engine.estimateCost(new AgentAction.StudyRepo("octo", "widget")));
            var channel = channel();

            assertEquals(engine.scoreDecision(decision, agent, channel),
                    engine.scoreDecision(decision, agent, channel));
        }

        @Test
        @DisplayName("matches the weighted formula for a fresh agent")
        void formula() {
            var engine = engine(LOW_ROLL);
            var agent = agent(50_000);
            var action = new AgentAction.StudyRepo("octo", "widget");
            var decision = new AgentDecision("a-1", action, engine.estimateCost(action));

            double expected = 0.85 * 0.20
                    + (1.0 - 3_000.0 / 50_000) * 0.25
                    + 0.15
                    - 0.0
                    + 0.0
                    + 0.9 * 0.10;
            assertEquals(expected, engine.scoreDecision(decision, agent, channel()), 1e-9);
        }

        @Test
        @DisplayName("repeating a recent action kind loses the novelty bonus")
        void novelty() {
            var engine = engine(LOW_ROLL);
            var agent = agent(50_000);
            var action = new AgentAction.StudyRepo("octo", "widget");
            double fresh = engine.scoreDecision(new AgentDecision("a-1", action, engine.estimateCost(action)),
                    agent, channel());

            var done = new AgentDecision("a-1", action, engine.estimateCost(action));
            agent.startDecision(done);
            done.complete(new DecisionResult(true, "ok", List.of(), 0));
            agent.finishCurrentDecision();

            double repeated = engine.scoreDecision(new AgentDecision("a-1", action, engine.estimateCost(action)),
                    agent, channel());
            assertEquals(fresh - 0.15, repeated, 1e-9);
        }

        @Test
        @DisplayName("after the phase transition non-exploration actions get the collective bonus")
        void collectiveBonus() {
            var engine = engine(LOW_ROLL);
            var agent = agent(50_000);
            var transitioned = new PheromoneChannel((count, mean) -> 0.9, 0.6);
            transitioned.recomputeDensity();
            transitioned.checkPhaseTransition(1);

            var study = new AgentDecision("a-1", new AgentAction.StudyRepo("octo", "widget"),
                    engine.estimateCost(new AgentAction.StudyRepo("octo", "widget")));
            var explore = new AgentDecision("a-1", new AgentAction.ExploreTopic("rust"),
                    engine.estimateCost(new AgentAction.ExploreTopic("rust")));

            assertEquals(engine.scoreDecision(study, agent, channel()) + 0.10,
                    engine.scoreDecision(study, agent, transitioned), 1e-9);
            assertEquals(engine.scoreDecision(explore, agent, channel()),
                    engine.scoreDecision(explore, agent, transitioned), 1e-9);
        }

        @Test
        @DisplayName("risky actions are penalised more as the budget drains")
        void riskPenalty() {
            var engine = engine(LOW_ROLL);
            var rich = agent(100_000);
            var poor = agent(100_000);
            poor.spendTokens(80_000);
            var action = new AgentAction.Refactor("octo", "widget", "cleanup");
            var decision = new AgentDecision("a-1", action, engine.estimateCost(action));

            double richScore = engine.scoreDecision(decision, rich, channel());
            double poorScore = engine.scoreDecision(decision, poor, channel());
            assertTrue(poorScore < richScore);
        }
    }

    @Nested
    @DisplayName("selectDecision")
    class SelectTests {

        private AgentDecision withPriority(double priority) {
            var d = new AgentDecision("a-1", new AgentAction.ExploreTopic("t" + priority),
                    engine(LOW_ROLL).estimateCost(new AgentAction.ExploreTopic("t")));
            d.setPriority(priority);
            return d;
        }

        @Test
        @DisplayName("temperature 0 is greedy")
        void greedy() {
            var low = withPriority(0.2);
            var high = withPriority(0.8);
            var mid = withPriority(0.5);

            assertSame(high, engine(HIGH_ROLL).selectDecision(List.of(low, high, mid), 0).orElseThrow());
        }

        @Test
        @DisplayName("greedy ties go to the first candidate")
        void greedyTie() {
            var first = withPriority(0.5);
            var second = withPriority(0.5);

            assertSame(first, engine(HIGH_ROLL).selectDecision(List.of(first, second), 0).orElseThrow());
        }

        @Test
        @DisplayName("sampling follows the cumulative softmax weights")
        void sampling() {
            var a = withPriority(0.5);
            var b = withPriority(0.4);
            var candidates = List.of(a, b);

            assertSame(a, engine(LOW_ROLL).selectDecision(candidates, 0.3).orElseThrow());
            assertSame(b, engine(roll(0.9)).selectDecision(candidates, 0.3).orElseThrow());
        }

        @Test
        @DisplayName("empty candidates select nothing")
        void empty() {
            assertTrue(engine(LOW_ROLL).selectDecision(List.of(), 0.3).isEmpty());
        }

        @Test
        @DisplayName("negative temperature is rejected")
        void negativeTemperature() {
            assertThrows(IllegalArgumentException.class,
                    () -> engine(LOW_ROLL).selectDecision(List.of(withPriority(0.1)), -0.1));
        }
    }

    @Nested
    @DisplayName("shouldSwitch")
    class ShouldSwitchTests {

        private AutonomousAgentState executing(int budget) {
            var agent = agent(budget);
            agent.startDecision(new AgentDecision("a-1", new AgentAction.ExploreTopic("rust"),
                    engine(LOW_ROLL).estimateCost(new AgentAction.ExploreTopic("rust"))));
            return agent;
        }

        @Test
        @DisplayName("switches when nothing is in flight")
        void nothingInFlight() {
            assertTrue(engine(HIGH_ROLL).shouldSwitch(agent(50_000), null));
        }

        @Test
        @DisplayName("switches when the budget is exhausted")
        void budgetExhausted() {
            var agent = executing(1_000);
            agent.spendTokens(1_000);
            assertTrue(engine(HIGH_ROLL).shouldSwitch(agent, null));
        }

        @Test
        @DisplayName("keeps going while the current decision is still running")
        void stillRunning() {
            assertFalse(engine(LOW_ROLL).shouldSwitch(executing(50_000), null));
        }

        @Test
        @DisplayName("a failure switches more readily than a success")
        void failureVersusSuccess() {
            // 0.5 sits between the success (0.3) and failure (0.7) thresholds
            var engine = engine(roll(0.5));
            var agent = executing(50_000);

            assertTrue(engine.shouldSwitch(agent, DecisionResult.failure("nope", 0)));
            assertFalse(engine.shouldSwitch(agent, new DecisionResult(true, "ok", List.of(), 0)));
        }
    }
}
