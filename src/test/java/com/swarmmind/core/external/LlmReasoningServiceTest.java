package com.swarmmind.core.external;

import com.swarmmind.core.agent.AutonomousAgentState;
import com.swarmmind.core.llm.LlmParseException;
import com.swarmmind.core.llm.LlmProperties;
import com.swarmmind.core.llm.LlmService;
import com.swarmmind.core.metrics.SwarmmindMetrics;
import com.swarmmind.core.model.AgentPersonality;
import com.swarmmind.core.model.CodePatch;
import com.swarmmind.core.model.Specialization;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmReasoningService}.
 */
class LlmReasoningServiceTest {

    private LlmService llmService;
    private LlmProperties properties;
    private SimpleMeterRegistry registry;
    private LlmReasoningService service;
    private ReasoningContext context;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        properties = new LlmProperties();
        properties.setOpenaiApiKey("sk-test");
        registry = new SimpleMeterRegistry();
        service = new LlmReasoningService(llmService, properties, new SwarmmindMetrics(registry));

        var agent = new AutonomousAgentState("a-1", "Neuron-A", 500, 400, 0, 0, "consensus mechanisms", 0.5,
                Specialization.EXPLORER, Specialization.EXPLORER.basePersonality(), 50_000, 20);
        context = ReasoningContext.of(agent, "exploration", "Found a Raft library", "octo/raft");
    }

    private double failures() {
        var counter = registry.find("swarmmind.external.failures").tag("collaborator", "reasoning").counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("reason")
    class ReasonTests {

        @Test
        @DisplayName("maps the structured reply onto an outcome")
        void mapsReply() {
            when(llmService.structuredCall(anyString(), anyString(), eq(LlmReasoningService.ThoughtResponse.class)))
                    .thenReturn(new LlmReasoningService.ThoughtResponse("r", "Raft is simpler than Paxos",
                            List.of("study_repo:octo/raft"), 0.8));

            ReasoningOutcome outcome = service.reason(context);

            assertFalse(outcome.degraded());
            assertEquals("Raft is simpler than Paxos", outcome.conclusion());
            assertEquals(List.of("study_repo:octo/raft"), outcome.suggestedActions());
            assertEquals(0.8, outcome.confidence());
        }

        @Test
        @DisplayName("missing confidence defaults to 0.5")
        void defaultConfidence() {
            when(llmService.structuredCall(anyString(), anyString(), eq(LlmReasoningService.ThoughtResponse.class)))
                    .thenReturn(new LlmReasoningService.ThoughtResponse("r", "c", null, null));

            assertEquals(0.5, service.reason(context).confidence());
        }

        @Test
        @DisplayName("parse failures degrade to a low-confidence outcome and are counted")
        void parseFailure() {
            when(llmService.structuredCall(anyString(), anyString(), any()))
                    .thenThrow(new LlmParseException("bad json"));

            ReasoningOutcome outcome = service.reason(context);

            assertTrue(outcome.degraded());
            assertEquals(0.3, outcome.confidence());
            assertTrue(outcome.suggestedActions().isEmpty());
            assertEquals(1.0, failures());
        }

        @Test
        @DisplayName("without an API key the model is never called")
        void unavailable() {
            properties.setOpenaiApiKey("not-set");

            ReasoningOutcome outcome = service.reason(context);

            assertFalse(service.isAvailable());
            assertTrue(outcome.degraded());
            verifyNoInteractions(llmService);
        }
    }

    @Nested
    @DisplayName("generatePatch")
    class PatchTests {

        @Test
        @DisplayName("drops changes without a file path")
        void dropsPathless() {
            when(llmService.structuredCall(anyString(), anyString(), eq(LlmReasoningService.PatchResponse.class)))
                    .thenReturn(new LlmReasoningService.PatchResponse(Arrays.asList(
                            new LlmReasoningService.PatchItem("src/lib.rs", null, "fn main() {}", "entry point"),
                            new LlmReasoningService.PatchItem(" ", "", "x", "no path"),
                            null)));

            List<CodePatch> patches = service.generatePatch(context);

            assertEquals(1, patches.size());
            assertEquals("src/lib.rs", patches.get(0).path());
            assertEquals("", patches.get(0).original());
        }

        @Test
        @DisplayName("failures yield no patches")
        void failure() {
            when(llmService.structuredCall(anyString(), anyString(), any()))
                    .thenThrow(new RuntimeException("timeout"));

            assertTrue(service.generatePatch(context).isEmpty());
            assertEquals(1.0, failures());
        }
    }

    @Nested
    @DisplayName("review")
    class ReviewTests {

        private final List<CodePatch> patches = List.of(new CodePatch("a.rs", "", "fn a() {}", "add a"));

        @Test
        @DisplayName("nothing to review fails with score 0")
        void emptyPatches() {
            var feedback = service.review(List.of(), "objective");

            assertFalse(feedback.passed());
            assertEquals(0, feedback.score());
            assertEquals(List.of("No changes to review"), feedback.issues());
        }

        @Test
        @DisplayName("maps the review reply")
        void mapsReview() {
            when(llmService.structuredCall(anyString(), anyString(), eq(LlmReasoningService.ReviewResponse.class)))
                    .thenReturn(new LlmReasoningService.ReviewResponse(true, List.of(), List.of("add tests"), 8));

            var feedback = service.review(patches, "objective");

            assertTrue(feedback.passed());
            assertEquals(8, feedback.score());
        }

        @Test
        @DisplayName("failures are reported as unavailable, not passed")
        void failure() {
            when(llmService.structuredCall(anyString(), anyString(), any()))
                    .thenThrow(new RuntimeException("boom"));

            var feedback = service.review(patches, "objective");

            assertFalse(feedback.passed());
            assertEquals(3, feedback.score());
        }
    }

    @Test
    @DisplayName("system prompt carries name, specialization and traits")
    void systemPrompt() {
        String prompt = LlmReasoningService.systemPrompt(context);

        assertTrue(prompt.contains("Neuron-A"));
        assertTrue(prompt.contains("Explorer"));
        assertTrue(prompt.contains("deeply curious"));
        assertEquals("balanced across all traits",
                LlmReasoningService.traits(new AgentPersonality(0.5, 0.5, 0.5, 0.5)));
    }
}
