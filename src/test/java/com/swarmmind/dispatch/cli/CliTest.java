package com.swarmmind.dispatch.cli;

import com.swarmmind.core.config.SwarmProperties;
import com.swarmmind.core.engine.SwarmEngine;
import com.swarmmind.core.engine.SwarmRunner;
import com.swarmmind.core.engine.SwarmSnapshot;
import com.swarmmind.core.engine.SwarmStats;
import com.swarmmind.core.health.HealthCheckService;
import com.swarmmind.core.health.HealthStatus;
import com.swarmmind.core.model.CollaborativeProject;
import com.swarmmind.core.model.ProjectStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the Swarmmind CLI command structure.
 * These exercise picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private SwarmEngine engine;
    private SwarmProperties properties;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        engine = mock(SwarmEngine.class);
        properties = new SwarmProperties();
        healthCheckService = mock(HealthCheckService.class);
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("swarm", HealthStatus.Status.UP, "3 agent(s) at tick 0", Map.of()),
                new HealthStatus("reasoning", HealthStatus.Status.DEGRADED, "Chat model disabled", Map.of()),
                new HealthStatus("discovery", HealthStatus.Status.UP, "GitHub discovery enabled", Map.of())));
    }

    private static SwarmStats stats(int pheromones, double density) {
        return new SwarmStats(pheromones, pheromones, 1, 0.75, density, 0, 2);
    }

    private static SwarmSnapshot snapshot(long step, double density, Long transitionStep) {
        return new SwarmSnapshot(step, density, 0.6, transitionStep != null, transitionStep, List.of(),
                stats((int) step * 2, density));
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(engine, properties);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand(mock(SwarmRunner.class));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new SwarmmindCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("run"), "Help should list 'run' subcommand");
            assertTrue(output.contains("health"), "Help should list 'health' subcommand");
            assertTrue(output.contains("serve"), "Help should list 'serve' subcommand");
            assertTrue(output.contains("help"), "Help should list 'help' subcommand");
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Swarmmind 0.1.0"));
        }

        @Test
        @DisplayName("run --help lists its options")
        void runHelp() {
            CliResult result = execute("run", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--ticks"));
            assertTrue(result.output().contains("--seed"));
            assertTrue(result.output().contains("--temperature"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SWARMMIND"));
            assertTrue(result.output().contains("Usage"));
        }
    }

    // =====================================================================
    //  Run command tests
    // =====================================================================

    @Nested
    @DisplayName("Run command")
    class RunTests {

        @Test
        @DisplayName("runs the requested ticks on a fresh swarm and prints a report")
        void runsTicks() {
            when(engine.tick()).thenReturn(stats(2, 0.2), stats(4, 0.4), stats(7, 0.65));
            when(engine.snapshot()).thenReturn(snapshot(1, 0.2, null), snapshot(2, 0.4, null),
                    snapshot(3, 0.65, 3L), snapshot(3, 0.65, 3L));
            when(engine.collaborations()).thenReturn(List.of());

            CliResult result = execute("run", "--ticks", "3", "--agents", "4", "--seed", "7");

            assertEquals(0, result.exitCode());
            verify(engine).reset(4, 7L);
            verify(engine, times(3)).tick();
            String output = result.output();
            assertTrue(output.contains("[TICK 1]"));
            assertTrue(output.contains("[TICK 3]"));
            assertTrue(output.contains("PHASE TRANSITION"));
            assertTrue(output.contains("Swarm Report"));
            assertTrue(output.contains("Phase transition at tick 3"));
        }

        @Test
        @DisplayName("uses the configured agent count when --agents is omitted")
        void defaultAgentCount() {
            properties.setAgentCount(5);
            when(engine.tick()).thenReturn(stats(1, 0.1));
            when(engine.snapshot()).thenReturn(snapshot(1, 0.1, null));
            when(engine.collaborations()).thenReturn(List.of());

            execute("run", "-t", "1");

            verify(engine).reset(5, null);
        }

        @Test
        @DisplayName("--temperature overrides the selection temperature")
        void temperatureOverride() {
            when(engine.tick()).thenReturn(stats(1, 0.1));
            when(engine.snapshot()).thenReturn(snapshot(1, 0.1, null));
            when(engine.collaborations()).thenReturn(List.of());

            execute("run", "-t", "1", "--temperature", "0");

            assertEquals(0.0, properties.getSelectionTemperature());
        }

        @Test
        @DisplayName("new collaborations are printed once")
        void printsCollaborationsOnce() {
            var project = new CollaborativeProject("c-1", "Collaborative analysis of octo/widget", "shared repo",
                    List.of("a-1", "a-2"), List.of("octo/widget"), ProjectStatus.PROPOSED, Instant.now());
            when(engine.tick()).thenReturn(stats(3, 0.3));
            when(engine.snapshot()).thenReturn(snapshot(1, 0.3, null));
            when(engine.collaborations()).thenReturn(List.of(project));

            CliResult result = execute("run", "-t", "2");

            String output = result.output();
            assertEquals(output.indexOf("octo/widget"), output.lastIndexOf("octo/widget"));
        }

        @Test
        @DisplayName("invalid values are rejected before the swarm is touched")
        void rejectsInvalidValues() {
            CliResult ticks = execute("run", "--ticks", "0");
            CliResult agents = execute("run", "--agents", "0");
            CliResult temperature = execute("run", "--temperature=-1");

            assertTrue(ticks.output().contains("--ticks must be at least 1"));
            assertTrue(agents.output().contains("--agents must be at least 1"));
            assertTrue(temperature.output().contains("--temperature must be >= 0"));
            verify(engine, never()).reset(anyInt(), any());
            verify(engine, never()).tick();
        }

        @Test
        @DisplayName("a failing tick stops the run with an error")
        void tickFailure() {
            when(engine.tick()).thenThrow(new IllegalStateException("channel closed"));
            when(engine.step()).thenReturn(1L);

            CliResult result = execute("run", "-t", "5");

            assertTrue(result.output().contains("channel closed"));
            verify(engine, times(1)).tick();
        }
    }

    // =====================================================================
    //  Health command tests
    // =====================================================================

    @Nested
    @DisplayName("Health command")
    class HealthTests {

        @Test
        @DisplayName("prints every component and a degraded overall line")
        void printsComponents() {
            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("swarm: 3 agent(s) at tick 0"));
            assertTrue(output.contains("reasoning: Chat model disabled"));
            assertTrue(output.contains("discovery"));
            assertTrue(output.contains("running degraded"));
        }

        @Test
        @DisplayName("reports all systems operational when everything is UP")
        void allUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("swarm", HealthStatus.Status.UP, "ok", Map.of())));

            assertTrue(execute("health").output().contains("all systems operational"));
        }

        @Test
        @DisplayName("reports a down component")
        void down() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("swarm", HealthStatus.Status.DOWN, "Swarm error: boom", Map.of())));

            assertTrue(execute("health").output().contains("one or more components down"));
        }
    }
}
