package com.swarmmind.dispatch.cli;

import com.swarmmind.core.config.SwarmProperties;
import com.swarmmind.core.engine.SwarmEngine;
import com.swarmmind.core.engine.SwarmSnapshot;
import com.swarmmind.core.engine.SwarmStats;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: swarmmind run [--ticks N] [--agents N] [--temperature T] [--seed S]
 * <p>
 * Builds a fresh swarm, runs it for a fixed number of ticks printing one
 * summary line per tick, then prints the final report.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the swarm for a number of ticks")
@Component
public class RunCommand implements Runnable {

    @Option(names = {"--ticks", "-t"}, description = "Number of ticks to run", defaultValue = "30")
    private int ticks;

    @Option(names = {"--agents", "-a"}, description = "Number of agents (default: swarmmind.swarm.agent-count)")
    private Integer agents;

    @Option(names = "--temperature",
            description = "Decision selection temperature, 0 = greedy (default: swarmmind.swarm.selection-temperature)")
    private Double temperature;

    @Option(names = "--seed", description = "Seed for a reproducible run")
    private Long seed;

    private final SwarmEngine swarmEngine;
    private final SwarmProperties properties;

    public RunCommand(SwarmEngine swarmEngine, SwarmProperties properties) {
        this.swarmEngine = swarmEngine;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (ticks < 1) {
            ConsoleOutput.error("--ticks must be at least 1, got " + ticks);
            return;
        }
        int agentCount = agents != null ? agents : properties.getAgentCount();
        if (agentCount < 1) {
            ConsoleOutput.error("--agents must be at least 1, got " + agentCount);
            return;
        }
        if (temperature != null) {
            if (temperature.isNaN() || temperature < 0) {
                ConsoleOutput.error("--temperature must be >= 0, got " + temperature);
                return;
            }
            properties.setSelectionTemperature(temperature);
        }

        swarmEngine.reset(agentCount, seed);
        ConsoleOutput.info(String.format("Running %d agent(s) for %d tick(s), temperature %.2f%s",
                agentCount, ticks, properties.getSelectionTemperature(),
                seed != null ? ", seed " + seed : ""));

        int collaborationsSeen = 0;
        for (int i = 0; i < ticks; i++) {
            SwarmStats stats;
            try {
                stats = swarmEngine.tick();
            } catch (RuntimeException e) {
                ConsoleOutput.error("Tick " + (swarmEngine.step()) + " failed: " + e.getMessage());
                return;
            }
            SwarmSnapshot snapshot = swarmEngine.snapshot();
            Long transitionStep = snapshot.transitionStep();
            ConsoleOutput.tick(snapshot.step(), stats,
                    transitionStep != null && transitionStep == snapshot.step());

            var projects = swarmEngine.collaborations();
            for (int p = collaborationsSeen; p < projects.size(); p++) {
                ConsoleOutput.collaboration(projects.get(p));
            }
            collaborationsSeen = projects.size();
        }

        ConsoleOutput.report(swarmEngine.snapshot());
    }
}
