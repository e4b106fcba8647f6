package com.swarmmind.dispatch.cli;

import com.swarmmind.core.engine.SwarmSnapshot;
import com.swarmmind.core.engine.SwarmStats;
import com.swarmmind.core.model.CollaborativeProject;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Swarmmind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWARMMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWARMMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void tick(long step, SwarmStats stats, boolean transitioned) {
        String line = String.format("@|fg(blue) [TICK %d]|@ pheromones %d | synced %d | density %.3f | energy %.2f",
                step, stats.totalPheromones(), stats.synchronizedCount(), stats.density(), stats.averageEnergy());
        if (transitioned) {
            line += " @|bold,fg(magenta) PHASE TRANSITION|@";
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
    }

    public static void collaboration(CollaborativeProject project) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [COLLAB]|@ " + project.title() + " (" + project.participants().size() + " agents)"));
    }

    public static void report(SwarmSnapshot snapshot) {
        SwarmStats s = snapshot.stats();
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Swarm Report|@"));
        System.out.println("  Ticks:          " + snapshot.step());
        System.out.println("  Pheromones:     " + s.totalPheromones() + " across " + s.uniqueDomains() + " domain(s)");
        System.out.println("  Discoveries:    " + s.totalDiscoveries());
        System.out.println("  Synchronized:   " + s.synchronizedCount() + "/" + snapshot.agents().size());
        System.out.println(String.format("  Density:        %.3f (critical %.2f)",
                snapshot.density(), snapshot.criticalThreshold()));
        System.out.println("  Collaborations: " + s.collaborationCount());
        if (snapshot.phaseTransitionOccurred()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green),bold Phase transition at tick " + snapshot.transitionStep() + "|@"));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) No phase transition yet|@"));
        }
    }
}
