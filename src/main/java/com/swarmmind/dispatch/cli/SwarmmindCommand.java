package com.swarmmind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Swarmmind.
 * Routes to subcommands: run, health, serve.
 */
@Command(
        name = "swarmmind",
        mixinStandardHelpOptions = true,
        version = "Swarmmind 0.1.0",
        description = "Swarm of autonomous agents coordinating through a shared pheromone channel",
        subcommands = {
                RunCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwarmmindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
