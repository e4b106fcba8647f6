package com.swarmmind.dispatch.cli;

import com.swarmmind.core.engine.SwarmRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: swarmmind serve
 * <p>
 * Starts the read-only dashboard API and SSE stream, and ticks the swarm in
 * the background. The web server is enabled by
 * {@link com.swarmmind.SwarmmindApplication#main} detecting "serve" in args;
 * {@link CliRunner} then skips picocli. Ticking starts once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 swarmmind serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Swarmmind HTTP server and tick the swarm in the background")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final SwarmRunner swarmRunner;

    public ServeCommand(SwarmRunner swarmRunner) {
        this.swarmRunner = swarmRunner;
    }

    @Override
    public void run() {
        // Not reached in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
        swarmRunner.start();
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Swarmmind server running on port " + port);
        System.out.println();
        System.out.println("  Swarm:   http://localhost:" + port + "/api/v1/swarm");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/swarm/events");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
