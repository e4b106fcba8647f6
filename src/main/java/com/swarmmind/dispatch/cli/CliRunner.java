package com.swarmmind.dispatch.cli;

import com.swarmmind.SwarmmindApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands the process arguments to picocli once the Spring context is up.
 * <p>
 * In {@code serve} mode the embedded server owns the process and
 * {@link ServeCommand} starts ticking once it is listening, so no command
 * runs here and the exit code stays 0. Every other invocation is
 * a one-shot swarm command whose exit code becomes the process exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final SwarmmindCommand swarmmindCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SwarmmindCommand swarmmindCommand, IFactory factory) {
        this.swarmmindCommand = swarmmindCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (SwarmmindApplication.isServeMode(args)) {
            log.debug("Serve mode, ticking starts when the web server is ready");
            return;
        }
        exitCode = new CommandLine(swarmmindCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
