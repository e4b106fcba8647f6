package com.swarmmind.dispatch.cli;

import com.swarmmind.SwarmmindApplication;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CliRunnerTest {

    @Test
    void serveModeRunsNoCommand() {
        CommandLine.IFactory factory = mock(CommandLine.IFactory.class);
        CliRunner runner = new CliRunner(new SwarmmindCommand(), factory);

        runner.run("serve", "--help");

        verifyNoInteractions(factory);
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void serveModeDetection() {
        assertTrue(SwarmmindApplication.isServeMode("serve"));
        assertTrue(SwarmmindApplication.isServeMode("--debug", "serve"));
        assertFalse(SwarmmindApplication.isServeMode("run", "--ticks", "5"));
        assertFalse(SwarmmindApplication.isServeMode());
    }
}
