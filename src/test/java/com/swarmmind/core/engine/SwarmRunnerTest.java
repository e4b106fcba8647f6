package com.swarmmind.core.engine;

import com.swarmmind.core.config.SwarmProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SwarmRunnerTest {

    private SwarmEngine engine;
    private SwarmProperties properties;
    private SwarmRunner runner;

    @BeforeEach
    void setUp() {
        engine = mock(SwarmEngine.class);
        properties = new SwarmProperties();
        properties.setTickIntervalMs(60_000);
        runner = new SwarmRunner(engine, properties);
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    @Test
    void tickOnceAdvancesTheEngine() {
        runner.tickOnce();

        verify(engine).tick();
    }

    @Test
    void tickOnceStopsAtMaxTicks() {
        properties.setMaxTicks(3);
        when(engine.step()).thenReturn(3L);

        runner.tickOnce();

        verify(engine, never()).tick();
        assertFalse(runner.isRunning());
    }

    @Test
    void failedTickDoesNotPropagate() {
        when(engine.tick()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(runner::tickOnce);
    }

    @Test
    void startIsIdempotentAndStopHalts() {
        runner.start();
        assertTrue(runner.isRunning());

        runner.start();
        assertTrue(runner.isRunning());

        runner.stop();
        assertFalse(runner.isRunning());
    }
}
