package com.swarmmind.core.engine;

import com.swarmmind.core.config.SwarmProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Ticks the swarm in the background at a fixed delay, for serve mode.
 * Stops by itself after {@code max-ticks} ticks when that is positive.
 */
@Service
public class SwarmRunner {

    private static final Logger log = LoggerFactory.getLogger(SwarmRunner.class);

    private final SwarmEngine engine;
    private final SwarmProperties properties;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "swarm-ticker");
        t.setDaemon(true);
        return t;
    });

    private ScheduledFuture<?> ticking;

    public SwarmRunner(SwarmEngine engine, SwarmProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        long interval = Math.max(1, properties.getTickIntervalMs());
        ticking = scheduler.scheduleWithFixedDelay(this::tickOnce, 0, interval, TimeUnit.MILLISECONDS);
        log.info("Swarm ticking every {}ms (max ticks: {})", interval,
                properties.getMaxTicks() > 0 ? properties.getMaxTicks() : "unbounded");
    }

    public synchronized void stop() {
        if (ticking != null) {
            ticking.cancel(false);
            ticking = null;
            log.info("Swarm ticking stopped at tick {}", engine.step());
        }
    }

    public synchronized boolean isRunning() {
        return ticking != null && !ticking.isDone();
    }

    void tickOnce() {
        long maxTicks = properties.getMaxTicks();
        if (maxTicks > 0 && engine.step() >= maxTicks) {
            stop();
            return;
        }
        try {
            engine.tick();
        } catch (RuntimeException e) {
            // an exception would cancel the schedule
            log.error("Tick failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    void shutdown() {
        stop();
        scheduler.shutdownNow();
    }
}
