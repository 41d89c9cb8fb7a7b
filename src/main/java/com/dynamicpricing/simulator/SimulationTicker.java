package com.dynamicpricing.simulator;

import com.dynamicpricing.config.SimulatorConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Drives the {@link TickScheduler} at the configured cadence.
 *
 * <p>On start, the first tick runs synchronously so the state store is populated before
 * the web layer accepts subscribers; later ticks run at a fixed rate on the task scheduler.
 */
@Component
public class SimulationTicker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SimulationTicker.class);

    private final TickScheduler tickScheduler;
    private final TaskScheduler taskScheduler;
    private final Duration tickInterval;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> scheduledTicks;

    public SimulationTicker(
            TickScheduler tickScheduler,
            @Qualifier("taskScheduler") TaskScheduler taskScheduler,
            SimulatorConfig simulatorConfig,
            Clock clock) {
        Duration interval = simulatorConfig.getTickInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalStateException("Tick interval must be positive: " + interval);
        }
        this.tickScheduler = tickScheduler;
        this.taskScheduler = taskScheduler;
        this.tickInterval = interval;
        this.clock = clock;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            tickScheduler.runTickSafely();
            scheduledTicks = taskScheduler.scheduleAtFixedRate(
                    tickScheduler::runTickSafely, clock.instant().plus(tickInterval), tickInterval);
            log.info(
                    "Simulation started for {} cities, ticking every {}ms",
                    tickScheduler.getCities().size(),
                    tickInterval.toMillis());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            ScheduledFuture<?> ticks = scheduledTicks;
            if (ticks != null) {
                ticks.cancel(false);
            }
            log.info("Simulation stopped after tick {}", tickScheduler.getTickCount());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Ahead of the web server lifecycle, so the first snapshot exists before clients connect
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }
}
