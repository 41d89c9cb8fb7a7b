package com.dynamicpricing.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.dynamicpricing.config.SimulatorConfig;
import com.dynamicpricing.simulator.SimulationTicker;
import com.dynamicpricing.simulator.TickScheduler;
import com.dynamicpricing.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class SimulationTickerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private TickScheduler tickScheduler;

    @Mock
    private TaskScheduler taskScheduler;

    private SimulatorConfig simulatorConfig;
    private SimulationTicker simulationTicker;

    @BeforeEach
    void setUp() {
        simulatorConfig = new SimulatorConfig();
        simulationTicker = new SimulationTicker(tickScheduler, taskScheduler, simulatorConfig, new MutableClock(T0));
    }

    @Test
    @DisplayName("Start runs one tick immediately, then schedules at the fixed interval")
    void startRunsFirstTickImmediately() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future)
                .when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        simulationTicker.start();

        verify(tickScheduler).runTickSafely();
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler)
                .scheduleAtFixedRate(task.capture(), eq(T0.plusSeconds(5)), eq(Duration.ofSeconds(5)));
        assertThat(simulationTicker.isRunning()).isTrue();

        task.getValue().run();
        verify(tickScheduler, times(2)).runTickSafely();
    }

    @Test
    @DisplayName("Stop cancels the schedule; start and stop are idempotent")
    void stopCancelsSchedule() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future)
                .when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        simulationTicker.start();
        simulationTicker.start();
        simulationTicker.stop();
        simulationTicker.stop();

        verify(tickScheduler, times(1)).runTickSafely();
        verify(future, times(1)).cancel(false);
        assertThat(simulationTicker.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Non-positive interval is a startup error")
    void rejectsZeroInterval() {
        simulatorConfig.setTickInterval(Duration.ZERO);

        MutableClock clock = new MutableClock(T0);
        assertThatThrownBy(() -> new SimulationTicker(tickScheduler, taskScheduler, simulatorConfig, clock))
                .isInstanceOf(IllegalStateException.class);
    }
}
