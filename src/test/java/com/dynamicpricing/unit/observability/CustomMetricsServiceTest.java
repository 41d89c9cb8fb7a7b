package com.dynamicpricing.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.dynamicpricing.broadcast.BroadcastHub;
import com.dynamicpricing.domain.model.PricingSnapshot;
import com.dynamicpricing.event.PricingTickEvent;
import com.dynamicpricing.observability.CustomMetricsService;
import com.dynamicpricing.scenario.ScenarioOverrideRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CustomMetricsServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private CustomMetricsService customMetricsService;

    @Mock
    private BroadcastHub broadcastHub;

    @Mock
    private ScenarioOverrideRegistry scenarioOverrideRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        customMetricsService = new CustomMetricsService(meterRegistry, broadcastHub, scenarioOverrideRegistry);
    }

    private PricingTickEvent tick(long tick, int fallbacks, Duration duration) {
        PricingSnapshot snapshot = new PricingSnapshot(tick, Instant.parse("2025-03-01T10:00:00Z"), Map.of());
        return new PricingTickEvent(this, snapshot, fallbacks, duration);
    }

    @Test
    @DisplayName("Counts ticks and records their duration")
    void countsTicks() {
        customMetricsService.onPricingTick(tick(1, 0, Duration.ofMillis(40)));
        customMetricsService.onPricingTick(tick(2, 0, Duration.ofMillis(60)));

        assertThat(meterRegistry.get("pricing.ticks.count").counter().count()).isEqualTo(2.0);
        assertThat(customMetricsService.getTickDurationTimer().count()).isEqualTo(2);
        assertThat(customMetricsService.getTickDurationTimer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(100.0);
        assertThat(customMetricsService.getFallbackCounter().count()).isZero();
    }

    @Test
    @DisplayName("Adds the tick's fallback count")
    void countsFallbacks() {
        customMetricsService.onPricingTick(tick(1, 2, Duration.ofMillis(10)));
        customMetricsService.onPricingTick(tick(2, 1, Duration.ofMillis(10)));

        assertThat(meterRegistry.get("pricing.scoring.fallback.count").counter().count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Gauges report connected subscribers and active scenarios")
    void gauges() {
        when(broadcastHub.connectedCount()).thenReturn(4);
        when(scenarioOverrideRegistry.activeCount()).thenReturn(2);

        assertThat(meterRegistry.get("pricing.subscribers").gauge().value()).isEqualTo(4.0);
        assertThat(meterRegistry.get("pricing.scenarios.active").gauge().value()).isEqualTo(2.0);
    }
}
