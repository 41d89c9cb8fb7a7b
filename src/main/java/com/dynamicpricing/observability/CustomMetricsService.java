package com.dynamicpricing.observability;

import com.dynamicpricing.broadcast.BroadcastHub;
import com.dynamicpricing.event.PricingTickEvent;
import com.dynamicpricing.scenario.ScenarioOverrideRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the pricing engine's Micrometer metrics:
 * <ul>
 *   <li><b>pricing.ticks.count</b> (counter): published ticks</li>
 *   <li><b>pricing.scoring.fallback.count</b> (counter): city states priced by the fallback formula</li>
 *   <li><b>pricing.tick.duration</b> (timer): wall-clock time of one tick, scoring included</li>
 *   <li><b>pricing.subscribers</b> (gauge): connected broadcast subscribers</li>
 *   <li><b>pricing.scenarios.active</b> (gauge): unexpired scenario overrides</li>
 * </ul>
 *
 * <p>Gauges are polled by Micrometer on scrape. Counters and the timer are fed from
 * {@link PricingTickEvent}.
 */
@Service
public class CustomMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricsService.class);

    private final Counter ticksCounter;
    private final Counter fallbackCounter;
    private final Timer tickDurationTimer;

    public CustomMetricsService(
            MeterRegistry meterRegistry,
            BroadcastHub broadcastHub,
            ScenarioOverrideRegistry scenarioOverrideRegistry) {
        this.ticksCounter = Counter.builder("pricing.ticks.count")
                .description("Total pricing ticks published")
                .register(meterRegistry);

        this.fallbackCounter = Counter.builder("pricing.scoring.fallback.count")
                .description("City states priced by the fallback formula")
                .register(meterRegistry);

        this.tickDurationTimer = Timer.builder("pricing.tick.duration")
                .description("Time to sample, score and publish one tick")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(10))
                .register(meterRegistry);

        meterRegistry.gauge("pricing.subscribers", broadcastHub, BroadcastHub::connectedCount);
        meterRegistry.gauge(
                "pricing.scenarios.active", scenarioOverrideRegistry, ScenarioOverrideRegistry::activeCount);
    }

    @EventListener
    @Order(20)
    public void onPricingTick(PricingTickEvent event) {
        ticksCounter.increment();
        tickDurationTimer.record(event.getTickDuration());
        if (event.getFallbackCount() > 0) {
            fallbackCounter.increment(event.getFallbackCount());
            log.debug(
                    "Tick {} used the fallback formula for {} cities",
                    event.getSnapshot().getTick(),
                    event.getFallbackCount());
        }
    }

    public Counter getTicksCounter() {
        return ticksCounter;
    }

    public Counter getFallbackCounter() {
        return fallbackCounter;
    }

    public Timer getTickDurationTimer() {
        return tickDurationTimer;
    }
}
