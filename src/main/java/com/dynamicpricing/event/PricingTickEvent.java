package com.dynamicpricing.event;

import com.dynamicpricing.domain.model.PricingSnapshot;
import java.time.Duration;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a tick's snapshot was stored and handed to the broadcast hub.
 *
 * <p>Carries how many cities fell back to the deterministic formula and how long
 * the tick took, for metrics and health reporting.
 */
public class PricingTickEvent extends ApplicationEvent {

    private final PricingSnapshot snapshot;
    private final int fallbackCount;
    private final Duration tickDuration;

    public PricingTickEvent(Object source, PricingSnapshot snapshot, int fallbackCount, Duration tickDuration) {
        super(source);
        this.snapshot = snapshot;
        this.fallbackCount = fallbackCount;
        this.tickDuration = tickDuration;
    }

    public PricingSnapshot getSnapshot() {
        return snapshot;
    }

    public int getFallbackCount() {
        return fallbackCount;
    }

    public Duration getTickDuration() {
        return tickDuration;
    }
}
