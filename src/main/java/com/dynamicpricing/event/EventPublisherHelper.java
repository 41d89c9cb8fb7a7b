package com.dynamicpricing.event;

import com.dynamicpricing.domain.model.PricingSnapshot;
import com.dynamicpricing.domain.model.ScenarioOverride;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Listener failures are logged and swallowed here: observers of ticks and scenarios
 * must never fail the simulation path that published the event.
 */
@Component
public class EventPublisherHelper {

    private static final Logger log = LoggerFactory.getLogger(EventPublisherHelper.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Tick ----

    public void publishPricingTick(Object source, PricingSnapshot snapshot, int fallbackCount, Duration duration) {
        publish(new PricingTickEvent(source, snapshot, fallbackCount, duration));
    }

    // ---- Scenario ----

    public void publishScenarioApplied(Object source, ScenarioOverride override) {
        publish(new ScenarioEvent(source, ScenarioEventType.APPLIED, override));
    }

    public void publishScenarioReplaced(Object source, ScenarioOverride override, ScenarioOverride previous) {
        publish(new ScenarioEvent(source, ScenarioEventType.REPLACED, override, previous));
    }

    public void publishScenarioExpired(Object source, ScenarioOverride override) {
        publish(new ScenarioEvent(source, ScenarioEventType.EXPIRED, override));
    }

    public void publishScenarioCleared(Object source, ScenarioOverride override) {
        publish(new ScenarioEvent(source, ScenarioEventType.CLEARED, override));
    }

    private void publish(Object event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Failed to publish {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
