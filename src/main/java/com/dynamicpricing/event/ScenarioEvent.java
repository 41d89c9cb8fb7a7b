package com.dynamicpricing.event;

import com.dynamicpricing.domain.model.ScenarioOverride;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a scenario override is applied, replaced, expired, or cleared.
 *
 * <p>For REPLACED the event carries the new override; the replaced one is available
 * through {@link #getPrevious()}.
 */
public class ScenarioEvent extends ApplicationEvent {

    private final ScenarioEventType eventType;
    private final ScenarioOverride override;
    private final ScenarioOverride previous;

    public ScenarioEvent(Object source, ScenarioEventType eventType, ScenarioOverride override) {
        this(source, eventType, override, null);
    }

    public ScenarioEvent(
            Object source, ScenarioEventType eventType, ScenarioOverride override, ScenarioOverride previous) {
        super(source);
        this.eventType = eventType;
        this.override = override;
        this.previous = previous;
    }

    public ScenarioEventType getEventType() {
        return eventType;
    }

    public ScenarioOverride getOverride() {
        return override;
    }

    public ScenarioOverride getPrevious() {
        return previous;
    }
}
