package com.dynamicpricing.scenario;

import com.dynamicpricing.config.ScenarioConfig;
import com.dynamicpricing.domain.enums.MetricField;
import com.dynamicpricing.domain.enums.ScenarioKind;
import com.dynamicpricing.domain.model.ScenarioOverride;
import com.dynamicpricing.exception.InvalidEffectTypeException;
import java.time.Duration;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Resolves scenario requests against the configured catalogue and installs the
 * resulting override.
 */
@Service
public class ScenarioService {

    static final String CUSTOM_SOURCE = "CUSTOM";

    private final ScenarioConfig scenarioConfig;
    private final ScenarioOverrideRegistry scenarioOverrideRegistry;

    public ScenarioService(ScenarioConfig scenarioConfig, ScenarioOverrideRegistry scenarioOverrideRegistry) {
        this.scenarioConfig = scenarioConfig;
        this.scenarioOverrideRegistry = scenarioOverrideRegistry;
    }

    /**
     * Applies a predefined scenario kind to a city.
     *
     * @throws InvalidEffectTypeException if {@code eventType} is unknown or has no definition
     */
    public ScenarioResult applyScenario(String eventType, String city) {
        ScenarioKind kind = ScenarioKind.parse(eventType)
                .orElseThrow(() -> InvalidEffectTypeException.unknownEventType(eventType));
        ScenarioConfig.Definition definition = scenarioConfig.getDefinitions().get(kind);
        if (definition == null) {
            throw new InvalidEffectTypeException(
                    "No definition configured for event type: " + kind, Map.of("eventType", kind.name()));
        }

        ScenarioOverride override = scenarioOverrideRegistry.apply(
                city, definition.getEffects(), definition.getDuration(), kind.name());
        return toResult(override, kind.name(), "Scenario " + kind + " applied to " + city);
    }

    /** Forces an arbitrary subset of metrics for an arbitrary duration. */
    public ScenarioResult applyCustom(String city, Map<MetricField, Double> effects, Duration duration) {
        ScenarioOverride override = scenarioOverrideRegistry.apply(city, effects, duration, CUSTOM_SOURCE);
        return toResult(override, CUSTOM_SOURCE, "Custom scenario applied to " + city);
    }

    public Map<String, ScenarioOverride> getActiveScenarios() {
        return scenarioOverrideRegistry.activeOverrides();
    }

    public Map<ScenarioKind, ScenarioConfig.Definition> getDefinitions() {
        return scenarioConfig.getDefinitions();
    }

    public boolean clearScenario(String city) {
        return scenarioOverrideRegistry.clear(city);
    }

    private static ScenarioResult toResult(ScenarioOverride override, String eventType, String message) {
        return ScenarioResult.builder()
                .accepted(true)
                .eventType(eventType)
                .city(override.getEntityId())
                .effects(override.getEffects())
                .durationMs(override.getExpiresAt().toEpochMilli() - override.getAppliedAt().toEpochMilli())
                .expiresAt(override.getExpiresAt())
                .message(message)
                .build();
    }
}
