package com.dynamicpricing.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Predefined scenario kinds that can be injected through the scenario API.
 * The forced values and durations for each kind come from configuration
 * ({@code dynamicpricing.scenario.definitions}).
 */
public enum ScenarioKind {
    DEMAND_SURGE,
    FUEL_SPIKE,
    TRAFFIC_JAM,
    GLOBAL_CRISIS;

    /** Case-insensitive lookup that returns empty for unknown or blank names. */
    public static Optional<ScenarioKind> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.name().equals(normalized)).findFirst();
    }
}
