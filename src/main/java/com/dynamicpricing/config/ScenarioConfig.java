package com.dynamicpricing.config;

import com.dynamicpricing.domain.enums.MetricField;
import com.dynamicpricing.domain.enums.ScenarioKind;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Static scenario catalogue under {@code dynamicpricing.scenario}.
 *
 * <p>Each {@link ScenarioKind} maps to the metric values it forces and how long
 * the override lasts. Defaults force the affected metrics to their maximum for 60s.
 */
@Configuration
@ConfigurationProperties(prefix = "dynamicpricing.scenario")
@Getter
@Setter
public class ScenarioConfig {

    /** Background expiry sweep cadence. Reads also expire lazily. */
    private long sweepIntervalMs = 1000;

    private Map<ScenarioKind, Definition> definitions = defaultDefinitions();

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Definition {

        private Duration duration = Duration.ofSeconds(60);

        private Map<MetricField, Double> effects = new EnumMap<>(MetricField.class);
    }

    static Map<ScenarioKind, Definition> defaultDefinitions() {
        Duration duration = Duration.ofSeconds(60);
        Map<ScenarioKind, Definition> defaults = new EnumMap<>(ScenarioKind.class);
        defaults.put(ScenarioKind.DEMAND_SURGE, new Definition(duration, effects(MetricField.DEMAND_LEVEL, 10.0)));
        defaults.put(ScenarioKind.FUEL_SPIKE, new Definition(duration, effects(MetricField.FUEL_PRICE, 3.0)));
        defaults.put(ScenarioKind.TRAFFIC_JAM, new Definition(duration, effects(MetricField.CONGESTION_INDEX, 10.0)));

        Map<MetricField, Double> crisis = new EnumMap<>(MetricField.class);
        crisis.put(MetricField.FUEL_PRICE, 3.0);
        crisis.put(MetricField.CONGESTION_INDEX, 10.0);
        crisis.put(MetricField.DEMAND_LEVEL, 10.0);
        defaults.put(ScenarioKind.GLOBAL_CRISIS, new Definition(duration, crisis));
        return defaults;
    }

    private static Map<MetricField, Double> effects(MetricField field, double value) {
        Map<MetricField, Double> effects = new EnumMap<>(MetricField.class);
        effects.put(field, value);
        return effects;
    }
}
