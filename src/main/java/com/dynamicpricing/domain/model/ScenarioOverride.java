package com.dynamicpricing.domain.model;

import com.dynamicpricing.domain.enums.MetricField;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A time-bounded forced value for one or more of a city's metrics.
 *
 * <p>At most one override exists per city. It applies while {@code now < expiresAt}.
 */
@Value
@Builder
public class ScenarioOverride {

    String entityId;

    /** Label of the request that created the override (scenario kind or "CUSTOM"). */
    String source;

    /** Forced values. Fields absent from the map keep their sampled value. */
    Map<MetricField, Double> effects;

    Instant appliedAt;
    Instant expiresAt;

    /** Monotonic version used to resolve concurrent applies for the same city. */
    long version;

    public boolean isActiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    /** Replaces each forced field of {@code sample}; other fields are kept. */
    public MetricSample applyTo(MetricSample sample) {
        double fuelPrice = sample.fuelPrice();
        int congestionIndex = sample.congestionIndex();
        int demandLevel = sample.demandLevel();

        Double forcedFuel = effects.get(MetricField.FUEL_PRICE);
        if (forcedFuel != null) {
            fuelPrice = forcedFuel;
        }
        Double forcedCongestion = effects.get(MetricField.CONGESTION_INDEX);
        if (forcedCongestion != null) {
            congestionIndex = (int) Math.round(forcedCongestion);
        }
        Double forcedDemand = effects.get(MetricField.DEMAND_LEVEL);
        if (forcedDemand != null) {
            demandLevel = (int) Math.round(forcedDemand);
        }
        return new MetricSample(fuelPrice, congestionIndex, demandLevel);
    }
}
