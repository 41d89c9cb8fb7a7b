package com.dynamicpricing.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Pricing state of one city as produced by a single tick.
 *
 * <p>Immutable. The multiplier and explanation were computed from exactly the
 * fuel/congestion/demand triple held in the same instance, so readers never see a
 * partially updated record.
 */
@Value
@Builder
public class EntityState {

    String entityId;

    /** Fuel price per litre, rounded to 2 decimals. */
    double fuelPrice;

    /** Congestion index, 1-10. */
    int congestionIndex;

    /** Demand level, 1-10. */
    int demandLevel;

    /** Scored price multiplier, rounded to 3 decimals. Not clamped here. */
    double priceMultiplier;

    String explanation;

    /** True when the fallback formula replaced the model for this record. */
    boolean fallbackUsed;

    /** True when at least one metric was forced by an active scenario. */
    boolean scenarioActive;

    Instant generatedAt;

    public MetricSample toSample() {
        return new MetricSample(fuelPrice, congestionIndex, demandLevel);
    }
}
