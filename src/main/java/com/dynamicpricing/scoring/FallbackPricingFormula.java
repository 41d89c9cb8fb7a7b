package com.dynamicpricing.scoring;

import com.dynamicpricing.domain.Rounding;
import com.dynamicpricing.domain.model.MetricSample;
import com.dynamicpricing.domain.model.ScoringResult;

/**
 * Deterministic linear stand-in used when the pricing model fails.
 *
 * <p>{@code 1.0 + (fuel - 1.5) * 0.2 + (congestion - 5.5) * 0.05 + (demand - 5.5) * 0.08},
 * rounded to 3 decimals and not clamped. Independent of the model's shape.
 */
public final class FallbackPricingFormula {

    public static final String FALLBACK_EXPLANATION =
            "Price calculated using fallback algorithm due to ML model unavailability.";

    static final double BASELINE_FUEL = 1.5;
    static final double BASELINE_CONGESTION = 5.5;
    static final double BASELINE_DEMAND = 5.5;
    static final double FUEL_WEIGHT = 0.2;
    static final double CONGESTION_WEIGHT = 0.05;
    static final double DEMAND_WEIGHT = 0.08;

    private FallbackPricingFormula() {}

    public static double multiplier(MetricSample sample) {
        double raw = 1.0
                + (sample.fuelPrice() - BASELINE_FUEL) * FUEL_WEIGHT
                + (sample.congestionIndex() - BASELINE_CONGESTION) * CONGESTION_WEIGHT
                + (sample.demandLevel() - BASELINE_DEMAND) * DEMAND_WEIGHT;
        return Rounding.multiplier(raw);
    }

    public static ScoringResult apply(MetricSample sample) {
        return ScoringResult.fallback(multiplier(sample), FALLBACK_EXPLANATION);
    }
}
