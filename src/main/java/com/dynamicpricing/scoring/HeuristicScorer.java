package com.dynamicpricing.scoring;

import com.dynamicpricing.domain.enums.MetricField;
import com.dynamicpricing.domain.model.MetricSample;
import com.dynamicpricing.domain.model.ScoringResult;
import com.dynamicpricing.exception.ScoringException;

/**
 * In-process pricing model with the same shape as the data the external model was
 * trained on: independent fuel, traffic and demand factors multiplied together and
 * clamped to [0.8, 2.0].
 *
 * <p>Inputs outside the trained range (fuel 1.00-3.00, indices 1-10) are rejected
 * with a {@link ScoringException}, as the predictor rejects them.
 */
public class HeuristicScorer implements Scorer {

    static final double MIN_FUEL = 1.0;
    static final double MAX_FUEL = 3.0;
    static final double MIN_MULTIPLIER = 0.8;
    static final double MAX_MULTIPLIER = 2.0;

    @Override
    public ScoringResult score(MetricSample sample) {
        validate(sample);

        double fuelImpact = 1.0 + (sample.fuelPrice() - 1.0) * 0.2;
        double trafficImpact = 1.0 + (sample.congestionIndex() - 1) * 0.033;
        double demandImpact = 1.0 + (sample.demandLevel() - 1) * 0.033;

        double multiplier = fuelImpact * trafficImpact * demandImpact;
        multiplier = Math.max(MIN_MULTIPLIER, Math.min(MAX_MULTIPLIER, multiplier));

        return ScoringResult.scored(multiplier, ExplanationGenerator.explain(sample, multiplier));
    }

    @Override
    public String name() {
        return "heuristic";
    }

    private void validate(MetricSample sample) {
        if (sample.fuelPrice() < MIN_FUEL || sample.fuelPrice() > MAX_FUEL || Double.isNaN(sample.fuelPrice())) {
            throw new ScoringException("Fuel price must be between $1.00 and $3.00, got " + sample.fuelPrice());
        }
        if (outOfIndexRange(sample.congestionIndex())) {
            throw new ScoringException("Traffic index must be between 1 and 10, got " + sample.congestionIndex());
        }
        if (outOfIndexRange(sample.demandLevel())) {
            throw new ScoringException("Demand level must be between 1 and 10, got " + sample.demandLevel());
        }
    }

    private static boolean outOfIndexRange(int value) {
        return value < MetricField.INDEX_MIN || value > MetricField.INDEX_MAX;
    }
}
