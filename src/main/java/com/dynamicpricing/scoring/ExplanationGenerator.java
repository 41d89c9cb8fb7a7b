package com.dynamicpricing.scoring;

import com.dynamicpricing.domain.model.MetricSample;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the "Price driven by ..." sentence from the metric thresholds the
 * predictor uses.
 */
public final class ExplanationGenerator {

    static final String NEUTRAL = "Price calculated based on current market conditions.";

    private ExplanationGenerator() {}

    public static String explain(MetricSample sample, double priceMultiplier) {
        List<String> drivers = new ArrayList<>();

        if (sample.fuelPrice() > 2.0) {
            drivers.add("high fuel costs");
        } else if (sample.fuelPrice() < 1.7) {
            drivers.add("low fuel costs");
        }

        if (sample.congestionIndex() >= 8) {
            drivers.add("heavy traffic conditions");
        } else if (sample.congestionIndex() <= 3) {
            drivers.add("light traffic conditions");
        }

        if (sample.demandLevel() >= 8) {
            drivers.add("high customer demand");
        } else if (sample.demandLevel() <= 3) {
            drivers.add("low customer demand");
        }

        if (priceMultiplier > 1.5) {
            drivers.add("significant price increase due to market conditions");
        } else if (priceMultiplier < 1.0) {
            drivers.add("price reduction due to favorable conditions");
        }

        if (drivers.isEmpty()) {
            return NEUTRAL;
        }
        if (drivers.size() == 1) {
            return "Price driven by " + drivers.get(0) + ".";
        }
        String head = String.join(", ", drivers.subList(0, drivers.size() - 1));
        return "Price driven by " + head + " and " + drivers.get(drivers.size() - 1) + ".";
    }
}
