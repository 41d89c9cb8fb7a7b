package com.dynamicpricing.simulator;

import com.dynamicpricing.config.SimulatorConfig;
import com.dynamicpricing.domain.Rounding;
import com.dynamicpricing.domain.enums.MetricField;
import com.dynamicpricing.domain.model.MetricSample;
import java.util.Random;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Draws base metrics for one city: fuel price uniform in the configured range (2 decimals),
 * congestion and demand as independent integers uniform in 1-10.
 */
@Component
public class MetricSampler {

    private final double fuelPriceMin;
    private final double fuelPriceMax;
    private final Random random;

    @Autowired
    public MetricSampler(SimulatorConfig simulatorConfig) {
        this(simulatorConfig.getFuelPriceMin(), simulatorConfig.getFuelPriceMax(), new Random());
    }

    public MetricSampler(double fuelPriceMin, double fuelPriceMax, Random random) {
        if (fuelPriceMin > fuelPriceMax) {
            throw new IllegalStateException(
                    "Fuel price range is empty: min " + fuelPriceMin + " > max " + fuelPriceMax);
        }
        this.fuelPriceMin = fuelPriceMin;
        this.fuelPriceMax = fuelPriceMax;
        this.random = random;
    }

    public MetricSample sample() {
        double fuelPrice = Rounding.fuelPrice(fuelPriceMin + random.nextDouble() * (fuelPriceMax - fuelPriceMin));
        return new MetricSample(fuelPrice, nextIndex(), nextIndex());
    }

    private int nextIndex() {
        return MetricField.INDEX_MIN + random.nextInt(MetricField.INDEX_MAX - MetricField.INDEX_MIN + 1);
    }
}
