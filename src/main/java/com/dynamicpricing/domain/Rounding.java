package com.dynamicpricing.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal precision of published metrics: fuel prices carry 2 decimals and
 * multipliers 3, half-up.
 */
public final class Rounding {

    public static final int FUEL_PRICE_SCALE = 2;
    public static final int MULTIPLIER_SCALE = 3;

    private Rounding() {}

    public static double fuelPrice(double value) {
        return round(value, FUEL_PRICE_SCALE);
    }

    public static double multiplier(double value) {
        return round(value, MULTIPLIER_SCALE);
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
