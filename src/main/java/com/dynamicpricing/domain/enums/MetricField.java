package com.dynamicpricing.domain.enums;

/**
 * The three operating metrics sampled for every city on every tick.
 * Scenario overrides force a subset of these fields.
 */
public enum MetricField {
    FUEL_PRICE,
    CONGESTION_INDEX,
    DEMAND_LEVEL;

    /** Lower bound of the integer metrics (congestion, demand). */
    public static final int INDEX_MIN = 1;

    /** Upper bound of the integer metrics (congestion, demand). */
    public static final int INDEX_MAX = 10;

    public boolean isIndex() {
        return this != FUEL_PRICE;
    }
}
