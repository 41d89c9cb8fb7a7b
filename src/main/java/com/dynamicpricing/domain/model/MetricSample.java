package com.dynamicpricing.domain.model;

/**
 * One city's input triple for a single tick, after scenario overrides were applied.
 */
public record MetricSample(double fuelPrice, int congestionIndex, int demandLevel) {}
