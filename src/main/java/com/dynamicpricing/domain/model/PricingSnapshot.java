package com.dynamicpricing.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Map;
import lombok.Value;

/**
 * The full city-to-state mapping produced by one tick. Published as a single unit
 * so observers never see a mix of two ticks.
 *
 * <p>{@code tick} is 0 for the empty snapshot that exists before the first tick completes.
 */
@Value
public class PricingSnapshot {

    long tick;
    Instant generatedAt;
    Map<String, EntityState> states;

    public static PricingSnapshot empty() {
        return new PricingSnapshot(0, Instant.EPOCH, Map.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return states.isEmpty();
    }
}
