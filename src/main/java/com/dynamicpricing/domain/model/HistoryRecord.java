package com.dynamicpricing.domain.model;

import java.time.Instant;
import lombok.Value;

/**
 * An {@link EntityState} tagged with its emission sequence number and tick.
 * The sequence is strictly increasing across all cities and defines history order.
 */
@Value
public class HistoryRecord {

    long sequence;
    long tick;
    EntityState state;

    public String getEntityId() {
        return state.getEntityId();
    }

    public Instant getGeneratedAt() {
        return state.getGeneratedAt();
    }
}
