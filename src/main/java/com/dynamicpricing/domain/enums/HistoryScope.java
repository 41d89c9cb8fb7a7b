package com.dynamicpricing.domain.enums;

/**
 * How the history capacity is applied.
 *
 * <p>GLOBAL keeps the most recent N records across all cities. PER_ENTITY keeps the
 * most recent N records for each city independently.
 */
public enum HistoryScope {
    GLOBAL,
    PER_ENTITY
}
