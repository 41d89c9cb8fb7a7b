package com.dynamicpricing.domain.enums;

/** Selects which {@link com.dynamicpricing.scoring.Scorer} implementation backs the pricing adapter. */
public enum ScoringMode {
    /** Built-in heuristic model, no external process. */
    IN_PROCESS,
    /** Spawns the external predictor script once per city per tick. */
    SUBPROCESS
}
