package com.dynamicpricing.scoring;

import com.dynamicpricing.domain.model.MetricSample;
import com.dynamicpricing.domain.model.ScoringResult;
import com.dynamicpricing.exception.ScoringException;

/**
 * Synchronous pricing model: turns one city's metrics into a price multiplier and a
 * human-readable explanation.
 *
 * <p>Implementations may run in-process, spawn a process, or call a remote service.
 * They must respond to thread interruption (the adapter cancels calls that exceed
 * the timeout) and release every resource they acquired on all exit paths.
 */
public interface Scorer {

    /**
     * @throws ScoringException when no multiplier can be produced
     */
    ScoringResult score(MetricSample sample);

    /** Short identifier for logs and health output. */
    String name();
}
