package com.dynamicpricing.scenario;

import com.dynamicpricing.domain.enums.MetricField;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Outcome of an accepted scenario request. Rejections are raised as exceptions instead. */
@Value
@Builder
public class ScenarioResult {

    boolean accepted;
    String eventType;
    String city;
    Map<MetricField, Double> effects;
    long durationMs;
    Instant expiresAt;
    String message;
}
