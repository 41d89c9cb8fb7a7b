package com.dynamicpricing.api.dto.response;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Returned by GET /api/health/detailed.
 */
@Getter
@Builder
public class HealthDetailedResponse {

    /** "UP" or "DEGRADED". */
    private final String status;

    private final Map<String, SubsystemHealth> subsystems;

    private final long lastTick;

    private final Instant lastTickAt;

    private final int subscribers;

    private final int activeScenarios;

    private final String scoringMode;

    @Getter
    @Builder
    public static class SubsystemHealth {
        private final String status;
        private final String message;
    }
}
