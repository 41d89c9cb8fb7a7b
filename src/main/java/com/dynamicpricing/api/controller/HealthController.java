package com.dynamicpricing.api.controller;

import com.dynamicpricing.api.dto.response.HealthDetailedResponse;
import com.dynamicpricing.broadcast.BroadcastHub;
import com.dynamicpricing.config.ScoringConfig;
import com.dynamicpricing.config.SimulatorConfig;
import com.dynamicpricing.scenario.ScenarioOverrideRegistry;
import com.dynamicpricing.scoring.PricingModelAdapter;
import com.dynamicpricing.simulator.TickScheduler;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health check endpoints.
 *
 * <ul>
 *   <li>GET /api/health -- shallow, always UP while the app responds</li>
 *   <li>GET /api/health/detailed -- simulation freshness, subscribers, scenarios, scoring mode</li>
 * </ul>
 *
 * <p>The simulation is DEGRADED when no tick completed within three tick intervals.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    static final int STALE_TICK_INTERVALS = 3;

    private final TickScheduler tickScheduler;
    private final BroadcastHub broadcastHub;
    private final ScenarioOverrideRegistry scenarioOverrideRegistry;
    private final PricingModelAdapter pricingModelAdapter;
    private final SimulatorConfig simulatorConfig;
    private final ScoringConfig scoringConfig;
    private final Clock clock;

    public HealthController(
            TickScheduler tickScheduler,
            BroadcastHub broadcastHub,
            ScenarioOverrideRegistry scenarioOverrideRegistry,
            PricingModelAdapter pricingModelAdapter,
            SimulatorConfig simulatorConfig,
            ScoringConfig scoringConfig,
            Clock clock) {
        this.tickScheduler = tickScheduler;
        this.broadcastHub = broadcastHub;
        this.scenarioOverrideRegistry = scenarioOverrideRegistry;
        this.pricingModelAdapter = pricingModelAdapter;
        this.simulatorConfig = simulatorConfig;
        this.scoringConfig = scoringConfig;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/detailed")
    public ResponseEntity<HealthDetailedResponse> detailedHealth() {
        Map<String, HealthDetailedResponse.SubsystemHealth> subsystems = new LinkedHashMap<>();

        Optional<Instant> lastTickAt = tickScheduler.getLastTickAt();
        Duration staleAfter = simulatorConfig.getTickInterval().multipliedBy(STALE_TICK_INTERVALS);
        boolean fresh = lastTickAt
                .map(at -> Duration.between(at, clock.instant()).compareTo(staleAfter) <= 0)
                .orElse(false);
        subsystems.put(
                "simulator",
                HealthDetailedResponse.SubsystemHealth.builder()
                        .status(fresh ? "UP" : "DEGRADED")
                        .message(lastTickAt
                                .map(at -> "Last tick " + tickScheduler.getTickCount() + " at " + at)
                                .orElse("No tick completed yet"))
                        .build());

        subsystems.put(
                "scoring",
                HealthDetailedResponse.SubsystemHealth.builder()
                        .status("UP")
                        .message(pricingModelAdapter.getScorerName() + " scorer, timeout "
                                + pricingModelAdapter.getTimeout().toMillis() + "ms")
                        .build());

        int subscribers = broadcastHub.connectedCount();
        subsystems.put(
                "broadcast",
                HealthDetailedResponse.SubsystemHealth.builder()
                        .status("UP")
                        .message(subscribers + " subscribers connected")
                        .build());

        String overallStatus = subsystems.values().stream().anyMatch(s -> !"UP".equals(s.getStatus()))
                ? "DEGRADED"
                : "UP";

        HealthDetailedResponse response = HealthDetailedResponse.builder()
                .status(overallStatus)
                .subsystems(subsystems)
                .lastTick(tickScheduler.getTickCount())
                .lastTickAt(lastTickAt.orElse(null))
                .subscribers(subscribers)
                .activeScenarios(scenarioOverrideRegistry.activeCount())
                .scoringMode(scoringConfig.getMode().name())
                .build();
        return ResponseEntity.ok(response);
    }
}
