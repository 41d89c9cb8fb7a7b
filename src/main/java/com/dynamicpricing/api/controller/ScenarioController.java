package com.dynamicpricing.api.controller;

import com.dynamicpricing.api.dto.request.CustomScenarioRequest;
import com.dynamicpricing.api.dto.request.ScenarioRequest;
import com.dynamicpricing.config.ScenarioConfig;
import com.dynamicpricing.domain.enums.ScenarioKind;
import com.dynamicpricing.domain.model.ScenarioOverride;
import com.dynamicpricing.scenario.ScenarioResult;
import com.dynamicpricing.scenario.ScenarioService;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Scenario control.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/scenario -- apply a predefined scenario to a city</li>
 *   <li>POST /api/scenario/custom -- force arbitrary metrics for an arbitrary duration</li>
 *   <li>GET /api/scenario/active -- unexpired overrides by city</li>
 *   <li>GET /api/scenario/kinds -- the configured scenario catalogue</li>
 *   <li>DELETE /api/scenario/{city} -- end a city's scenario early</li>
 * </ul>
 *
 * <p>An accepted scenario affects the next tick; the one in flight may or may not see it.
 */
@RestController
@RequestMapping("/api/scenario")
public class ScenarioController {

    private final ScenarioService scenarioService;

    public ScenarioController(ScenarioService scenarioService) {
        this.scenarioService = scenarioService;
    }

    @PostMapping
    public ResponseEntity<ScenarioResult> applyScenario(@Valid @RequestBody ScenarioRequest request) {
        return ResponseEntity.ok(scenarioService.applyScenario(request.getEventType(), request.getCity()));
    }

    @PostMapping("/custom")
    public ResponseEntity<ScenarioResult> applyCustomScenario(@Valid @RequestBody CustomScenarioRequest request) {
        ScenarioResult result = scenarioService.applyCustom(
                request.getCity(), request.getEffects(), Duration.ofMillis(request.getDurationMs()));
        return ResponseEntity.ok(result);
    }

    @GetMapping("/active")
    public ResponseEntity<Map<String, ScenarioOverride>> getActiveScenarios() {
        return ResponseEntity.ok(scenarioService.getActiveScenarios());
    }

    @GetMapping("/kinds")
    public ResponseEntity<Map<ScenarioKind, ScenarioConfig.Definition>> getScenarioKinds() {
        return ResponseEntity.ok(scenarioService.getDefinitions());
    }

    /** Returns whether an override was removed. */
    @DeleteMapping("/{city}")
    public ResponseEntity<Map<String, Object>> clearScenario(@PathVariable String city) {
        boolean cleared = scenarioService.clearScenario(city);
        return ResponseEntity.ok(Map.of("city", city, "cleared", cleared));
    }
}
