package com.dynamicpricing.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for applying a predefined scenario to a city.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioRequest {

    /** Scenario kind, e.g. "FUEL_SPIKE". Case-insensitive. */
    @NotBlank
    private String eventType;

    @NotBlank
    private String city;
}
