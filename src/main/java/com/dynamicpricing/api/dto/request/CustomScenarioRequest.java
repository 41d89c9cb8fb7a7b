package com.dynamicpricing.api.dto.request;

import com.dynamicpricing.domain.enums.MetricField;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for forcing an arbitrary subset of a city's metrics.
 * Value ranges are checked by the override registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomScenarioRequest {

    @NotBlank
    private String city;

    @NotEmpty
    private Map<MetricField, Double> effects;

    @NotNull
    @Positive
    private Long durationMs;
}
