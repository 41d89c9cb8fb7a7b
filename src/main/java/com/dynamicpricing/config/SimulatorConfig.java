package com.dynamicpricing.config;

import com.dynamicpricing.domain.enums.HistoryScope;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the tick simulation.
 *
 * <p>Controls which cities are simulated, the fuel price sampling range, the tick
 * cadence, and how much history is retained.
 */
@Configuration
@ConfigurationProperties(prefix = "dynamicpricing.simulator")
@Getter
@Setter
public class SimulatorConfig {

    /** Simulated cities, in display order. Must not be empty. */
    private List<String> cities = new ArrayList<>(List.of("Mumbai", "Delhi", "Bengaluru", "Hyderabad", "Chennai"));

    private double fuelPriceMin = 1.50;

    private double fuelPriceMax = 2.50;

    /** Time between two ticks. The first tick runs immediately on startup. */
    private Duration tickInterval = Duration.ofSeconds(5);

    /** Number of history records retained (across all cities, or per city). */
    private int historyCapacity = 100;

    private HistoryScope historyScope = HistoryScope.GLOBAL;
}
