package com.dynamicpricing.config;

import com.dynamicpricing.domain.enums.ScoringMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the pricing model boundary.
 */
@Configuration
@ConfigurationProperties(prefix = "dynamicpricing.scoring")
@Getter
@Setter
public class ScoringConfig {

    private ScoringMode mode = ScoringMode.IN_PROCESS;

    /** Upper bound for one scoring call. Slower calls are cancelled and fall back. */
    private Duration timeout = Duration.ofSeconds(3);

    /** Concurrent scoring calls. One per city keeps a tick fully parallel. */
    private int poolSize = 5;

    /** Predictor command for SUBPROCESS mode. Metric arguments are appended. */
    private List<String> command = new ArrayList<>(List.of("python3", "backend/ml_model/predict.py"));

    /** Working directory for the predictor process. Null means the JVM's working directory. */
    private String workingDirectory;
}
