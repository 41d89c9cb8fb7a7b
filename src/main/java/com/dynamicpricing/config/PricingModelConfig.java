package com.dynamicpricing.config;

import com.dynamicpricing.domain.enums.ScoringMode;
import com.dynamicpricing.scoring.HeuristicScorer;
import com.dynamicpricing.scoring.Scorer;
import com.dynamicpricing.scoring.SubprocessScorer;
import java.io.File;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link Scorer} implementation from {@code dynamicpricing.scoring.mode}.
 */
@Configuration
public class PricingModelConfig {

    private static final Logger log = LoggerFactory.getLogger(PricingModelConfig.class);

    @Bean
    public Scorer scorer(ScoringConfig scoringConfig) {
        if (scoringConfig.getMode() == ScoringMode.SUBPROCESS) {
            File workingDirectory =
                    scoringConfig.getWorkingDirectory() != null ? new File(scoringConfig.getWorkingDirectory()) : null;
            log.info("Pricing model: subprocess {}", scoringConfig.getCommand());
            // Backstop only; the adapter's timeout ends a slow call first
            return new SubprocessScorer(
                    scoringConfig.getCommand(),
                    workingDirectory,
                    scoringConfig.getTimeout().plusMillis(500));
        }
        log.info("Pricing model: in-process heuristic");
        return new HeuristicScorer();
    }
}
