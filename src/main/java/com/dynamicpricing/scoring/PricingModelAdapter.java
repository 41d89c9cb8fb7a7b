package com.dynamicpricing.scoring;

import com.dynamicpricing.config.ScoringConfig;
import com.dynamicpricing.domain.model.MetricSample;
import com.dynamicpricing.domain.model.ScoringResult;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Time-bounded boundary in front of the {@link Scorer}.
 *
 * <p>Each call runs on the scoring pool under a Resilience4j {@link TimeLimiter}. A call
 * that exceeds the timeout is cancelled with interruption so the scorer can release its
 * resources. Any failure (timeout, scorer error, rejected submission, malformed output)
 * is contained here and replaced by {@link FallbackPricingFormula}; this method never throws.
 */
@Component
public class PricingModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(PricingModelAdapter.class);

    private final Scorer scorer;
    private final ExecutorService scoringExecutor;
    private final TimeLimiter timeLimiter;

    @Autowired
    public PricingModelAdapter(
            Scorer scorer,
            @Qualifier("scoringExecutor") ThreadPoolTaskExecutor scoringExecutor,
            ScoringConfig scoringConfig) {
        this(scorer, scoringExecutor.getThreadPoolExecutor(), scoringConfig.getTimeout());
    }

    public PricingModelAdapter(Scorer scorer, ExecutorService scoringExecutor, Duration timeout) {
        this.scorer = scorer;
        this.scoringExecutor = scoringExecutor;
        this.timeLimiter = TimeLimiter.of(
                "pricing-model",
                TimeLimiterConfig.custom()
                        .timeoutDuration(timeout)
                        .cancelRunningFuture(true)
                        .build());
    }

    /**
     * Scores one city's metrics, falling back to the deterministic formula on any failure.
     */
    public ScoringResult score(String entityId, MetricSample sample) {
        try {
            ScoringResult result =
                    timeLimiter.executeFutureSupplier(() -> scoringExecutor.submit(() -> scorer.score(sample)));
            if (result == null
                    || Double.isNaN(result.priceMultiplier())
                    || Double.isInfinite(result.priceMultiplier())) {
                log.warn("Pricing model returned no usable multiplier for {}, using fallback", entityId);
                return FallbackPricingFormula.apply(sample);
            }
            return result;
        } catch (TimeoutException e) {
            log.warn("Pricing model timed out for {} after {}, using fallback", entityId, getTimeout());
            return FallbackPricingFormula.apply(sample);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Pricing model call interrupted for {}, using fallback", entityId);
            return FallbackPricingFormula.apply(sample);
        } catch (Exception e) {
            log.warn("Pricing model failed for {}: {}. Using fallback", entityId, e.getMessage());
            return FallbackPricingFormula.apply(sample);
        }
    }

    public String getScorerName() {
        return scorer.name();
    }

    public Duration getTimeout() {
        return timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
    }
}
