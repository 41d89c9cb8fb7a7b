package com.dynamicpricing.unit.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.dynamicpricing.domain.model.MetricSample;
import com.dynamicpricing.domain.model.ScoringResult;
import com.dynamicpricing.exception.ScoringException;
import com.dynamicpricing.scoring.FallbackPricingFormula;
import com.dynamicpricing.scoring.PricingModelAdapter;
import com.dynamicpricing.scoring.Scorer;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PricingModelAdapterTest {

    private static final MetricSample SAMPLE = new MetricSample(2.1, 6, 8);

    @Mock
    private Scorer scorer;

    private ExecutorService scoringExecutor;
    private PricingModelAdapter pricingModelAdapter;

    @BeforeEach
    void setUp() {
        scoringExecutor = Executors.newFixedThreadPool(2);
        pricingModelAdapter = new PricingModelAdapter(scorer, scoringExecutor, Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        scoringExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Returns the scorer's result when it answers in time")
    void passesThroughResult() {
        ScoringResult scored = ScoringResult.scored(1.42, "Price driven by high customer demand.");
        when(scorer.score(SAMPLE)).thenReturn(scored);

        assertThat(pricingModelAdapter.score("Mumbai", SAMPLE)).isEqualTo(scored);
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("Scorer error yields the fallback formula for the same inputs")
        void scorerErrorFallsBack() {
            when(scorer.score(SAMPLE)).thenThrow(new ScoringException("predictor exited with code 1"));

            ScoringResult result = pricingModelAdapter.score("Mumbai", SAMPLE);

            assertThat(result).isEqualTo(FallbackPricingFormula.apply(SAMPLE));
            assertThat(result.fallback()).isTrue();
        }

        @Test
        @DisplayName("Unexpected runtime error also falls back")
        void runtimeErrorFallsBack() {
            when(scorer.score(any())).thenThrow(new IllegalStateException("model not loaded"));

            assertThat(pricingModelAdapter.score("Delhi", SAMPLE).fallback()).isTrue();
        }

        @Test
        @DisplayName("NaN multiplier falls back")
        void nanFallsBack() {
            when(scorer.score(SAMPLE)).thenReturn(ScoringResult.scored(Double.NaN, "broken"));

            assertThat(pricingModelAdapter.score("Delhi", SAMPLE)).isEqualTo(FallbackPricingFormula.apply(SAMPLE));
        }

        @Test
        @DisplayName("Null result falls back")
        void nullFallsBack() {
            when(scorer.score(SAMPLE)).thenReturn(null);

            assertThat(pricingModelAdapter.score("Delhi", SAMPLE).fallback()).isTrue();
        }

        @Test
        @DisplayName("Rejected submission falls back")
        void rejectedSubmissionFallsBack() {
            scoringExecutor.shutdownNow();

            assertThat(pricingModelAdapter.score("Chennai", SAMPLE)).isEqualTo(FallbackPricingFormula.apply(SAMPLE));
        }
    }

    @Nested
    @DisplayName("Timeout")
    class Timeout {

        @Test
        @DisplayName("Slow call falls back within the timeout and is interrupted")
        void slowCallIsCancelled() throws Exception {
            CountDownLatch interrupted = new CountDownLatch(1);
            when(scorer.score(SAMPLE)).thenAnswer(invocation -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return ScoringResult.scored(1.5, "too late");
            });

            long start = System.nanoTime();
            ScoringResult result = pricingModelAdapter.score("Hyderabad", SAMPLE);
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(result).isEqualTo(FallbackPricingFormula.apply(SAMPLE));
            assertThat(elapsedMillis).isLessThan(2_000);
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("Exposes the configured timeout")
        void exposesTimeout() {
            assertThat(pricingModelAdapter.getTimeout()).isEqualTo(Duration.ofMillis(200));
        }
    }
}
