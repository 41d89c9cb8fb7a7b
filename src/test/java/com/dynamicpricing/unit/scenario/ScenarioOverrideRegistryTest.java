package com.dynamicpricing.unit.scenario;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.dynamicpricing.config.SimulatorConfig;
import com.dynamicpricing.domain.enums.MetricField;
import com.dynamicpricing.domain.model.ScenarioOverride;
import com.dynamicpricing.event.EventPublisherHelper;
import com.dynamicpricing.exception.InvalidDurationException;
import com.dynamicpricing.exception.InvalidEffectTypeException;
import com.dynamicpricing.exception.InvalidEntityException;
import com.dynamicpricing.scenario.ScenarioOverrideRegistry;
import com.dynamicpricing.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScenarioOverrideRegistryTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MutableClock clock;
    private ScenarioOverrideRegistry registry;

    @BeforeEach
    void setUp() {
        SimulatorConfig simulatorConfig = new SimulatorConfig();
        simulatorConfig.setCities(List.of("Mumbai", "Delhi", "Chennai"));
        clock = new MutableClock(T0);
        registry = new ScenarioOverrideRegistry(simulatorConfig, clock, eventPublisherHelper);
    }

    private static Map<MetricField, Double> effects(MetricField field, double value) {
        Map<MetricField, Double> effects = new EnumMap<>(MetricField.class);
        effects.put(field, value);
        return effects;
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Unknown city is rejected without any change")
        void rejectsUnknownCity() {
            assertThatThrownBy(() -> registry.apply(
                            "Paris", effects(MetricField.FUEL_PRICE, 3.0), Duration.ofSeconds(10), "FUEL_SPIKE"))
                    .isInstanceOf(InvalidEntityException.class)
                    .hasMessageContaining("Paris");

            assertThat(registry.activeOverrides()).isEmpty();
            verifyNoInteractions(eventPublisherHelper);
        }

        @Test
        @DisplayName("Empty effect set is rejected")
        void rejectsEmptyEffects() {
            assertThatThrownBy(() -> registry.apply("Mumbai", Map.of(), Duration.ofSeconds(10), "CUSTOM"))
                    .isInstanceOf(InvalidEffectTypeException.class);
            assertThat(registry.activeOverride("Mumbai")).isEmpty();
        }

        @Test
        @DisplayName("Index values outside 1-10 are rejected")
        void rejectsIndexOutOfRange() {
            assertThatThrownBy(() -> registry.apply(
                            "Mumbai", effects(MetricField.DEMAND_LEVEL, 11.0), Duration.ofSeconds(10), "CUSTOM"))
                    .isInstanceOf(InvalidEffectTypeException.class);
            assertThatThrownBy(() -> registry.apply(
                            "Mumbai", effects(MetricField.CONGESTION_INDEX, 0.0), Duration.ofSeconds(10), "CUSTOM"))
                    .isInstanceOf(InvalidEffectTypeException.class);
        }

        @Test
        @DisplayName("Fractional index values are rejected, whole ones accepted")
        void rejectsFractionalIndex() {
            assertThatThrownBy(() -> registry.apply(
                            "Mumbai", effects(MetricField.CONGESTION_INDEX, 7.4), Duration.ofSeconds(10), "CUSTOM"))
                    .isInstanceOf(InvalidEffectTypeException.class)
                    .hasMessageContaining("whole number")
                    .satisfies(e -> assertThat(((InvalidEffectTypeException) e).getDetails())
                            .containsEntry("effect", "CONGESTION_INDEX")
                            .containsEntry("value", "7.4"));
            assertThat(registry.activeOverrides()).isEmpty();

            ScenarioOverride override = registry.apply(
                    "Mumbai", effects(MetricField.CONGESTION_INDEX, 7.0), Duration.ofSeconds(10), "CUSTOM");
            assertThat(override.getEffects()).containsEntry(MetricField.CONGESTION_INDEX, 7.0);
        }

        @Test
        @DisplayName("Non-positive fuel price is rejected")
        void rejectsNonPositiveFuel() {
            assertThatThrownBy(() -> registry.apply(
                            "Mumbai", effects(MetricField.FUEL_PRICE, -1.0), Duration.ofSeconds(10), "CUSTOM"))
                    .isInstanceOf(InvalidEffectTypeException.class);
        }

        @Test
        @DisplayName("Zero and negative durations are rejected")
        void rejectsNonPositiveDuration() {
            assertThatThrownBy(() ->
                            registry.apply("Mumbai", effects(MetricField.FUEL_PRICE, 3.0), Duration.ZERO, "CUSTOM"))
                    .isInstanceOf(InvalidDurationException.class);
            assertThatThrownBy(() -> registry.apply(
                            "Mumbai", effects(MetricField.FUEL_PRICE, 3.0), Duration.ofSeconds(-5), "CUSTOM"))
                    .isInstanceOf(InvalidDurationException.class);
            assertThat(registry.activeOverrides()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Replacement")
    class Replacement {

        @Test
        @DisplayName("A second apply replaces the first, effects and expiry")
        void lastApplyWins() {
            ScenarioOverride first = registry.apply(
                    "Delhi", effects(MetricField.FUEL_PRICE, 3.0), Duration.ofSeconds(60), "FUEL_SPIKE");
            clock.advance(Duration.ofSeconds(1));
            ScenarioOverride second = registry.apply(
                    "Delhi", effects(MetricField.DEMAND_LEVEL, 10.0), Duration.ofSeconds(5), "DEMAND_SURGE");

            ScenarioOverride active = registry.activeOverride("Delhi").orElseThrow();
            assertThat(active).isEqualTo(second);
            assertThat(active.getEffects()).containsOnlyKeys(MetricField.DEMAND_LEVEL);
            assertThat(active.getExpiresAt()).isEqualTo(T0.plusSeconds(6));
            assertThat(second.getVersion()).isGreaterThan(first.getVersion());
            verify(eventPublisherHelper).publishScenarioApplied(registry, first);
            verify(eventPublisherHelper).publishScenarioReplaced(registry, second, first);

            // The replaced override never comes back, even while it would still be unexpired
            clock.advance(Duration.ofSeconds(10));
            assertThat(registry.activeOverride("Delhi")).isEmpty();
        }

        @Test
        @DisplayName("Applies for different cities do not interfere")
        void citiesAreIndependent() {
            registry.apply("Mumbai", effects(MetricField.FUEL_PRICE, 3.0), Duration.ofSeconds(60), "FUEL_SPIKE");
            registry.apply(
                    "Chennai", effects(MetricField.CONGESTION_INDEX, 10.0), Duration.ofSeconds(60), "TRAFFIC_JAM");

            assertThat(registry.activeOverrides()).containsOnlyKeys("Mumbai", "Chennai");
        }

        @Test
        @DisplayName("Concurrent applies for one city resolve to the highest version")
        void concurrentAppliesResolveToOneWinner() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<ScenarioOverride>> futures = new ArrayList<>();
            try {
                for (int i = 1; i <= 8; i++) {
                    int demand = i + 2;
                    Callable<ScenarioOverride> apply = () -> {
                        start.await();
                        return registry.apply(
                                "Mumbai", effects(MetricField.DEMAND_LEVEL, demand), Duration.ofSeconds(30), "CUSTOM");
                    };
                    futures.add(executor.submit(apply));
                }
                start.countDown();

                long maxVersion = 0;
                for (Future<ScenarioOverride> future : futures) {
                    maxVersion = Math.max(maxVersion, future.get().getVersion());
                }

                ScenarioOverride winner = registry.activeOverride("Mumbai").orElseThrow();
                assertThat(winner.getVersion()).isEqualTo(maxVersion);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("Visible for every instant in [t0, t0+d) and gone at t0+d")
        void expiresAtBoundary() {
            registry.apply("Mumbai", effects(MetricField.FUEL_PRICE, 3.0), Duration.ofSeconds(10), "FUEL_SPIKE");

            assertThat(registry.activeOverride("Mumbai", T0)).isPresent();
            assertThat(registry.activeOverride("Mumbai", T0.plusMillis(9_999))).isPresent();
            assertThat(registry.activeOverride("Mumbai", T0.plusSeconds(10))).isEmpty();
            // Removed by the read above
            assertThat(registry.activeOverride("Mumbai", T0.plusMillis(9_999))).isEmpty();
        }

        @Test
        @DisplayName("Lazy expiry publishes an EXPIRED event once")
        void lazyExpiryPublishesOnce() {
            ScenarioOverride override = registry.apply(
                    "Mumbai", effects(MetricField.FUEL_PRICE, 3.0), Duration.ofSeconds(10), "FUEL_SPIKE");
            clock.advance(Duration.ofSeconds(10));

            assertThat(registry.activeOverride("Mumbai")).isEmpty();
            assertThat(registry.activeOverride("Mumbai")).isEmpty();

            verify(eventPublisherHelper).publishScenarioExpired(registry, override);
        }

        @Test
        @DisplayName("Sweep removes only expired overrides")
        void sweepRemovesExpired() {
            registry.apply("Mumbai", effects(MetricField.FUEL_PRICE, 3.0), Duration.ofSeconds(5), "FUEL_SPIKE");
            registry.apply("Delhi", effects(MetricField.FUEL_PRICE, 3.0), Duration.ofSeconds(60), "FUEL_SPIKE");
            clock.advance(Duration.ofSeconds(5));

            assertThat(registry.sweepExpired()).isEqualTo(1);
            assertThat(registry.activeOverrides()).containsOnlyKeys("Delhi");
            assertThat(registry.sweepExpired()).isZero();
        }

        @Test
        @DisplayName("Replacing an unswept expired override reports its end, then a fresh apply")
        void applyAfterExpiryIsFresh() {
            ScenarioOverride first = registry.apply(
                    "Mumbai", effects(MetricField.FUEL_PRICE, 3.0), Duration.ofSeconds(5), "FUEL_SPIKE");
            clock.advance(Duration.ofSeconds(6));

            ScenarioOverride next = registry.apply(
                    "Mumbai", effects(MetricField.DEMAND_LEVEL, 10.0), Duration.ofSeconds(5), "DEMAND_SURGE");

            InOrder inOrder = inOrder(eventPublisherHelper);
            inOrder.verify(eventPublisherHelper).publishScenarioApplied(registry, first);
            inOrder.verify(eventPublisherHelper).publishScenarioExpired(registry, first);
            inOrder.verify(eventPublisherHelper).publishScenarioApplied(registry, next);
            verify(eventPublisherHelper, never()).publishScenarioReplaced(any(), any(), any());
            assertThat(registry.activeOverride("Mumbai")).contains(next);
        }

        @Test
        @DisplayName("Expired override replaced before the sweep is not reported twice")
        void expiredReplacedThenSweptOnce() {
            ScenarioOverride first = registry.apply(
                    "Mumbai", effects(MetricField.FUEL_PRICE, 3.0), Duration.ofSeconds(5), "FUEL_SPIKE");
            clock.advance(Duration.ofSeconds(6));
            registry.apply("Mumbai", effects(MetricField.DEMAND_LEVEL, 10.0), Duration.ofSeconds(5), "DEMAND_SURGE");

            assertThat(registry.sweepExpired()).isZero();
            verify(eventPublisherHelper, times(1)).publishScenarioExpired(registry, first);
        }
    }

    @Nested
    @DisplayName("Clear")
    class Clear {

        @Test
        @DisplayName("Removes the override and reports whether one existed")
        void clearsOverride() {
            ScenarioOverride override = registry.apply(
                    "Chennai", effects(MetricField.CONGESTION_INDEX, 10.0), Duration.ofSeconds(60), "TRAFFIC_JAM");

            assertThat(registry.clear("Chennai")).isTrue();
            assertThat(registry.clear("Chennai")).isFalse();
            assertThat(registry.activeOverride("Chennai")).isEmpty();
            verify(eventPublisherHelper).publishScenarioCleared(registry, override);
        }

        @Test
        @DisplayName("Unknown city is rejected")
        void rejectsUnknownCity() {
            assertThatThrownBy(() -> registry.clear("Paris")).isInstanceOf(InvalidEntityException.class);
        }
    }
}
