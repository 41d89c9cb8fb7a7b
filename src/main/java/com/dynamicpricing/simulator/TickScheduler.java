package com.dynamicpricing.simulator;

import com.dynamicpricing.broadcast.BroadcastHub;
import com.dynamicpricing.config.SimulatorConfig;
import com.dynamicpricing.domain.Rounding;
import com.dynamicpricing.domain.model.EntityState;
import com.dynamicpricing.domain.model.MetricSample;
import com.dynamicpricing.domain.model.PricingSnapshot;
import com.dynamicpricing.domain.model.ScenarioOverride;
import com.dynamicpricing.domain.model.ScoringResult;
import com.dynamicpricing.event.EventPublisherHelper;
import com.dynamicpricing.scenario.ScenarioOverrideRegistry;
import com.dynamicpricing.scoring.FallbackPricingFormula;
import com.dynamicpricing.scoring.PricingModelAdapter;
import com.dynamicpricing.state.EntityStateStore;
import com.dynamicpricing.state.HistoryBuffer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Produces one consistent snapshot of all cities per tick.
 *
 * <p>Per tick, each city is processed concurrently on the entity executor:
 * <ol>
 *   <li>sample base metrics</li>
 *   <li>replace the fields forced by an active scenario override</li>
 *   <li>score through the {@link PricingModelAdapter} (which falls back on any failure)</li>
 *   <li>build an immutable {@link EntityState}</li>
 * </ol>
 * All cities are joined before the snapshot is stored, appended to history and handed to
 * the {@link BroadcastHub} as one unit. A failing city still yields a fallback state, so
 * every snapshot contains every configured city.
 *
 * <p>Ticks are serialized by a lock and numbered from 1. Override expiry is evaluated against
 * the instant the tick started.
 */
@Service
public class TickScheduler {

    private static final Logger log = LoggerFactory.getLogger(TickScheduler.class);

    private final List<String> cities;
    private final MetricSampler metricSampler;
    private final ScenarioOverrideRegistry scenarioOverrideRegistry;
    private final PricingModelAdapter pricingModelAdapter;
    private final EntityStateStore entityStateStore;
    private final HistoryBuffer historyBuffer;
    private final BroadcastHub broadcastHub;
    private final EventPublisherHelper eventPublisherHelper;
    private final Executor entityExecutor;
    private final Clock clock;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicLong tickCounter = new AtomicLong();
    private volatile Instant lastTickAt;

    @Autowired
    public TickScheduler(
            SimulatorConfig simulatorConfig,
            MetricSampler metricSampler,
            ScenarioOverrideRegistry scenarioOverrideRegistry,
            PricingModelAdapter pricingModelAdapter,
            EntityStateStore entityStateStore,
            HistoryBuffer historyBuffer,
            BroadcastHub broadcastHub,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("entityExecutor") ThreadPoolTaskExecutor entityExecutor,
            Clock clock) {
        this(
                simulatorConfig.getCities(),
                metricSampler,
                scenarioOverrideRegistry,
                pricingModelAdapter,
                entityStateStore,
                historyBuffer,
                broadcastHub,
                eventPublisherHelper,
                (Executor) entityExecutor,
                clock);
    }

    public TickScheduler(
            List<String> cities,
            MetricSampler metricSampler,
            ScenarioOverrideRegistry scenarioOverrideRegistry,
            PricingModelAdapter pricingModelAdapter,
            EntityStateStore entityStateStore,
            HistoryBuffer historyBuffer,
            BroadcastHub broadcastHub,
            EventPublisherHelper eventPublisherHelper,
            Executor entityExecutor,
            Clock clock) {
        if (cities == null || cities.isEmpty()) {
            throw new IllegalStateException(
                    "At least one city must be configured under dynamicpricing.simulator.cities");
        }
        this.cities = List.copyOf(cities);
        this.metricSampler = metricSampler;
        this.scenarioOverrideRegistry = scenarioOverrideRegistry;
        this.pricingModelAdapter = pricingModelAdapter;
        this.entityStateStore = entityStateStore;
        this.historyBuffer = historyBuffer;
        this.broadcastHub = broadcastHub;
        this.eventPublisherHelper = eventPublisherHelper;
        this.entityExecutor = entityExecutor;
        this.clock = clock;
    }

    /**
     * Runs one full tick and returns the published snapshot.
     */
    public PricingSnapshot runTick() {
        tickLock.lock();
        try {
            long startNanos = System.nanoTime();
            long tick = tickCounter.incrementAndGet();
            Instant tickStart = clock.instant();
            PricingSnapshot previous = entityStateStore.getAll();

            List<CompletableFuture<EntityState>> futures = new ArrayList<>(cities.size());
            for (String city : cities) {
                futures.add(CompletableFuture.supplyAsync(
                                () -> computeState(city, tickStart, previous), entityExecutor)
                        .exceptionally(e -> unexpectedFailureState(city, tickStart, previous, e)));
            }

            // Barrier: the snapshot is assembled only after every city completed
            Map<String, EntityState> states = new LinkedHashMap<>();
            int fallbackCount = 0;
            for (int i = 0; i < cities.size(); i++) {
                EntityState state = futures.get(i).join();
                states.put(cities.get(i), state);
                if (state.isFallbackUsed()) {
                    fallbackCount++;
                }
            }

            Instant snapshotAt = max(tickStart, previous.getGeneratedAt());
            PricingSnapshot snapshot = new PricingSnapshot(tick, snapshotAt, Collections.unmodifiableMap(states));

            entityStateStore.replace(snapshot);
            for (EntityState state : states.values()) {
                historyBuffer.append(tick, state);
            }
            broadcastHub.publish(snapshot);
            lastTickAt = tickStart;

            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            eventPublisherHelper.publishPricingTick(this, snapshot, fallbackCount, duration);
            log.debug(
                    "Tick {} published {} cities ({} fallback) in {}ms",
                    tick,
                    states.size(),
                    fallbackCount,
                    duration.toMillis());
            return snapshot;
        } finally {
            tickLock.unlock();
        }
    }

    /** Entry point for the periodic ticker: a failed tick is logged and the next one still runs. */
    public void runTickSafely() {
        try {
            runTick();
        } catch (RuntimeException e) {
            log.error("Tick failed: {}", e.getMessage(), e);
        }
    }

    public Optional<Instant> getLastTickAt() {
        return Optional.ofNullable(lastTickAt);
    }

    /** Number of the last published tick, 0 before the first. */
    public long getTickCount() {
        return entityStateStore.getAll().getTick();
    }

    public List<String> getCities() {
        return cities;
    }

    // ---- Per-city work ----

    private EntityState computeState(String city, Instant tickStart, PricingSnapshot previous) {
        MetricSample sampled = metricSampler.sample();
        Optional<ScenarioOverride> override = scenarioOverrideRegistry.activeOverride(city, tickStart);

        // Score exactly the values that get recorded
        MetricSample recorded = recordedSample(sampled, override);
        ScoringResult result = pricingModelAdapter.score(city, recorded);
        return buildState(city, recorded, result, override.isPresent(), tickStart, previous);
    }

    /**
     * Replacement state when {@link #computeState} threw. An active scenario still forces
     * its fields; a failing lookup leaves the fresh sample unforced.
     */
    private EntityState unexpectedFailureState(String city, Instant tickStart, PricingSnapshot previous, Throwable e) {
        log.error("Unexpected failure computing {} at tick start {}: {}", city, tickStart, e.getMessage(), e);
        MetricSample sampled = metricSampler.sample();
        Optional<ScenarioOverride> override = lookupOverrideQuietly(city, tickStart);
        MetricSample recorded = recordedSample(sampled, override);
        return buildState(
                city, recorded, FallbackPricingFormula.apply(recorded), override.isPresent(), tickStart, previous);
    }

    private Optional<ScenarioOverride> lookupOverrideQuietly(String city, Instant tickStart) {
        try {
            return scenarioOverrideRegistry.activeOverride(city, tickStart);
        } catch (RuntimeException e) {
            log.warn("Scenario lookup failed for {} at tick start {}: {}", city, tickStart, e.getMessage());
            return Optional.empty();
        }
    }

    private static MetricSample recordedSample(MetricSample sampled, Optional<ScenarioOverride> override) {
        MetricSample effective = override.map(o -> o.applyTo(sampled)).orElse(sampled);
        return new MetricSample(
                Rounding.fuelPrice(effective.fuelPrice()), effective.congestionIndex(), effective.demandLevel());
    }

    private static EntityState buildState(
            String city,
            MetricSample sample,
            ScoringResult result,
            boolean scenarioActive,
            Instant tickStart,
            PricingSnapshot previous) {
        EntityState prior = previous.getStates().get(city);
        Instant generatedAt = prior == null ? tickStart : max(tickStart, prior.getGeneratedAt());
        return EntityState.builder()
                .entityId(city)
                .fuelPrice(sample.fuelPrice())
                .congestionIndex(sample.congestionIndex())
                .demandLevel(sample.demandLevel())
                .priceMultiplier(Rounding.multiplier(result.priceMultiplier()))
                .explanation(result.explanation())
                .fallbackUsed(result.fallback())
                .scenarioActive(scenarioActive)
                .generatedAt(generatedAt)
                .build();
    }

    private static Instant max(Instant a, Instant b) {
        return a.isBefore(b) ? b : a;
    }
}
