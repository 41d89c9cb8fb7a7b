package com.dynamicpricing.scenario;

import com.dynamicpricing.config.SimulatorConfig;
import com.dynamicpricing.domain.enums.MetricField;
import com.dynamicpricing.domain.model.ScenarioOverride;
import com.dynamicpricing.event.EventPublisherHelper;
import com.dynamicpricing.exception.InvalidDurationException;
import com.dynamicpricing.exception.InvalidEffectTypeException;
import com.dynamicpricing.exception.InvalidEntityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Active scenario overrides, at most one per city.
 *
 * <p>Applying an override for a city that already has one replaces it, expiry included.
 * Concurrent applies for the same city are serialized per key; the one that runs last wins
 * and carries the higher {@link ScenarioOverride#getVersion() version}. Applies for different
 * cities do not contend.
 *
 * <p>Expiry is wall-clock based: an override is visible while {@code now < expiresAt}. Reads
 * drop expired entries lazily, and {@link #sweepExpired()} removes the rest in the background.
 */
@Component
public class ScenarioOverrideRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScenarioOverrideRegistry.class);

    private final Set<String> knownEntities;
    private final Clock clock;
    private final EventPublisherHelper eventPublisherHelper;

    private final ConcurrentHashMap<String, ScenarioOverride> overrides = new ConcurrentHashMap<>();
    private final AtomicLong versions = new AtomicLong();

    public ScenarioOverrideRegistry(
            SimulatorConfig simulatorConfig, Clock clock, EventPublisherHelper eventPublisherHelper) {
        this.knownEntities = Collections.unmodifiableSet(new LinkedHashSet<>(simulatorConfig.getCities()));
        this.clock = clock;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Validates and installs an override for {@code entityId}. Nothing changes on rejection.
     *
     * @param source label stored with the override, e.g. the scenario kind
     * @throws InvalidEntityException      if the city is not simulated
     * @throws InvalidEffectTypeException  if {@code effects} is empty or a value is out of range
     * @throws InvalidDurationException    if {@code duration} is not positive
     */
    public ScenarioOverride apply(String entityId, Map<MetricField, Double> effects, Duration duration, String source) {
        if (entityId == null || !knownEntities.contains(entityId)) {
            throw new InvalidEntityException(entityId);
        }
        Map<MetricField, Double> validatedEffects = validateEffects(effects);
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new InvalidDurationException(duration);
        }

        Instant now = clock.instant();
        ScenarioOverride[] replaced = new ScenarioOverride[1];
        ScenarioOverride installed = overrides.compute(entityId, (key, previous) -> {
            replaced[0] = previous;
            return ScenarioOverride.builder()
                    .entityId(entityId)
                    .source(source)
                    .effects(validatedEffects)
                    .appliedAt(now)
                    .expiresAt(now.plus(duration))
                    .version(versions.incrementAndGet())
                    .build();
        });

        ScenarioOverride previous = replaced[0];
        if (previous != null && !previous.isActiveAt(now)) {
            // Expired but not yet swept: its end is reported before the new one starts
            log.info("Scenario {} for {} has ended", previous.getSource(), entityId);
            eventPublisherHelper.publishScenarioExpired(this, previous);
            previous = null;
        }
        if (previous != null) {
            log.info(
                    "Scenario {} replaced {} for {} until {}",
                    source,
                    previous.getSource(),
                    entityId,
                    installed.getExpiresAt());
            eventPublisherHelper.publishScenarioReplaced(this, installed, previous);
        } else {
            log.info("Applied scenario {} to {} for {}ms: {}", source, entityId, duration.toMillis(), validatedEffects);
            eventPublisherHelper.publishScenarioApplied(this, installed);
        }
        return installed;
    }

    /** The override in force for {@code entityId} at {@code now}, dropping it if expired. */
    public Optional<ScenarioOverride> activeOverride(String entityId, Instant now) {
        ScenarioOverride override = overrides.get(entityId);
        if (override == null) {
            return Optional.empty();
        }
        if (override.isActiveAt(now)) {
            return Optional.of(override);
        }
        expire(entityId, override);
        return Optional.empty();
    }

    public Optional<ScenarioOverride> activeOverride(String entityId) {
        return activeOverride(entityId, clock.instant());
    }

    /** Snapshot of all unexpired overrides keyed by city. */
    public Map<String, ScenarioOverride> activeOverrides() {
        Instant now = clock.instant();
        Map<String, ScenarioOverride> active = new LinkedHashMap<>();
        for (String entityId : knownEntities) {
            activeOverride(entityId, now).ifPresent(o -> active.put(entityId, o));
        }
        return active;
    }

    public int activeCount() {
        return activeOverrides().size();
    }

    /** Removes the override for {@code entityId}, if any. */
    public boolean clear(String entityId) {
        if (entityId == null || !knownEntities.contains(entityId)) {
            throw new InvalidEntityException(entityId);
        }
        ScenarioOverride removed = overrides.remove(entityId);
        if (removed == null) {
            return false;
        }
        log.info("Cleared scenario {} for {}", removed.getSource(), entityId);
        eventPublisherHelper.publishScenarioCleared(this, removed);
        return true;
    }

    /** Removes every expired override. Returns how many were removed. */
    @Scheduled(fixedRateString = "${dynamicpricing.scenario.sweep-interval-ms:1000}")
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, ScenarioOverride> entry : overrides.entrySet()) {
            if (!entry.getValue().isActiveAt(now) && expire(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public Set<String> getKnownEntities() {
        return knownEntities;
    }

    private boolean expire(String entityId, ScenarioOverride override) {
        // Conditional remove: a newer override installed meanwhile must survive
        if (!overrides.remove(entityId, override)) {
            return false;
        }
        log.info("Scenario {} for {} has ended", override.getSource(), entityId);
        eventPublisherHelper.publishScenarioExpired(this, override);
        return true;
    }

    private static Map<MetricField, Double> validateEffects(Map<MetricField, Double> effects) {
        if (effects == null || effects.isEmpty()) {
            throw new InvalidEffectTypeException("Scenario must force at least one metric");
        }
        Map<MetricField, Double> validated = new EnumMap<>(MetricField.class);
        for (Map.Entry<MetricField, Double> entry : effects.entrySet()) {
            MetricField field = entry.getKey();
            Double value = entry.getValue();
            if (field == null || value == null || Double.isNaN(value) || Double.isInfinite(value)) {
                throw InvalidEffectTypeException.invalidEffect(field, value, "Invalid effect " + field + "=" + value);
            }
            if (field.isIndex()) {
                if (value < MetricField.INDEX_MIN || value > MetricField.INDEX_MAX) {
                    throw InvalidEffectTypeException.invalidEffect(
                            field, value, field + " must be between 1 and 10, got " + value);
                }
                if (value != Math.rint(value)) {
                    throw InvalidEffectTypeException.invalidEffect(
                            field, value, field + " must be a whole number, got " + value);
                }
            }
            if (field == MetricField.FUEL_PRICE && value <= 0) {
                throw InvalidEffectTypeException.invalidEffect(
                        field, value, "FUEL_PRICE must be positive, got " + value);
            }
            validated.put(field, value);
        }
        return Collections.unmodifiableMap(validated);
    }
}
