package com.dynamicpricing.unit.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dynamicpricing.domain.model.EntityState;
import com.dynamicpricing.domain.model.PricingSnapshot;
import com.dynamicpricing.state.EntityStateStore;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EntityStateStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private final EntityStateStore entityStateStore = new EntityStateStore();

    private static PricingSnapshot snapshot(long tick, String... cities) {
        Map<String, EntityState> states = new LinkedHashMap<>();
        for (String city : cities) {
            states.put(
                    city,
                    EntityState.builder()
                            .entityId(city)
                            .fuelPrice(2.0)
                            .congestionIndex(5)
                            .demandLevel(5)
                            .priceMultiplier(1.1)
                            .explanation("tick " + tick)
                            .generatedAt(T0.plusSeconds(tick * 5))
                            .build());
        }
        return new PricingSnapshot(tick, T0.plusSeconds(tick * 5), states);
    }

    @Test
    @DisplayName("Empty before the first tick")
    void emptyInitially() {
        assertThat(entityStateStore.isEmpty()).isTrue();
        assertThat(entityStateStore.getAll().getTick()).isZero();
        assertThat(entityStateStore.get("Mumbai")).isEmpty();
    }

    @Test
    @DisplayName("Replace swaps the whole snapshot")
    void replaceSwapsSnapshot() {
        entityStateStore.replace(snapshot(1, "Mumbai", "Delhi"));
        PricingSnapshot second = snapshot(2, "Mumbai", "Delhi");

        entityStateStore.replace(second);

        assertThat(entityStateStore.getAll()).isSameAs(second);
        assertThat(entityStateStore.get("Delhi")).get().extracting(EntityState::getExplanation).isEqualTo("tick 2");
    }

    @Test
    @DisplayName("Rejects a snapshot that is not newer")
    void rejectsOlderTick() {
        entityStateStore.replace(snapshot(3, "Mumbai"));

        assertThatThrownBy(() -> entityStateStore.replace(snapshot(3, "Mumbai")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> entityStateStore.replace(snapshot(2, "Mumbai")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(entityStateStore.getAll().getTick()).isEqualTo(3);
    }

    @Test
    @DisplayName("Unknown city is absent")
    void unknownCity() {
        entityStateStore.replace(snapshot(1, "Mumbai"));

        assertThat(entityStateStore.get("Paris")).isEmpty();
    }
}
