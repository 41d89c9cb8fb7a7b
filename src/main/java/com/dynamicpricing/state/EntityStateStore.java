package com.dynamicpricing.state;

import com.dynamicpricing.domain.model.EntityState;
import com.dynamicpricing.domain.model.PricingSnapshot;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Holds the latest state of every city.
 *
 * <p>The whole tick is swapped in as one immutable {@link PricingSnapshot}, so a reader of
 * {@link #getAll()} sees either tick N or tick N+1 in full. Only the tick scheduler writes.
 */
@Component
public class EntityStateStore {

    private final AtomicReference<PricingSnapshot> current = new AtomicReference<>(PricingSnapshot.empty());

    public Optional<EntityState> get(String entityId) {
        return Optional.ofNullable(current.get().getStates().get(entityId));
    }

    public PricingSnapshot getAll() {
        return current.get();
    }

    public boolean isEmpty() {
        return current.get().isEmpty();
    }

    /**
     * Replaces the stored snapshot.
     *
     * @throws IllegalStateException if {@code snapshot} is not newer than the stored one
     */
    public void replace(PricingSnapshot snapshot) {
        current.getAndUpdate(previous -> {
            if (snapshot.getTick() <= previous.getTick()) {
                throw new IllegalStateException(
                        "Snapshot for tick " + snapshot.getTick() + " is not newer than tick " + previous.getTick());
            }
            return snapshot;
        });
    }
}
