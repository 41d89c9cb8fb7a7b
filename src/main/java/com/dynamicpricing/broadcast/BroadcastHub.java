package com.dynamicpricing.broadcast;

import com.dynamicpricing.config.BroadcastConfig;
import com.dynamicpricing.domain.model.PricingSnapshot;
import com.dynamicpricing.state.EntityStateStore;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Fans out each tick's snapshot to every connected subscriber.
 *
 * <p>Subscribers go {@code CONNECTING -> CONNECTED -> DISCONNECTED}. Entering
 * {@code CONNECTED} enqueues the current snapshot from the {@link EntityStateStore} so late
 * joiners are not blind until the next tick.
 *
 * <p>{@link #publish} only enqueues; sink delivery runs on the delivery executor, at most one
 * drain per subscriber at a time. A subscriber whose queue is full, or whose sink throws, is
 * disconnected and removed. Neither case affects other subscribers or the caller.
 */
@Component
public class BroadcastHub {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private final EntityStateStore entityStateStore;
    private final Executor deliveryExecutor;
    private final int queueCapacity;

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    @Autowired
    public BroadcastHub(
            EntityStateStore entityStateStore,
            @Qualifier("deliveryExecutor") ThreadPoolTaskExecutor deliveryExecutor,
            BroadcastConfig broadcastConfig) {
        this(entityStateStore, (Executor) deliveryExecutor, broadcastConfig.getSubscriberQueueCapacity());
    }

    public BroadcastHub(EntityStateStore entityStateStore, Executor deliveryExecutor, int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("Subscriber queue capacity must be positive: " + queueCapacity);
        }
        this.entityStateStore = entityStateStore;
        this.deliveryExecutor = deliveryExecutor;
        this.queueCapacity = queueCapacity;
    }

    // ---- Subscription lifecycle ----

    /**
     * Registers a subscriber in {@code CONNECTING} state. It receives nothing until
     * {@link #connect(String)} is called. Registering an id that already exists replaces
     * (and disconnects) the previous subscriber.
     */
    public Subscriber register(String subscriberId, SnapshotSink sink) {
        Subscriber subscriber = new Subscriber(subscriberId, sink, queueCapacity);
        Subscriber previous = subscribers.put(subscriberId, subscriber);
        if (previous != null) {
            previous.markDisconnected();
            log.debug("Subscriber {} re-registered, previous handle closed", subscriberId);
        }
        return subscriber;
    }

    /**
     * Moves a {@code CONNECTING} subscriber to {@code CONNECTED} and enqueues the current snapshot.
     *
     * @return false if the subscriber is unknown or not in {@code CONNECTING}
     */
    public boolean connect(String subscriberId) {
        Subscriber subscriber = subscribers.get(subscriberId);
        if (subscriber == null || !subscriber.markConnected()) {
            return false;
        }
        log.info("Subscriber {} connected ({} connected)", subscriberId, connectedCount());

        PricingSnapshot current = entityStateStore.getAll();
        if (!current.isEmpty()) {
            enqueue(subscriber, current);
        }
        return true;
    }

    /** Opens a pull subscription, already connected. Read it with {@link Subscriber#poll}. */
    public Subscriber subscribe() {
        return subscribe(null);
    }

    /** Opens a push subscription delivering to {@code sink}, already connected. */
    public Subscriber subscribe(SnapshotSink sink) {
        String subscriberId = UUID.randomUUID().toString();
        Subscriber subscriber = register(subscriberId, sink);
        connect(subscriberId);
        return subscriber;
    }

    public boolean unsubscribe(String subscriberId) {
        return disconnect(subscriberId, "unsubscribed");
    }

    /** Releases the subscriber. Idempotent. */
    public boolean disconnect(String subscriberId, String reason) {
        Subscriber subscriber = subscribers.remove(subscriberId);
        if (subscriber == null || !subscriber.markDisconnected()) {
            return false;
        }
        log.info("Subscriber {} disconnected: {}", subscriberId, reason);
        return true;
    }

    // ---- Publication ----

    /**
     * Enqueues {@code snapshot} for every connected subscriber. Never blocks on a subscriber
     * and never throws because of one.
     */
    public void publish(PricingSnapshot snapshot) {
        for (Subscriber subscriber : subscribers.values()) {
            if (subscriber.isConnected()) {
                enqueue(subscriber, snapshot);
            }
        }
    }

    private void enqueue(Subscriber subscriber, PricingSnapshot snapshot) {
        Subscriber.OfferResult result = subscriber.offer(snapshot);
        switch (result) {
            case ACCEPTED -> scheduleDrain(subscriber);
            case OVERFLOW -> {
                log.warn(
                        "Subscriber {} fell {} snapshots behind at tick {}, dropping",
                        subscriber.getId(),
                        subscriber.pending(),
                        snapshot.getTick());
                drop(subscriber, "queue overflow");
            }
            case STALE -> log.debug(
                    "Skipped tick {} for subscriber {}: already has a newer one",
                    snapshot.getTick(),
                    subscriber.getId());
            case CLOSED -> {
                // raced with disconnect
            }
        }
    }

    private void scheduleDrain(Subscriber subscriber) {
        if (!subscriber.hasSink() || !subscriber.tryStartDrain()) {
            return;
        }
        try {
            deliveryExecutor.execute(() -> drain(subscriber));
        } catch (RejectedExecutionException e) {
            subscriber.finishDrain();
            log.warn("Delivery executor rejected drain for subscriber {}", subscriber.getId());
            drop(subscriber, "delivery rejected");
        }
    }

    private void drain(Subscriber subscriber) {
        while (true) {
            PricingSnapshot snapshot;
            while ((snapshot = subscriber.pollNow()) != null) {
                if (subscriber.getState() == SubscriberState.DISCONNECTED) {
                    subscriber.finishDrain();
                    return;
                }
                try {
                    subscriber.getSink().deliver(snapshot);
                } catch (RuntimeException e) {
                    subscriber.finishDrain();
                    log.warn("Delivery to subscriber {} failed: {}", subscriber.getId(), e.getMessage());
                    drop(subscriber, "delivery failed");
                    return;
                }
            }
            subscriber.finishDrain();
            // A publish may have enqueued after the last poll but before finishDrain
            if (subscriber.pending() == 0 || !subscriber.tryStartDrain()) {
                return;
            }
        }
    }

    private void drop(Subscriber subscriber, String reason) {
        // Conditional remove: the id may already belong to a newer registration
        if (subscribers.remove(subscriber.getId(), subscriber)) {
            subscriber.markDisconnected();
            log.info("Subscriber {} disconnected: {}", subscriber.getId(), reason);
        } else {
            subscriber.markDisconnected();
        }
    }

    // ---- Queries ----

    public Optional<Subscriber> getSubscriber(String subscriberId) {
        return Optional.ofNullable(subscribers.get(subscriberId));
    }

    public int connectedCount() {
        return (int) subscribers.values().stream().filter(Subscriber::isConnected).count();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public List<String> getSubscriberIds() {
        return List.copyOf(subscribers.keySet());
    }
}
