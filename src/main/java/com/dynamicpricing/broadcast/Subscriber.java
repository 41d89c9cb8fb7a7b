package com.dynamicpricing.broadcast;

import com.dynamicpricing.domain.model.PricingSnapshot;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One connection handle inside the {@link BroadcastHub}.
 *
 * <p>Owns a bounded queue of pending snapshots. Snapshots are only accepted in strictly
 * increasing tick order, so a subscriber never observes a snapshot older than one it was
 * already given, even when the initial snapshot races with a publish.
 *
 * <p>A subscriber with a {@link SnapshotSink} is drained by the hub; one without is a pull
 * stream read through {@link #poll(Duration)}.
 */
public class Subscriber {

    public enum OfferResult {
        ACCEPTED,
        STALE,
        OVERFLOW,
        CLOSED
    }

    private final String id;
    private final SnapshotSink sink;
    private final BlockingQueue<PricingSnapshot> queue;
    private final AtomicReference<SubscriberState> state = new AtomicReference<>(SubscriberState.CONNECTING);
    private final AtomicBoolean draining = new AtomicBoolean();

    private long lastEnqueuedTick = -1;

    Subscriber(String id, SnapshotSink sink, int queueCapacity) {
        this.id = id;
        this.sink = sink;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
    }

    public String getId() {
        return id;
    }

    public SubscriberState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == SubscriberState.CONNECTED;
    }

    public int pending() {
        return queue.size();
    }

    /**
     * Waits up to {@code timeout} for the next snapshot.
     *
     * @return the snapshot, or {@code null} if none arrived or the subscriber is disconnected and drained
     */
    public PricingSnapshot poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    PricingSnapshot pollNow() {
        return queue.poll();
    }

    SnapshotSink getSink() {
        return sink;
    }

    boolean hasSink() {
        return sink != null;
    }

    synchronized OfferResult offer(PricingSnapshot snapshot) {
        if (state.get() == SubscriberState.DISCONNECTED) {
            return OfferResult.CLOSED;
        }
        if (snapshot.getTick() <= lastEnqueuedTick) {
            return OfferResult.STALE;
        }
        if (!queue.offer(snapshot)) {
            return OfferResult.OVERFLOW;
        }
        lastEnqueuedTick = snapshot.getTick();
        return OfferResult.ACCEPTED;
    }

    boolean markConnected() {
        return state.compareAndSet(SubscriberState.CONNECTING, SubscriberState.CONNECTED);
    }

    /** Returns false if the subscriber was already disconnected. */
    boolean markDisconnected() {
        SubscriberState previous = state.getAndSet(SubscriberState.DISCONNECTED);
        if (previous == SubscriberState.DISCONNECTED) {
            return false;
        }
        if (hasSink()) {
            queue.clear();
        }
        return true;
    }

    boolean tryStartDrain() {
        return draining.compareAndSet(false, true);
    }

    void finishDrain() {
        draining.set(false);
    }
}
