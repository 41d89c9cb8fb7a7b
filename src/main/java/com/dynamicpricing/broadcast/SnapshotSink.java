package com.dynamicpricing.broadcast;

import com.dynamicpricing.domain.model.PricingSnapshot;

/**
 * Push target of a subscriber, typically a transport session.
 *
 * <p>Called from a delivery thread, one snapshot at a time per subscriber and in tick order.
 * Throwing from {@link #deliver} marks the delivery as failed and disconnects the subscriber.
 */
@FunctionalInterface
public interface SnapshotSink {

    void deliver(PricingSnapshot snapshot);
}
