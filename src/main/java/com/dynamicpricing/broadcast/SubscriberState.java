package com.dynamicpricing.broadcast;

/** Lifecycle of a broadcast subscriber. {@code DISCONNECTED} is terminal. */
public enum SubscriberState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED
}
