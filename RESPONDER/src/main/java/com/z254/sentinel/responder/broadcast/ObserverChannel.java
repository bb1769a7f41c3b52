package com.z254.sentinel.responder.broadcast;

/**
 * Outbound channel to one connected observer.
 */
public interface ObserverChannel {

    /**
     * User name the channel belongs to; one channel per name.
     */
    String name();

    /**
     * Hand a serialized event to the observer. Must not block on network I/O;
     * throwing marks the channel as failed.
     */
    void send(String payload);

    default void close() {
    }
}
