package com.marketplace.realtime.connection;

/**
 * Receives the status changes of the connection backing a subscription.
 *
 * <p>Notifications are dispatched through the manager's scheduler, never while the manager's
 * lock is held.
 */
public interface ConnectionStatusListener {

    void onStatusChange(String topic, ChannelStatus status);

    /**
     * Called once when the connection has been closed for good after {@code attempts} failed
     * reconnection attempts. The subscription no longer receives events.
     */
    default void onReconnectExhausted(String topic, int attempts) {
    }
}
