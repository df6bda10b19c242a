package com.marketplace.realtime.connection;

/**
 * Handle of a handler registered through {@link ConnectionManager#subscribe}.
 */
public interface Subscription {

    String getSubscriptionId();

    String getTopic();

    /**
     * Removes the handler from its connection. Idempotent.
     */
    void unsubscribe();

    /**
     * @return {@code false} once unsubscribed or once the backing connection was closed
     */
    boolean isActive();
}
