package com.marketplace.realtime.connection;

import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * Multiplexes subscriptions onto a small pool of channels, one per topic, and keeps those
 * channels healthy.
 */
public interface ConnectionManager extends AutoCloseable {

    /**
     * Registers {@code callback} for changes on {@code topic} that pass {@code filter}, opening
     * the topic's connection if none exists yet.
     *
     * <p>When the pool already holds {@code maxConnections} connections, idle connections are
     * reclaimed first. The subscribe proceeds even if none could be reclaimed.
     *
     * @throws IllegalArgumentException if {@code topic} is blank
     * @throws IllegalStateException if the manager has been closed
     */
    Subscription subscribe(@Nonnull String topic, @Nonnull ChangeFilter filter,
                           @Nonnull Consumer<RealtimeEvent> callback, @Nonnull SubscribeOptions options);

    default Subscription subscribe(@Nonnull String topic, @Nonnull ChangeFilter filter,
                                   @Nonnull Consumer<RealtimeEvent> callback) {
        return subscribe(topic, filter, callback, SubscribeOptions.defaults());
    }

    /**
     * Removes a handler. A connection left without handlers is closed after the idle grace
     * period unless a new subscribe reaches it first.
     *
     * @return {@code true} if the subscription was active
     */
    boolean unsubscribe(@Nonnull String subscriptionId);

    /**
     * Closes connections without handlers and connections idle for longer than the idle
     * threshold, least recently active first.
     *
     * @return the number of connections closed
     */
    int optimizeConnections();

    /**
     * Policy hook for platform connectivity signals. Going back online reconnects every
     * connection with a fresh attempt budget; while offline no reconnect is scheduled.
     */
    void onNetworkStatusChanged(boolean online);

    /**
     * Policy hook for foreground/background signals. Heartbeats pause in the background.
     */
    void onVisibilityChanged(boolean foreground);

    ConnectionStats getStats();

    /**
     * Force-closes every connection. The manager stays usable.
     */
    void cleanup();

    /**
     * Closes every connection and stops the manager's timers.
     */
    @Override
    void close();
}
