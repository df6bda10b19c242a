package com.marketplace.realtime.connection;

/**
 * The change feed the connection manager multiplexes subscriptions onto.
 */
public interface EventSource {

    RealtimeChannel openChannel(String topic, ChannelOptions options);

    /**
     * Closes the channel subscription identified by {@code token}. Closing an unknown or
     * already closed token does nothing.
     */
    void close(ChannelToken token);
}
