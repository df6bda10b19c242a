package com.marketplace.realtime.connection;

/**
 * Status reported by the event source for a channel subscription.
 */
public enum ChannelStatus {
    SUBSCRIBED,
    TIMED_OUT,
    CLOSED,
    CHANNEL_ERROR;

    /**
     * @return {@code true} for the statuses that send a connection through reconnection
     */
    public boolean isFailure() {
        return this != SUBSCRIBED;
    }
}
