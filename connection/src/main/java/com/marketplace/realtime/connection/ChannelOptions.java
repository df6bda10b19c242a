package com.marketplace.realtime.connection;

import java.util.Objects;

/**
 * Options passed to the event source when a channel is opened.
 */
public final class ChannelOptions {

    private final String presenceKey;
    private final boolean broadcastSelf;
    private final boolean compression;

    public ChannelOptions(String presenceKey, boolean broadcastSelf, boolean compression) {
        this.presenceKey = Objects.requireNonNull(presenceKey, "presenceKey");
        this.broadcastSelf = broadcastSelf;
        this.compression = compression;
    }

    public String getPresenceKey() {
        return presenceKey;
    }

    /**
     * @return whether messages broadcast by this client are echoed back to it
     */
    public boolean isBroadcastSelf() {
        return broadcastSelf;
    }

    /**
     * @return whether the transport should compress traffic, ignored by transports that cannot
     */
    public boolean isCompression() {
        return compression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChannelOptions)) {
            return false;
        }
        ChannelOptions that = (ChannelOptions) o;
        return broadcastSelf == that.broadcastSelf && compression == that.compression
                && presenceKey.equals(that.presenceKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(presenceKey, broadcastSelf, compression);
    }

    @Override
    public String toString() {
        return "ChannelOptions{presenceKey=" + presenceKey + ", broadcastSelf=" + broadcastSelf
                + ", compression=" + compression + "}";
    }
}
