package com.marketplace.realtime.connection;

import java.util.Objects;

/**
 * Out-of-band message sent on a channel, such as a heartbeat ping.
 */
public final class ControlMessage {

    public static final String PING = "ping";

    private final String type;
    private final long timestamp;

    public ControlMessage(String type, long timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.timestamp = timestamp;
    }

    public static ControlMessage ping(long timestamp) {
        return new ControlMessage(PING, timestamp);
    }

    public String getType() {
        return type;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ControlMessage)) {
            return false;
        }
        ControlMessage that = (ControlMessage) o;
        return timestamp == that.timestamp && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, timestamp);
    }

    @Override
    public String toString() {
        return "ControlMessage{type=" + type + ", timestamp=" + timestamp + "}";
    }
}
