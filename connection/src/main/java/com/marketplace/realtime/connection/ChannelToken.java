package com.marketplace.realtime.connection;

import java.util.Objects;

/**
 * Opaque handle of a channel subscription, used to close it through {@link EventSource}.
 */
public final class ChannelToken {

    private final String topic;
    private final long id;

    public ChannelToken(String topic, long id) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.id = id;
    }

    public String getTopic() {
        return topic;
    }

    public long getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChannelToken)) {
            return false;
        }
        ChannelToken that = (ChannelToken) o;
        return id == that.id && topic.equals(that.topic);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, id);
    }

    @Override
    public String toString() {
        return "ChannelToken{" + topic + "#" + id + "}";
    }
}
