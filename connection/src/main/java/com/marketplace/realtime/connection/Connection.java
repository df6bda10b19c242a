package com.marketplace.realtime.connection;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One pooled channel bound to a topic. Every field except the counters is guarded by the
 * owning {@link DefaultConnectionManager}'s lock.
 *
 * <p>Reconnecting reuses this object with a fresh channel. {@link #generation} is bumped on
 * every reopen so callbacks still arriving from a replaced channel can be recognised and
 * ignored.
 */
final class Connection {

    final String topic;
    final ChannelOptions options;
    final Map<String, HandlerRegistration> handlers = new LinkedHashMap<>();
    final AtomicLong messageCount = new AtomicLong();
    final AtomicLong errorCount = new AtomicLong();

    RealtimeChannel channel;
    ChannelToken token;
    long generation;
    ConnectionStatus status = ConnectionStatus.CONNECTING;
    /** Last event, status, accepted ping or open attempt; drives staleness. */
    long lastActivity;
    /** Last delivered event or attached handler; drives pool reclamation. */
    long lastUsed;
    int reconnectAttempts;
    ScheduledFuture<?> reconnectTask;
    ScheduledFuture<?> cleanupTask;
    boolean closed;

    Connection(String topic, ChannelOptions options, long now) {
        this.topic = topic;
        this.options = options;
        this.lastActivity = now;
        this.lastUsed = now;
    }

    ConnectionSnapshot snapshot() {
        return new ConnectionSnapshot(topic, status, handlers.size(), messageCount.get(), errorCount.get(),
                lastActivity, reconnectAttempts);
    }

    @Override
    public String toString() {
        return "Connection{topic=" + topic + ", status=" + status + ", handlers=" + handlers.size() + "}";
    }
}
