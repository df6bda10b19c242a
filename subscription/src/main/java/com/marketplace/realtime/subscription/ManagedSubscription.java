package com.marketplace.realtime.subscription;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A consumer's registration of interest in one {@link TopicSpec}, shared by every callback the
 * consumer registered for that spec. All fields except the message counter are guarded by the
 * optimizer's lock.
 */
final class ManagedSubscription {

    final String id;
    final SubscriptionKey key;
    final long sequence;
    final long createdAt;
    final Map<Long, CallbackEntry> callbacks = new LinkedHashMap<>();
    final AtomicLong messageCount = new AtomicLong();
    long lastAccessed;
    SubscriptionGroup group;
    boolean removed;

    ManagedSubscription(String id, SubscriptionKey key, long sequence, long now) {
        this.id = id;
        this.key = key;
        this.sequence = sequence;
        this.createdAt = now;
        this.lastAccessed = now;
    }

    String getConsumerId() {
        return key.getConsumerId();
    }

    @Override
    public String toString() {
        return "ManagedSubscription{id=" + id + ", callbacks=" + callbacks.size() + ", lastAccessed=" + lastAccessed
                + ", messages=" + messageCount.get() + "}";
    }
}
