package com.marketplace.realtime.subscription;

import com.marketplace.realtime.connection.Subscription;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Subscriptions fed by one connection subscription. The master is the member that opened it;
 * when it leaves, the oldest remaining member takes over. The connection subscription belongs
 * to the group and is closed with it.
 *
 * <p>A shared group is indexed by its spec so later subscriptions can join it. A private group
 * holds a single subscription and is used when grouping is disabled. Guarded by the
 * optimizer's lock.
 */
final class SubscriptionGroup {

    final TopicSpec topicSpec;
    final boolean shared;
    final long createdAt;
    final Map<String, ManagedSubscription> members = new LinkedHashMap<>();
    ManagedSubscription master;
    Subscription connectionSubscription;
    boolean closed;

    SubscriptionGroup(TopicSpec topicSpec, boolean shared, ManagedSubscription master, long now) {
        this.topicSpec = topicSpec;
        this.shared = shared;
        this.createdAt = now;
        this.master = master;
        members.put(master.id, master);
    }

    @Override
    public String toString() {
        return "SubscriptionGroup{spec=" + topicSpec + ", members=" + members.size()
                + ", master=" + (master == null ? null : master.id) + "}";
    }
}
