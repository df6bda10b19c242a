package com.marketplace.realtime.subscription;

/**
 * Handle of one callback registered through {@link SubscriptionOptimizer#subscribe}.
 */
public final class OptimizedSubscription {

    private final String subscriptionId;
    private final TopicSpec topicSpec;
    private final boolean deduplicated;
    private final boolean grouped;
    private final CallbackEntry entry;
    private final DefaultSubscriptionOptimizer optimizer;

    OptimizedSubscription(String subscriptionId, TopicSpec topicSpec, boolean deduplicated, boolean grouped,
                          CallbackEntry entry, DefaultSubscriptionOptimizer optimizer) {
        this.subscriptionId = subscriptionId;
        this.topicSpec = topicSpec;
        this.deduplicated = deduplicated;
        this.grouped = grouped;
        this.entry = entry;
        this.optimizer = optimizer;
    }

    /**
     * @return the id of the subscription this callback belongs to; callbacks deduplicated onto
     *         the same subscription share it
     */
    public String getSubscriptionId() {
        return subscriptionId;
    }

    public TopicSpec getTopicSpec() {
        return topicSpec;
    }

    /**
     * @return {@code true} if the callback was attached to an existing identical subscription
     */
    public boolean isDeduplicated() {
        return deduplicated;
    }

    /**
     * @return {@code true} if the subscription joined an existing group instead of opening its
     *         own connection subscription
     */
    public boolean isGrouped() {
        return grouped;
    }

    public boolean isActive() {
        return entry.isActive();
    }

    /**
     * Removes this callback only. The subscription goes away with its last callback. Idempotent.
     */
    public void unsubscribe() {
        optimizer.removeCallback(subscriptionId, entry);
    }

    @Override
    public String toString() {
        return "OptimizedSubscription{id=" + subscriptionId + ", spec=" + topicSpec + ", deduplicated=" + deduplicated
                + ", grouped=" + grouped + ", active=" + isActive() + "}";
    }
}
