package com.marketplace.realtime.subscription;

/**
 * Point-in-time statistics of a {@link SubscriptionOptimizer}. Totals are counted since
 * creation or the last {@link SubscriptionOptimizer#cleanup()}.
 */
public final class OptimizerStats {

    private final long totalSubscriptions;
    private final int activeSubscriptions;
    private final long optimizedSubscriptions;
    private final long deduplicatedSubscriptions;
    private final int activeConsumers;
    private final int subscriptionGroups;
    private final long callbackErrors;

    OptimizerStats(long totalSubscriptions, int activeSubscriptions, long optimizedSubscriptions,
                   long deduplicatedSubscriptions, int activeConsumers, int subscriptionGroups,
                   long callbackErrors) {
        this.totalSubscriptions = totalSubscriptions;
        this.activeSubscriptions = activeSubscriptions;
        this.optimizedSubscriptions = optimizedSubscriptions;
        this.deduplicatedSubscriptions = deduplicatedSubscriptions;
        this.activeConsumers = activeConsumers;
        this.subscriptionGroups = subscriptionGroups;
        this.callbackErrors = callbackErrors;
    }

    /**
     * @return subscriptions created, grouped or not; deduplicated callbacks are not counted
     */
    public long getTotalSubscriptions() {
        return totalSubscriptions;
    }

    public int getActiveSubscriptions() {
        return activeSubscriptions;
    }

    /**
     * @return subscriptions that joined an existing group
     */
    public long getOptimizedSubscriptions() {
        return optimizedSubscriptions;
    }

    /**
     * @return callbacks attached to an already existing identical subscription
     */
    public long getDeduplicatedSubscriptions() {
        return deduplicatedSubscriptions;
    }

    public int getActiveConsumers() {
        return activeConsumers;
    }

    public int getSubscriptionGroups() {
        return subscriptionGroups;
    }

    public long getCallbackErrors() {
        return callbackErrors;
    }

    public double getAverageSubscriptionsPerConsumer() {
        return activeConsumers == 0 ? 0.0 : (double) activeSubscriptions / activeConsumers;
    }

    /**
     * @return optimized / total, between 0 and 1
     */
    public double getOptimizationRate() {
        return totalSubscriptions == 0 ? 0.0 : (double) optimizedSubscriptions / totalSubscriptions;
    }

    @Override
    public String toString() {
        return "OptimizerStats{total=" + totalSubscriptions + ", active=" + activeSubscriptions
                + ", optimized=" + optimizedSubscriptions + ", deduplicated=" + deduplicatedSubscriptions
                + ", consumers=" + activeConsumers + ", groups=" + subscriptionGroups
                + ", callbackErrors=" + callbackErrors
                + ", optimizationRate=" + String.format("%.2f", getOptimizationRate()) + "}";
    }
}
