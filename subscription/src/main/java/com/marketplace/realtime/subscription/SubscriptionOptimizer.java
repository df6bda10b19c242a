package com.marketplace.realtime.subscription;

import com.marketplace.realtime.connection.RealtimeEvent;
import java.util.List;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * Consumer-facing entry point for change subscriptions.
 *
 * <p>Identical registrations of one consumer are deduplicated onto one subscription,
 * subscriptions to the same spec share one connection subscription, and every callback is
 * throttled and prioritized before it runs. A consumer holds a bounded number of
 * subscriptions; subscribing beyond it evicts the consumer's least recently accessed ones
 * rather than failing.
 */
public interface SubscriptionOptimizer extends AutoCloseable {

    default OptimizedSubscription subscribe(@Nonnull String consumerId, @Nonnull TopicSpec topicSpec,
                                            @Nonnull Consumer<RealtimeEvent> callback) {
        return subscribe(consumerId, topicSpec, callback, SubscriptionOptions.defaults());
    }

    /**
     * @throws IllegalArgumentException if {@code consumerId} is blank
     * @throws IllegalStateException    if the optimizer has been closed
     */
    OptimizedSubscription subscribe(@Nonnull String consumerId, @Nonnull TopicSpec topicSpec,
                                    @Nonnull Consumer<RealtimeEvent> callback, @Nonnull SubscriptionOptions options);

    /**
     * Removes a subscription with all its callbacks.
     *
     * @return {@code false} if no such subscription exists
     */
    boolean unsubscribe(@Nonnull String subscriptionId);

    /**
     * Marks a subscription as accessed, protecting it from the idle sweep and from quota
     * eviction for a while.
     *
     * @return {@code false} if no such subscription exists
     */
    boolean touch(@Nonnull String subscriptionId);

    /**
     * @return ids of the consumer's active subscriptions, oldest first
     */
    List<String> getSubscriptionIds(@Nonnull String consumerId);

    /**
     * Removes subscriptions idle for longer than the subscription timeout, and empty groups.
     * Runs periodically on its own.
     *
     * @return the number of removed subscriptions
     */
    int cleanupStaleSubscriptions();

    OptimizerStats getStats();

    /**
     * Removes every subscription and resets the statistics. The instance stays usable.
     */
    void cleanup();

    @Override
    void close();
}
