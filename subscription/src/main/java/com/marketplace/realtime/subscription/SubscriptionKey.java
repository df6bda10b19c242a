package com.marketplace.realtime.subscription;

import java.util.Objects;

/**
 * Identity of a registration for deduplication: the same consumer asking for the same spec.
 */
final class SubscriptionKey {

    private final String consumerId;
    private final TopicSpec topicSpec;

    SubscriptionKey(String consumerId, TopicSpec topicSpec) {
        this.consumerId = consumerId;
        this.topicSpec = topicSpec;
    }

    String getConsumerId() {
        return consumerId;
    }

    TopicSpec getTopicSpec() {
        return topicSpec;
    }

    /**
     * @return {@code sub_<consumerId>_<fingerprint>}, unique only up to fingerprint collisions
     */
    String baseId() {
        return "sub_" + consumerId + "_" + topicSpec.fingerprint();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubscriptionKey)) {
            return false;
        }
        SubscriptionKey that = (SubscriptionKey) o;
        return consumerId.equals(that.consumerId) && topicSpec.equals(that.topicSpec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(consumerId, topicSpec);
    }

    @Override
    public String toString() {
        return consumerId + "/" + topicSpec;
    }
}
