package com.marketplace.realtime.subscription;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable configuration of a {@link DefaultSubscriptionOptimizer}.
 *
 * <p>{@link #fromProperties(Properties)} reads overrides from keys prefixed with
 * {@value #PREFIX}; durations are given in milliseconds.
 */
public final class OptimizerConfig {

    public static final String PREFIX = "realtime.optimizer.";
    public static final String DEFAULT_CALLBACK_QUEUE = "subscription_callbacks";

    private static final OptimizerConfig DEFAULTS = builder().build();

    private final int maxSubscriptionsPerConsumer;
    private final Duration subscriptionTimeout;
    private final Duration cleanupInterval;
    private final boolean enableBatching;
    private final boolean enableDeduplication;
    private final boolean enableThrottling;
    private final Duration throttleDelay;
    private final boolean enablePrioritization;
    private final String callbackQueueName;
    private final int callbackBatchSize;
    private final Duration callbackBatchTimeout;

    private OptimizerConfig(Builder builder) {
        if (builder.maxSubscriptionsPerConsumer <= 0) {
            throw new IllegalArgumentException("maxSubscriptionsPerConsumer must be positive");
        }
        if (builder.callbackBatchSize <= 0) {
            throw new IllegalArgumentException("callbackBatchSize must be positive");
        }
        Objects.requireNonNull(builder.callbackQueueName, "callbackQueueName");
        if (builder.callbackQueueName.trim().isEmpty()) {
            throw new IllegalArgumentException("callbackQueueName must not be blank");
        }
        this.maxSubscriptionsPerConsumer = builder.maxSubscriptionsPerConsumer;
        this.subscriptionTimeout = requirePositive(builder.subscriptionTimeout, "subscriptionTimeout");
        this.cleanupInterval = requirePositive(builder.cleanupInterval, "cleanupInterval");
        this.enableBatching = builder.enableBatching;
        this.enableDeduplication = builder.enableDeduplication;
        this.enableThrottling = builder.enableThrottling;
        this.throttleDelay = requireNonNegative(builder.throttleDelay, "throttleDelay");
        this.enablePrioritization = builder.enablePrioritization;
        this.callbackQueueName = builder.callbackQueueName;
        this.callbackBatchSize = builder.callbackBatchSize;
        this.callbackBatchTimeout = requireNonNegative(builder.callbackBatchTimeout, "callbackBatchTimeout");
    }

    public static OptimizerConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from {@code properties}, falling back to the defaults for absent
     * keys.
     *
     * @throws IllegalArgumentException if a present value cannot be parsed or is out of range
     */
    public static OptimizerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String value;
        if ((value = properties.getProperty(PREFIX + "maxSubscriptionsPerConsumer")) != null) {
            builder.maxSubscriptionsPerConsumer(parseInt("maxSubscriptionsPerConsumer", value));
        }
        if ((value = properties.getProperty(PREFIX + "subscriptionTimeoutMs")) != null) {
            builder.subscriptionTimeout(Duration.ofMillis(parseLong("subscriptionTimeoutMs", value)));
        }
        if ((value = properties.getProperty(PREFIX + "cleanupIntervalMs")) != null) {
            builder.cleanupInterval(Duration.ofMillis(parseLong("cleanupIntervalMs", value)));
        }
        if ((value = properties.getProperty(PREFIX + "enableBatching")) != null) {
            builder.enableBatching(Boolean.parseBoolean(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "enableDeduplication")) != null) {
            builder.enableDeduplication(Boolean.parseBoolean(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "enableThrottling")) != null) {
            builder.enableThrottling(Boolean.parseBoolean(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "throttleDelayMs")) != null) {
            builder.throttleDelay(Duration.ofMillis(parseLong("throttleDelayMs", value)));
        }
        if ((value = properties.getProperty(PREFIX + "enablePrioritization")) != null) {
            builder.enablePrioritization(Boolean.parseBoolean(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "callbackQueueName")) != null) {
            builder.callbackQueueName(value.trim());
        }
        if ((value = properties.getProperty(PREFIX + "callbackBatchSize")) != null) {
            builder.callbackBatchSize(parseInt("callbackBatchSize", value));
        }
        if ((value = properties.getProperty(PREFIX + "callbackBatchTimeoutMs")) != null) {
            builder.callbackBatchTimeout(Duration.ofMillis(parseLong("callbackBatchTimeoutMs", value)));
        }
        return builder.build();
    }

    /**
     * @return active subscriptions a consumer may hold before its least recently accessed ones
     *         are evicted
     */
    public int getMaxSubscriptionsPerConsumer() {
        return maxSubscriptionsPerConsumer;
    }

    public Duration getSubscriptionTimeout() {
        return subscriptionTimeout;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    /**
     * @return whether subscriptions to the same spec share one connection subscription
     */
    public boolean isEnableBatching() {
        return enableBatching;
    }

    public boolean isEnableDeduplication() {
        return enableDeduplication;
    }

    public boolean isEnableThrottling() {
        return enableThrottling;
    }

    public Duration getThrottleDelay() {
        return throttleDelay;
    }

    public boolean isEnablePrioritization() {
        return enablePrioritization;
    }

    public String getCallbackQueueName() {
        return callbackQueueName;
    }

    public int getCallbackBatchSize() {
        return callbackBatchSize;
    }

    public Duration getCallbackBatchTimeout() {
        return callbackBatchTimeout;
    }

    @Override
    public String toString() {
        return "OptimizerConfig{maxSubscriptionsPerConsumer=" + maxSubscriptionsPerConsumer
                + ", subscriptionTimeout=" + subscriptionTimeout
                + ", cleanupInterval=" + cleanupInterval
                + ", enableBatching=" + enableBatching
                + ", enableDeduplication=" + enableDeduplication
                + ", enableThrottling=" + enableThrottling
                + ", throttleDelay=" + throttleDelay
                + ", enablePrioritization=" + enablePrioritization
                + ", callbackQueueName=" + callbackQueueName
                + ", callbackBatchSize=" + callbackBatchSize
                + ", callbackBatchTimeout=" + callbackBatchTimeout + "}";
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    public static final class Builder {

        private int maxSubscriptionsPerConsumer = 10;
        private Duration subscriptionTimeout = Duration.ofMinutes(5);
        private Duration cleanupInterval = Duration.ofMinutes(1);
        private boolean enableBatching = true;
        private boolean enableDeduplication = true;
        private boolean enableThrottling = true;
        private Duration throttleDelay = Duration.ofMillis(100);
        private boolean enablePrioritization = true;
        private String callbackQueueName = DEFAULT_CALLBACK_QUEUE;
        private int callbackBatchSize = 20;
        private Duration callbackBatchTimeout = Duration.ofMillis(50);

        private Builder() {
        }

        public Builder maxSubscriptionsPerConsumer(int maxSubscriptionsPerConsumer) {
            this.maxSubscriptionsPerConsumer = maxSubscriptionsPerConsumer;
            return this;
        }

        /**
         * @param subscriptionTimeout idle time after which the sweep removes a subscription
         */
        public Builder subscriptionTimeout(Duration subscriptionTimeout) {
            this.subscriptionTimeout = subscriptionTimeout;
            return this;
        }

        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        public Builder enableBatching(boolean enableBatching) {
            this.enableBatching = enableBatching;
            return this;
        }

        public Builder enableDeduplication(boolean enableDeduplication) {
            this.enableDeduplication = enableDeduplication;
            return this;
        }

        public Builder enableThrottling(boolean enableThrottling) {
            this.enableThrottling = enableThrottling;
            return this;
        }

        public Builder throttleDelay(Duration throttleDelay) {
            this.throttleDelay = throttleDelay;
            return this;
        }

        public Builder enablePrioritization(boolean enablePrioritization) {
            this.enablePrioritization = enablePrioritization;
            return this;
        }

        public Builder callbackQueueName(String callbackQueueName) {
            this.callbackQueueName = callbackQueueName;
            return this;
        }

        public Builder callbackBatchSize(int callbackBatchSize) {
            this.callbackBatchSize = callbackBatchSize;
            return this;
        }

        public Builder callbackBatchTimeout(Duration callbackBatchTimeout) {
            this.callbackBatchTimeout = callbackBatchTimeout;
            return this;
        }

        public OptimizerConfig build() {
            return new OptimizerConfig(this);
        }
    }
}
