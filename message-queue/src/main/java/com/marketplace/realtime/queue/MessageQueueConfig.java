package com.marketplace.realtime.queue;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable configuration of a {@link PriorityMessageQueue}.
 *
 * <p>Every value has a default, so {@code MessageQueueConfig.builder().build()} is a usable
 * configuration. {@link #fromProperties(Properties)} reads overrides from keys prefixed with
 * {@value #PREFIX}; durations are given in milliseconds.
 */
public final class MessageQueueConfig {

    public static final String PREFIX = "realtime.queue.";

    private static final MessageQueueConfig DEFAULTS = builder().build();

    private final int maxQueueSize;
    private final int batchSize;
    private final Duration batchTimeout;
    private final Duration processingDelay;
    private final int retryAttempts;
    private final Duration retryDelay;
    private final boolean enablePriority;
    private final boolean enableBatching;
    private final int statisticsWindowSize;

    private MessageQueueConfig(Builder builder) {
        if (builder.maxQueueSize <= 0) {
            throw new IllegalArgumentException("maxQueueSize must be positive");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (builder.retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts must not be negative");
        }
        if (builder.statisticsWindowSize <= 0) {
            throw new IllegalArgumentException("statisticsWindowSize must be positive");
        }
        this.maxQueueSize = builder.maxQueueSize;
        this.batchSize = builder.batchSize;
        this.batchTimeout = requireNonNegative(builder.batchTimeout, "batchTimeout");
        this.processingDelay = requireNonNegative(builder.processingDelay, "processingDelay");
        this.retryAttempts = builder.retryAttempts;
        this.retryDelay = requireNonNegative(builder.retryDelay, "retryDelay");
        this.enablePriority = builder.enablePriority;
        this.enableBatching = builder.enableBatching;
        this.statisticsWindowSize = builder.statisticsWindowSize;
    }

    public static MessageQueueConfig defaults() {
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
    public static MessageQueueConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String value;
        if ((value = properties.getProperty(PREFIX + "maxQueueSize")) != null) {
            builder.maxQueueSize(parseInt("maxQueueSize", value));
        }
        if ((value = properties.getProperty(PREFIX + "batchSize")) != null) {
            builder.batchSize(parseInt("batchSize", value));
        }
        if ((value = properties.getProperty(PREFIX + "batchTimeoutMs")) != null) {
            builder.batchTimeout(Duration.ofMillis(parseLong("batchTimeoutMs", value)));
        }
        if ((value = properties.getProperty(PREFIX + "processingDelayMs")) != null) {
            builder.processingDelay(Duration.ofMillis(parseLong("processingDelayMs", value)));
        }
        if ((value = properties.getProperty(PREFIX + "retryAttempts")) != null) {
            builder.retryAttempts(parseInt("retryAttempts", value));
        }
        if ((value = properties.getProperty(PREFIX + "retryDelayMs")) != null) {
            builder.retryDelay(Duration.ofMillis(parseLong("retryDelayMs", value)));
        }
        if ((value = properties.getProperty(PREFIX + "enablePriority")) != null) {
            builder.enablePriority(Boolean.parseBoolean(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "enableBatching")) != null) {
            builder.enableBatching(Boolean.parseBoolean(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "statisticsWindowSize")) != null) {
            builder.statisticsWindowSize(parseInt("statisticsWindowSize", value));
        }
        return builder.build();
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    public Duration getProcessingDelay() {
        return processingDelay;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public boolean isEnablePriority() {
        return enablePriority;
    }

    public boolean isEnableBatching() {
        return enableBatching;
    }

    public int getStatisticsWindowSize() {
        return statisticsWindowSize;
    }

    @Override
    public String toString() {
        return "MessageQueueConfig{maxQueueSize=" + maxQueueSize
                + ", batchSize=" + batchSize
                + ", batchTimeout=" + batchTimeout
                + ", processingDelay=" + processingDelay
                + ", retryAttempts=" + retryAttempts
                + ", retryDelay=" + retryDelay
                + ", enablePriority=" + enablePriority
                + ", enableBatching=" + enableBatching
                + ", statisticsWindowSize=" + statisticsWindowSize + "}";
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
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

        private int maxQueueSize = 10_000;
        private int batchSize = 50;
        private Duration batchTimeout = Duration.ofSeconds(1);
        private Duration processingDelay = Duration.ofMillis(100);
        private int retryAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private boolean enablePriority = true;
        private boolean enableBatching = true;
        private int statisticsWindowSize = 1000;

        private Builder() {
        }

        public Builder maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder batchTimeout(Duration batchTimeout) {
            this.batchTimeout = batchTimeout;
            return this;
        }

        public Builder processingDelay(Duration processingDelay) {
            this.processingDelay = processingDelay;
            return this;
        }

        /**
         * @param retryAttempts default number of retries after the first failed attempt
         */
        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        /**
         * @param retryDelay base delay of the exponential retry backoff
         */
        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder enablePriority(boolean enablePriority) {
            this.enablePriority = enablePriority;
            return this;
        }

        /**
         * @param enableBatching when {@code false}, batch processors receive single-message batches
         */
        public Builder enableBatching(boolean enableBatching) {
            this.enableBatching = enableBatching;
            return this;
        }

        /**
         * @param statisticsWindowSize number of most recent processing times kept per queue
         */
        public Builder statisticsWindowSize(int statisticsWindowSize) {
            this.statisticsWindowSize = statisticsWindowSize;
            return this;
        }

        public MessageQueueConfig build() {
            return new MessageQueueConfig(this);
        }
    }
}
