package com.marketplace.realtime.connection;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable configuration of a {@link DefaultConnectionManager}.
 *
 * <p>{@link #fromProperties(Properties)} reads overrides from keys prefixed with
 * {@value #PREFIX}; durations are given in milliseconds.
 */
public final class ConnectionManagerConfig {

    public static final String PREFIX = "realtime.connection.";

    private static final ConnectionManagerConfig DEFAULTS = builder().build();

    private final int maxConnections;
    private final int maxReconnectAttempts;
    private final Duration reconnectDelay;
    private final Duration batchDelay;
    private final Duration heartbeatInterval;
    private final int messageQueueSize;
    private final boolean enableBatching;
    private final boolean enableCompression;
    private final Duration idleGracePeriod;
    private final Duration idleThreshold;

    private ConnectionManagerConfig(Builder builder) {
        if (builder.maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive");
        }
        if (builder.maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must not be negative");
        }
        if (builder.messageQueueSize <= 0) {
            throw new IllegalArgumentException("messageQueueSize must be positive");
        }
        this.maxConnections = builder.maxConnections;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.reconnectDelay = requirePositive(builder.reconnectDelay, "reconnectDelay");
        this.batchDelay = requireNonNegative(builder.batchDelay, "batchDelay");
        this.heartbeatInterval = requirePositive(builder.heartbeatInterval, "heartbeatInterval");
        this.messageQueueSize = builder.messageQueueSize;
        this.enableBatching = builder.enableBatching;
        this.enableCompression = builder.enableCompression;
        this.idleGracePeriod = requireNonNegative(builder.idleGracePeriod, "idleGracePeriod");
        this.idleThreshold = requirePositive(builder.idleThreshold, "idleThreshold");
    }

    public static ConnectionManagerConfig defaults() {
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
    public static ConnectionManagerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String value;
        if ((value = properties.getProperty(PREFIX + "maxConnections")) != null) {
            builder.maxConnections(parseInt("maxConnections", value));
        }
        if ((value = properties.getProperty(PREFIX + "maxReconnectAttempts")) != null) {
            builder.maxReconnectAttempts(parseInt("maxReconnectAttempts", value));
        }
        if ((value = properties.getProperty(PREFIX + "reconnectDelayMs")) != null) {
            builder.reconnectDelay(parseMillis("reconnectDelayMs", value));
        }
        if ((value = properties.getProperty(PREFIX + "batchDelayMs")) != null) {
            builder.batchDelay(parseMillis("batchDelayMs", value));
        }
        if ((value = properties.getProperty(PREFIX + "heartbeatIntervalMs")) != null) {
            builder.heartbeatInterval(parseMillis("heartbeatIntervalMs", value));
        }
        if ((value = properties.getProperty(PREFIX + "messageQueueSize")) != null) {
            builder.messageQueueSize(parseInt("messageQueueSize", value));
        }
        if ((value = properties.getProperty(PREFIX + "enableBatching")) != null) {
            builder.enableBatching(Boolean.parseBoolean(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "enableCompression")) != null) {
            builder.enableCompression(Boolean.parseBoolean(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "idleGracePeriodMs")) != null) {
            builder.idleGracePeriod(parseMillis("idleGracePeriodMs", value));
        }
        if ((value = properties.getProperty(PREFIX + "idleThresholdMs")) != null) {
            builder.idleThreshold(parseMillis("idleThresholdMs", value));
        }
        return builder.build();
    }

    /**
     * @return pool size above which subscribe first reclaims idle connections; not a hard cap
     */
    public int getMaxConnections() {
        return maxConnections;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public Duration getBatchDelay() {
        return batchDelay;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    /**
     * @return number of buffered events that forces a batch to flush before its window ends
     */
    public int getMessageQueueSize() {
        return messageQueueSize;
    }

    public boolean isEnableBatching() {
        return enableBatching;
    }

    public boolean isEnableCompression() {
        return enableCompression;
    }

    public Duration getIdleGracePeriod() {
        return idleGracePeriod;
    }

    public Duration getIdleThreshold() {
        return idleThreshold;
    }

    @Override
    public String toString() {
        return "ConnectionManagerConfig{maxConnections=" + maxConnections
                + ", maxReconnectAttempts=" + maxReconnectAttempts
                + ", reconnectDelay=" + reconnectDelay
                + ", batchDelay=" + batchDelay
                + ", heartbeatInterval=" + heartbeatInterval
                + ", messageQueueSize=" + messageQueueSize
                + ", enableBatching=" + enableBatching
                + ", enableCompression=" + enableCompression
                + ", idleGracePeriod=" + idleGracePeriod
                + ", idleThreshold=" + idleThreshold + "}";
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

    private static Duration parseMillis(String key, String value) {
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    public static final class Builder {

        private int maxConnections = 5;
        private int maxReconnectAttempts = 5;
        private Duration reconnectDelay = Duration.ofSeconds(1);
        private Duration batchDelay = Duration.ofMillis(100);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private int messageQueueSize = 1000;
        private boolean enableBatching = true;
        private boolean enableCompression = true;
        private Duration idleGracePeriod = Duration.ofSeconds(30);
        private Duration idleThreshold = Duration.ofMinutes(5);

        private Builder() {
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        /**
         * @param reconnectDelay base delay of the exponential reconnect backoff
         */
        public Builder reconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
            return this;
        }

        public Builder batchDelay(Duration batchDelay) {
            this.batchDelay = batchDelay;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder messageQueueSize(int messageQueueSize) {
            this.messageQueueSize = messageQueueSize;
            return this;
        }

        public Builder enableBatching(boolean enableBatching) {
            this.enableBatching = enableBatching;
            return this;
        }

        public Builder enableCompression(boolean enableCompression) {
            this.enableCompression = enableCompression;
            return this;
        }

        /**
         * @param idleGracePeriod how long a connection without handlers stays open
         */
        public Builder idleGracePeriod(Duration idleGracePeriod) {
            this.idleGracePeriod = idleGracePeriod;
            return this;
        }

        /**
         * @param idleThreshold inactivity after which a pooled connection may be reclaimed
         */
        public Builder idleThreshold(Duration idleThreshold) {
            this.idleThreshold = idleThreshold;
            return this;
        }

        public ConnectionManagerConfig build() {
            return new ConnectionManagerConfig(this);
        }
    }
}
