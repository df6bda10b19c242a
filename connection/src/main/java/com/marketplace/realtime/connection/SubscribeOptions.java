package com.marketplace.realtime.connection;

import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Per-subscribe options. Unset values fall back to the {@link ConnectionManagerConfig}.
 */
public final class SubscribeOptions {

    private static final SubscribeOptions DEFAULTS = builder().build();

    private final Boolean batching;
    private final Duration batchDelay;
    private final ConnectionStatusListener statusListener;
    private final String presenceKey;

    private SubscribeOptions(Builder builder) {
        this.batching = builder.batching;
        this.batchDelay = builder.batchDelay;
        this.statusListener = builder.statusListener;
        this.presenceKey = builder.presenceKey;
    }

    public static SubscribeOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    public Boolean getBatching() {
        return batching;
    }

    @Nullable
    public Duration getBatchDelay() {
        return batchDelay;
    }

    @Nullable
    public ConnectionStatusListener getStatusListener() {
        return statusListener;
    }

    /**
     * @return the presence key used when this subscribe opens the channel, {@code null} for the topic name
     */
    @Nullable
    public String getPresenceKey() {
        return presenceKey;
    }

    public static final class Builder {

        private Boolean batching;
        private Duration batchDelay;
        private ConnectionStatusListener statusListener;
        private String presenceKey;

        private Builder() {
        }

        public Builder batching(boolean batching) {
            this.batching = batching;
            return this;
        }

        public Builder batchDelay(Duration batchDelay) {
            Objects.requireNonNull(batchDelay, "batchDelay");
            if (batchDelay.isNegative()) {
                throw new IllegalArgumentException("batchDelay must not be negative");
            }
            this.batchDelay = batchDelay;
            return this;
        }

        public Builder statusListener(ConnectionStatusListener statusListener) {
            this.statusListener = Objects.requireNonNull(statusListener, "statusListener");
            return this;
        }

        public Builder presenceKey(String presenceKey) {
            this.presenceKey = Objects.requireNonNull(presenceKey, "presenceKey");
            return this;
        }

        public SubscribeOptions build() {
            return new SubscribeOptions(this);
        }
    }
}
