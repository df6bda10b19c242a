package com.marketplace.realtime.queue;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Per-message enqueue options. Unset values fall back to the queue configuration.
 */
public final class EnqueueOptions {

    private static final EnqueueOptions DEFAULTS = builder().build();

    private final MessagePriority priority;
    private final Integer maxRetries;
    private final Duration delay;
    private final Map<String, Object> metadata;

    private EnqueueOptions(Builder builder) {
        this.priority = builder.priority;
        this.maxRetries = builder.maxRetries;
        this.delay = builder.delay;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static EnqueueOptions defaults() {
        return DEFAULTS;
    }

    public static EnqueueOptions withPriority(MessagePriority priority) {
        return builder().priority(priority).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public MessagePriority getPriority() {
        return priority;
    }

    /**
     * @return the retry budget, or {@code null} to use the configured default
     */
    @Nullable
    public Integer getMaxRetries() {
        return maxRetries;
    }

    public Duration getDelay() {
        return delay;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public static final class Builder {

        private MessagePriority priority = MessagePriority.NORMAL;
        private Integer maxRetries;
        private Duration delay = Duration.ZERO;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder priority(MessagePriority priority) {
            this.priority = Objects.requireNonNull(priority, "priority");
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder delay(Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
            this.delay = delay;
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder metadata(Map<String, ?> values) {
            values.forEach(this::metadata);
            return this;
        }

        public EnqueueOptions build() {
            return new EnqueueOptions(this);
        }
    }
}
