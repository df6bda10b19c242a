package com.marketplace.realtime.queue;

import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Batching options for a batch processor. Unset values fall back to the queue configuration.
 */
public final class ProcessorOptions {

    private final Integer batchSize;
    private final Duration batchTimeout;

    private ProcessorOptions(Integer batchSize, Duration batchTimeout) {
        this.batchSize = batchSize;
        this.batchTimeout = batchTimeout;
    }

    /**
     * @return options that use the configured batch size and timeout
     */
    public static ProcessorOptions defaults() {
        return new ProcessorOptions(null, null);
    }

    public static ProcessorOptions batched(int batchSize, Duration batchTimeout) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        Objects.requireNonNull(batchTimeout, "batchTimeout");
        if (batchTimeout.isNegative()) {
            throw new IllegalArgumentException("batchTimeout must not be negative");
        }
        return new ProcessorOptions(batchSize, batchTimeout);
    }

    @Nullable
    public Integer getBatchSize() {
        return batchSize;
    }

    @Nullable
    public Duration getBatchTimeout() {
        return batchTimeout;
    }
}
