package com.marketplace.realtime.queue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message waiting in a named queue together with its delivery bookkeeping.
 *
 * <p>The retry count and ready time are mutated only by {@link PriorityMessageQueue} while it
 * holds the owning queue's monitor.
 */
public final class QueuedMessage {

    private final String id;
    private final Object payload;
    private final long enqueuedAt;
    private final MessagePriority priority;
    private final int maxRetries;
    private final Map<String, Object> metadata;
    private int retryCount;
    private long readyAt;

    QueuedMessage(String id, Object payload, long enqueuedAt, MessagePriority priority, int maxRetries,
                  long delayMillis, Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.enqueuedAt = enqueuedAt;
        this.priority = Objects.requireNonNull(priority, "priority");
        this.maxRetries = maxRetries;
        this.readyAt = enqueuedAt + delayMillis;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getId() {
        return id;
    }

    public Object getPayload() {
        return payload;
    }

    public long getEnqueuedAt() {
        return enqueuedAt;
    }

    public MessagePriority getPriority() {
        return priority;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @param now the current time in epoch millis
     * @return the time left before this message may be processed, zero when it is due
     */
    public long getRemainingDelay(long now) {
        return Math.max(0L, readyAt - now);
    }

    boolean isDue(long now) {
        return readyAt <= now;
    }

    long getReadyAt() {
        return readyAt;
    }

    /**
     * Records a failed attempt.
     *
     * @return {@code true} if the retry budget still allows another attempt
     */
    boolean recordFailure() {
        retryCount++;
        return retryCount <= maxRetries;
    }

    void delayUntil(long readyAt) {
        this.readyAt = readyAt;
    }

    @Override
    public String toString() {
        return "QueuedMessage{id=" + id + ", priority=" + priority + ", retryCount=" + retryCount
                + "/" + maxRetries + "}";
    }
}
