package com.marketplace.realtime.queue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate snapshot across every named queue of a {@link MessageQueue}.
 *
 * <p>The lifetime counters survive {@link MessageQueue#removeQueue(String)} and
 * {@link MessageQueue#cleanup()}; the per-queue map only lists queues that currently exist.
 */
public final class OverallQueueStats {

    private final long totalEnqueued;
    private final long totalProcessed;
    private final long totalFailed;
    private final long totalDropped;
    private final long totalRetried;
    private final Map<String, QueueStats> queues;

    OverallQueueStats(long totalEnqueued, long totalProcessed, long totalFailed, long totalDropped,
                      long totalRetried, Map<String, QueueStats> queues) {
        this.totalEnqueued = totalEnqueued;
        this.totalProcessed = totalProcessed;
        this.totalFailed = totalFailed;
        this.totalDropped = totalDropped;
        this.totalRetried = totalRetried;
        this.queues = Collections.unmodifiableMap(new LinkedHashMap<>(queues));
    }

    public long getTotalEnqueued() {
        return totalEnqueued;
    }

    public long getTotalProcessed() {
        return totalProcessed;
    }

    public long getTotalFailed() {
        return totalFailed;
    }

    public long getTotalDropped() {
        return totalDropped;
    }

    public long getTotalRetried() {
        return totalRetried;
    }

    public int getTotalQueues() {
        return queues.size();
    }

    /**
     * @return number of messages currently waiting across all queues
     */
    public int getTotalMessages() {
        int total = 0;
        for (QueueStats stats : queues.values()) {
            total += stats.getSize();
        }
        return total;
    }

    public int getProcessingQueues() {
        int count = 0;
        for (QueueStats stats : queues.values()) {
            if (stats.isProcessing()) {
                count++;
            }
        }
        return count;
    }

    public Map<String, QueueStats> getQueues() {
        return queues;
    }

    @Override
    public String toString() {
        return "OverallQueueStats{queues=" + queues.size() + ", messages=" + getTotalMessages()
                + ", enqueued=" + totalEnqueued + ", processed=" + totalProcessed + ", failed=" + totalFailed
                + ", dropped=" + totalDropped + ", retried=" + totalRetried + "}";
    }
}
