package com.marketplace.realtime.queue;

/**
 * Point-in-time snapshot of one named queue.
 *
 * <p>Processing times are wall-clock milliseconds spent inside the processor per step (one
 * message, or one batch), computed over the most recent
 * {@link MessageQueueConfig#getStatisticsWindowSize()} steps. They are zero before the first
 * step completes.
 */
public final class QueueStats {

    private final String name;
    private final int size;
    private final boolean processing;
    private final boolean paused;
    private final long processedMessages;
    private final long failedMessages;
    private final long droppedMessages;
    private final long retriedMessages;
    private final long oldestMessageAgeMillis;
    private final long processingTimeSamples;
    private final double meanProcessingTimeMillis;
    private final double p95ProcessingTimeMillis;
    private final double maxProcessingTimeMillis;

    QueueStats(String name, int size, boolean processing, boolean paused, long processedMessages,
               long failedMessages, long droppedMessages, long retriedMessages, long oldestMessageAgeMillis,
               long processingTimeSamples, double meanProcessingTimeMillis, double p95ProcessingTimeMillis,
               double maxProcessingTimeMillis) {
        this.name = name;
        this.size = size;
        this.processing = processing;
        this.paused = paused;
        this.processedMessages = processedMessages;
        this.failedMessages = failedMessages;
        this.droppedMessages = droppedMessages;
        this.retriedMessages = retriedMessages;
        this.oldestMessageAgeMillis = oldestMessageAgeMillis;
        this.processingTimeSamples = processingTimeSamples;
        this.meanProcessingTimeMillis = meanProcessingTimeMillis;
        this.p95ProcessingTimeMillis = p95ProcessingTimeMillis;
        this.maxProcessingTimeMillis = maxProcessingTimeMillis;
    }

    public String getName() {
        return name;
    }

    public int getSize() {
        return size;
    }

    public boolean isProcessing() {
        return processing;
    }

    public boolean isPaused() {
        return paused;
    }

    public long getProcessedMessages() {
        return processedMessages;
    }

    public long getFailedMessages() {
        return failedMessages;
    }

    public long getDroppedMessages() {
        return droppedMessages;
    }

    public long getRetriedMessages() {
        return retriedMessages;
    }

    /**
     * @return age of the message that has waited longest, zero for an empty queue
     */
    public long getOldestMessageAgeMillis() {
        return oldestMessageAgeMillis;
    }

    public long getProcessingTimeSamples() {
        return processingTimeSamples;
    }

    public double getMeanProcessingTimeMillis() {
        return meanProcessingTimeMillis;
    }

    public double getP95ProcessingTimeMillis() {
        return p95ProcessingTimeMillis;
    }

    public double getMaxProcessingTimeMillis() {
        return maxProcessingTimeMillis;
    }

    @Override
    public String toString() {
        return "QueueStats{name=" + name + ", size=" + size + ", processing=" + processing
                + ", paused=" + paused + ", processed=" + processedMessages + ", failed=" + failedMessages
                + ", dropped=" + droppedMessages + ", retried=" + retriedMessages
                + ", oldestAgeMs=" + oldestMessageAgeMillis + ", meanMs=" + meanProcessingTimeMillis
                + ", p95Ms=" + p95ProcessingTimeMillis + ", maxMs=" + maxProcessingTimeMillis + "}";
    }
}
