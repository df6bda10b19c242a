package com.marketplace.realtime.queue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * State of one named queue. All fields are guarded by the instance monitor.
 *
 * <p>Messages are kept in drain order: by priority tier, then by insertion within a tier.
 */
final class NamedQueue {

    final String name;
    private final List<QueuedMessage> messages = new ArrayList<>();
    private final DescriptiveStatistics processingTimes;

    ProcessorBinding binding;
    /** A drain step is scheduled or running. */
    boolean processing;
    /** A drain step is executing right now. */
    boolean running;
    /** The scheduled step only waits for a delayed message to become due. */
    boolean waitingForReady;
    /** The scheduled step waits out the batch timeout of a short batch. */
    boolean waitingForBatch;
    /** When the last drain step finished, or {@code Long.MIN_VALUE} before the first one. */
    long lastStepEndedAt = Long.MIN_VALUE;
    boolean paused;
    boolean removed;
    ScheduledFuture<?> drainTask;
    long drainAt;

    long processedMessages;
    long failedMessages;
    long droppedMessages;
    long retriedMessages;

    NamedQueue(String name, int statisticsWindowSize) {
        this.name = name;
        this.processingTimes = new DescriptiveStatistics(statisticsWindowSize);
    }

    int size() {
        return messages.size();
    }

    boolean isEmpty() {
        return messages.isEmpty();
    }

    void insert(QueuedMessage message, boolean byPriority) {
        if (byPriority) {
            for (int i = 0; i < messages.size(); i++) {
                if (message.getPriority().isHigherThan(messages.get(i).getPriority())) {
                    messages.add(i, message);
                    return;
                }
            }
        }
        messages.add(message);
    }

    /**
     * Removes the message that overflow sacrifices: the oldest LOW message, else the oldest
     * NORMAL message, else the oldest message.
     */
    QueuedMessage evictForOverflow() {
        QueuedMessage victim = firstOf(MessagePriority.LOW);
        if (victim == null) {
            victim = firstOf(MessagePriority.NORMAL);
        }
        if (victim == null) {
            victim = messages.get(0);
        }
        messages.remove(victim);
        droppedMessages++;
        return victim;
    }

    List<QueuedMessage> takeDue(long now, int limit) {
        List<QueuedMessage> taken = new ArrayList<>(Math.min(limit, messages.size()));
        Iterator<QueuedMessage> it = messages.iterator();
        while (it.hasNext() && taken.size() < limit) {
            QueuedMessage message = it.next();
            if (message.isDue(now)) {
                it.remove();
                taken.add(message);
            }
        }
        return taken;
    }

    int countDue(long now) {
        int due = 0;
        for (QueuedMessage message : messages) {
            if (message.isDue(now)) {
                due++;
            }
        }
        return due;
    }

    long minRemainingDelay(long now) {
        long min = Long.MAX_VALUE;
        for (QueuedMessage message : messages) {
            min = Math.min(min, message.getRemainingDelay(now));
        }
        return min == Long.MAX_VALUE ? 0L : min;
    }

    int clear() {
        int cleared = messages.size();
        messages.clear();
        return cleared;
    }

    /**
     * Cancels a scheduled step that has not started yet.
     */
    void cancelPendingDrain() {
        if (drainTask != null && !running) {
            drainTask.cancel(false);
            drainTask = null;
            waitingForReady = false;
            waitingForBatch = false;
            processing = false;
        }
    }

    void recordProcessingTime(double millis) {
        processingTimes.addValue(millis);
    }

    QueueStats snapshot(long now) {
        long oldestEnqueuedAt = Long.MAX_VALUE;
        for (QueuedMessage message : messages) {
            oldestEnqueuedAt = Math.min(oldestEnqueuedAt, message.getEnqueuedAt());
        }
        long oldestAge = oldestEnqueuedAt == Long.MAX_VALUE ? 0L : Math.max(0L, now - oldestEnqueuedAt);
        long samples = processingTimes.getN();
        double mean = samples == 0 ? 0.0 : processingTimes.getMean();
        double p95 = samples == 0 ? 0.0 : processingTimes.getPercentile(95);
        double max = samples == 0 ? 0.0 : processingTimes.getMax();
        return new QueueStats(name, messages.size(), processing, paused, processedMessages, failedMessages,
                droppedMessages, retriedMessages, oldestAge, samples, mean, p95, max);
    }

    private QueuedMessage firstOf(MessagePriority priority) {
        for (QueuedMessage message : messages) {
            if (message.getPriority() == priority) {
                return message;
            }
        }
        return null;
    }
}
