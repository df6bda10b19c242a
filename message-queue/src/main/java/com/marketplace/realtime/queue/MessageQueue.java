package com.marketplace.realtime.queue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A set of named, bounded, in-memory queues drained asynchronously by registered processors.
 *
 * <p>Within a queue, higher priorities drain first and messages of the same priority drain in
 * enqueue order. Queues are created on first use. A queue without a processor keeps its
 * messages until one is registered.
 */
public interface MessageQueue extends AutoCloseable {

    /**
     * Enqueues {@code payload} with default options.
     *
     * @return the generated message id
     */
    String enqueue(@Nonnull String queueName, @Nonnull Object payload);

    /**
     * Enqueues {@code payload}. When the queue is full, one message is dropped first: the
     * oldest LOW message, else the oldest NORMAL message, else the oldest message.
     *
     * @return the generated message id
     * @throws IllegalStateException if this queue has been closed
     */
    String enqueue(@Nonnull String queueName, @Nonnull Object payload, @Nonnull EnqueueOptions options);

    /**
     * Registers the processor of {@code queueName}, replacing any previous one, and starts
     * draining waiting messages.
     *
     * @param payloadType payloads that are not instances of this type fail with a
     *                    {@link MessageQueueException}
     */
    <T> void setProcessor(@Nonnull String queueName, @Nonnull Class<T> payloadType,
                          @Nonnull MessageProcessor<T> processor);

    <T> void setBatchProcessor(@Nonnull String queueName, @Nonnull Class<T> payloadType,
                               @Nonnull BatchMessageProcessor<T> processor, @Nonnull ProcessorOptions options);

    /**
     * @return a snapshot of {@code queueName}, or {@code null} if no such queue exists
     */
    @Nullable
    QueueStats getQueueStats(@Nonnull String queueName);

    OverallQueueStats getOverallStats();

    void pauseQueue(@Nonnull String queueName);

    void resumeQueue(@Nonnull String queueName);

    /**
     * Discards every waiting message of {@code queueName}. A step already handed to the
     * processor completes.
     *
     * @return the number of discarded messages
     */
    int clearQueue(@Nonnull String queueName);

    /**
     * @return {@code true} if the queue existed
     */
    boolean removeQueue(@Nonnull String queueName);

    /**
     * Removes every queue and its messages. The instance stays usable.
     */
    void cleanup();

    /**
     * Removes every queue and stops accepting work.
     */
    @Override
    void close();
}
