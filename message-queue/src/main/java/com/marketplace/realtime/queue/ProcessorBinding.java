package com.marketplace.realtime.queue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The processor registered for a named queue together with the payload type it accepts.
 */
final class ProcessorBinding {

    @FunctionalInterface
    private interface Invoker {
        void invoke(List<QueuedMessage> messages) throws Exception;
    }

    private final Class<?> payloadType;
    private final Invoker invoker;
    private final boolean batch;
    private final int batchSize;
    private final long batchTimeoutMillis;

    private ProcessorBinding(Class<?> payloadType, Invoker invoker, boolean batch, int batchSize,
                             long batchTimeoutMillis) {
        this.payloadType = payloadType;
        this.invoker = invoker;
        this.batch = batch;
        this.batchSize = batchSize;
        this.batchTimeoutMillis = batchTimeoutMillis;
    }

    static <T> ProcessorBinding single(Class<T> payloadType, MessageProcessor<T> processor) {
        Objects.requireNonNull(payloadType, "payloadType");
        Objects.requireNonNull(processor, "processor");
        return new ProcessorBinding(payloadType, messages -> {
            QueuedMessage message = messages.get(0);
            processor.process(payloadType.cast(message.getPayload()), message.getMetadata());
        }, false, 1, 0L);
    }

    static <T> ProcessorBinding batch(Class<T> payloadType, BatchMessageProcessor<T> processor, int batchSize,
                                      long batchTimeoutMillis) {
        Objects.requireNonNull(payloadType, "payloadType");
        Objects.requireNonNull(processor, "processor");
        return new ProcessorBinding(payloadType, messages -> {
            List<T> payloads = new ArrayList<>(messages.size());
            List<Map<String, Object>> metadata = new ArrayList<>(messages.size());
            for (QueuedMessage message : messages) {
                payloads.add(payloadType.cast(message.getPayload()));
                metadata.add(message.getMetadata());
            }
            processor.processBatch(payloads, metadata);
        }, true, batchSize, batchTimeoutMillis);
    }

    boolean isBatch() {
        return batch;
    }

    int getBatchSize() {
        return batchSize;
    }

    long getBatchTimeoutMillis() {
        return batchTimeoutMillis;
    }

    boolean accepts(QueuedMessage message) {
        return payloadType.isInstance(message.getPayload());
    }

    MessageQueueException typeMismatch(QueuedMessage message) {
        return new MessageQueueException("Message " + message.getId() + " carries a "
                + message.getPayload().getClass().getName() + " but the processor accepts "
                + payloadType.getName());
    }

    /**
     * Hands {@code messages} to the processor. Every payload must have passed {@link #accepts}.
     */
    void process(List<QueuedMessage> messages) throws Exception {
        invoker.invoke(messages);
    }
}
