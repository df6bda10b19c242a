package com.marketplace.realtime.queue;

import java.util.List;
import java.util.Map;

/**
 * Processes queued messages in batches. A batch succeeds or fails as a whole: throwing fails
 * every message of the batch for retry purposes.
 *
 * @param <T> the payload type accepted by this processor
 */
@FunctionalInterface
public interface BatchMessageProcessor<T> {

    /**
     * @param payloads the batch payloads in queue order
     * @param metadata the metadata of each message, index-aligned with {@code payloads}
     */
    void processBatch(List<T> payloads, List<Map<String, Object>> metadata) throws Exception;
}
