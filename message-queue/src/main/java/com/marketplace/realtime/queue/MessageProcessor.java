package com.marketplace.realtime.queue;

import java.util.Map;

/**
 * Processes queued messages one at a time.
 *
 * <p>Throwing any exception marks the message as failed; it is then retried with backoff
 * until its retry budget is spent.
 *
 * @param <T> the payload type accepted by this processor
 */
@FunctionalInterface
public interface MessageProcessor<T> {

    void process(T payload, Map<String, Object> metadata) throws Exception;
}
