package com.marketplace.realtime.queue;

/**
 * Exception raised when a queued message cannot be handed to its processor.
 */
public class MessageQueueException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MessageQueueException(String message) {
        super(message);
    }

    public MessageQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
