package com.marketplace.realtime.queue;

/**
 * Delivery priority of a queued message. Declared from highest to lowest.
 */
public enum MessagePriority {
    HIGH,
    NORMAL,
    LOW;

    /**
     * @param other the priority to compare with
     * @return {@code true} if this priority drains before {@code other}
     */
    public boolean isHigherThan(MessagePriority other) {
        return ordinal() < other.ordinal();
    }
}
