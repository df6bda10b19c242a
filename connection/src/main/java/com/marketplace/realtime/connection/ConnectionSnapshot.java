package com.marketplace.realtime.connection;

/**
 * Point-in-time view of one pooled connection.
 */
public final class ConnectionSnapshot {

    private final String topic;
    private final ConnectionStatus status;
    private final int subscriptions;
    private final long messageCount;
    private final long errorCount;
    private final long lastActivity;
    private final int reconnectAttempts;

    ConnectionSnapshot(String topic, ConnectionStatus status, int subscriptions, long messageCount,
                       long errorCount, long lastActivity, int reconnectAttempts) {
        this.topic = topic;
        this.status = status;
        this.subscriptions = subscriptions;
        this.messageCount = messageCount;
        this.errorCount = errorCount;
        this.lastActivity = lastActivity;
        this.reconnectAttempts = reconnectAttempts;
    }

    public String getTopic() {
        return topic;
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    public int getSubscriptions() {
        return subscriptions;
    }

    public long getMessageCount() {
        return messageCount;
    }

    /**
     * @return channel failures plus exceptions thrown by handlers
     */
    public long getErrorCount() {
        return errorCount;
    }

    public long getLastActivity() {
        return lastActivity;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    @Override
    public String toString() {
        return "ConnectionSnapshot{topic=" + topic + ", status=" + status + ", subscriptions=" + subscriptions
                + ", messages=" + messageCount + ", errors=" + errorCount + ", reconnectAttempts="
                + reconnectAttempts + "}";
    }
}
