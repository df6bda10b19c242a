package com.marketplace.realtime.connection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time statistics of a {@link ConnectionManager}.
 */
public final class ConnectionStats {

    private final int totalConnections;
    private final int activeConnections;
    private final int totalSubscriptions;
    private final long totalMessages;
    private final long totalErrors;
    private final Map<String, ConnectionSnapshot> connections;

    ConnectionStats(int totalSubscriptions, Map<String, ConnectionSnapshot> connections) {
        this.totalSubscriptions = totalSubscriptions;
        this.connections = Collections.unmodifiableMap(new LinkedHashMap<>(connections));
        int active = 0;
        long messages = 0;
        long errors = 0;
        for (ConnectionSnapshot snapshot : connections.values()) {
            if (snapshot.getStatus() == ConnectionStatus.SUBSCRIBED) {
                active++;
            }
            messages += snapshot.getMessageCount();
            errors += snapshot.getErrorCount();
        }
        this.totalConnections = connections.size();
        this.activeConnections = active;
        this.totalMessages = messages;
        this.totalErrors = errors;
    }

    public int getTotalConnections() {
        return totalConnections;
    }

    /**
     * @return connections currently in {@link ConnectionStatus#SUBSCRIBED}
     */
    public int getActiveConnections() {
        return activeConnections;
    }

    public int getTotalSubscriptions() {
        return totalSubscriptions;
    }

    public long getTotalMessages() {
        return totalMessages;
    }

    public long getTotalErrors() {
        return totalErrors;
    }

    public Map<String, ConnectionSnapshot> getConnections() {
        return connections;
    }

    @Override
    public String toString() {
        return "ConnectionStats{connections=" + totalConnections + ", active=" + activeConnections
                + ", subscriptions=" + totalSubscriptions + ", messages=" + totalMessages
                + ", errors=" + totalErrors + "}";
    }
}
