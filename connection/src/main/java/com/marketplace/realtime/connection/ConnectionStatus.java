package com.marketplace.realtime.connection;

/**
 * Lifecycle state of a pooled connection.
 */
public enum ConnectionStatus {
    CONNECTING,
    SUBSCRIBED,
    ERRORED,
    CLOSED
}
