package com.marketplace.realtime.connection;

/**
 * Kind of row change carried by a {@link ChangeEvent}.
 */
public enum ChangeType {
    INSERT,
    UPDATE,
    DELETE
}
