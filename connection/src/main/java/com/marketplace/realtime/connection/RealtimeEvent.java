package com.marketplace.realtime.connection;

import java.util.List;

/**
 * What a subscription callback receives: either a single {@link ChangeEvent} or, when
 * batching collected more than one event in a window, an {@link EventBatch}.
 */
public interface RealtimeEvent {

    String getTopic();

    /**
     * @return the change type name shared by every event carried, e.g. {@code "INSERT"}
     */
    String getEventKind();

    boolean isBatch();

    /**
     * @return the carried events in arrival order; a single event returns itself
     */
    List<ChangeEvent> getEvents();

    int size();
}
