package com.marketplace.realtime.connection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Several change events of the same kind delivered together because they arrived within one
 * batching window.
 */
public final class EventBatch implements RealtimeEvent {

    private final String topic;
    private final String eventKind;
    private final List<ChangeEvent> events;

    public EventBatch(String topic, String eventKind, List<ChangeEvent> events) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.eventKind = Objects.requireNonNull(eventKind, "eventKind");
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one event");
        }
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
    }

    @Override
    public String getTopic() {
        return topic;
    }

    @Override
    public String getEventKind() {
        return eventKind;
    }

    @Override
    public boolean isBatch() {
        return true;
    }

    @Override
    public List<ChangeEvent> getEvents() {
        return events;
    }

    @Override
    public int size() {
        return events.size();
    }

    @Override
    public String toString() {
        return "EventBatch{topic=" + topic + ", kind=" + eventKind + ", count=" + events.size() + "}";
    }
}
