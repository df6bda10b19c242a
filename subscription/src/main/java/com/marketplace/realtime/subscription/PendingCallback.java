package com.marketplace.realtime.subscription;

import com.marketplace.realtime.connection.RealtimeEvent;

/**
 * Payload of the callback queue: an event waiting to be handed to one callback.
 */
final class PendingCallback {

    private final CallbackEntry entry;
    private final RealtimeEvent event;

    PendingCallback(CallbackEntry entry, RealtimeEvent event) {
        this.entry = entry;
        this.event = event;
    }

    void run() {
        entry.invoke(event);
    }

    @Override
    public String toString() {
        return "PendingCallback{subscription=" + entry.getSubscriptionId() + ", event=" + event.getEventKind() + "}";
    }
}
