package com.marketplace.realtime.connection;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A handler attached to a connection, with its optional batching buffers.
 *
 * <p>When batching is on, events are buffered per event kind. The first buffered event opens
 * a window of {@code batchDelay}; when it ends the buffer is delivered as the single event or
 * as an {@link EventBatch}. A buffer reaching {@code maxBatchSize} is delivered at once.
 * Buffers are guarded by this object's monitor, which is never held while the callback runs.
 */
final class HandlerRegistration implements Subscription {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistration.class);

    private final String subscriptionId;
    private final String topic;
    private final ChangeFilter filter;
    private final Consumer<RealtimeEvent> callback;
    private final ConnectionStatusListener statusListener;
    private final boolean batching;
    private final long batchDelayMillis;
    private final int maxBatchSize;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong errorCounter;
    private final DefaultConnectionManager manager;

    private final Map<String, List<ChangeEvent>> buffers = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> flushTimers = new HashMap<>();
    private volatile boolean active = true;

    HandlerRegistration(String subscriptionId, String topic, ChangeFilter filter, Consumer<RealtimeEvent> callback,
                        @Nullable ConnectionStatusListener statusListener, boolean batching, long batchDelayMillis,
                        int maxBatchSize, ScheduledExecutorService scheduler, AtomicLong errorCounter,
                        DefaultConnectionManager manager) {
        this.subscriptionId = subscriptionId;
        this.topic = topic;
        this.filter = filter;
        this.callback = Objects.requireNonNull(callback, "callback");
        this.statusListener = statusListener;
        this.batching = batching;
        this.batchDelayMillis = batchDelayMillis;
        this.maxBatchSize = maxBatchSize;
        this.scheduler = scheduler;
        this.errorCounter = errorCounter;
        this.manager = manager;
    }

    @Override
    public String getSubscriptionId() {
        return subscriptionId;
    }

    @Override
    public String getTopic() {
        return topic;
    }

    ChangeFilter getFilter() {
        return filter;
    }

    @Nullable
    ConnectionStatusListener getStatusListener() {
        return statusListener;
    }

    @Override
    public void unsubscribe() {
        manager.unsubscribe(subscriptionId);
    }

    @Override
    public boolean isActive() {
        return active;
    }

    void accept(ChangeEvent event) {
        if (!active) {
            return;
        }
        if (!batching) {
            invoke(event);
            return;
        }
        List<ChangeEvent> full = null;
        String kind = event.getEventKind();
        synchronized (this) {
            List<ChangeEvent> buffer = buffers.computeIfAbsent(kind, k -> new ArrayList<>());
            buffer.add(event);
            if (buffer.size() >= maxBatchSize) {
                full = takeBuffer(kind);
            } else if (!flushTimers.containsKey(kind)) {
                try {
                    flushTimers.put(kind, scheduler.schedule(() -> flush(kind), batchDelayMillis,
                            TimeUnit.MILLISECONDS));
                } catch (RejectedExecutionException e) {
                    log.warn("Could not schedule batch flush for '{}', delivering immediately", subscriptionId, e);
                    full = takeBuffer(kind);
                }
            }
        }
        if (full != null) {
            deliver(kind, full);
        }
    }

    /**
     * Stops deliveries and drops buffered events.
     */
    void deactivate() {
        active = false;
        synchronized (this) {
            for (ScheduledFuture<?> timer : flushTimers.values()) {
                timer.cancel(false);
            }
            flushTimers.clear();
            buffers.clear();
        }
    }

    private void flush(String kind) {
        List<ChangeEvent> events;
        synchronized (this) {
            flushTimers.remove(kind);
            events = buffers.remove(kind);
        }
        if (events != null && !events.isEmpty()) {
            deliver(kind, events);
        }
    }

    // Caller holds this monitor.
    private List<ChangeEvent> takeBuffer(String kind) {
        ScheduledFuture<?> timer = flushTimers.remove(kind);
        if (timer != null) {
            timer.cancel(false);
        }
        return buffers.remove(kind);
    }

    private void deliver(String kind, List<ChangeEvent> events) {
        if (events.size() == 1) {
            invoke(events.get(0));
        } else {
            invoke(new EventBatch(topic, kind, events));
        }
    }

    private void invoke(RealtimeEvent event) {
        if (!active) {
            return;
        }
        try {
            callback.accept(event);
        } catch (RuntimeException e) {
            errorCounter.incrementAndGet();
            log.warn("Handler of subscription '{}' threw while handling {} on '{}'", subscriptionId,
                    event.getEventKind(), topic, e);
        } catch (Error e) {
            errorCounter.incrementAndGet();
            log.error("Handler of subscription '{}' threw Error while handling {} on '{}'", subscriptionId,
                    event.getEventKind(), topic, e);
            throw e;
        }
    }

    @Override
    public String toString() {
        return "Subscription{id=" + subscriptionId + ", topic=" + topic + ", filter=" + filter
                + ", active=" + active + "}";
    }
}
