package com.marketplace.realtime.subscription;

import com.marketplace.realtime.connection.ConnectionStatusListener;
import com.marketplace.realtime.connection.RealtimeEvent;
import com.marketplace.realtime.queue.MessagePriority;
import com.marketplace.realtime.throttler.Throttler;
import com.marketplace.realtime.throttler.TrailingEdgeThrottler;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One consumer callback with its delivery policy.
 *
 * <p>An offered event first passes the throttler, if any. What comes out of it is classified:
 * without a classifier, or for {@link MessagePriority#HIGH}, the callback runs on the
 * delivering thread; otherwise the event is queued on the optimizer's callback queue. A
 * callback that throws is logged and counted and never affects other callbacks.
 */
final class CallbackEntry {

    private static final Logger log = LoggerFactory.getLogger(CallbackEntry.class);

    private final long id;
    private final String subscriptionId;
    private final Consumer<RealtimeEvent> callback;
    private final PriorityClassifier classifier;
    private final ConnectionStatusListener statusListener;
    private final Throttler<RealtimeEvent> throttler;
    private final DefaultSubscriptionOptimizer owner;
    private volatile boolean active = true;

    CallbackEntry(long id, String subscriptionId, Consumer<RealtimeEvent> callback,
                  @Nullable PriorityClassifier classifier, @Nullable ConnectionStatusListener statusListener,
                  @Nullable Duration throttleDelay, Clock clock, ScheduledExecutorService scheduler,
                  DefaultSubscriptionOptimizer owner) {
        this.id = id;
        this.subscriptionId = subscriptionId;
        this.callback = callback;
        this.classifier = classifier;
        this.statusListener = statusListener;
        this.owner = owner;
        this.throttler = throttleDelay == null
                ? null : new TrailingEdgeThrottler<>(throttleDelay, this::dispatch, clock, scheduler);
    }

    long getId() {
        return id;
    }

    String getSubscriptionId() {
        return subscriptionId;
    }

    @Nullable
    ConnectionStatusListener getStatusListener() {
        return statusListener;
    }

    boolean isActive() {
        return active;
    }

    void offer(RealtimeEvent event) {
        if (!active) {
            return;
        }
        if (throttler != null) {
            throttler.offer(event);
        } else {
            dispatch(event);
        }
    }

    /**
     * Stops deliveries, including a throttled delivery still pending. Events already on the
     * callback queue are skipped when they come up.
     */
    void deactivate() {
        active = false;
        if (throttler != null) {
            throttler.shutdown();
        }
    }

    void invoke(RealtimeEvent event) {
        if (!active) {
            return;
        }
        try {
            callback.accept(event);
        } catch (RuntimeException e) {
            owner.recordCallbackError();
            log.warn("Callback of subscription '{}' threw while handling {} on '{}'", subscriptionId,
                    event.getEventKind(), event.getTopic(), e);
        } catch (Error e) {
            owner.recordCallbackError();
            log.error("Callback of subscription '{}' threw Error while handling {} on '{}'", subscriptionId,
                    event.getEventKind(), event.getTopic(), e);
            throw e;
        }
    }

    private void dispatch(RealtimeEvent event) {
        if (!active) {
            return;
        }
        if (classifier == null) {
            invoke(event);
            return;
        }
        MessagePriority priority = classify(event);
        if (priority == MessagePriority.HIGH || !owner.enqueueCallback(this, event, priority)) {
            invoke(event);
        }
    }

    private MessagePriority classify(RealtimeEvent event) {
        try {
            MessagePriority priority = classifier.classify(event);
            return priority != null ? priority : MessagePriority.NORMAL;
        } catch (RuntimeException e) {
            log.warn("Priority classifier of subscription '{}' threw, using NORMAL", subscriptionId, e);
            return MessagePriority.NORMAL;
        }
    }
}
