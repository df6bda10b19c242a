package com.marketplace.realtime.subscription;

import com.marketplace.realtime.connection.RealtimeEvent;
import com.marketplace.realtime.queue.MessagePriority;

/**
 * Decides how urgently an event must reach a callback. {@link MessagePriority#HIGH} events are
 * delivered on the delivering thread; the others go through the callback queue.
 */
@FunctionalInterface
public interface PriorityClassifier {

    /**
     * @return the priority of {@code event}; {@code null} is read as {@link MessagePriority#NORMAL}
     */
    MessagePriority classify(RealtimeEvent event);
}
