package com.marketplace.realtime.connection;

import java.util.function.Consumer;

/**
 * A duplex channel opened against one topic of an {@link EventSource}.
 *
 * <p>Handlers and the status callback may be invoked on any thread. Implementations should
 * not invoke them on the thread calling {@link #on} or {@link #subscribe}.
 */
public interface RealtimeChannel {

    /** Event kind for row change notifications. */
    String CHANGES = "changes";

    String getTopic();

    /**
     * Registers {@code handler} for events of {@code eventKind} that pass {@code filter}.
     */
    void on(String eventKind, ChangeFilter filter, Consumer<ChangeEvent> handler);

    /**
     * Starts the channel subscription. Every status change is reported to
     * {@code statusCallback}.
     *
     * @return the token used to close the subscription
     */
    ChannelToken subscribe(Consumer<ChannelStatus> statusCallback);

    /**
     * @return {@code true} if the message was accepted for sending
     */
    boolean send(ControlMessage message);
}
