package com.marketplace.realtime.connection.memory;

import com.marketplace.realtime.connection.ChangeEvent;
import com.marketplace.realtime.connection.ChangeFilter;
import com.marketplace.realtime.connection.ChannelOptions;
import com.marketplace.realtime.connection.ChannelStatus;
import com.marketplace.realtime.connection.ChannelToken;
import com.marketplace.realtime.connection.ControlMessage;
import com.marketplace.realtime.connection.EventSource;
import com.marketplace.realtime.connection.RealtimeChannel;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An in-process {@link EventSource} for local runs, examples and tests.
 *
 * <p>Published events are delivered synchronously on the publishing thread to every handler
 * of every subscribed channel of the topic whose filter matches. The outcome of a channel
 * subscription is reported asynchronously through the given scheduler; it is
 * {@link ChannelStatus#SUBSCRIBED} unless scripted otherwise with
 * {@link #setSubscribeOutcome(String, ChannelStatus)}.
 */
public class InMemoryEventSource implements EventSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventSource.class);

    private final ScheduledExecutorService executor;
    private final Object lock = new Object();
    private final Map<String, List<MemoryChannel>> channels = new HashMap<>();
    private final Map<String, ChannelStatus> subscribeOutcomes = new HashMap<>();
    private final Map<String, Integer> openCounts = new HashMap<>();
    private final Map<String, ChannelOptions> lastOptions = new HashMap<>();
    private final List<ControlMessage> sentMessages = new ArrayList<>();
    private final AtomicLong tokenSequence = new AtomicLong();
    private volatile boolean acceptControlMessages = true;

    public InMemoryEventSource(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public RealtimeChannel openChannel(String topic, ChannelOptions options) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(options, "options");
        MemoryChannel channel = new MemoryChannel(topic);
        synchronized (lock) {
            channels.computeIfAbsent(topic, t -> new ArrayList<>()).add(channel);
            openCounts.merge(topic, 1, Integer::sum);
            lastOptions.put(topic, options);
        }
        log.debug("Opened channel for topic '{}' with {}", topic, options);
        return channel;
    }

    @Override
    public void close(ChannelToken token) {
        Objects.requireNonNull(token, "token");
        synchronized (lock) {
            List<MemoryChannel> open = channels.get(token.getTopic());
            if (open == null) {
                return;
            }
            for (MemoryChannel channel : open) {
                if (token.equals(channel.token)) {
                    channel.closed = true;
                    open.remove(channel);
                    log.debug("Closed channel {}", token);
                    return;
                }
            }
        }
    }

    /**
     * Delivers {@code event} to the matching handlers of the topic's subscribed channels.
     *
     * @return the number of handlers that received the event
     */
    public int publish(ChangeEvent event) {
        Objects.requireNonNull(event, "event");
        List<Consumer<ChangeEvent>> targets = new ArrayList<>();
        synchronized (lock) {
            for (MemoryChannel channel : channels.getOrDefault(event.getTopic(), new ArrayList<>())) {
                if (!channel.subscribed || channel.closed) {
                    continue;
                }
                for (HandlerEntry entry : channel.handlers) {
                    if (RealtimeChannel.CHANGES.equals(entry.eventKind) && entry.filter.matches(event)) {
                        targets.add(entry.handler);
                    }
                }
            }
        }
        for (Consumer<ChangeEvent> target : targets) {
            target.accept(event);
        }
        return targets.size();
    }

    /**
     * Reports {@code status} to the status callback of every open channel of {@code topic}.
     */
    public void emitStatus(String topic, ChannelStatus status) {
        List<MemoryChannel> targets = new ArrayList<>();
        synchronized (lock) {
            for (MemoryChannel channel : channels.getOrDefault(topic, new ArrayList<>())) {
                if (channel.statusCallback != null && !channel.closed) {
                    channel.subscribed = status == ChannelStatus.SUBSCRIBED;
                    targets.add(channel);
                }
            }
        }
        for (MemoryChannel channel : targets) {
            channel.statusCallback.accept(status);
        }
    }

    /**
     * Scripts the status reported when a channel of {@code topic} subscribes from now on.
     */
    public void setSubscribeOutcome(String topic, ChannelStatus status) {
        synchronized (lock) {
            subscribeOutcomes.put(Objects.requireNonNull(topic, "topic"), Objects.requireNonNull(status, "status"));
        }
    }

    public void setAcceptControlMessages(boolean acceptControlMessages) {
        this.acceptControlMessages = acceptControlMessages;
    }

    /**
     * @return how many channels have been opened for {@code topic} so far
     */
    public int getOpenCount(String topic) {
        synchronized (lock) {
            return openCounts.getOrDefault(topic, 0);
        }
    }

    /**
     * @return how many channels of {@code topic} are currently open
     */
    public int getOpenChannelCount(String topic) {
        synchronized (lock) {
            return channels.getOrDefault(topic, new ArrayList<>()).size();
        }
    }

    @Nullable
    public ChannelOptions getLastOptions(String topic) {
        synchronized (lock) {
            return lastOptions.get(topic);
        }
    }

    public List<ControlMessage> getSentMessages() {
        synchronized (lock) {
            return new ArrayList<>(sentMessages);
        }
    }

    private static final class HandlerEntry {
        private final String eventKind;
        private final ChangeFilter filter;
        private final Consumer<ChangeEvent> handler;

        private HandlerEntry(String eventKind, ChangeFilter filter, Consumer<ChangeEvent> handler) {
            this.eventKind = eventKind;
            this.filter = filter;
            this.handler = handler;
        }
    }

    private final class MemoryChannel implements RealtimeChannel {

        private final String topic;
        // guarded by the source's lock
        private final List<HandlerEntry> handlers = new ArrayList<>();
        private Consumer<ChannelStatus> statusCallback;
        private ChannelToken token;
        private boolean subscribed;
        private boolean closed;

        private MemoryChannel(String topic) {
            this.topic = topic;
        }

        @Override
        public String getTopic() {
            return topic;
        }

        @Override
        public void on(String eventKind, ChangeFilter filter, Consumer<ChangeEvent> handler) {
            synchronized (lock) {
                handlers.add(new HandlerEntry(Objects.requireNonNull(eventKind, "eventKind"),
                        Objects.requireNonNull(filter, "filter"), Objects.requireNonNull(handler, "handler")));
            }
        }

        @Override
        public ChannelToken subscribe(Consumer<ChannelStatus> statusCallback) {
            Objects.requireNonNull(statusCallback, "statusCallback");
            ChannelToken newToken = new ChannelToken(topic, tokenSequence.incrementAndGet());
            ChannelStatus outcome;
            synchronized (lock) {
                this.statusCallback = statusCallback;
                this.token = newToken;
                outcome = subscribeOutcomes.getOrDefault(topic, ChannelStatus.SUBSCRIBED);
            }
            try {
                executor.schedule(() -> reportOutcome(outcome), 0L, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.warn("Could not report subscribe outcome for topic '{}'", topic, e);
            }
            return newToken;
        }

        @Override
        public boolean send(ControlMessage message) {
            Objects.requireNonNull(message, "message");
            synchronized (lock) {
                if (closed || !acceptControlMessages) {
                    return false;
                }
                sentMessages.add(message);
                return true;
            }
        }

        private void reportOutcome(ChannelStatus outcome) {
            synchronized (lock) {
                if (closed) {
                    return;
                }
                subscribed = outcome == ChannelStatus.SUBSCRIBED;
            }
            statusCallback.accept(outcome);
        }
    }
}
