package com.marketplace.realtime.connection;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConnectionManager} keeping at most one {@link Connection} per topic.
 *
 * <h2>Health</h2>
 * A fixed-rate heartbeat pings every subscribed connection; an accepted ping counts as
 * activity. A connection without activity for more than twice the heartbeat interval is
 * stale and goes through reconnection, as does a connection whose channel reports
 * {@link ChannelStatus#CHANNEL_ERROR}, {@link ChannelStatus#CLOSED} or
 * {@link ChannelStatus#TIMED_OUT}.
 *
 * <h2>Reconnection</h2>
 * Attempt {@code n} (counting from zero) waits {@code reconnectDelay * 2^n}. A
 * {@link ChannelStatus#SUBSCRIBED} status resets the count. Once
 * {@code maxReconnectAttempts} attempts have failed the connection is closed and every
 * attached {@link ConnectionStatusListener} is told. Reopening replaces the channel and
 * re-registers every handler on it.
 *
 * <p>All state is guarded by a single lock. Handlers run on the event source's thread and
 * status listeners on the scheduler, never while the lock is held.
 */
public class DefaultConnectionManager implements ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultConnectionManager.class);
    private static final int MAX_BACKOFF_EXPONENT = 30;
    private static final long MAX_BACKOFF_MILLIS = 1L << 50;

    private final EventSource eventSource;
    private final ConnectionManagerConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final Object lock = new Object();
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final Map<String, HandlerRegistration> subscriptions = new HashMap<>();
    private final AtomicLong subscriptionSequence = new AtomicLong();
    private ScheduledFuture<?> heartbeatTask;
    private boolean online = true;
    private boolean closed;

    /**
     * Creates a manager backed by its own daemon scheduler thread, shut down by {@link #close()}.
     */
    public DefaultConnectionManager(@Nonnull EventSource eventSource, @Nonnull ConnectionManagerConfig config) {
        this(eventSource, config, Clock.systemUTC(), createDefaultScheduler(), true);
    }

    /**
     * Creates a manager sharing the given clock and scheduler. The scheduler is left running
     * by {@link #close()}.
     */
    public DefaultConnectionManager(@Nonnull EventSource eventSource, @Nonnull ConnectionManagerConfig config,
                                    @Nonnull Clock clock, @Nonnull ScheduledExecutorService scheduler) {
        this(eventSource, config, clock, scheduler, false);
    }

    private DefaultConnectionManager(EventSource eventSource, ConnectionManagerConfig config, Clock clock,
                                     ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.eventSource = Objects.requireNonNull(eventSource, "eventSource");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
        synchronized (lock) {
            startHeartbeat();
        }
    }

    public ConnectionManagerConfig getConfig() {
        return config;
    }

    @Override
    public Subscription subscribe(@Nonnull String topic, @Nonnull ChangeFilter filter,
                                  @Nonnull Consumer<RealtimeEvent> callback, @Nonnull SubscribeOptions options) {
        Objects.requireNonNull(topic, "topic");
        if (topic.trim().isEmpty()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(options, "options");

        List<Runnable> notifications = new ArrayList<>();
        HandlerRegistration registration;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Connection manager is closed");
            }
            long now = clock.millis();
            Connection connection = connections.get(topic);
            boolean created = connection == null;
            if (created) {
                if (connections.size() >= config.getMaxConnections()) {
                    optimizeLocked(now, notifications);
                }
                String presenceKey = options.getPresenceKey() != null ? options.getPresenceKey() : topic;
                connection = new Connection(topic, new ChannelOptions(presenceKey, false,
                        config.isEnableCompression()), now);
                connections.put(topic, connection);
                log.info("Opening connection for topic '{}' ({} pooled)", topic, connections.size());
            } else if (connection.cleanupTask != null) {
                connection.cleanupTask.cancel(false);
                connection.cleanupTask = null;
            }

            boolean batching = options.getBatching() != null ? options.getBatching() : config.isEnableBatching();
            long batchDelay = options.getBatchDelay() != null
                    ? options.getBatchDelay().toMillis() : config.getBatchDelay().toMillis();
            String subscriptionId = topic + "-" + subscriptionSequence.incrementAndGet();
            registration = new HandlerRegistration(subscriptionId, topic, filter, callback,
                    options.getStatusListener(), batching, batchDelay, config.getMessageQueueSize(), scheduler,
                    connection.errorCount, this);
            connection.handlers.put(subscriptionId, registration);
            connection.lastUsed = now;
            subscriptions.put(subscriptionId, registration);

            if (created) {
                open(connection, notifications);
            } else if (connection.channel != null) {
                attach(connection, connection.channel, connection.generation, registration);
                ConnectionStatusListener listener = registration.getStatusListener();
                if (connection.status == ConnectionStatus.SUBSCRIBED && listener != null) {
                    notifications.add(() -> listener.onStatusChange(topic, ChannelStatus.SUBSCRIBED));
                }
            }
            log.debug("Attached subscription '{}' to topic '{}' with filter {}", subscriptionId, topic, filter);
        }
        dispatch(notifications);
        return registration;
    }

    @Override
    public boolean unsubscribe(@Nonnull String subscriptionId) {
        Objects.requireNonNull(subscriptionId, "subscriptionId");
        synchronized (lock) {
            HandlerRegistration registration = subscriptions.remove(subscriptionId);
            if (registration == null) {
                return false;
            }
            registration.deactivate();
            Connection connection = connections.get(registration.getTopic());
            if (connection != null && connection.handlers.remove(subscriptionId) != null
                    && connection.handlers.isEmpty()) {
                scheduleCleanup(connection);
            }
            log.debug("Detached subscription '{}' from topic '{}'", subscriptionId, registration.getTopic());
            return true;
        }
    }

    @Override
    public int optimizeConnections() {
        List<Runnable> notifications = new ArrayList<>();
        int reclaimed;
        synchronized (lock) {
            reclaimed = optimizeLocked(clock.millis(), notifications);
        }
        dispatch(notifications);
        return reclaimed;
    }

    @Override
    public void onNetworkStatusChanged(boolean online) {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (lock) {
            boolean wasOnline = this.online;
            this.online = online;
            if (!online) {
                log.info("Network went offline, reconnection suspended");
                return;
            }
            if (wasOnline || closed) {
                return;
            }
            log.info("Network is back, reconnecting {} connections", connections.size());
            for (Connection connection : new ArrayList<>(connections.values())) {
                if (connection.closed) {
                    continue;
                }
                if (connection.reconnectTask != null) {
                    connection.reconnectTask.cancel(false);
                    connection.reconnectTask = null;
                }
                connection.reconnectAttempts = 0;
                closeToken(connection);
                open(connection, notifications);
            }
        }
        dispatch(notifications);
    }

    @Override
    public void onVisibilityChanged(boolean foreground) {
        synchronized (lock) {
            if (foreground) {
                if (heartbeatTask == null && !closed) {
                    startHeartbeat();
                    log.debug("Heartbeat resumed");
                }
            } else if (heartbeatTask != null) {
                heartbeatTask.cancel(false);
                heartbeatTask = null;
                log.debug("Heartbeat paused");
            }
        }
    }

    @Override
    public ConnectionStats getStats() {
        synchronized (lock) {
            Map<String, ConnectionSnapshot> snapshots = new LinkedHashMap<>();
            for (Connection connection : connections.values()) {
                snapshots.put(connection.topic, connection.snapshot());
            }
            return new ConnectionStats(subscriptions.size(), snapshots);
        }
    }

    @Override
    public void cleanup() {
        synchronized (lock) {
            int count = connections.size();
            for (Connection connection : new ArrayList<>(connections.values())) {
                closeConnectionLocked(connection);
            }
            subscriptions.clear();
            log.info("Closed {} connections", count);
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            if (heartbeatTask != null) {
                heartbeatTask.cancel(false);
                heartbeatTask = null;
            }
        }
        cleanup();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    // Caller holds the lock.
    private void open(Connection connection, List<Runnable> notifications) {
        long generation = ++connection.generation;
        connection.status = ConnectionStatus.CONNECTING;
        connection.lastActivity = clock.millis();
        try {
            RealtimeChannel channel = eventSource.openChannel(connection.topic, connection.options);
            connection.channel = channel;
            for (HandlerRegistration registration : connection.handlers.values()) {
                attach(connection, channel, generation, registration);
            }
            ChannelToken token = channel.subscribe(status -> onChannelStatus(connection, generation, status));
            if (connection.closed || connection.generation != generation) {
                // the channel was given up on while subscribing
                eventSource.close(token);
            } else {
                connection.token = token;
            }
        } catch (RuntimeException e) {
            connection.errorCount.incrementAndGet();
            connection.status = ConnectionStatus.ERRORED;
            log.warn("Could not open channel for topic '{}'", connection.topic, e);
            handleFailure(connection, notifications);
        }
    }

    private void attach(Connection connection, RealtimeChannel channel, long generation,
                        HandlerRegistration registration) {
        channel.on(RealtimeChannel.CHANGES, registration.getFilter(),
                event -> onChannelEvent(connection, generation, registration, event));
    }

    private void onChannelEvent(Connection connection, long generation, HandlerRegistration registration,
                                ChangeEvent event) {
        synchronized (lock) {
            if (connection.closed || connection.generation != generation || !registration.isActive()) {
                return;
            }
            long now = clock.millis();
            connection.lastActivity = now;
            connection.lastUsed = now;
        }
        connection.messageCount.incrementAndGet();
        registration.accept(event);
    }

    private void onChannelStatus(Connection connection, long generation, ChannelStatus status) {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (lock) {
            if (connection.closed || connection.generation != generation) {
                return;
            }
            connection.lastActivity = clock.millis();
            for (HandlerRegistration registration : connection.handlers.values()) {
                ConnectionStatusListener listener = registration.getStatusListener();
                if (listener != null) {
                    notifications.add(() -> listener.onStatusChange(connection.topic, status));
                }
            }
            if (status.isFailure()) {
                connection.status = ConnectionStatus.ERRORED;
                connection.errorCount.incrementAndGet();
                log.warn("Channel for topic '{}' reported {}", connection.topic, status);
                handleFailure(connection, notifications);
            } else {
                connection.status = ConnectionStatus.SUBSCRIBED;
                connection.reconnectAttempts = 0;
                log.info("Connection for topic '{}' subscribed", connection.topic);
            }
        }
        dispatch(notifications);
    }

    // Caller holds the lock.
    private void handleFailure(Connection connection, List<Runnable> notifications) {
        if (connection.closed || connection.reconnectTask != null) {
            return;
        }
        if (!online) {
            log.debug("Offline, reconnection of topic '{}' waits for the network", connection.topic);
            return;
        }
        int attempts = connection.reconnectAttempts;
        if (attempts >= config.getMaxReconnectAttempts()) {
            log.error("Giving up on topic '{}' after {} reconnection attempts", connection.topic, attempts);
            for (HandlerRegistration registration : connection.handlers.values()) {
                ConnectionStatusListener listener = registration.getStatusListener();
                if (listener != null) {
                    notifications.add(() -> listener.onReconnectExhausted(connection.topic, attempts));
                }
            }
            closeConnectionLocked(connection);
            return;
        }
        long delay = reconnectDelayMillis(config.getReconnectDelay().toMillis(), attempts);
        connection.reconnectAttempts = attempts + 1;
        log.warn("Reconnecting topic '{}' in {} ms (attempt {} of {})", connection.topic, delay, attempts + 1,
                config.getMaxReconnectAttempts());
        try {
            connection.reconnectTask = scheduler.schedule(() -> reconnect(connection), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule reconnection of topic '{}'", connection.topic, e);
        }
    }

    private void reconnect(Connection connection) {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (lock) {
            connection.reconnectTask = null;
            if (connection.closed || !online) {
                return;
            }
            log.info("Reconnecting topic '{}' (attempt {})", connection.topic, connection.reconnectAttempts);
            closeToken(connection);
            open(connection, notifications);
        }
        dispatch(notifications);
    }

    // Caller holds the lock.
    private int optimizeLocked(long now, List<Runnable> notifications) {
        long idleThreshold = config.getIdleThreshold().toMillis();
        List<Connection> candidates = new ArrayList<>();
        for (Connection connection : connections.values()) {
            if (connection.handlers.isEmpty() || now - connection.lastUsed > idleThreshold) {
                candidates.add(connection);
            }
        }
        candidates.sort(Comparator.comparingLong(c -> c.lastUsed));
        for (Connection connection : candidates) {
            for (HandlerRegistration registration : connection.handlers.values()) {
                ConnectionStatusListener listener = registration.getStatusListener();
                if (listener != null) {
                    notifications.add(() -> listener.onStatusChange(connection.topic, ChannelStatus.CLOSED));
                }
            }
            closeConnectionLocked(connection);
        }
        if (!candidates.isEmpty()) {
            log.info("Reclaimed {} idle connections, {} remain pooled", candidates.size(), connections.size());
        }
        return candidates.size();
    }

    // Caller holds the lock.
    private void scheduleCleanup(Connection connection) {
        if (connection.cleanupTask != null) {
            connection.cleanupTask.cancel(false);
        }
        try {
            connection.cleanupTask = scheduler.schedule(() -> closeIfUnused(connection),
                    config.getIdleGracePeriod().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule cleanup of topic '{}', closing now", connection.topic, e);
            closeConnectionLocked(connection);
        }
    }

    private void closeIfUnused(Connection connection) {
        synchronized (lock) {
            connection.cleanupTask = null;
            if (!connection.closed && connection.handlers.isEmpty()) {
                log.info("Closing unused connection for topic '{}'", connection.topic);
                closeConnectionLocked(connection);
            }
        }
    }

    // Caller holds the lock.
    private void closeConnectionLocked(Connection connection) {
        if (connection.closed) {
            return;
        }
        connection.closed = true;
        connection.status = ConnectionStatus.CLOSED;
        if (connection.reconnectTask != null) {
            connection.reconnectTask.cancel(false);
            connection.reconnectTask = null;
        }
        if (connection.cleanupTask != null) {
            connection.cleanupTask.cancel(false);
            connection.cleanupTask = null;
        }
        closeToken(connection);
        for (HandlerRegistration registration : connection.handlers.values()) {
            registration.deactivate();
            subscriptions.remove(registration.getSubscriptionId());
        }
        connection.handlers.clear();
        connections.remove(connection.topic, connection);
        log.info("Closed connection for topic '{}'", connection.topic);
    }

    // Caller holds the lock.
    private void closeToken(Connection connection) {
        ChannelToken token = connection.token;
        connection.token = null;
        if (token == null) {
            return;
        }
        try {
            eventSource.close(token);
        } catch (RuntimeException e) {
            log.warn("Event source failed to close channel for topic '{}'", connection.topic, e);
        }
    }

    // Caller holds the lock.
    private void startHeartbeat() {
        long interval = config.getHeartbeatInterval().toMillis();
        try {
            heartbeatTask = scheduler.scheduleAtFixedRate(this::heartbeat, interval, interval, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule heartbeat", e);
        }
    }

    private void heartbeat() {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (lock) {
            if (closed) {
                return;
            }
            long now = clock.millis();
            long staleAfter = 2 * config.getHeartbeatInterval().toMillis();
            for (Connection connection : new ArrayList<>(connections.values())) {
                if (connection.closed) {
                    continue;
                }
                if (connection.status == ConnectionStatus.SUBSCRIBED && connection.channel != null
                        && ping(connection, now)) {
                    connection.lastActivity = now;
                }
                if (now - connection.lastActivity > staleAfter && connection.reconnectTask == null && online) {
                    log.warn("Connection for topic '{}' is stale, no activity for {} ms", connection.topic,
                            now - connection.lastActivity);
                    connection.status = ConnectionStatus.ERRORED;
                    handleFailure(connection, notifications);
                }
            }
        }
        dispatch(notifications);
    }

    private boolean ping(Connection connection, long now) {
        try {
            return connection.channel.send(ControlMessage.ping(now));
        } catch (RuntimeException e) {
            log.debug("Heartbeat ping failed for topic '{}'", connection.topic, e);
            return false;
        }
    }

    private void dispatch(List<Runnable> notifications) {
        for (Runnable notification : notifications) {
            try {
                scheduler.execute(() -> runListener(notification));
            } catch (RejectedExecutionException e) {
                log.warn("Dropped a status notification, scheduler is shut down", e);
            }
        }
    }

    private static void runListener(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Connection status listener threw", e);
        }
    }

    /**
     * {@code reconnectDelay * 2^attempts}, with the exponent capped at
     * {@value #MAX_BACKOFF_EXPONENT} and the product capped at {@value #MAX_BACKOFF_MILLIS} ms.
     */
    static long reconnectDelayMillis(long reconnectDelayMillis, int attempts) {
        int exponent = Math.min(Math.max(attempts, 0), MAX_BACKOFF_EXPONENT);
        if (reconnectDelayMillis > MAX_BACKOFF_MILLIS >> exponent) {
            return MAX_BACKOFF_MILLIS;
        }
        return reconnectDelayMillis << exponent;
    }

    private static ScheduledExecutorService createDefaultScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "DefaultConnectionManager-scheduler");
            t.setDaemon(true);
            return t;
        });
    }
}
