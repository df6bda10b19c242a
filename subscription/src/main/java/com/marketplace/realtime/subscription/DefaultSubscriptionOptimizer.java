package com.marketplace.realtime.subscription;

import com.marketplace.realtime.connection.ChannelStatus;
import com.marketplace.realtime.connection.ConnectionManager;
import com.marketplace.realtime.connection.ConnectionStatusListener;
import com.marketplace.realtime.connection.RealtimeEvent;
import com.marketplace.realtime.connection.SubscribeOptions;
import com.marketplace.realtime.connection.Subscription;
import com.marketplace.realtime.queue.EnqueueOptions;
import com.marketplace.realtime.queue.MessagePriority;
import com.marketplace.realtime.queue.MessageQueue;
import com.marketplace.realtime.queue.ProcessorOptions;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
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
 * {@link SubscriptionOptimizer} on top of a {@link ConnectionManager} and a
 * {@link MessageQueue}.
 *
 * <h2>Subscribe</h2>
 * <ol>
 *   <li>The subscription id is {@code sub_<consumerId>_<fingerprint>}, suffixed when taken.</li>
 *   <li>With deduplication on, a registration identical to a live one (same consumer, same
 *       spec) adds its callback to it.</li>
 *   <li>A consumer at its quota first loses its least recently accessed subscriptions.</li>
 *   <li>With batching on, a subscription to a spec that already has a group joins it and is
 *       fed by the group's connection subscription.</li>
 *   <li>Otherwise a connection subscription is opened; with batching on it seeds a new group
 *       with the new subscription as master.</li>
 * </ol>
 *
 * <h2>Removal</h2>
 * Unsubscribing a callback removes that callback. A subscription without callbacks leaves its
 * group, and a group without members closes its connection subscription, which lets the
 * connection manager close the connection. A connection that exhausted its reconnection
 * attempts takes its subscriptions with it.
 *
 * <p>Registries are guarded by a single lock. Callbacks never run while it is held.
 */
public class DefaultSubscriptionOptimizer implements SubscriptionOptimizer {

    private static final Logger log = LoggerFactory.getLogger(DefaultSubscriptionOptimizer.class);

    private final ConnectionManager connectionManager;
    private final MessageQueue messageQueue;
    private final OptimizerConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final Object lock = new Object();
    private final Map<String, ManagedSubscription> subscriptions = new LinkedHashMap<>();
    private final Map<SubscriptionKey, ManagedSubscription> identical = new HashMap<>();
    private final Map<String, Set<String>> consumers = new LinkedHashMap<>();
    private final Map<TopicSpec, SubscriptionGroup> groups = new LinkedHashMap<>();
    private final AtomicLong callbackSequence = new AtomicLong();
    private final AtomicLong callbackErrors = new AtomicLong();
    private long subscriptionSequence;
    private long totalSubscriptions;
    private long optimizedSubscriptions;
    private long deduplicatedSubscriptions;
    private ScheduledFuture<?> sweepTask;
    private boolean closed;

    /**
     * Creates an optimizer backed by its own daemon scheduler thread, shut down by
     * {@link #close()}.
     */
    public DefaultSubscriptionOptimizer(@Nonnull ConnectionManager connectionManager,
                                        @Nonnull MessageQueue messageQueue, @Nonnull OptimizerConfig config) {
        this(connectionManager, messageQueue, config, Clock.systemUTC(), createDefaultScheduler(), true);
    }

    /**
     * Creates an optimizer sharing the given clock and scheduler, which run throttling and the
     * idle sweep. The scheduler is left running by {@link #close()}.
     */
    public DefaultSubscriptionOptimizer(@Nonnull ConnectionManager connectionManager,
                                        @Nonnull MessageQueue messageQueue, @Nonnull OptimizerConfig config,
                                        @Nonnull Clock clock, @Nonnull ScheduledExecutorService scheduler) {
        this(connectionManager, messageQueue, config, clock, scheduler, false);
    }

    private DefaultSubscriptionOptimizer(ConnectionManager connectionManager, MessageQueue messageQueue,
                                         OptimizerConfig config, Clock clock, ScheduledExecutorService scheduler,
                                         boolean ownsScheduler) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.messageQueue = Objects.requireNonNull(messageQueue, "messageQueue");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;

        messageQueue.setBatchProcessor(config.getCallbackQueueName(), PendingCallback.class,
                (pending, metadata) -> {
                    for (PendingCallback callback : pending) {
                        callback.run();
                    }
                },
                ProcessorOptions.batched(config.getCallbackBatchSize(), config.getCallbackBatchTimeout()));
        long interval = config.getCleanupInterval().toMillis();
        try {
            sweepTask = scheduler.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule the idle subscription sweep", e);
        }
    }

    public OptimizerConfig getConfig() {
        return config;
    }

    @Override
    public OptimizedSubscription subscribe(@Nonnull String consumerId, @Nonnull TopicSpec topicSpec,
                                           @Nonnull Consumer<RealtimeEvent> callback,
                                           @Nonnull SubscriptionOptions options) {
        Objects.requireNonNull(consumerId, "consumerId");
        if (consumerId.trim().isEmpty()) {
            throw new IllegalArgumentException("consumerId must not be blank");
        }
        Objects.requireNonNull(topicSpec, "topicSpec");
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(options, "options");

        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Subscription optimizer is closed");
            }
            long now = clock.millis();
            SubscriptionKey key = new SubscriptionKey(consumerId, topicSpec);

            if (config.isEnableDeduplication()) {
                ManagedSubscription existing = identical.get(key);
                if (existing != null && isDetached(existing.group)) {
                    dropDetachedGroupLocked(existing.group);
                    existing = null;
                }
                if (existing != null) {
                    CallbackEntry entry = newEntry(existing.id, callback, options);
                    existing.callbacks.put(entry.getId(), entry);
                    existing.lastAccessed = now;
                    deduplicatedSubscriptions++;
                    log.debug("Deduplicated callback onto subscription '{}' ({} callbacks)", existing.id,
                            existing.callbacks.size());
                    return new OptimizedSubscription(existing.id, topicSpec, true, false, entry, this);
                }
            }

            enforceQuota(consumerId);

            String id = allocateId(key);
            ManagedSubscription subscription = new ManagedSubscription(id, key, ++subscriptionSequence, now);
            CallbackEntry entry = newEntry(id, callback, options);
            subscription.callbacks.put(entry.getId(), entry);

            boolean grouped = false;
            SubscriptionGroup group = config.isEnableBatching() ? groups.get(topicSpec) : null;
            if (group != null && isDetached(group)) {
                dropDetachedGroupLocked(group);
                group = null;
            }
            if (group != null) {
                group.members.put(id, subscription);
                grouped = true;
                optimizedSubscriptions++;
                log.debug("Subscription '{}' joined the group of {} ({} members)", id, topicSpec,
                        group.members.size());
            } else {
                group = new SubscriptionGroup(topicSpec, config.isEnableBatching(), subscription, now);
                group.connectionSubscription = openConnectionSubscription(group, options);
                if (group.shared) {
                    groups.put(topicSpec, group);
                }
                log.debug("Subscription '{}' opened a connection subscription for {}", id, topicSpec);
            }
            subscription.group = group;

            subscriptions.put(id, subscription);
            if (config.isEnableDeduplication()) {
                identical.put(key, subscription);
            }
            consumers.computeIfAbsent(consumerId, c -> new LinkedHashSet<>()).add(id);
            totalSubscriptions++;
            return new OptimizedSubscription(id, topicSpec, false, grouped, entry, this);
        }
    }

    @Override
    public boolean unsubscribe(@Nonnull String subscriptionId) {
        Objects.requireNonNull(subscriptionId, "subscriptionId");
        synchronized (lock) {
            ManagedSubscription subscription = subscriptions.get(subscriptionId);
            if (subscription == null) {
                return false;
            }
            removeLocked(subscription);
            log.debug("Removed subscription '{}'", subscriptionId);
            return true;
        }
    }

    @Override
    public boolean touch(@Nonnull String subscriptionId) {
        Objects.requireNonNull(subscriptionId, "subscriptionId");
        synchronized (lock) {
            ManagedSubscription subscription = subscriptions.get(subscriptionId);
            if (subscription == null) {
                return false;
            }
            subscription.lastAccessed = clock.millis();
            return true;
        }
    }

    @Override
    public List<String> getSubscriptionIds(@Nonnull String consumerId) {
        Objects.requireNonNull(consumerId, "consumerId");
        synchronized (lock) {
            Set<String> ids = consumers.get(consumerId);
            return ids == null ? new ArrayList<>() : new ArrayList<>(ids);
        }
    }

    @Override
    public int cleanupStaleSubscriptions() {
        synchronized (lock) {
            long now = clock.millis();
            long timeout = config.getSubscriptionTimeout().toMillis();
            List<ManagedSubscription> stale = new ArrayList<>();
            for (ManagedSubscription subscription : subscriptions.values()) {
                if (now - subscription.lastAccessed > timeout) {
                    stale.add(subscription);
                }
            }
            for (ManagedSubscription subscription : stale) {
                log.info("Removing subscription '{}' idle for {} ms", subscription.id, now - subscription.lastAccessed);
                removeLocked(subscription);
            }
            for (SubscriptionGroup group : new ArrayList<>(groups.values())) {
                if (group.members.isEmpty()) {
                    closeGroupLocked(group);
                }
            }
            return stale.size();
        }
    }

    @Override
    public OptimizerStats getStats() {
        synchronized (lock) {
            return new OptimizerStats(totalSubscriptions, subscriptions.size(), optimizedSubscriptions,
                    deduplicatedSubscriptions, consumers.size(), groups.size(), callbackErrors.get());
        }
    }

    @Override
    public void cleanup() {
        synchronized (lock) {
            int count = subscriptions.size();
            for (ManagedSubscription subscription : new ArrayList<>(subscriptions.values())) {
                removeLocked(subscription);
            }
            for (SubscriptionGroup group : new ArrayList<>(groups.values())) {
                closeGroupLocked(group);
            }
            totalSubscriptions = 0;
            optimizedSubscriptions = 0;
            deduplicatedSubscriptions = 0;
            callbackErrors.set(0);
            log.info("Removed {} subscriptions", count);
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            if (sweepTask != null) {
                sweepTask.cancel(false);
                sweepTask = null;
            }
        }
        cleanup();
        messageQueue.removeQueue(config.getCallbackQueueName());
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    void removeCallback(String subscriptionId, CallbackEntry entry) {
        synchronized (lock) {
            entry.deactivate();
            ManagedSubscription subscription = subscriptions.get(subscriptionId);
            if (subscription == null || subscription.callbacks.remove(entry.getId()) == null) {
                return;
            }
            if (subscription.callbacks.isEmpty()) {
                removeLocked(subscription);
                log.debug("Removed subscription '{}' with its last callback", subscriptionId);
            }
        }
    }

    /**
     * @return {@code false} if the callback queue refused the event
     */
    boolean enqueueCallback(CallbackEntry entry, RealtimeEvent event, MessagePriority priority) {
        try {
            messageQueue.enqueue(config.getCallbackQueueName(), new PendingCallback(entry, event),
                    EnqueueOptions.builder().priority(priority).maxRetries(0).build());
            return true;
        } catch (IllegalStateException e) {
            log.warn("Callback queue unavailable, invoking the callback of '{}' directly", entry.getSubscriptionId(),
                    e);
            return false;
        }
    }

    void recordCallbackError() {
        callbackErrors.incrementAndGet();
    }

    private CallbackEntry newEntry(String subscriptionId, Consumer<RealtimeEvent> callback,
                                   SubscriptionOptions options) {
        PriorityClassifier classifier = config.isEnablePrioritization() ? options.getPriorityClassifier() : null;
        Duration throttleDelay = config.isEnableThrottling() ? config.getThrottleDelay() : null;
        return new CallbackEntry(callbackSequence.incrementAndGet(), subscriptionId, callback, classifier,
                options.getStatusListener(), throttleDelay, clock, scheduler, this);
    }

    // Caller holds the lock.
    private String allocateId(SubscriptionKey key) {
        String base = key.baseId();
        String id = base;
        int suffix = 1;
        while (subscriptions.containsKey(id)) {
            id = base + "_" + (++suffix);
        }
        return id;
    }

    // Caller holds the lock.
    private void enforceQuota(String consumerId) {
        Set<String> ids = consumers.get(consumerId);
        int max = config.getMaxSubscriptionsPerConsumer();
        if (ids == null || ids.size() < max) {
            return;
        }
        List<ManagedSubscription> owned = new ArrayList<>();
        for (String id : ids) {
            owned.add(subscriptions.get(id));
        }
        owned.sort(Comparator.comparingLong((ManagedSubscription s) -> s.lastAccessed)
                .thenComparingLong(s -> s.sequence));
        int excess = owned.size() - max + 1;
        for (int i = 0; i < excess; i++) {
            ManagedSubscription evicted = owned.get(i);
            log.info("Consumer '{}' is at its quota of {}, evicting subscription '{}'", consumerId, max, evicted.id);
            removeLocked(evicted);
        }
    }

    // Caller holds the lock.
    private Subscription openConnectionSubscription(SubscriptionGroup group, SubscriptionOptions options) {
        SubscribeOptions.Builder connectionOptions = SubscribeOptions.builder()
                .batchDelay(config.getThrottleDelay())
                .statusListener(new GroupStatusListener(group));
        if (options.getEventBatching() != null) {
            connectionOptions.batching(options.getEventBatching());
        }
        TopicSpec spec = group.topicSpec;
        return connectionManager.subscribe(spec.getChannelName(), spec.getFilter(),
                event -> deliver(group, event), connectionOptions.build());
    }

    // Caller holds the lock.
    private void removeLocked(ManagedSubscription subscription) {
        if (subscription.removed) {
            return;
        }
        subscription.removed = true;
        subscriptions.remove(subscription.id);
        identical.remove(subscription.key, subscription);
        Set<String> ids = consumers.get(subscription.getConsumerId());
        if (ids != null) {
            ids.remove(subscription.id);
            if (ids.isEmpty()) {
                consumers.remove(subscription.getConsumerId());
            }
        }
        for (CallbackEntry entry : subscription.callbacks.values()) {
            entry.deactivate();
        }
        subscription.callbacks.clear();

        SubscriptionGroup group = subscription.group;
        if (group == null) {
            return;
        }
        group.members.remove(subscription.id);
        if (group.members.isEmpty()) {
            closeGroupLocked(group);
        } else if (group.master == subscription) {
            group.master = group.members.values().iterator().next();
            log.debug("Subscription '{}' is the new master of the group of {}", group.master.id, group.topicSpec);
        }
    }

    // Caller holds the lock.
    private static boolean isDetached(SubscriptionGroup group) {
        return group != null && (group.closed || group.connectionSubscription == null
                || !group.connectionSubscription.isActive());
    }

    /**
     * Removes the members of a group whose connection subscription was released by the
     * connection manager, for example when the pool reclaimed its connection. Caller holds the
     * lock.
     */
    private void dropDetachedGroupLocked(SubscriptionGroup group) {
        if (!group.members.isEmpty()) {
            log.warn("Connection subscription for {} is gone, removing {} subscriptions", group.topicSpec,
                    group.members.size());
        }
        for (ManagedSubscription member : new ArrayList<>(group.members.values())) {
            removeLocked(member);
        }
        closeGroupLocked(group);
    }

    // Caller holds the lock.
    private void closeGroupLocked(SubscriptionGroup group) {
        if (group.closed) {
            return;
        }
        group.closed = true;
        group.master = null;
        if (group.shared) {
            groups.remove(group.topicSpec, group);
        }
        Subscription connectionSubscription = group.connectionSubscription;
        group.connectionSubscription = null;
        if (connectionSubscription != null) {
            try {
                connectionSubscription.unsubscribe();
            } catch (RuntimeException e) {
                log.warn("Connection manager failed to release the subscription for {}", group.topicSpec, e);
            }
        }
    }

    private void deliver(SubscriptionGroup group, RealtimeEvent event) {
        List<CallbackEntry> targets = new ArrayList<>();
        synchronized (lock) {
            if (group.closed) {
                return;
            }
            for (ManagedSubscription member : group.members.values()) {
                member.messageCount.incrementAndGet();
                targets.addAll(member.callbacks.values());
            }
        }
        for (CallbackEntry target : targets) {
            target.offer(event);
        }
    }

    private void sweep() {
        try {
            int removed = cleanupStaleSubscriptions();
            if (removed > 0) {
                log.info("Idle sweep removed {} subscriptions", removed);
            }
        } catch (RuntimeException e) {
            log.warn("Idle subscription sweep failed", e);
        }
    }

    private static ScheduledExecutorService createDefaultScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "DefaultSubscriptionOptimizer-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Forwards the status of a group's connection to every callback that registered a listener.
     * A connection that is gone for good, because reconnection was exhausted or the pool
     * reclaimed it, takes the group's subscriptions with it.
     */
    private final class GroupStatusListener implements ConnectionStatusListener {

        private final SubscriptionGroup group;

        private GroupStatusListener(SubscriptionGroup group) {
            this.group = group;
        }

        @Override
        public void onStatusChange(String topic, ChannelStatus status) {
            for (ConnectionStatusListener listener : listeners(status == ChannelStatus.CLOSED, false)) {
                listener.onStatusChange(topic, status);
            }
        }

        @Override
        public void onReconnectExhausted(String topic, int attempts) {
            for (ConnectionStatusListener listener : listeners(true, true)) {
                listener.onReconnectExhausted(topic, attempts);
            }
        }

        private List<ConnectionStatusListener> listeners(boolean mayBeGone, boolean gone) {
            List<ConnectionStatusListener> listeners = new ArrayList<>();
            synchronized (lock) {
                for (ManagedSubscription member : group.members.values()) {
                    for (CallbackEntry entry : member.callbacks.values()) {
                        if (entry.getStatusListener() != null) {
                            listeners.add(entry.getStatusListener());
                        }
                    }
                }
                if (mayBeGone && !group.closed && (gone || isDetached(group))) {
                    dropDetachedGroupLocked(group);
                }
            }
            return listeners;
        }
    }
}
