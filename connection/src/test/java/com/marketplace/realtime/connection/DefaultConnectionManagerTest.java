package com.marketplace.realtime.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketplace.realtime.connection.memory.InMemoryEventSource;
import com.marketplace.realtime.testkit.ManualClock;
import com.marketplace.realtime.testkit.ManualScheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DefaultConnectionManagerTest {

    private static final String TOPIC = "orders-feed";
    private static final ChangeFilter ORDERS = ChangeFilter.table("orders");

    private ManualClock clock;
    private ManualScheduler scheduler;
    private InMemoryEventSource source;
    private List<Long> openTimes;
    private DefaultConnectionManager manager;
    private List<RealtimeEvent> received;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_000L);
        scheduler = new ManualScheduler(clock);
        source = new InMemoryEventSource(scheduler);
        openTimes = new ArrayList<>();
        received = new ArrayList<>();
        manager = newManager(baseConfig().build());
    }

    @AfterEach
    void tearDown() {
        manager.close();
        assertThat(scheduler.getUncaughtExceptions()).isEmpty();
    }

    // ========== Pooling ==========

    @Test
    @DisplayName("Should share one connection between subscriptions to the same topic")
    void oneConnectionPerTopic() {
        Subscription first = manager.subscribe(TOPIC, ORDERS, received::add);
        Subscription second = manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();

        assertThat(first.getSubscriptionId()).isNotEqualTo(second.getSubscriptionId());
        assertThat(source.getOpenCount(TOPIC)).isEqualTo(1);
        ConnectionStats stats = manager.getStats();
        assertThat(stats.getTotalConnections()).isEqualTo(1);
        assertThat(stats.getActiveConnections()).isEqualTo(1);
        assertThat(stats.getTotalSubscriptions()).isEqualTo(2);
        assertThat(stats.getConnections().get(TOPIC).getStatus()).isEqualTo(ConnectionStatus.SUBSCRIBED);
    }

    @Test
    @DisplayName("Should open the channel with the presence key and compression setting")
    void channelOptions() {
        manager.subscribe(TOPIC, ORDERS, received::add);
        manager.subscribe("other", ORDERS, received::add, SubscribeOptions.builder().presenceKey("me").build());

        assertThat(source.getLastOptions(TOPIC)).isEqualTo(new ChannelOptions(TOPIC, false, true));
        assertThat(source.getLastOptions("other").getPresenceKey()).isEqualTo("me");
    }

    @Test
    @DisplayName("Should deliver only events that pass the subscription filter")
    void deliversMatchingEvents() {
        ChangeFilter activeOrders = ChangeFilter.builder()
                .event("INSERT")
                .table("orders")
                .filter("status=eq.active")
                .build();
        manager.subscribe(TOPIC, activeOrders, received::add);
        scheduler.runDueTasks();

        source.publish(order(ChangeType.INSERT, "active"));
        source.publish(order(ChangeType.INSERT, "draft"));
        source.publish(order(ChangeType.UPDATE, "active"));
        source.publish(ChangeEvent.builder(TOPIC, ChangeType.INSERT, "users").value("status", "active").build());

        assertThat(received).hasSize(1);
        assertThat(received.get(0).getEventKind()).isEqualTo("INSERT");
        assertThat(manager.getStats().getTotalMessages()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should tell a listener joining a subscribed connection that it is subscribed")
    void lateListenerLearnsStatus() {
        manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();
        RecordingListener listener = new RecordingListener();

        manager.subscribe(TOPIC, ORDERS, received::add, SubscribeOptions.builder().statusListener(listener).build());

        assertThat(listener.statuses).containsExactly(ChannelStatus.SUBSCRIBED);
    }

    // ========== Unsubscribe ==========

    @Test
    @DisplayName("Should treat a second unsubscribe as a no-op")
    void idempotentUnsubscribe() {
        Subscription first = manager.subscribe(TOPIC, ORDERS, received::add);
        manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();

        first.unsubscribe();
        first.unsubscribe();

        assertThat(first.isActive()).isFalse();
        assertThat(manager.unsubscribe(first.getSubscriptionId())).isFalse();
        assertThat(manager.getStats().getTotalSubscriptions()).isEqualTo(1);
        assertThat(manager.getStats().getConnections().get(TOPIC).getSubscriptions()).isEqualTo(1);

        source.publish(order(ChangeType.INSERT, "active"));
        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("Should close a connection without handlers after the grace period")
    void closesAfterGracePeriod() {
        Subscription subscription = manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();

        subscription.unsubscribe();
        scheduler.advanceBy(Duration.ofMillis(499));
        assertThat(source.getOpenChannelCount(TOPIC)).isEqualTo(1);

        scheduler.advanceBy(Duration.ofMillis(1));
        assertThat(source.getOpenChannelCount(TOPIC)).isZero();
        assertThat(manager.getStats().getTotalConnections()).isZero();
    }

    @Test
    @DisplayName("Should keep the connection when a subscribe arrives within the grace period")
    void resubscribeCancelsCleanup() {
        manager.subscribe(TOPIC, ORDERS, received::add).unsubscribe();
        scheduler.advanceBy(Duration.ofMillis(300));

        manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.advanceBy(Duration.ofSeconds(5));

        assertThat(source.getOpenCount(TOPIC)).isEqualTo(1);
        assertThat(source.getOpenChannelCount(TOPIC)).isEqualTo(1);
    }

    // ========== Reconnection ==========

    @Test
    @DisplayName("Should back off exponentially and give up after the maximum attempts")
    void reconnectBackoff() {
        source.setSubscribeOutcome(TOPIC, ChannelStatus.CHANNEL_ERROR);
        RecordingListener listener = new RecordingListener();
        Subscription subscription = manager.subscribe(TOPIC, ORDERS, received::add,
                SubscribeOptions.builder().statusListener(listener).build());

        scheduler.advanceBy(Duration.ofSeconds(60));

        assertThat(openTimes).containsExactly(1_000L, 1_100L, 1_300L, 1_700L, 2_500L);
        assertThat(listener.exhaustedAttempts).containsExactly(4);
        assertThat(listener.statuses).hasSize(5).containsOnly(ChannelStatus.CHANNEL_ERROR);
        assertThat(subscription.isActive()).isFalse();
        assertThat(manager.getStats().getTotalConnections()).isZero();
        assertThat(source.getOpenChannelCount(TOPIC)).isZero();
    }

    @Test
    @DisplayName("Should keep the reconnection backoff positive for large attempt counts")
    void reconnectBackoffIsBounded() {
        assertThat(DefaultConnectionManager.reconnectDelayMillis(100L, 0)).isEqualTo(100L);
        assertThat(DefaultConnectionManager.reconnectDelayMillis(100L, 3)).isEqualTo(800L);
        assertThat(DefaultConnectionManager.reconnectDelayMillis(100L, 64)).isPositive()
                .isEqualTo(DefaultConnectionManager.reconnectDelayMillis(100L, 1_000));
        assertThat(DefaultConnectionManager.reconnectDelayMillis(Long.MAX_VALUE, 5)).isPositive();
    }

    @Test
    @DisplayName("Should reset the attempt counter once the channel subscribes again")
    void subscribedResetsAttempts() {
        source.setSubscribeOutcome(TOPIC, ChannelStatus.TIMED_OUT);
        manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();
        assertThat(manager.getStats().getConnections().get(TOPIC).getReconnectAttempts()).isEqualTo(1);

        source.setSubscribeOutcome(TOPIC, ChannelStatus.SUBSCRIBED);
        scheduler.advanceBy(Duration.ofMillis(100));

        ConnectionSnapshot snapshot = manager.getStats().getConnections().get(TOPIC);
        assertThat(snapshot.getReconnectAttempts()).isZero();
        assertThat(snapshot.getStatus()).isEqualTo(ConnectionStatus.SUBSCRIBED);
        assertThat(snapshot.getErrorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reopen the channel after an error and keep delivering to existing handlers")
    void reconnectRestoresHandlers() {
        manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();

        source.emitStatus(TOPIC, ChannelStatus.CHANNEL_ERROR);
        scheduler.advanceBy(Duration.ofMillis(100));

        assertThat(source.getOpenCount(TOPIC)).isEqualTo(2);
        assertThat(source.getOpenChannelCount(TOPIC)).isEqualTo(1);
        source.publish(order(ChangeType.INSERT, "active"));
        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("Should treat a connection without activity for two heartbeat intervals as stale")
    void staleConnectionReconnects() {
        source.setAcceptControlMessages(false);
        manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();

        scheduler.advanceBy(Duration.ofMillis(2_999));
        assertThat(source.getOpenCount(TOPIC)).isEqualTo(1);

        scheduler.advanceBy(Duration.ofMillis(1));
        scheduler.advanceBy(Duration.ofMillis(100));
        assertThat(source.getOpenCount(TOPIC)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should count accepted pings as activity")
    void acceptedPingsKeepConnectionFresh() {
        manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();

        scheduler.advanceBy(Duration.ofSeconds(10));

        assertThat(source.getOpenCount(TOPIC)).isEqualTo(1);
        assertThat(source.getSentMessages()).hasSize(10);
        assertThat(source.getSentMessages().get(0).getType()).isEqualTo(ControlMessage.PING);
    }

    @Test
    @DisplayName("Should pause heartbeats in the background and resume them in the foreground")
    void visibilityPausesHeartbeat() {
        manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();

        manager.onVisibilityChanged(false);
        scheduler.advanceBy(Duration.ofSeconds(5));
        assertThat(source.getSentMessages()).isEmpty();

        manager.onVisibilityChanged(true);
        scheduler.advanceBy(Duration.ofSeconds(1));
        assertThat(source.getSentMessages()).hasSize(1);
    }

    @Test
    @DisplayName("Should not reconnect while offline and reconnect everything when back online")
    void networkHooks() {
        manager.subscribe(TOPIC, ORDERS, received::add);
        manager.subscribe("other", ORDERS, received::add);
        scheduler.runDueTasks();

        manager.onNetworkStatusChanged(false);
        source.emitStatus(TOPIC, ChannelStatus.CLOSED);
        scheduler.advanceBy(Duration.ofSeconds(10));
        assertThat(source.getOpenCount(TOPIC)).isEqualTo(1);

        manager.onNetworkStatusChanged(true);
        assertThat(source.getOpenCount(TOPIC)).isEqualTo(2);
        assertThat(source.getOpenCount("other")).isEqualTo(2);

        scheduler.runDueTasks();
        source.publish(order(ChangeType.INSERT, "active"));
        assertThat(received).hasSize(1);
        assertThat(manager.getStats().getActiveConnections()).isEqualTo(2);
    }

    // ========== Batching ==========

    @Test
    @DisplayName("Should batch events of the same kind that arrive within one window")
    void batchesEventsWithinWindow() {
        manager.subscribe(TOPIC, ORDERS, received::add, SubscribeOptions.builder().batching(true).build());
        scheduler.runDueTasks();

        source.publish(order(ChangeType.INSERT, "a"));
        scheduler.advanceBy(Duration.ofMillis(50));
        source.publish(order(ChangeType.INSERT, "b"));
        source.publish(order(ChangeType.UPDATE, "c"));
        assertThat(received).isEmpty();

        scheduler.advanceBy(Duration.ofMillis(50));
        assertThat(received).hasSize(1);
        RealtimeEvent batch = received.get(0);
        assertThat(batch.isBatch()).isTrue();
        assertThat(batch.size()).isEqualTo(2);
        assertThat(batch.getEventKind()).isEqualTo("INSERT");

        scheduler.advanceBy(Duration.ofMillis(50));
        assertThat(received).hasSize(2);
        assertThat(received.get(1).isBatch()).isFalse();
        assertThat(received.get(1).getEventKind()).isEqualTo("UPDATE");
    }

    @Test
    @DisplayName("Should flush a batch at once when the buffer is full")
    void fullBufferFlushesImmediately() {
        manager.close();
        manager = newManager(baseConfig().enableBatching(true).messageQueueSize(3).build());
        manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();

        for (int i = 0; i < 3; i++) {
            source.publish(order(ChangeType.INSERT, "s" + i));
        }

        assertThat(received).hasSize(1);
        assertThat(received.get(0).getEvents()).hasSize(3);
    }

    // ========== Pool pressure ==========

    @Test
    @DisplayName("Should reclaim connections without handlers when the pool is full")
    void reclaimsUnusedConnections() {
        manager.close();
        manager = newManager(baseConfig().maxConnections(2).build());
        manager.subscribe("a", ORDERS, received::add).unsubscribe();
        manager.subscribe("b", ORDERS, received::add);

        manager.subscribe("c", ORDERS, received::add);

        assertThat(manager.getStats().getConnections()).containsOnlyKeys("b", "c");
    }

    @Test
    @DisplayName("Should reclaim idle connections least recently used first and tell their listeners")
    void reclaimsIdleConnections() {
        manager.close();
        manager = newManager(baseConfig().maxConnections(1).idleThreshold(Duration.ofSeconds(10)).build());
        RecordingListener listener = new RecordingListener();
        Subscription idle = manager.subscribe("a", ORDERS, received::add,
                SubscribeOptions.builder().statusListener(listener).build());
        scheduler.advanceBy(Duration.ofSeconds(11));

        manager.subscribe("b", ORDERS, received::add);

        assertThat(idle.isActive()).isFalse();
        assertThat(listener.statuses).endsWith(ChannelStatus.CLOSED);
        assertThat(manager.getStats().getConnections()).containsOnlyKeys("b");
    }

    @Test
    @DisplayName("Should let a subscribe exceed the pool size when nothing can be reclaimed")
    void poolCapIsAdvisory() {
        manager.close();
        manager = newManager(baseConfig().maxConnections(1).build());
        manager.subscribe("a", ORDERS, received::add);

        manager.subscribe("b", ORDERS, received::add);

        assertThat(manager.getStats().getTotalConnections()).isEqualTo(2);
        assertThat(manager.optimizeConnections()).isZero();
    }

    // ========== Isolation & lifecycle ==========

    @Test
    @DisplayName("Should isolate a failing handler from the others")
    void handlerIsolation() {
        manager.subscribe(TOPIC, ORDERS, event -> {
            throw new IllegalStateException("handler failure");
        });
        manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();

        source.publish(order(ChangeType.INSERT, "active"));

        assertThat(received).hasSize(1);
        assertThat(manager.getStats().getTotalErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should close every connection on cleanup and stay usable")
    void cleanupClosesEverything() {
        Subscription subscription = manager.subscribe(TOPIC, ORDERS, received::add);
        scheduler.runDueTasks();

        manager.cleanup();

        assertThat(subscription.isActive()).isFalse();
        assertThat(source.getOpenChannelCount(TOPIC)).isZero();
        assertThat(manager.getStats().getTotalSubscriptions()).isZero();
        manager.subscribe(TOPIC, ORDERS, received::add);
        assertThat(source.getOpenCount(TOPIC)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject subscribe after close and leave a shared scheduler running")
    void closeRejectsSubscribe() {
        manager.close();

        assertThatThrownBy(() -> manager.subscribe(TOPIC, ORDERS, received::add))
                .isInstanceOf(IllegalStateException.class);
        assertThat(scheduler.isShutdown()).isFalse();
    }

    @Test
    @DisplayName("Should validate subscribe arguments")
    void validatesArguments() {
        assertThatThrownBy(() -> manager.subscribe(" ", ORDERS, received::add))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.subscribe(TOPIC, null, received::add))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> manager.subscribe(TOPIC, ORDERS, null))
                .isInstanceOf(NullPointerException.class);
    }

    private DefaultConnectionManager newManager(ConnectionManagerConfig config) {
        EventSource recording = new EventSource() {
            @Override
            public RealtimeChannel openChannel(String topic, ChannelOptions options) {
                openTimes.add(clock.millis());
                return source.openChannel(topic, options);
            }

            @Override
            public void close(ChannelToken token) {
                source.close(token);
            }
        };
        return new DefaultConnectionManager(recording, config, clock, scheduler);
    }

    private static ConnectionManagerConfig.Builder baseConfig() {
        return ConnectionManagerConfig.builder()
                .enableBatching(false)
                .reconnectDelay(Duration.ofMillis(100))
                .maxReconnectAttempts(4)
                .heartbeatInterval(Duration.ofSeconds(1))
                .idleGracePeriod(Duration.ofMillis(500));
    }

    private static ChangeEvent order(ChangeType type, String status) {
        return ChangeEvent.builder(TOPIC, type, "orders").value("status", status).build();
    }

    private static final class RecordingListener implements ConnectionStatusListener {
        private final List<ChannelStatus> statuses = new ArrayList<>();
        private final List<Integer> exhaustedAttempts = new ArrayList<>();

        @Override
        public void onStatusChange(String topic, ChannelStatus status) {
            statuses.add(status);
        }

        @Override
        public void onReconnectExhausted(String topic, int attempts) {
            exhaustedAttempts.add(attempts);
        }
    }
}
