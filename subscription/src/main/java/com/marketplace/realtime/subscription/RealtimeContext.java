package com.marketplace.realtime.subscription;

import com.marketplace.realtime.connection.ConnectionManager;
import com.marketplace.realtime.connection.ConnectionManagerConfig;
import com.marketplace.realtime.connection.DefaultConnectionManager;
import com.marketplace.realtime.connection.EventSource;
import com.marketplace.realtime.queue.MessageQueue;
import com.marketplace.realtime.queue.MessageQueueConfig;
import com.marketplace.realtime.queue.PriorityMessageQueue;
import java.time.Clock;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The real-time delivery stack of one process: a message queue, a connection manager and a
 * subscription optimizer wired together over one clock and one scheduler.
 *
 * <p>Build it once at start-up and hand it, or its parts, to whoever needs them:
 *
 * <pre>{@code
 * try (RealtimeContext context = RealtimeContext.builder(eventSource)
 *         .properties(properties)
 *         .build()) {
 *     context.getSubscriptionOptimizer().subscribe("user-42", TopicSpec.channel("orders"), handler);
 * }
 * }</pre>
 */
public final class RealtimeContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RealtimeContext.class);

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final PriorityMessageQueue messageQueue;
    private final DefaultConnectionManager connectionManager;
    private final DefaultSubscriptionOptimizer subscriptionOptimizer;
    private final Object lock = new Object();
    private boolean closed;

    private RealtimeContext(Builder builder) {
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler ? createDefaultScheduler() : builder.scheduler;
        this.messageQueue = new PriorityMessageQueue(builder.queueConfig, builder.clock, scheduler);
        this.connectionManager = new DefaultConnectionManager(builder.eventSource, builder.connectionConfig,
                builder.clock, scheduler);
        this.subscriptionOptimizer = new DefaultSubscriptionOptimizer(connectionManager, messageQueue,
                builder.optimizerConfig, builder.clock, scheduler);
        log.info("Realtime context started with {}, {} and {}", builder.connectionConfig, builder.queueConfig,
                builder.optimizerConfig);
    }

    public static Builder builder(@Nonnull EventSource eventSource) {
        return new Builder(eventSource);
    }

    public MessageQueue getMessageQueue() {
        return messageQueue;
    }

    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public SubscriptionOptimizer getSubscriptionOptimizer() {
        return subscriptionOptimizer;
    }

    /**
     * Closes the optimizer, the connection manager and the queue, in that order, then the
     * scheduler if the context created it. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        subscriptionOptimizer.close();
        connectionManager.close();
        messageQueue.close();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        log.info("Realtime context closed");
    }

    private static ScheduledExecutorService createDefaultScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "RealtimeContext-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public static final class Builder {

        private final EventSource eventSource;
        private ConnectionManagerConfig connectionConfig = ConnectionManagerConfig.defaults();
        private MessageQueueConfig queueConfig = MessageQueueConfig.defaults();
        private OptimizerConfig optimizerConfig = OptimizerConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private ScheduledExecutorService scheduler;

        private Builder(EventSource eventSource) {
            this.eventSource = Objects.requireNonNull(eventSource, "eventSource");
        }

        public Builder connectionConfig(ConnectionManagerConfig connectionConfig) {
            this.connectionConfig = Objects.requireNonNull(connectionConfig, "connectionConfig");
            return this;
        }

        public Builder queueConfig(MessageQueueConfig queueConfig) {
            this.queueConfig = Objects.requireNonNull(queueConfig, "queueConfig");
            return this;
        }

        public Builder optimizerConfig(OptimizerConfig optimizerConfig) {
            this.optimizerConfig = Objects.requireNonNull(optimizerConfig, "optimizerConfig");
            return this;
        }

        /**
         * Reads all three configurations from {@code properties}, replacing any set before.
         */
        public Builder properties(Properties properties) {
            Objects.requireNonNull(properties, "properties");
            this.connectionConfig = ConnectionManagerConfig.fromProperties(properties);
            this.queueConfig = MessageQueueConfig.fromProperties(properties);
            this.optimizerConfig = OptimizerConfig.fromProperties(properties);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Shares {@code scheduler}; the context does not shut it down.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        public RealtimeContext build() {
            return new RealtimeContext(this);
        }
    }
}
