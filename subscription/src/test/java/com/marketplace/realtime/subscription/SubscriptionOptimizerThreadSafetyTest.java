package com.marketplace.realtime.subscription;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.marketplace.realtime.connection.ChangeFilter;
import com.marketplace.realtime.connection.ConnectionManagerConfig;
import com.marketplace.realtime.connection.memory.InMemoryEventSource;
import com.marketplace.realtime.queue.MessageQueueConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Hammers one optimizer from several threads and checks that every registry drains back to
 * empty.
 */
class SubscriptionOptimizerThreadSafetyTest {

    private static final int THREADS = 8;
    private static final int ROUNDS = 50;

    @Test
    @DisplayName("Concurrent subscribe and unsubscribe should leave no subscription behind")
    void concurrentSubscribeAndUnsubscribe() throws InterruptedException {
        ScheduledExecutorService sourceExecutor = Executors.newSingleThreadScheduledExecutor();
        ExecutorService workers = Executors.newFixedThreadPool(THREADS);
        InMemoryEventSource source = new InMemoryEventSource(sourceExecutor);
        List<TopicSpec> specs = new ArrayList<>();
        specs.add(TopicSpec.of("orders", ChangeFilter.table("orders")));
        specs.add(TopicSpec.of("orders", ChangeFilter.table("payments")));
        specs.add(TopicSpec.channel("users"));

        try (RealtimeContext context = RealtimeContext.builder(source)
                .connectionConfig(ConnectionManagerConfig.builder().idleGracePeriod(Duration.ZERO).build())
                .queueConfig(MessageQueueConfig.builder().processingDelay(Duration.ZERO).build())
                .optimizerConfig(OptimizerConfig.builder().maxSubscriptionsPerConsumer(2).build())
                .build()) {
            SubscriptionOptimizer optimizer = context.getSubscriptionOptimizer();
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(THREADS);
            AtomicReference<Throwable> failure = new AtomicReference<>();

            for (int t = 0; t < THREADS; t++) {
                String consumer = "consumer-" + (t % 3);
                workers.execute(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < ROUNDS; i++) {
                            TopicSpec spec = specs.get(i % specs.size());
                            OptimizedSubscription subscription = optimizer.subscribe(consumer, spec, event -> { });
                            optimizer.touch(subscription.getSubscriptionId());
                            subscription.unsubscribe();
                        }
                    } catch (Throwable e) {
                        failure.compareAndSet(null, e);
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();

            assertTrue(done.await(10, TimeUnit.SECONDS), "All workers should finish");
            assertEquals(null, failure.get(), "No worker should fail");
            OptimizerStats stats = optimizer.getStats();
            assertEquals(0, stats.getActiveSubscriptions());
            assertEquals(0, stats.getActiveConsumers());
            assertEquals(0, stats.getSubscriptionGroups());
            assertEquals(0, context.getConnectionManager().getStats().getTotalSubscriptions());
        } finally {
            workers.shutdownNow();
            sourceExecutor.shutdownNow();
        }
    }
}
