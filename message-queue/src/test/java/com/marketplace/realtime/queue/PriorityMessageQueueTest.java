package com.marketplace.realtime.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketplace.realtime.testkit.ManualClock;
import com.marketplace.realtime.testkit.ManualScheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PriorityMessageQueueTest {

    private static final String QUEUE = "orders";

    private ManualClock clock;
    private ManualScheduler scheduler;
    private PriorityMessageQueue queue;
    private List<Object> processed;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_000L);
        scheduler = new ManualScheduler(clock);
        queue = newQueue(baseConfig().build());
        processed = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        queue.close();
        assertThat(scheduler.getUncaughtExceptions()).isEmpty();
    }

    // ========== Ordering ==========

    @Test
    @DisplayName("Should drain higher priorities first and keep FIFO order within a tier")
    void drainsByPriorityThenFifo() {
        queue.enqueue(QUEUE, "low", EnqueueOptions.withPriority(MessagePriority.LOW));
        queue.enqueue(QUEUE, "high-1", EnqueueOptions.withPriority(MessagePriority.HIGH));
        queue.enqueue(QUEUE, "normal", EnqueueOptions.withPriority(MessagePriority.NORMAL));
        queue.enqueue(QUEUE, "high-2", EnqueueOptions.withPriority(MessagePriority.HIGH));

        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));
        scheduler.runDueTasks();

        assertThat(processed).containsExactly("high-1", "high-2", "normal", "low");
    }

    @Test
    @DisplayName("Should keep plain FIFO order when priorities are disabled")
    void plainFifoWhenPriorityDisabled() {
        queue.close();
        queue = newQueue(baseConfig().enablePriority(false).build());

        queue.enqueue(QUEUE, "low", EnqueueOptions.withPriority(MessagePriority.LOW));
        queue.enqueue(QUEUE, "high", EnqueueOptions.withPriority(MessagePriority.HIGH));
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));
        scheduler.runDueTasks();

        assertThat(processed).containsExactly("low", "high");
    }

    @Test
    @DisplayName("Should never process inside enqueue")
    void enqueueDoesNotProcessInline() {
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));

        String id = queue.enqueue(QUEUE, "a");

        assertThat(id).startsWith("msg_");
        assertThat(processed).isEmpty();
        scheduler.runDueTasks();
        assertThat(processed).containsExactly("a");
        assertThat(queue.getQueueStats(QUEUE).isProcessing()).isFalse();
    }

    @Test
    @DisplayName("Should generate distinct message ids")
    void generatesDistinctIds() {
        String first = queue.enqueue(QUEUE, "a");
        String second = queue.enqueue("other", "b");

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("Should space processing steps by the processing delay")
    void processingDelaySeparatesSteps() {
        queue.close();
        queue = newQueue(baseConfig().processingDelay(Duration.ofMillis(100)).build());
        List<Long> times = new ArrayList<>();
        queue.enqueue(QUEUE, "a");
        queue.enqueue(QUEUE, "b");
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> times.add(clock.millis()));

        scheduler.advanceBy(Duration.ofMillis(500));

        assertThat(times).containsExactly(1_000L, 1_100L);
    }

    @Test
    @DisplayName("Should pass metadata to the processor")
    void passesMetadata() {
        List<Map<String, Object>> seen = new ArrayList<>();
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> seen.add(metadata));

        queue.enqueue(QUEUE, "a", EnqueueOptions.builder().metadata("source", "test").build());
        scheduler.runDueTasks();

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0)).containsEntry("source", "test");
    }

    // ========== Overflow ==========

    @Test
    @DisplayName("Should drop the oldest LOW message, then the oldest NORMAL one, on overflow")
    void overflowDropsLowestTierFirst() {
        queue.close();
        queue = newQueue(baseConfig().maxQueueSize(3).build());

        queue.enqueue(QUEUE, "normal-1");
        queue.enqueue(QUEUE, "low-1", EnqueueOptions.withPriority(MessagePriority.LOW));
        queue.enqueue(QUEUE, "normal-2");
        queue.enqueue(QUEUE, "high-1", EnqueueOptions.withPriority(MessagePriority.HIGH));
        queue.enqueue(QUEUE, "normal-3");

        assertThat(queue.getQueueStats(QUEUE).getSize()).isEqualTo(3);
        assertThat(queue.getQueueStats(QUEUE).getDroppedMessages()).isEqualTo(2);
        assertThat(queue.getOverallStats().getTotalDropped()).isEqualTo(2);

        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));
        scheduler.runDueTasks();

        assertThat(processed).containsExactly("high-1", "normal-2", "normal-3");
    }

    @Test
    @DisplayName("Should drop the oldest message when every message is HIGH")
    void overflowDropsOldestHigh() {
        queue.close();
        queue = newQueue(baseConfig().maxQueueSize(2).build());
        EnqueueOptions high = EnqueueOptions.withPriority(MessagePriority.HIGH);

        queue.enqueue(QUEUE, "h1", high);
        queue.enqueue(QUEUE, "h2", high);
        queue.enqueue(QUEUE, "h3", high);

        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));
        scheduler.runDueTasks();

        assertThat(processed).containsExactly("h2", "h3");
    }

    // ========== Retry ==========

    @Test
    @DisplayName("Should retry with exponential backoff and give up after maxRetries")
    void retryExhaustion() {
        List<Long> attempts = new ArrayList<>();
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> {
            attempts.add(clock.millis());
            throw new IllegalStateException("always failing");
        });

        queue.enqueue(QUEUE, "doomed", EnqueueOptions.builder().maxRetries(2).build());
        scheduler.runDueTasks();
        scheduler.advanceBy(Duration.ofMillis(10));
        scheduler.advanceBy(Duration.ofMillis(19));
        assertThat(attempts).hasSize(2);
        scheduler.advanceBy(Duration.ofMillis(1));
        scheduler.advanceBy(Duration.ofSeconds(10));

        assertThat(attempts).containsExactly(1_000L, 1_010L, 1_030L);
        QueueStats stats = queue.getQueueStats(QUEUE);
        assertThat(stats.getFailedMessages()).isEqualTo(1);
        assertThat(stats.getRetriedMessages()).isEqualTo(2);
        assertThat(stats.getSize()).isZero();
        assertThat(stats.isProcessing()).isFalse();
        assertThat(scheduler.queuedTaskCount()).isZero();
    }

    @Test
    @DisplayName("Should use the configured retry budget when the message does not set one")
    void defaultRetryBudget() {
        AtomicInteger attempts = new AtomicInteger();
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("failing");
        });

        queue.enqueue(QUEUE, "doomed");
        scheduler.advanceBy(Duration.ofSeconds(5));

        assertThat(attempts.get()).isEqualTo(4);
        assertThat(queue.getOverallStats().getTotalFailed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should process a message that succeeds on retry")
    void succeedsOnRetry() {
        AtomicInteger attempts = new AtomicInteger();
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("transient");
            }
            processed.add(payload);
        });

        queue.enqueue(QUEUE, "flaky");
        scheduler.advanceBy(Duration.ofMillis(100));

        assertThat(processed).containsExactly("flaky");
        QueueStats stats = queue.getQueueStats(QUEUE);
        assertThat(stats.getProcessedMessages()).isEqualTo(1);
        assertThat(stats.getRetriedMessages()).isEqualTo(1);
        assertThat(stats.getFailedMessages()).isZero();
    }

    @Test
    @DisplayName("Should let other messages through while a failed message backs off")
    void failedMessageDoesNotBlockOthers() {
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> {
            if (payload.equals("bad")) {
                throw new IllegalStateException("bad payload");
            }
            processed.add(payload);
        });

        queue.enqueue(QUEUE, "bad", EnqueueOptions.builder().maxRetries(1).build());
        queue.enqueue(QUEUE, "good");
        scheduler.runDueTasks();

        assertThat(processed).containsExactly("good");
    }

    // ========== Delays ==========

    @Test
    @DisplayName("Should skip delayed messages until their ready time")
    void delayedMessagesWait() {
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));

        queue.enqueue(QUEUE, "later", EnqueueOptions.builder().delay(Duration.ofMillis(100)).build());
        scheduler.runDueTasks();
        assertThat(processed).isEmpty();

        scheduler.advanceBy(Duration.ofMillis(99));
        assertThat(processed).isEmpty();

        scheduler.advanceBy(Duration.ofMillis(1));
        assertThat(processed).containsExactly("later");
    }

    @Test
    @DisplayName("Should process a ready message while a delayed one is still waiting")
    void readyMessageOvertakesDelayedOne() {
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));

        queue.enqueue(QUEUE, "later", EnqueueOptions.builder()
                .priority(MessagePriority.HIGH)
                .delay(Duration.ofMillis(100))
                .build());
        queue.enqueue(QUEUE, "now");
        scheduler.runDueTasks();

        assertThat(processed).containsExactly("now");
        scheduler.advanceBy(Duration.ofMillis(100));
        assertThat(processed).containsExactly("now", "later");
    }

    // ========== Processors ==========

    @Test
    @DisplayName("Should accumulate messages until a processor is registered")
    void accumulatesWithoutProcessor() {
        queue.enqueue(QUEUE, "a");
        queue.enqueue(QUEUE, "b");
        scheduler.advanceBy(Duration.ofSeconds(1));

        assertThat(queue.getQueueStats(QUEUE).getSize()).isEqualTo(2);
        assertThat(queue.getQueueStats(QUEUE).isProcessing()).isFalse();
    }

    @Test
    @DisplayName("Should replace the processor on a later registration")
    void laterRegistrationReplaces() {
        List<Object> second = new ArrayList<>();
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> second.add(payload));

        queue.enqueue(QUEUE, "a");
        scheduler.runDueTasks();

        assertThat(processed).isEmpty();
        assertThat(second).containsExactly("a");
    }

    @Test
    @DisplayName("Should fail a payload of the wrong type without calling the processor")
    void typeMismatchFails() {
        queue.setProcessor(QUEUE, Integer.class, (payload, metadata) -> processed.add(payload));

        queue.enqueue(QUEUE, "not a number", EnqueueOptions.builder().maxRetries(0).build());
        queue.enqueue(QUEUE, 42);
        scheduler.runDueTasks();

        assertThat(processed).containsExactly(42);
        assertThat(queue.getQueueStats(QUEUE).getFailedMessages()).isEqualTo(1);
        assertThat(queue.getQueueStats(QUEUE).getProcessedMessages()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should deliver full batches at once and flush a short batch after the timeout")
    void batchProcessing() {
        List<List<String>> batches = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            queue.enqueue(QUEUE, "m" + i);
        }
        queue.setBatchProcessor(QUEUE, String.class, (payloads, metadata) -> batches.add(payloads),
                ProcessorOptions.batched(3, Duration.ofMillis(50)));

        scheduler.runDueTasks();
        assertThat(batches).containsExactly(List.of("m1", "m2", "m3"), List.of("m4", "m5", "m6"));

        scheduler.advanceBy(Duration.ofMillis(49));
        assertThat(batches).hasSize(2);
        scheduler.advanceBy(Duration.ofMillis(1));
        assertThat(batches).hasSize(3);
        assertThat(batches.get(2)).containsExactly("m7");
        assertThat(queue.getQueueStats(QUEUE).getProcessedMessages()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should deliver a batch as soon as it fills while a short-batch flush is pending")
    void batchFillingWhileFlushPending() {
        List<List<String>> batches = new ArrayList<>();
        queue.setBatchProcessor(QUEUE, String.class, (payloads, metadata) -> batches.add(payloads),
                ProcessorOptions.batched(3, Duration.ofSeconds(1)));

        queue.enqueue(QUEUE, "m1");
        queue.enqueue(QUEUE, "m2");
        scheduler.runDueTasks();
        assertThat(batches).isEmpty();

        queue.enqueue(QUEUE, "m3");
        scheduler.runDueTasks();
        assertThat(batches).containsExactly(List.of("m1", "m2", "m3"));

        queue.enqueue(QUEUE, "m4");
        scheduler.advanceBy(Duration.ofMillis(999));
        assertThat(batches).hasSize(1);
        scheduler.advanceBy(Duration.ofMillis(1));
        assertThat(batches).hasSize(2);
        assertThat(batches.get(1)).containsExactly("m4");
    }

    @Test
    @DisplayName("Should keep the step gap when a filling batch brings a flush forward")
    void batchFillingKeepsProcessingDelay() {
        queue.close();
        queue = newQueue(baseConfig().processingDelay(Duration.ofMillis(100)).build());
        List<List<String>> batches = new ArrayList<>();
        queue.setBatchProcessor(QUEUE, String.class, (payloads, metadata) -> batches.add(payloads),
                ProcessorOptions.batched(2, Duration.ofSeconds(1)));

        queue.enqueue(QUEUE, "a");
        queue.enqueue(QUEUE, "b");
        scheduler.runDueTasks();
        assertThat(batches).hasSize(1);

        queue.enqueue(QUEUE, "c");
        scheduler.advanceBy(Duration.ofMillis(10));
        queue.enqueue(QUEUE, "d");
        scheduler.advanceBy(Duration.ofMillis(89));
        assertThat(batches).hasSize(1);
        scheduler.advanceBy(Duration.ofMillis(1));
        assertThat(batches).containsExactly(List.of("a", "b"), List.of("c", "d"));
    }

    @Test
    @DisplayName("Should keep the retry backoff positive for large retry counts")
    void retryBackoffIsBounded() {
        assertThat(PriorityMessageQueue.retryDelayMillis(1_000L, 1)).isEqualTo(1_000L);
        assertThat(PriorityMessageQueue.retryDelayMillis(1_000L, 4)).isEqualTo(8_000L);
        assertThat(PriorityMessageQueue.retryDelayMillis(1_000L, 64)).isPositive()
                .isEqualTo(PriorityMessageQueue.retryDelayMillis(1_000L, 200));
        assertThat(PriorityMessageQueue.retryDelayMillis(Long.MAX_VALUE / 2, 40)).isPositive();
    }

    @Test
    @DisplayName("Should fail every member of a failing batch")
    void batchFailureFailsEveryMember() {
        queue.enqueue(QUEUE, "a", EnqueueOptions.builder().maxRetries(0).build());
        queue.enqueue(QUEUE, "b", EnqueueOptions.builder().maxRetries(0).build());
        queue.setBatchProcessor(QUEUE, String.class, (payloads, metadata) -> {
            throw new IllegalStateException("batch failed");
        }, ProcessorOptions.batched(2, Duration.ofMillis(50)));

        scheduler.runDueTasks();

        assertThat(queue.getQueueStats(QUEUE).getFailedMessages()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should hand single-message batches to batch processors when batching is disabled")
    void batchingDisabled() {
        queue.close();
        queue = newQueue(baseConfig().enableBatching(false).build());
        List<List<String>> batches = new ArrayList<>();
        queue.enqueue(QUEUE, "a");
        queue.enqueue(QUEUE, "b");

        queue.setBatchProcessor(QUEUE, String.class, (payloads, metadata) -> batches.add(payloads),
                ProcessorOptions.batched(10, Duration.ofMillis(50)));
        scheduler.runDueTasks();

        assertThat(batches).containsExactly(List.of("a"), List.of("b"));
    }

    // ========== Administration ==========

    @Test
    @DisplayName("Should stop draining while paused and resume afterwards")
    void pauseAndResume() {
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));
        queue.pauseQueue(QUEUE);

        queue.enqueue(QUEUE, "a");
        scheduler.advanceBy(Duration.ofSeconds(1));
        assertThat(processed).isEmpty();
        assertThat(queue.getQueueStats(QUEUE).isPaused()).isTrue();

        queue.resumeQueue(QUEUE);
        scheduler.runDueTasks();
        assertThat(processed).containsExactly("a");
    }

    @Test
    @DisplayName("Should discard waiting messages on clear")
    void clearQueue() {
        queue.enqueue(QUEUE, "a");
        queue.enqueue(QUEUE, "b");

        assertThat(queue.clearQueue(QUEUE)).isEqualTo(2);
        assertThat(queue.clearQueue(QUEUE)).isZero();
        assertThat(queue.clearQueue("missing")).isZero();
        assertThat(queue.getQueueStats(QUEUE).getSize()).isZero();
    }

    @Test
    @DisplayName("Should remove a queue and recreate it on the next enqueue")
    void removeQueue() {
        queue.enqueue(QUEUE, "a");

        assertThat(queue.removeQueue(QUEUE)).isTrue();
        assertThat(queue.removeQueue(QUEUE)).isFalse();
        assertThat(queue.getQueueStats(QUEUE)).isNull();

        queue.enqueue(QUEUE, "b");
        assertThat(queue.getQueueStats(QUEUE).getSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop pending work of a removed queue")
    void removedQueueStopsProcessing() {
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));
        queue.enqueue(QUEUE, "a");

        queue.removeQueue(QUEUE);
        scheduler.runDueTasks();

        assertThat(processed).isEmpty();
    }

    @Test
    @DisplayName("Should report per-queue and overall statistics")
    void statistics() {
        queue.enqueue("idle", "waiting");
        clock.advance(Duration.ofMillis(250));
        queue.setProcessor(QUEUE, String.class, (payload, metadata) -> processed.add(payload));
        queue.enqueue(QUEUE, "a");
        queue.enqueue(QUEUE, "b");
        scheduler.runDueTasks();

        QueueStats idle = queue.getQueueStats("idle");
        assertThat(idle.getOldestMessageAgeMillis()).isEqualTo(250L);
        assertThat(idle.getProcessingTimeSamples()).isZero();
        assertThat(idle.getMeanProcessingTimeMillis()).isZero();

        QueueStats busy = queue.getQueueStats(QUEUE);
        assertThat(busy.getProcessedMessages()).isEqualTo(2);
        assertThat(busy.getProcessingTimeSamples()).isEqualTo(2);
        assertThat(busy.getMaxProcessingTimeMillis()).isGreaterThanOrEqualTo(busy.getMeanProcessingTimeMillis());

        OverallQueueStats overall = queue.getOverallStats();
        assertThat(overall.getTotalQueues()).isEqualTo(2);
        assertThat(overall.getTotalMessages()).isEqualTo(1);
        assertThat(overall.getTotalEnqueued()).isEqualTo(3);
        assertThat(overall.getTotalProcessed()).isEqualTo(2);
        assertThat(overall.getQueues()).containsOnlyKeys("idle", QUEUE);
    }

    @Test
    @DisplayName("Should remove every queue on cleanup and stay usable")
    void cleanupRemovesQueues() {
        queue.enqueue("a", "x");
        queue.enqueue("b", "y");

        queue.cleanup();

        assertThat(queue.getOverallStats().getTotalQueues()).isZero();
        assertThat(queue.getOverallStats().getTotalEnqueued()).isEqualTo(2);
        queue.enqueue("a", "z");
        assertThat(queue.getQueueStats("a").getSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject use after close and leave a shared scheduler running")
    void closeRejectsFurtherUse() {
        queue.close();
        queue.close();

        assertThatThrownBy(() -> queue.enqueue(QUEUE, "a"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> queue.setProcessor(QUEUE, String.class, (payload, metadata) -> { }))
                .isInstanceOf(IllegalStateException.class);
        assertThat(scheduler.isShutdown()).isFalse();
    }

    @Test
    @DisplayName("Should validate arguments")
    void validatesArguments() {
        assertThatThrownBy(() -> queue.enqueue(" ", "a")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queue.enqueue(QUEUE, null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> queue.setProcessor(QUEUE, String.class, null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> EnqueueOptions.builder().delay(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProcessorOptions.batched(0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private PriorityMessageQueue newQueue(MessageQueueConfig config) {
        return new PriorityMessageQueue(config, clock, scheduler);
    }

    private static MessageQueueConfig.Builder baseConfig() {
        return MessageQueueConfig.builder()
                .processingDelay(Duration.ZERO)
                .retryDelay(Duration.ofMillis(10))
                .batchTimeout(Duration.ofMillis(50));
    }
}
