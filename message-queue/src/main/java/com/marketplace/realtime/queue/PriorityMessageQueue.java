package com.marketplace.realtime.queue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MessageQueue} implementation that drains each named queue with steps run on a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Draining</h2>
 * A queue is drained only while it has a processor, is not paused and holds messages. Each
 * step takes the due messages at the head of the queue (one for a {@link MessageProcessor},
 * up to the batch size for a {@link BatchMessageProcessor}), hands them to the processor
 * outside of any lock and then schedules the next step after {@code processingDelay}. A short
 * batch waits up to the batch timeout for more messages. Messages whose delay has not expired
 * are skipped; a queue holding only such messages sleeps until the earliest becomes due.
 *
 * <h2>Failures</h2>
 * A failed message is re-queued with its priority and an exponential delay of
 * {@code retryDelay * 2^(retryCount - 1)} until its retry budget is spent; it is then counted
 * as failed and discarded.
 *
 * <p>Each named queue has its own monitor; the map of queues is guarded by a separate one.
 * Processors for the same queue never run concurrently.
 */
public class PriorityMessageQueue implements MessageQueue {

    private static final Logger log = LoggerFactory.getLogger(PriorityMessageQueue.class);
    private static final int MAX_BACKOFF_EXPONENT = 30;
    private static final long MAX_BACKOFF_MILLIS = 1L << 50;

    private final MessageQueueConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final Object lock = new Object();
    private final Map<String, NamedQueue> queues = new LinkedHashMap<>();
    private boolean closed;

    private final AtomicLong messageSequence = new AtomicLong();
    private final AtomicLong totalEnqueued = new AtomicLong();
    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicLong totalDropped = new AtomicLong();
    private final AtomicLong totalRetried = new AtomicLong();

    /**
     * Creates a queue backed by its own daemon scheduler thread, shut down by {@link #close()}.
     */
    public PriorityMessageQueue(@Nonnull MessageQueueConfig config) {
        this(config, Clock.systemUTC(), createDefaultScheduler(), true);
    }

    /**
     * Creates a queue sharing the given clock and scheduler. The scheduler is left running by
     * {@link #close()}.
     */
    public PriorityMessageQueue(@Nonnull MessageQueueConfig config, @Nonnull Clock clock,
                                @Nonnull ScheduledExecutorService scheduler) {
        this(config, clock, scheduler, false);
    }

    private PriorityMessageQueue(MessageQueueConfig config, Clock clock, ScheduledExecutorService scheduler,
                                 boolean ownsScheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
    }

    public MessageQueueConfig getConfig() {
        return config;
    }

    @Override
    public String enqueue(@Nonnull String queueName, @Nonnull Object payload) {
        return enqueue(queueName, payload, EnqueueOptions.defaults());
    }

    @Override
    public String enqueue(@Nonnull String queueName, @Nonnull Object payload, @Nonnull EnqueueOptions options) {
        requireQueueName(queueName);
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(options, "options");

        String id = "msg_" + messageSequence.incrementAndGet();
        int maxRetries = options.getMaxRetries() != null ? options.getMaxRetries() : config.getRetryAttempts();
        QueuedMessage message = new QueuedMessage(id, payload, clock.millis(), options.getPriority(), maxRetries,
                options.getDelay().toMillis(), options.getMetadata());

        while (true) {
            NamedQueue queue = getOrCreateQueue(queueName);
            synchronized (queue) {
                // lost a race with removeQueue, the next lookup creates a fresh queue
                if (queue.removed) {
                    continue;
                }
                insert(queue, message);
                totalEnqueued.incrementAndGet();
                log.debug("Enqueued {} on '{}' with priority {}", id, queueName, message.getPriority());
                startDrainIfIdle(queue);
                return id;
            }
        }
    }

    @Override
    public <T> void setProcessor(@Nonnull String queueName, @Nonnull Class<T> payloadType,
                                 @Nonnull MessageProcessor<T> processor) {
        requireQueueName(queueName);
        bind(queueName, ProcessorBinding.single(payloadType, processor));
    }

    @Override
    public <T> void setBatchProcessor(@Nonnull String queueName, @Nonnull Class<T> payloadType,
                                      @Nonnull BatchMessageProcessor<T> processor,
                                      @Nonnull ProcessorOptions options) {
        requireQueueName(queueName);
        Objects.requireNonNull(options, "options");
        int batchSize;
        long batchTimeout;
        if (config.isEnableBatching()) {
            batchSize = options.getBatchSize() != null ? options.getBatchSize() : config.getBatchSize();
            batchTimeout = options.getBatchTimeout() != null
                    ? options.getBatchTimeout().toMillis() : config.getBatchTimeout().toMillis();
        } else {
            batchSize = 1;
            batchTimeout = 0L;
        }
        bind(queueName, ProcessorBinding.batch(payloadType, processor, batchSize, batchTimeout));
    }

    @Nullable
    @Override
    public QueueStats getQueueStats(@Nonnull String queueName) {
        requireQueueName(queueName);
        NamedQueue queue;
        synchronized (lock) {
            queue = queues.get(queueName);
        }
        if (queue == null) {
            return null;
        }
        synchronized (queue) {
            return queue.snapshot(clock.millis());
        }
    }

    @Override
    public OverallQueueStats getOverallStats() {
        List<NamedQueue> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(queues.values());
        }
        long now = clock.millis();
        Map<String, QueueStats> perQueue = new LinkedHashMap<>();
        for (NamedQueue queue : snapshot) {
            synchronized (queue) {
                if (!queue.removed) {
                    perQueue.put(queue.name, queue.snapshot(now));
                }
            }
        }
        return new OverallQueueStats(totalEnqueued.get(), totalProcessed.get(), totalFailed.get(),
                totalDropped.get(), totalRetried.get(), perQueue);
    }

    @Override
    public void pauseQueue(@Nonnull String queueName) {
        requireQueueName(queueName);
        NamedQueue queue = getOrCreateQueue(queueName);
        synchronized (queue) {
            queue.paused = true;
            queue.cancelPendingDrain();
        }
        log.info("Paused queue '{}'", queueName);
    }

    @Override
    public void resumeQueue(@Nonnull String queueName) {
        requireQueueName(queueName);
        NamedQueue queue = getOrCreateQueue(queueName);
        synchronized (queue) {
            queue.paused = false;
            startDrainIfIdle(queue);
        }
        log.info("Resumed queue '{}'", queueName);
    }

    @Override
    public int clearQueue(@Nonnull String queueName) {
        requireQueueName(queueName);
        NamedQueue queue;
        synchronized (lock) {
            queue = queues.get(queueName);
        }
        if (queue == null) {
            return 0;
        }
        int cleared;
        synchronized (queue) {
            cleared = queue.clear();
            queue.cancelPendingDrain();
        }
        log.info("Cleared {} messages from queue '{}'", cleared, queueName);
        return cleared;
    }

    @Override
    public boolean removeQueue(@Nonnull String queueName) {
        requireQueueName(queueName);
        NamedQueue queue;
        synchronized (lock) {
            queue = queues.remove(queueName);
        }
        if (queue == null) {
            return false;
        }
        retire(queue);
        log.info("Removed queue '{}'", queueName);
        return true;
    }

    @Override
    public void cleanup() {
        List<NamedQueue> removed;
        synchronized (lock) {
            removed = new ArrayList<>(queues.values());
            queues.clear();
        }
        for (NamedQueue queue : removed) {
            retire(queue);
        }
        log.info("Removed {} queues", removed.size());
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        cleanup();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private void bind(String queueName, ProcessorBinding binding) {
        NamedQueue queue = getOrCreateQueue(queueName);
        synchronized (queue) {
            queue.binding = binding;
            startDrainIfIdle(queue);
        }
        log.debug("Registered {} processor for queue '{}'", binding.isBatch() ? "batch" : "single", queueName);
    }

    private NamedQueue getOrCreateQueue(String queueName) {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Message queue is closed");
            }
            NamedQueue queue = queues.get(queueName);
            if (queue == null) {
                queue = new NamedQueue(queueName, config.getStatisticsWindowSize());
                queues.put(queueName, queue);
                log.debug("Created queue '{}'", queueName);
            }
            return queue;
        }
    }

    private void retire(NamedQueue queue) {
        synchronized (queue) {
            queue.removed = true;
            queue.clear();
            queue.cancelPendingDrain();
        }
    }

    // Caller holds the queue monitor.
    private void insert(NamedQueue queue, QueuedMessage message) {
        if (queue.size() >= config.getMaxQueueSize()) {
            QueuedMessage dropped = queue.evictForOverflow();
            totalDropped.incrementAndGet();
            log.warn("Queue '{}' is full ({} messages), dropped {} with priority {}", queue.name,
                    config.getMaxQueueSize(), dropped.getId(), dropped.getPriority());
        }
        queue.insert(message, config.isEnablePriority());
    }

    // Caller holds the queue monitor.
    private void startDrainIfIdle(NamedQueue queue) {
        if (queue.removed || queue.paused || queue.binding == null || queue.isEmpty()) {
            return;
        }
        long now = clock.millis();
        long delay = initialDelay(queue, now);
        if (queue.processing) {
            // a step that only sleeps until a delayed message is due, or until a short batch
            // times out, can be brought forward
            if (queue.running || !(queue.waitingForReady || queue.waitingForBatch)) {
                return;
            }
            delay = Math.max(delay, sinceLastStepDelay(queue, now));
            if (now + delay >= queue.drainAt) {
                return;
            }
            queue.cancelPendingDrain();
        }
        scheduleStep(queue, delay, now);
    }

    private long initialDelay(NamedQueue queue, long now) {
        int due = queue.countDue(now);
        ProcessorBinding binding = queue.binding;
        if (due == 0) {
            return queue.minRemainingDelay(now);
        }
        if (binding.isBatch() && due < binding.getBatchSize()) {
            return binding.getBatchTimeoutMillis();
        }
        return 0L;
    }

    // Remaining part of the processing delay that must separate two steps.
    private long sinceLastStepDelay(NamedQueue queue, long now) {
        if (queue.lastStepEndedAt == Long.MIN_VALUE) {
            return 0L;
        }
        return Math.max(0L, queue.lastStepEndedAt + config.getProcessingDelay().toMillis() - now);
    }

    private long nextStepDelay(NamedQueue queue, long now) {
        long processingDelay = config.getProcessingDelay().toMillis();
        return Math.max(processingDelay, initialDelay(queue, now));
    }

    // Caller holds the queue monitor.
    private void scheduleStep(NamedQueue queue, long delay, long now) {
        queue.processing = true;
        int due = queue.countDue(now);
        ProcessorBinding binding = queue.binding;
        queue.waitingForReady = due == 0;
        queue.waitingForBatch = due > 0 && binding != null && binding.isBatch() && due < binding.getBatchSize();
        queue.drainAt = now + delay;
        try {
            queue.drainTask = scheduler.schedule(() -> drainStep(queue), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            queue.processing = false;
            queue.waitingForReady = false;
            queue.waitingForBatch = false;
            queue.drainTask = null;
            log.warn("Could not schedule processing of queue '{}'", queue.name, e);
        }
    }

    private void drainStep(NamedQueue queue) {
        ProcessorBinding binding;
        List<QueuedMessage> taken;
        synchronized (queue) {
            queue.drainTask = null;
            queue.waitingForReady = false;
            queue.waitingForBatch = false;
            if (queue.removed || queue.paused || queue.binding == null) {
                queue.processing = false;
                return;
            }
            long now = clock.millis();
            binding = queue.binding;
            taken = queue.takeDue(now, binding.isBatch() ? binding.getBatchSize() : 1);
            if (taken.isEmpty()) {
                if (queue.isEmpty()) {
                    queue.processing = false;
                } else {
                    scheduleStep(queue, queue.minRemainingDelay(now), now);
                }
                return;
            }
            queue.running = true;
        }

        boolean finished = false;
        try {
            List<QueuedMessage> accepted = new ArrayList<>(taken.size());
            List<QueuedMessage> rejected = new ArrayList<>();
            for (QueuedMessage message : taken) {
                if (binding.accepts(message)) {
                    accepted.add(message);
                } else {
                    rejected.add(message);
                }
            }
            Exception failure = null;
            long started = System.nanoTime();
            if (!accepted.isEmpty()) {
                try {
                    binding.process(accepted);
                } catch (Exception e) {
                    failure = e;
                }
            }
            double elapsedMillis = (System.nanoTime() - started) / 1_000_000.0;
            completeStep(queue, binding, accepted, failure, rejected, elapsedMillis);
            finished = true;
        } finally {
            if (!finished) {
                synchronized (queue) {
                    queue.running = false;
                    queue.processing = false;
                }
            }
        }
    }

    private void completeStep(NamedQueue queue, ProcessorBinding binding, List<QueuedMessage> accepted,
                              @Nullable Exception failure, List<QueuedMessage> rejected, double elapsedMillis) {
        synchronized (queue) {
            queue.running = false;
            long now = clock.millis();
            queue.lastStepEndedAt = now;
            if (!accepted.isEmpty()) {
                queue.recordProcessingTime(elapsedMillis);
                if (failure == null) {
                    queue.processedMessages += accepted.size();
                    totalProcessed.addAndGet(accepted.size());
                } else {
                    for (QueuedMessage message : accepted) {
                        handleFailure(queue, message, failure, now);
                    }
                }
            }
            for (QueuedMessage message : rejected) {
                handleFailure(queue, message, binding.typeMismatch(message), now);
            }
            if (queue.removed || queue.paused || queue.binding == null || queue.isEmpty()) {
                queue.processing = false;
                return;
            }
            scheduleStep(queue, nextStepDelay(queue, now), now);
        }
    }

    // Caller holds the queue monitor.
    private void handleFailure(NamedQueue queue, QueuedMessage message, Exception failure, long now) {
        if (queue.removed) {
            return;
        }
        if (message.recordFailure()) {
            long delay = retryDelayMillis(config.getRetryDelay().toMillis(), message.getRetryCount());
            message.delayUntil(now + delay);
            queue.retriedMessages++;
            totalRetried.incrementAndGet();
            log.warn("Processing {} on '{}' failed (attempt {} of {}), retrying in {} ms", message.getId(),
                    queue.name, message.getRetryCount(), message.getMaxRetries() + 1, delay, failure);
            insert(queue, message);
        } else {
            queue.failedMessages++;
            totalFailed.incrementAndGet();
            log.error("Processing {} on '{}' failed after {} attempts, discarding", message.getId(), queue.name,
                    message.getRetryCount(), failure);
        }
    }

    private static void requireQueueName(String queueName) {
        Objects.requireNonNull(queueName, "queueName");
        if (queueName.trim().isEmpty()) {
            throw new IllegalArgumentException("queueName must not be blank");
        }
    }

    /**
     * {@code retryDelay * 2^(retryCount - 1)}, with the exponent capped at
     * {@value #MAX_BACKOFF_EXPONENT} and the product capped at {@value #MAX_BACKOFF_MILLIS} ms.
     */
    static long retryDelayMillis(long retryDelayMillis, int retryCount) {
        int exponent = Math.min(Math.max(retryCount - 1, 0), MAX_BACKOFF_EXPONENT);
        if (retryDelayMillis > MAX_BACKOFF_MILLIS >> exponent) {
            return MAX_BACKOFF_MILLIS;
        }
        return retryDelayMillis << exponent;
    }

    private static ScheduledExecutorService createDefaultScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "PriorityMessageQueue-scheduler");
            t.setDaemon(true);
            return t;
        });
    }
}
