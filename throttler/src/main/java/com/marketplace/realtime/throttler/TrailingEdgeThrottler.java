package com.marketplace.realtime.throttler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe throttler that guarantees a minimum interval between deliveries to its target
 * while never losing the most recent value.
 *
 * <h2>Algorithm</h2>
 * The throttler remembers the time of the last delivery. When a value is offered:
 * <ol>
 *   <li>If no delivery has happened yet, or at least {@code minInterval} has passed since the
 *       last one, the value is delivered immediately on the calling thread.</li>
 *   <li>Otherwise the value is parked. If no trailing task is scheduled yet, one is scheduled
 *       for the moment the interval expires. Parking again before that moment replaces the
 *       parked value.</li>
 *   <li>When the trailing task runs it takes the parked value, records the delivery time and
 *       hands the value to the target.</li>
 * </ol>
 *
 * <p>Exceptions thrown by the target during an immediate delivery propagate to the caller of
 * {@link #offer(Object)}. Exceptions thrown during a trailing delivery happen on the scheduler
 * thread; they are logged and swallowed so the throttler keeps working.
 *
 * @param <T> the type of value delivered to the target
 */
public class TrailingEdgeThrottler<T> implements Throttler<T> {

    private static final Logger log = LoggerFactory.getLogger(TrailingEdgeThrottler.class);
    private static final long NEVER = Long.MIN_VALUE;

    private final long minIntervalMillis;
    private final Consumer<? super T> target;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final Object lock = new Object();
    private long lastDeliveryMillis = NEVER;
    private T parked;
    private ScheduledFuture<?> trailingTask;
    private boolean shutdown;

    /**
     * Creates a throttler backed by its own daemon scheduler thread.
     *
     * @param minInterval minimum time between two deliveries
     * @param target receives the delivered values
     */
    public TrailingEdgeThrottler(@Nonnull Duration minInterval, @Nonnull Consumer<? super T> target) {
        this(minInterval, target, Clock.systemUTC(), createDefaultScheduler(), true);
    }

    /**
     * Creates a throttler sharing the given clock and scheduler. The scheduler is not shut down
     * by {@link #shutdown()}.
     *
     * @param minInterval minimum time between two deliveries
     * @param target receives the delivered values
     * @param clock the clock used to measure intervals
     * @param scheduler the scheduler running trailing deliveries
     */
    public TrailingEdgeThrottler(@Nonnull Duration minInterval, @Nonnull Consumer<? super T> target,
                                 @Nonnull Clock clock, @Nonnull ScheduledExecutorService scheduler) {
        this(minInterval, target, clock, scheduler, false);
    }

    private TrailingEdgeThrottler(Duration minInterval, Consumer<? super T> target, Clock clock,
                                  ScheduledExecutorService scheduler, boolean ownsScheduler) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        this.minIntervalMillis = minInterval.toMillis();
        this.target = Objects.requireNonNull(target, "target");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
    }

    @Override
    public ThrottleResult offer(@Nonnull T value) {
        Objects.requireNonNull(value, "value");
        synchronized (lock) {
            if (shutdown) {
                return ThrottleResult.REJECTED;
            }
            long now = clock.millis();
            long elapsed = lastDeliveryMillis == NEVER ? Long.MAX_VALUE : now - lastDeliveryMillis;
            if (elapsed >= minIntervalMillis && trailingTask == null) {
                lastDeliveryMillis = now;
            } else {
                parked = value;
                scheduleTrailingIfNeeded(now);
                return ThrottleResult.COALESCED;
            }
        }
        target.accept(value);
        return ThrottleResult.PROCEED;
    }

    @Override
    public boolean cancel() {
        synchronized (lock) {
            return discardParked();
        }
    }

    @Override
    public void shutdown() {
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            discardParked();
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    /**
     * @return {@code true} while a value is waiting for its trailing delivery
     */
    public boolean hasParkedValue() {
        synchronized (lock) {
            return parked != null;
        }
    }

    private void scheduleTrailingIfNeeded(long now) {
        if (trailingTask != null) {
            return;
        }
        long delay = Math.max(0L, lastDeliveryMillis + minIntervalMillis - now);
        try {
            trailingTask = scheduler.schedule(this::deliverParked, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule trailing delivery, dropping parked value", e);
            parked = null;
        }
    }

    private void deliverParked() {
        T value;
        synchronized (lock) {
            trailingTask = null;
            if (shutdown || parked == null) {
                return;
            }
            value = parked;
            parked = null;
            lastDeliveryMillis = clock.millis();
        }
        try {
            target.accept(value);
        } catch (RuntimeException e) {
            log.warn("Throttled target threw while handling a trailing delivery", e);
        }
    }

    private boolean discardParked() {
        boolean hadValue = parked != null;
        parked = null;
        if (trailingTask != null) {
            trailingTask.cancel(false);
            trailingTask = null;
        }
        return hadValue;
    }

    private static ScheduledExecutorService createDefaultScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "TrailingEdgeThrottler-scheduler");
            t.setDaemon(true);
            return t;
        });
    }
}
