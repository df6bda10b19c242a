package com.marketplace.realtime.testkit;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.Delayed;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nonnull;

/**
 * A single-threaded {@link ScheduledExecutorService} whose timers fire only when the test
 * moves the paired {@link ManualClock}.
 *
 * <p>{@link #execute(Runnable)} runs the command inline on the calling thread, as if it had
 * been handed to an idle worker. Scheduled tasks are kept in a queue ordered by due time and
 * then by submission order, so two tasks due at the same instant run in the order they were
 * scheduled.
 *
 * <p>Exceptions thrown by tasks are captured rather than propagated, mirroring a real
 * executor where a failing task does not kill the worker thread. A periodic task that throws
 * is not rescheduled, as with {@link java.util.concurrent.ScheduledThreadPoolExecutor}.
 */
public final class ManualScheduler extends AbstractExecutorService implements ScheduledExecutorService {

    private final ManualClock clock;
    private final PriorityQueue<ScheduledTask> tasks = new PriorityQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final List<Throwable> uncaught = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean shutdown;
    private volatile boolean shutdownNowCalled;

    public ManualScheduler(ManualClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ManualClock getClock() {
        return clock;
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    @Override
    public List<Runnable> shutdownNow() {
        shutdown = true;
        shutdownNowCalled = true;
        List<Runnable> remaining = new ArrayList<>();
        synchronized (tasks) {
            for (ScheduledTask task : tasks) {
                remaining.add(task.command);
            }
            tasks.clear();
        }
        return remaining;
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public boolean isTerminated() {
        synchronized (tasks) {
            return shutdown && tasks.isEmpty();
        }
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        return isTerminated();
    }

    @Override
    public void execute(@Nonnull Runnable command) {
        if (shutdown) {
            throw new RejectedExecutionException("Scheduler is shut down");
        }
        try {
            command.run();
        } catch (RuntimeException e) {
            uncaught.add(e);
        }
    }

    @Override
    public ScheduledFuture<?> schedule(@Nonnull Runnable command, long delay, @Nonnull TimeUnit unit) {
        return enqueue(command, delay, 0L, unit);
    }

    @Override
    public <V> ScheduledFuture<V> schedule(@Nonnull Callable<V> callable, long delay, @Nonnull TimeUnit unit) {
        throw new UnsupportedOperationException("Callable scheduling is not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(@Nonnull Runnable command, long initialDelay, long period,
                                                  @Nonnull TimeUnit unit) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be positive");
        }
        return enqueue(command, initialDelay, period, unit);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(@Nonnull Runnable command, long initialDelay, long delay,
                                                     @Nonnull TimeUnit unit) {
        // Tasks run instantly in simulated time, so fixed delay and fixed rate coincide.
        return scheduleAtFixedRate(command, initialDelay, delay, unit);
    }

    /**
     * Runs every task whose due time is not after the current clock reading, including tasks
     * scheduled with zero delay by the tasks being run.
     */
    public void runDueTasks() {
        ScheduledTask next;
        while ((next = pollDue(clock.millis())) != null) {
            next.run();
        }
    }

    /**
     * Moves time forward by {@code duration}, stopping at each intermediate due time so every
     * task observes the clock reading it was scheduled for.
     */
    public void advanceBy(Duration duration) {
        long target = clock.millis() + duration.toMillis();
        ScheduledTask next;
        while ((next = pollDue(target)) != null) {
            if (next.runAtMillis > clock.millis()) {
                clock.setMillis(next.runAtMillis);
            }
            next.run();
        }
        clock.setMillis(target);
    }

    public int queuedTaskCount() {
        synchronized (tasks) {
            return tasks.size();
        }
    }

    public boolean isShutdownNowCalled() {
        return shutdownNowCalled;
    }

    public List<Throwable> getUncaughtExceptions() {
        synchronized (uncaught) {
            return new ArrayList<>(uncaught);
        }
    }

    private ScheduledTask enqueue(Runnable command, long delay, long period, TimeUnit unit) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(unit, "unit");
        if (shutdown) {
            throw new RejectedExecutionException("Scheduler is shut down");
        }
        long runAt = clock.millis() + Math.max(0L, unit.toMillis(delay));
        ScheduledTask task = new ScheduledTask(command, runAt, unit.toMillis(period), sequence.getAndIncrement());
        synchronized (tasks) {
            tasks.add(task);
        }
        return task;
    }

    private ScheduledTask pollDue(long now) {
        synchronized (tasks) {
            ScheduledTask head = tasks.peek();
            if (head == null || head.runAtMillis > now) {
                return null;
            }
            return tasks.poll();
        }
    }

    private final class ScheduledTask implements ScheduledFuture<Void> {

        private final Runnable command;
        private final long periodMillis;
        private volatile long runAtMillis;
        private volatile long seq;
        private volatile boolean cancelled;
        private volatile boolean done;

        private ScheduledTask(Runnable command, long runAtMillis, long periodMillis, long seq) {
            this.command = command;
            this.runAtMillis = runAtMillis;
            this.periodMillis = periodMillis;
            this.seq = seq;
        }

        @Override
        public long getDelay(@Nonnull TimeUnit unit) {
            return unit.convert(runAtMillis - clock.millis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(@Nonnull Delayed other) {
            if (other instanceof ScheduledTask) {
                ScheduledTask that = (ScheduledTask) other;
                int byTime = Long.compare(runAtMillis, that.runAtMillis);
                return byTime != 0 ? byTime : Long.compare(seq, that.seq);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            done = true;
            synchronized (tasks) {
                tasks.remove(this);
            }
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done;
        }

        @Override
        public Void get() {
            throw new UnsupportedOperationException("get not supported");
        }

        @Override
        public Void get(long timeout, @Nonnull TimeUnit unit) {
            throw new UnsupportedOperationException("get not supported");
        }

        private void run() {
            if (cancelled) {
                return;
            }
            try {
                command.run();
            } catch (RuntimeException e) {
                uncaught.add(e);
                done = true;
                return;
            }
            if (periodMillis > 0 && !cancelled && !shutdown) {
                runAtMillis += periodMillis;
                seq = sequence.getAndIncrement();
                synchronized (tasks) {
                    tasks.add(this);
                }
            } else {
                done = true;
            }
        }
    }
}
