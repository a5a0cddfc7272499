package com.lunarview.testutil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Single-threaded scheduler driven by {@link #advance(long)}. Tasks run on
 * the calling thread in due-time order; {@link #now()} is the virtual clock
 * in milliseconds.
 */
public class ManualScheduler extends AbstractExecutorService implements ScheduledExecutorService {

    private final PriorityQueue<Task<?>> queue = new PriorityQueue<>();
    private long nowNanos;
    private long sequence;
    private boolean shutdown;

    public ManualScheduler() {
        this(0);
    }

    public ManualScheduler(long startMillis) {
        this.nowNanos = TimeUnit.MILLISECONDS.toNanos(startMillis);
    }

    public long now() {
        return TimeUnit.NANOSECONDS.toMillis(nowNanos);
    }

    public LongSupplier clock() {
        return this::now;
    }

    public void advance(long millis) {
        advanceNanos(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    public void advanceNanos(long nanos) {
        long target = nowNanos + nanos;
        while (true) {
            Task<?> next = queue.peek();
            if (next == null || next.due > target) {
                break;
            }
            queue.poll();
            nowNanos = next.due;
            next.runTask();
        }
        nowNanos = target;
    }

    /** Run everything due at the current instant. */
    public void runDueTasks() {
        advanceNanos(0);
    }

    public int pendingTasks() {
        int count = 0;
        for (Task<?> task : queue) {
            if (!task.isCancelled()) {
                count++;
            }
        }
        return count;
    }

    // ===============================
    // ScheduledExecutorService
    // ===============================

    @Override
    public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
        return enqueue(new Task<>(() -> {
            command.run();
            return null;
        }, unit.toNanos(delay), 0));
    }

    @Override
    public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
        return enqueue(new Task<>(callable, unit.toNanos(delay), 0));
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
        return periodic(command, initialDelay, period, unit);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay, TimeUnit unit) {
        return periodic(command, initialDelay, delay, unit);
    }

    @Override
    public void execute(Runnable command) {
        schedule(command, 0, TimeUnit.NANOSECONDS);
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    @Override
    public List<Runnable> shutdownNow() {
        shutdown = true;
        queue.clear();
        return Collections.emptyList();
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public boolean isTerminated() {
        return shutdown && queue.isEmpty();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        return isTerminated();
    }

    private ScheduledFuture<?> periodic(Runnable command, long initialDelay, long period, TimeUnit unit) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be positive");
        }
        return enqueue(new Task<>(() -> {
            command.run();
            return null;
        }, unit.toNanos(initialDelay), unit.toNanos(period)));
    }

    private <V> Task<V> enqueue(Task<V> task) {
        if (shutdown) {
            throw new IllegalStateException("Scheduler shut down");
        }
        queue.add(task);
        return task;
    }

    private final class Task<V> implements ScheduledFuture<V> {

        private final Callable<V> body;
        private final long period;
        private long due;
        private long order;
        private boolean cancelled;
        private boolean done;
        private V result;
        private Throwable failure;

        Task(Callable<V> body, long delayNanos, long periodNanos) {
            this.body = body;
            this.period = periodNanos;
            this.due = nowNanos + Math.max(0, delayNanos);
            this.order = sequence++;
        }

        void runTask() {
            if (cancelled) {
                return;
            }
            try {
                V value = body.call();
                if (period == 0) {
                    result = value;
                    done = true;
                } else if (!cancelled) {
                    due += period;
                    order = sequence++;
                    queue.add(this);
                }
            } catch (Exception e) {
                failure = e;
                done = true;
            }
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(due - nowNanos, TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            Task<?> that = (Task<?>) other;
            int byDue = Long.compare(due, that.due);
            return byDue != 0 ? byDue : Long.compare(order, that.order);
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            done = true;
            queue.remove(this);
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
        public V get() throws ExecutionException {
            if (cancelled) {
                throw new CancellationException();
            }
            if (failure != null) {
                throw new ExecutionException(failure);
            }
            if (!done) {
                throw new IllegalStateException("Task has not run; advance the scheduler first");
            }
            return result;
        }

        @Override
        public V get(long timeout, TimeUnit unit) throws ExecutionException {
            return get();
        }
    }

    /** Tasks still queued, for assertions. */
    public List<Long> pendingDelaysMillis() {
        List<Long> delays = new ArrayList<>();
        for (Task<?> task : queue) {
            if (!task.isCancelled()) {
                delays.add(task.getDelay(TimeUnit.MILLISECONDS));
            }
        }
        Collections.sort(delays);
        return delays;
    }
}
