package com.example.batchrunner.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded-concurrency executor for opaque work items.
 *
 * <p>At most {@code capacity} tasks hold a slot at any time; {@link #submit} blocks until one is
 * free. Each task races its computation against the configured timeout and resolves to exactly
 * one {@link TaskStatus}. The slot is released on every path before the handle resolves.
 *
 * <p>Timed-out and cancelled computations are interrupted, but a computation that ignores
 * interruption keeps running on its worker thread; its value is discarded.
 */
public final class TaskPool<T> implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(TaskPool.class);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(72);

    private final Duration timeout;
    private final Semaphore slots;
    private final PoolState state;
    private final ExecutorService executor;

    public TaskPool(int capacity) {
        this(capacity, DEFAULT_TIMEOUT);
    }

    /**
     * @param capacity maximum number of tasks in flight
     * @param timeout  per-task ceiling; null or non-positive disables the timeout
     */
    public TaskPool(int capacity, Duration timeout) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Pool capacity must be positive: " + capacity);
        }
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? null : clamp(timeout);
        this.slots = new Semaphore(capacity, true);
        this.state = new PoolState(capacity);
        this.executor = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    // Durations beyond Long.MAX_VALUE milliseconds cannot be scheduled.
    private static Duration clamp(Duration timeout) {
        try {
            return Duration.ofMillis(timeout.toMillis());
        } catch (ArithmeticException ex) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
    }

    /**
     * Waits for a free slot, then starts {@code work} under the pool's timeout.
     *
     * @throws InterruptedException  if interrupted while waiting for a slot
     * @throws IllegalStateException if the pool has been shut down
     */
    public TaskHandle<T> submit(Callable<? extends T> work, WorkItemMetadata metadata) throws InterruptedException {
        if (work == null || metadata == null) {
            throw new IllegalArgumentException("Work and metadata are required.");
        }
        if (state.isClosed()) {
            throw new IllegalStateException("Task pool is shut down.");
        }
        slots.acquire();

        CompletableFuture<T> race = new CompletableFuture<>();
        CompletableFuture<TaskResult<T>> outcome = new CompletableFuture<>();
        String taskId = state.register(new PoolState.InFlightTask(race, outcome));
        if (taskId == null) {
            slots.release();
            throw new IllegalStateException("Task pool is shut down.");
        }

        CompletableFuture<Future<?>> running = new CompletableFuture<>();
        race.whenComplete((value, error) -> {
            try {
                settle(taskId, metadata, value, error, running, outcome);
            } catch (RuntimeException ex) {
                LOGGER.error("Failed to record outcome of {} ({})", taskId, metadata.identifier(), ex);
                outcome.completeExceptionally(ex);
            }
        });

        try {
            running.complete(executor.submit(() -> execute(work, race)));
        } catch (RejectedExecutionException ex) {
            race.cancel(false);
            return new TaskHandle<>(taskId, metadata, outcome);
        }
        if (timeout != null) {
            race.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        LOGGER.debug("Submitted {} for {}", taskId, metadata.identifier());
        return new TaskHandle<>(taskId, metadata, outcome);
    }

    private void execute(Callable<? extends T> work, CompletableFuture<T> race) {
        if (race.isDone()) {
            return;
        }
        try {
            race.complete(work.call());
        } catch (Throwable ex) {
            race.completeExceptionally(ex);
        }
    }

    private void settle(String taskId,
                        WorkItemMetadata metadata,
                        T value,
                        Throwable error,
                        CompletableFuture<Future<?>> running,
                        CompletableFuture<TaskResult<T>> outcome) {
        TaskResult<T> result;
        try {
            result = toResult(taskId, metadata, value, error);
            state.record(result.status());
        } finally {
            releaseSlot(taskId);
        }
        if (result.status() == TaskStatus.TIMEOUT_ERROR || result.status() == TaskStatus.CANCELLED) {
            running.thenAccept(future -> future.cancel(true));
        }
        if (result.status() == TaskStatus.TIMEOUT_ERROR) {
            LOGGER.warn("{} ({}) timed out", taskId, metadata.identifier());
        }
        outcome.complete(result);
    }

    private TaskResult<T> toResult(String taskId, WorkItemMetadata metadata, T value, Throwable error) {
        if (error == null) {
            return TaskResult.success(taskId, metadata, value);
        }
        if (error instanceof TimeoutException) {
            return TaskResult.timeout(taskId, metadata, new TaskTimeoutException(metadata.identifier(), timeout));
        }
        if (error instanceof CancellationException) {
            return TaskResult.cancelled(taskId, metadata);
        }
        return TaskResult.taskError(taskId, metadata, error);
    }

    private void releaseSlot(String taskId) {
        if (state.release(taskId)) {
            slots.release();
        } else {
            LOGGER.error("Slot for {} was already released", taskId);
        }
    }

    public PoolStats getStats() {
        return state.snapshot();
    }

    /**
     * Blocks until no task is in flight, checking every {@code pollInterval}. Nothing is cancelled.
     */
    public void waitForCompletion(Duration pollInterval) throws InterruptedException {
        long pollMillis = Math.max(1L, pollInterval.toMillis());
        int remaining = state.inFlightCount();
        while (remaining > 0) {
            LOGGER.info("Waiting for {} tasks to complete...", remaining);
            remaining = state.awaitDrained(pollMillis);
        }
    }

    /**
     * Cancels every in-flight task and returns once all of them have reached their terminal
     * outcome. Calling it again returns immediately.
     */
    public void shutdown() {
        List<PoolState.InFlightTask> inFlight = state.close();
        if (inFlight == null) {
            return;
        }
        if (!inFlight.isEmpty()) {
            LOGGER.info("Cancelling {} in-flight tasks...", inFlight.size());
        }
        for (PoolState.InFlightTask task : inFlight) {
            task.race().cancel(true);
        }
        for (PoolState.InFlightTask task : inFlight) {
            task.outcome().handle((result, error) -> null).join();
        }
        executor.shutdownNow();
        LOGGER.info("Task pool shut down.");
    }

    @Override
    public void close() {
        shutdown();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "task-pool-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
