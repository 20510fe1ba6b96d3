package com.example.batchrunner.pool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Mutable bookkeeping of a {@link TaskPool}: the in-flight registry and the outcome counters.
 * Every read and write happens under this object's monitor.
 */
final class PoolState {
    private final int capacity;
    private final Map<String, InFlightTask> inFlight = new LinkedHashMap<>();
    private long nextTaskNumber;
    private long submitted;
    private long completed;
    private long failed;
    private long timedOut;
    private long cancelled;
    private int peakInFlight;
    private boolean closed;

    PoolState(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Allocates a task id and registers the task, or returns null once the pool is closed.
     */
    synchronized String register(InFlightTask task) {
        if (closed) {
            return null;
        }
        String taskId = "task_" + nextTaskNumber++;
        submitted++;
        inFlight.put(taskId, task);
        peakInFlight = Math.max(peakInFlight, inFlight.size());
        return taskId;
    }

    /**
     * Removes the task from the registry. Returns false if it was not registered.
     */
    synchronized boolean release(String taskId) {
        boolean removed = inFlight.remove(taskId) != null;
        if (removed) {
            notifyAll();
        }
        return removed;
    }

    synchronized void record(TaskStatus status) {
        switch (status) {
            case SUCCESS -> completed++;
            case TASK_ERROR -> failed++;
            case TIMEOUT_ERROR -> {
                timedOut++;
                failed++;
            }
            case CANCELLED -> cancelled++;
        }
    }

    /**
     * Marks the state closed and returns the tasks that were in flight at that moment.
     * Returns null if it was already closed.
     */
    synchronized List<InFlightTask> close() {
        if (closed) {
            return null;
        }
        closed = true;
        return new ArrayList<>(inFlight.values());
    }

    synchronized boolean isClosed() {
        return closed;
    }

    synchronized int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Waits up to {@code millis} for the registry to drain and returns the in-flight count.
     */
    synchronized int awaitDrained(long millis) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        while (!inFlight.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return inFlight.size();
    }

    synchronized PoolStats snapshot() {
        return new PoolStats(
                capacity,
                inFlight.size(),
                capacity - inFlight.size(),
                submitted,
                completed,
                failed,
                timedOut,
                cancelled,
                peakInFlight,
                completed * 100.0 / Math.max(submitted, 1)
        );
    }

    /**
     * A registered task: the race future that decides its status and the future that
     * resolves once its outcome has been recorded and its slot released.
     */
    record InFlightTask(CompletableFuture<?> race, CompletableFuture<?> outcome) {
    }
}
