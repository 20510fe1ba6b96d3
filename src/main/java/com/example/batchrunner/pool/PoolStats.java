package com.example.batchrunner.pool;

/**
 * Read-only snapshot of a task pool's counters.
 *
 * @param capacity       maximum number of tasks in flight
 * @param inFlight       tasks currently holding a slot
 * @param availableSlots free slots at snapshot time
 * @param submitted      tasks admitted since the pool was created
 * @param completed      tasks that finished successfully
 * @param failed         tasks that ended with a task error or a timeout
 * @param timedOut       tasks that exceeded the timeout (also counted in {@code failed})
 * @param cancelled      tasks cancelled by shutdown
 * @param peakInFlight   highest in-flight count observed
 * @param successRate    completed / max(submitted, 1) * 100
 */
public record PoolStats(
        int capacity,
        int inFlight,
        int availableSlots,
        long submitted,
        long completed,
        long failed,
        long timedOut,
        long cancelled,
        int peakInFlight,
        double successRate
) {
}
