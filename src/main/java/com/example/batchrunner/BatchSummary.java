package com.example.batchrunner;

import com.example.batchrunner.checkpoint.ProgressStats;
import com.example.batchrunner.pool.PoolStats;

import java.time.Duration;

/**
 * Outcome of one {@link BatchRunner#run()} call.
 *
 * @param discovered items found under the roots
 * @param skipped    items not submitted because a prior run already handled them
 * @param submitted  items handed to the task pool
 * @param succeeded  items that completed in this run
 * @param failed     items that failed or timed out in this run
 * @param cancelled  items cancelled by a stop request (left for the next run)
 * @param stopped    true if the run ended early (limit reached or stop requested)
 */
public record BatchSummary(
        int discovered,
        int skipped,
        int submitted,
        long succeeded,
        long failed,
        long cancelled,
        boolean stopped,
        Duration elapsed,
        PoolStats poolStats,
        ProgressStats progress
) {
}
