package com.example.batchrunner.checkpoint;

/**
 * Progress snapshot derived from the checkpoint. Durations are in seconds.
 */
public record ProgressStats(
        int completedCount,
        int failedCount,
        int processedCount,
        long totalFiles,
        long remainingCount,
        double successRate,
        double progressPercentage,
        double elapsedSeconds,
        double estimatedRemainingSeconds
) {
}
