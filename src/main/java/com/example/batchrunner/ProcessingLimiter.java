package com.example.batchrunner;

public interface ProcessingLimiter {
    /**
     * Returns true if submission should stop once the given number of items was submitted.
     */
    boolean shouldStop(long submittedCount);

    /**
     * Default limiter used in production runs (never stops early).
     */
    ProcessingLimiter NO_LIMIT = submittedCount -> false;

    static ProcessingLimiter atMost(long maxItems) {
        return submittedCount -> submittedCount >= maxItems;
    }
}
