package com.example.batchrunner.pool;

import java.time.Duration;

/**
 * Raised into a task result when the work did not finish within the pool's ceiling.
 */
public class TaskTimeoutException extends RuntimeException {
    private final Duration timeout;

    public TaskTimeoutException(String identifier, Duration timeout) {
        super("Task for " + identifier + " timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
