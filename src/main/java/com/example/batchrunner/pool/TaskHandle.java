package com.example.batchrunner.pool;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller-side view of a submitted task. Resolves exactly once, to a {@link TaskResult}.
 */
public final class TaskHandle<T> {
    private final String taskId;
    private final WorkItemMetadata metadata;
    private final CompletableFuture<TaskResult<T>> outcome;

    TaskHandle(String taskId, WorkItemMetadata metadata, CompletableFuture<TaskResult<T>> outcome) {
        this.taskId = taskId;
        this.metadata = metadata;
        this.outcome = outcome;
    }

    public String taskId() {
        return taskId;
    }

    public WorkItemMetadata metadata() {
        return metadata;
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    /**
     * Blocks until the task reaches its terminal outcome.
     */
    public TaskResult<T> await() throws InterruptedException {
        try {
            return outcome.get();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Outcome of " + taskId + " could not be recorded", ex.getCause());
        }
    }

    /**
     * Blocks for at most {@code timeout} waiting for the terminal outcome.
     */
    public TaskResult<T> await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Outcome of " + taskId + " could not be recorded", ex.getCause());
        }
    }

    /**
     * Stage that completes with the terminal outcome, after the task's slot has been released.
     */
    public CompletionStage<TaskResult<T>> completion() {
        return outcome.minimalCompletionStage();
    }
}
