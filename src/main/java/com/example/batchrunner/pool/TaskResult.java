package com.example.batchrunner.pool;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Terminal, immutable result of a pool task. Failures carry the error and its stack trace
 * instead of propagating out of the pool.
 */
public record TaskResult<T>(
        String taskId,
        WorkItemMetadata metadata,
        TaskStatus status,
        T payload,
        Throwable error,
        String trace
) {
    public static <T> TaskResult<T> success(String taskId, WorkItemMetadata metadata, T payload) {
        return new TaskResult<>(taskId, metadata, TaskStatus.SUCCESS, payload, null, null);
    }

    public static <T> TaskResult<T> taskError(String taskId, WorkItemMetadata metadata, Throwable cause) {
        WorkItemFailedException error = new WorkItemFailedException(metadata.identifier(), cause);
        return new TaskResult<>(taskId, metadata, TaskStatus.TASK_ERROR, null, error, stackTrace(cause));
    }

    public static <T> TaskResult<T> timeout(String taskId, WorkItemMetadata metadata, TaskTimeoutException error) {
        return new TaskResult<>(taskId, metadata, TaskStatus.TIMEOUT_ERROR, null, error, null);
    }

    public static <T> TaskResult<T> cancelled(String taskId, WorkItemMetadata metadata) {
        return new TaskResult<>(taskId, metadata, TaskStatus.CANCELLED, null, null, null);
    }

    public String identifier() {
        return metadata.identifier();
    }

    public boolean isSuccess() {
        return status == TaskStatus.SUCCESS;
    }

    /**
     * Human readable error message, or null for successful and cancelled tasks.
     */
    public String errorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage();
    }

    private static String stackTrace(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
