package com.example.batchrunner;

import com.example.batchrunner.pool.TaskResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One line of batch output: the result of a successful item, or the error of a failed one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemRecord(
        String identifier,
        String taskId,
        String status,
        Object result,
        String error,
        String traceback,
        Instant timestamp
) {
    public static ItemRecord from(TaskResult<?> result, Instant timestamp) {
        return new ItemRecord(
                result.identifier(),
                result.taskId(),
                result.status().wireName(),
                result.payload(),
                result.errorMessage(),
                result.trace(),
                timestamp
        );
    }
}
