package com.example.batchrunner.pool;

/**
 * Terminal outcome of a submitted task.
 */
public enum TaskStatus {
    SUCCESS("success"),
    TASK_ERROR("task_error"),
    TIMEOUT_ERROR("timeout_error"),
    CANCELLED("cancelled");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
