package com.example.batchrunner.pool;

/**
 * Wraps the error raised by a work item's computation.
 */
public class WorkItemFailedException extends RuntimeException {
    private final String identifier;

    public WorkItemFailedException(String identifier, Throwable cause) {
        super(cause.toString(), cause);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
