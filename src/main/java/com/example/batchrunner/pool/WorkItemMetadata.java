package com.example.batchrunner.pool;

/**
 * Describes a unit of work for reporting. The pool never interprets the payload reference.
 */
public record WorkItemMetadata(
        String identifier,
        String payloadReference
) {
    public WorkItemMetadata {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Work item identifier must not be empty.");
        }
    }

    /**
     * Metadata whose payload reference is the identifier itself (e.g. a file path).
     */
    public static WorkItemMetadata of(String identifier) {
        return new WorkItemMetadata(identifier, identifier);
    }
}
