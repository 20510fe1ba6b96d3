package com.example.batchrunner.checkpoint;

import java.util.Set;

/**
 * Identifiers restored from a checkpoint.
 */
public record CheckpointState(
        Set<String> completed,
        Set<String> failed
) {
    public static CheckpointState empty() {
        return new CheckpointState(Set.of(), Set.of());
    }

    public boolean isEmpty() {
        return completed.isEmpty() && failed.isEmpty();
    }
}
