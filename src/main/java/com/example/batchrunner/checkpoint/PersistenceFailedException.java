package com.example.batchrunner.checkpoint;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A checkpoint could not be written. The previously persisted file is left untouched.
 */
public class PersistenceFailedException extends IOException {
    private final Path checkpointPath;

    public PersistenceFailedException(Path checkpointPath, Throwable cause) {
        super("Failed to persist checkpoint " + checkpointPath, cause);
        this.checkpointPath = checkpointPath;
    }

    public Path getCheckpointPath() {
        return checkpointPath;
    }
}
