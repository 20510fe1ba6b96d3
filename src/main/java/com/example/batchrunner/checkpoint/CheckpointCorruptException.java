package com.example.batchrunner.checkpoint;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A checkpoint file exists but could not be read or parsed.
 */
public class CheckpointCorruptException extends IOException {
    public CheckpointCorruptException(Path checkpointPath, Throwable cause) {
        super("Checkpoint " + checkpointPath + " is unreadable", cause);
    }
}
