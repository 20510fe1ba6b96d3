package com.example.batchrunner;

import java.nio.file.Path;

/**
 * Processes one discovered item, typically by calling a remote service. Retries of the remote
 * call belong inside the implementation; a thrown exception marks the item failed.
 */
@FunctionalInterface
public interface ItemProcessor<R> {
    R process(Path item) throws Exception;
}
