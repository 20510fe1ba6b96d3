package com.example.batchrunner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for a batch run.
 */
public record RunnerConfig(
        List<Path> roots,
        Path outputDirectory,
        Path checkpointFile,
        int concurrentLimit,
        Duration taskTimeout,
        int autoSaveInterval,
        Duration pollInterval,
        int resultBufferThreshold,
        boolean forceRerun,
        boolean skipFailed,
        boolean followLinks,
        Optional<Integer> maxItems,
        List<String> excludeFilePatterns,
        List<String> excludeDirectoryPatterns
) {
}
