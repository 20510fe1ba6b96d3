package com.example.batchrunner;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ConfigLoader {
    private static final int DEFAULT_CONCURRENT_LIMIT = 32;
    private static final long DEFAULT_TASK_TIMEOUT_SECONDS = 72L * 3600;
    private static final int DEFAULT_AUTO_SAVE_INTERVAL = 100;
    private static final long DEFAULT_POLL_INTERVAL_SECONDS = 60;
    private static final int DEFAULT_RESULT_BUFFER_THRESHOLD = 1000;
    private static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            "._*"
    );
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information",
            ".*"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public RunnerConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.roots == null || raw.roots.isEmpty()) {
            throw new IllegalArgumentException("Config must include at least one root path.");
        }

        Path outputDirectory = Path.of(optionalString(raw.outputDirectory, "output"));
        Path checkpointFile = raw.checkpointFile == null || raw.checkpointFile.isBlank()
                ? outputDirectory.resolve("checkpoint.json")
                : Path.of(raw.checkpointFile);
        int concurrentLimit = positiveOr(raw.concurrentLimit, DEFAULT_CONCURRENT_LIMIT);
        // 0 is meaningful here: it disables the per-task timeout.
        long timeoutSeconds = raw.taskTimeoutSeconds != null && raw.taskTimeoutSeconds >= 0
                ? raw.taskTimeoutSeconds
                : DEFAULT_TASK_TIMEOUT_SECONDS;
        int autoSaveInterval = positiveOr(raw.autoSaveInterval, DEFAULT_AUTO_SAVE_INTERVAL);
        long pollSeconds = raw.pollIntervalSeconds != null && raw.pollIntervalSeconds > 0
                ? raw.pollIntervalSeconds
                : DEFAULT_POLL_INTERVAL_SECONDS;
        int bufferThreshold = positiveOr(raw.resultBufferThreshold, DEFAULT_RESULT_BUFFER_THRESHOLD);
        Optional<Integer> maxItems = Optional.ofNullable(raw.maxItems).filter(value -> value > 0);

        return new RunnerConfig(
                raw.roots.stream().map(Path::of).toList(),
                outputDirectory,
                checkpointFile,
                concurrentLimit,
                Duration.ofSeconds(timeoutSeconds),
                autoSaveInterval,
                Duration.ofSeconds(pollSeconds),
                bufferThreshold,
                raw.forceRerun != null && raw.forceRerun,
                raw.skipFailed != null && raw.skipFailed,
                raw.followLinks != null && raw.followLinks,
                maxItems,
                mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFilePatterns),
                mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns)
        );
    }

    private int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public List<String> roots = new ArrayList<>();
        public String outputDirectory;
        public String checkpointFile;
        public Integer concurrentLimit;
        public Long taskTimeoutSeconds;
        public Integer autoSaveInterval;
        public Long pollIntervalSeconds;
        public Integer resultBufferThreshold;
        public Boolean forceRerun;
        public Boolean skipFailed;
        public Boolean followLinks;
        public Integer maxItems;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
    }
}
