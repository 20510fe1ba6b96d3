package com.example.batchrunner.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Serialized checkpoint document. Times are epoch seconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckpointRecord(
        @JsonProperty("completed") List<String> completed,
        @JsonProperty("failed") List<String> failed,
        @JsonProperty("total_files") long totalFiles,
        @JsonProperty("start_time") Double startTime,
        @JsonProperty("last_update") Double lastUpdate,
        @JsonProperty("version") String version
) {
    public static final String CURRENT_VERSION = "1.0";
}
