package com.example.batchrunner.metadata;

import java.time.Instant;

/**
 * Serialized description of a processed image.
 */
public record ImageMetadata(
        String path,
        String name,
        long size,
        String mimeType,
        String hashSha256,
        Instant createdTime,
        Instant lastModifiedTime
) {
}
