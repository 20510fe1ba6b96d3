package com.example.batchrunner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonBufferTest {
    @Test
    void flushesWhenThresholdReached() throws Exception {
        Path outputDir = Files.createTempDirectory("buffer-test");
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        JsonBuffer<ItemRecord> buffer = new JsonBuffer<>(mapper, outputDir, 2, 1, "results_");

        buffer.add(new ItemRecord("a.png", "task_0", "success", "ok", null, null, Instant.now()));
        assertEquals(0L, Files.list(outputDir).count());

        buffer.add(new ItemRecord("b.png", "task_1", "success", "ok", null, null, Instant.now()));
        assertTrue(Files.exists(outputDir.resolve("results_000001.json")));
        assertEquals(2, mapper.readTree(outputDir.resolve("results_000001.json").toFile()).size());
        assertEquals(2, buffer.nextSequence());

        buffer.flush();
        assertEquals(1L, Files.list(outputDir).count());
    }

    @Test
    void resumeContinuesAfterExistingFiles() throws Exception {
        Path outputDir = Files.createTempDirectory("buffer-resume");
        Files.writeString(outputDir.resolve("results_000001.json"), "[]");
        Files.writeString(outputDir.resolve("results_000007.json"), "[]");
        Files.writeString(outputDir.resolve("errors_000009.json"), "[]");

        JsonBuffer<ItemRecord> buffer = JsonBuffer.resume(new ObjectMapper(), outputDir, 10, "results_");

        assertEquals(8, buffer.nextSequence());
        Files.writeString(outputDir.resolve("results_99999999999.json"), "[]");
        assertEquals(8, JsonBuffer.nextSequenceIn(outputDir, "results_"));
        assertEquals(1, JsonBuffer.nextSequenceIn(outputDir.resolve("missing"), "results_"));
    }
}
