package com.example.batchrunner;

import com.example.batchrunner.checkpoint.CheckpointManager;
import com.example.batchrunner.checkpoint.ItemOutcome;
import com.example.batchrunner.checkpoint.ProgressStats;
import com.example.batchrunner.pool.PoolStats;
import com.example.batchrunner.pool.TaskHandle;
import com.example.batchrunner.pool.TaskPool;
import com.example.batchrunner.pool.TaskResult;
import com.example.batchrunner.pool.WorkItemMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Drives a batch run: restores the checkpoint, discovers images, feeds the ones still to do
 * through a {@link TaskPool}, and records every outcome in the checkpoint and the JSON output.
 */
public final class BatchRunner<R> {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchRunner.class);
    private static final String RESULTS_PREFIX = "results_";
    private static final String ERRORS_PREFIX = "errors_";

    private final RunnerConfig config;
    private final CheckpointManager checkpointManager;
    private final ImageScanner scanner;
    private final ItemProcessor<R> processor;
    private final ProcessingLimiter limiter;
    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final Object recordLock = new Object();

    private volatile boolean stopRequested;
    private volatile TaskPool<R> activePool;

    public BatchRunner(RunnerConfig config, CheckpointManager checkpointManager, ImageScanner scanner, ItemProcessor<R> processor) {
        this(config, checkpointManager, scanner, processor, config.maxItems()
                .map(max -> ProcessingLimiter.atMost(max))
                .orElse(ProcessingLimiter.NO_LIMIT));
    }

    BatchRunner(RunnerConfig config,
                CheckpointManager checkpointManager,
                ImageScanner scanner,
                ItemProcessor<R> processor,
                ProcessingLimiter limiter) {
        this.config = config;
        this.checkpointManager = checkpointManager;
        this.scanner = scanner;
        this.processor = processor;
        this.limiter = limiter;
    }

    /**
     * Executes one run. Items completed by an earlier run are skipped unless a rerun is forced;
     * failed items are submitted again unless {@code skipFailed} is set.
     *
     * @throws com.example.batchrunner.checkpoint.PersistenceFailedException if the final checkpoint save fails
     */
    public BatchSummary run() throws IOException, InterruptedException {
        long startNanos = System.nanoTime();
        checkpointManager.load();

        List<Path> images = scanner.scan(config.roots());
        checkpointManager.setTotalFiles(images.size());
        List<Path> pending = new ArrayList<>();
        for (Path image : images) {
            String identifier = identifierFor(image);
            if (checkpointManager.shouldSkip(identifier, config.forceRerun())) {
                continue;
            }
            if (config.skipFailed() && !config.forceRerun() && checkpointManager.isFailed(identifier)) {
                continue;
            }
            pending.add(image);
        }
        int skipped = images.size() - pending.size();
        LOGGER.info("Images found: {}, already handled: {}, to process: {}, concurrent limit: {}",
                images.size(), skipped, pending.size(), config.concurrentLimit());

        OutputSink sink = new OutputSink(
                JsonBuffer.resume(mapper, config.outputDirectory(), config.resultBufferThreshold(), RESULTS_PREFIX),
                JsonBuffer.resume(mapper, config.outputDirectory(), config.resultBufferThreshold(), ERRORS_PREFIX)
        );
        List<CompletableFuture<Void>> recorded = new ArrayList<>(pending.size());
        int submitted = 0;
        boolean limited = false;
        PoolStats poolStats;

        // Outcomes are recorded off the pool's timer and worker threads, one at a time.
        ExecutorService recorder = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "batch-recorder"));
        try (TaskPool<R> pool = new TaskPool<>(config.concurrentLimit(), config.taskTimeout())) {
            activePool = pool;
            for (Path image : pending) {
                if (stopRequested) {
                    break;
                }
                if (limiter.shouldStop(submitted)) {
                    LOGGER.info("Stopping after {} submitted items.", submitted);
                    limited = true;
                    break;
                }
                TaskHandle<R> handle;
                try {
                    handle = pool.submit(() -> processor.process(image), new WorkItemMetadata(identifierFor(image), image.toString()));
                } catch (IllegalStateException ex) {
                    if (stopRequested) {
                        break;
                    }
                    throw ex;
                }
                submitted++;
                recorded.add(handle.completion().thenAcceptAsync(result -> record(result, sink), recorder).toCompletableFuture());
            }

            pool.waitForCompletion(config.pollInterval());
            CompletableFuture.allOf(recorded.toArray(new CompletableFuture[0])).join();
            poolStats = pool.getStats();
        } finally {
            activePool = null;
            recorder.shutdown();
        }

        synchronized (recordLock) {
            sink.flush();
            checkpointManager.save();
        }
        checkpointManager.logProgressSummary();
        ProgressStats progress = checkpointManager.getProgressStats();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        LOGGER.info("Batch finished in {} s: {} succeeded, {} failed, {} cancelled; pool success rate {}%",
                elapsed.toSeconds(), sink.succeeded, sink.failed, sink.cancelled,
                String.format("%.1f", poolStats.successRate()));

        return new BatchSummary(
                images.size(),
                skipped,
                submitted,
                sink.succeeded,
                sink.failed,
                sink.cancelled,
                limited || stopRequested,
                elapsed,
                poolStats,
                progress
        );
    }

    /**
     * Stops submitting new items and cancels the ones in flight. {@link #run()} still saves
     * the checkpoint before returning; cancelled items are left for the next run.
     */
    public void requestStop() {
        stopRequested = true;
        TaskPool<R> pool = activePool;
        if (pool != null) {
            LOGGER.info("Stop requested; cancelling in-flight work.");
            pool.shutdown();
        }
    }

    private void record(TaskResult<R> result, OutputSink sink) {
        String identifier = result.identifier();
        synchronized (recordLock) {
            try {
                switch (result.status()) {
                    case SUCCESS -> {
                        sink.succeeded++;
                        sink.results.add(ItemRecord.from(result, Instant.now()));
                        checkpointManager.updateProgress(identifier, ItemOutcome.COMPLETED, false);
                    }
                    case TASK_ERROR, TIMEOUT_ERROR -> {
                        sink.failed++;
                        LOGGER.warn("{} failed ({}): {}", identifier, result.status().wireName(), result.errorMessage());
                        sink.errors.add(ItemRecord.from(result, Instant.now()));
                        checkpointManager.updateProgress(identifier, ItemOutcome.FAILED, false);
                    }
                    case CANCELLED -> {
                        sink.cancelled++;
                        return;
                    }
                }
                // Results are flushed before the checkpoint so a saved "completed" always has its output on disk.
                if (++sink.sinceSave >= config.autoSaveInterval()) {
                    sink.flush();
                    checkpointManager.save();
                    sink.sinceSave = 0;
                    checkpointManager.logProgressSummary();
                }
            } catch (IOException ex) {
                LOGGER.error("Failed to record outcome for {}", identifier, ex);
            }
        }
    }

    static String identifierFor(Path image) {
        return image.toAbsolutePath().normalize().toString();
    }

    /**
     * Output buffers and per-run counters. Guarded by {@code recordLock}.
     */
    private static final class OutputSink {
        private final JsonBuffer<ItemRecord> results;
        private final JsonBuffer<ItemRecord> errors;
        private long succeeded;
        private long failed;
        private long cancelled;
        private int sinceSave;

        private OutputSink(JsonBuffer<ItemRecord> results, JsonBuffer<ItemRecord> errors) {
            this.results = results;
            this.errors = errors;
        }

        private void flush() throws IOException {
            results.flush();
            errors.flush();
        }
    }
}
