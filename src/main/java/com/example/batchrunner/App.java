package com.example.batchrunner;

import com.example.batchrunner.checkpoint.CheckpointManager;
import com.example.batchrunner.metadata.ImageMetadata;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar batch-runner.jar <config.json>");
            System.exit(1);
        }
        RunnerConfig config = new ConfigLoader().load(Path.of(args[0]));
        CheckpointManager checkpointManager = new CheckpointManager(config.checkpointFile(), config.autoSaveInterval());
        LOGGER.info("Using checkpoint {}", checkpointManager.path());
        Tika tika = new Tika();
        BatchRunner<ImageMetadata> runner = new BatchRunner<>(
                config,
                checkpointManager,
                ImageScanner.from(config, tika),
                new FileMetadataProcessor(tika)
        );

        // On Ctrl-C, cancel in-flight work and give run() time to write the final checkpoint.
        CountDownLatch finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            runner.requestStop();
            try {
                if (!finished.await(30, TimeUnit.SECONDS)) {
                    LOGGER.warn("Timed out waiting for the final checkpoint save.");
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "batch-runner-shutdown"));

        try {
            BatchSummary summary = runner.run();
            LOGGER.info("Processed {} of {} images ({} skipped).", summary.submitted(), summary.discovered(), summary.skipped());
        } finally {
            finished.countDown();
        }
    }
}
