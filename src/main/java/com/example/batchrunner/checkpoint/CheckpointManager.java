package com.example.batchrunner.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Tracks which identifiers have completed or failed and persists them to a single JSON file.
 *
 * <p>Saves are atomic: the document is written to a sibling {@code .tmp} file which then
 * replaces the checkpoint in one move, so a crash never leaves a truncated checkpoint behind.
 * An identifier is in at most one of the two sets.
 */
public final class CheckpointManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointManager.class);
    public static final int DEFAULT_AUTO_SAVE_INTERVAL = 100;

    private final ObjectMapper mapper;
    private final Path checkpointPath;
    private final int autoSaveInterval;
    private final Clock clock;
    private final FileMover mover;

    private final Set<String> completed = new HashSet<>();
    private final Set<String> failed = new HashSet<>();
    private long totalFiles;
    private double startTime;
    private int unsavedOutcomes;

    public CheckpointManager(Path checkpointPath) {
        this(checkpointPath, DEFAULT_AUTO_SAVE_INTERVAL);
    }

    public CheckpointManager(Path checkpointPath, int autoSaveInterval) {
        this(checkpointPath, autoSaveInterval, Clock.systemUTC());
    }

    public CheckpointManager(Path checkpointPath, int autoSaveInterval, Clock clock) {
        this(checkpointPath, autoSaveInterval, clock, CheckpointManager::replace);
    }

    CheckpointManager(Path checkpointPath, int autoSaveInterval, Clock clock, FileMover mover) {
        if (autoSaveInterval <= 0) {
            throw new IllegalArgumentException("Auto-save interval must be positive: " + autoSaveInterval);
        }
        this.mapper = new ObjectMapper();
        this.checkpointPath = checkpointPath;
        this.autoSaveInterval = autoSaveInterval;
        this.clock = clock;
        this.mover = mover;
        this.startTime = now();
    }

    /**
     * Restores progress from the checkpoint file. A missing or unreadable file yields empty
     * sets; an unreadable one is logged and otherwise ignored.
     */
    public synchronized CheckpointState load() {
        if (!Files.exists(checkpointPath)) {
            LOGGER.info("No checkpoint found at {}; starting from scratch.", checkpointPath);
            return CheckpointState.empty();
        }
        CheckpointRecord record;
        try {
            record = read();
        } catch (CheckpointCorruptException ex) {
            LOGGER.warn("Checkpoint {} is corrupt; starting from scratch.", checkpointPath, ex);
            clearState();
            return CheckpointState.empty();
        }

        clearState();
        if (record.completed() != null) {
            completed.addAll(record.completed());
        }
        if (record.failed() != null) {
            record.failed().stream().filter(id -> !completed.contains(id)).forEach(failed::add);
        }
        totalFiles = Math.max(0L, record.totalFiles());
        startTime = record.startTime() == null ? now() : record.startTime();

        LOGGER.info("Checkpoint loaded: {} completed, {} failed.", completed.size(), failed.size());
        if (totalFiles > 0) {
            LOGGER.info("Progress: {}%", String.format("%.1f", (completed.size() + failed.size()) * 100.0 / totalFiles));
        }
        return new CheckpointState(Set.copyOf(completed), Set.copyOf(failed));
    }

    private CheckpointRecord read() throws CheckpointCorruptException {
        try {
            CheckpointRecord record = mapper.readValue(checkpointPath.toFile(), CheckpointRecord.class);
            if (record == null) {
                throw new CheckpointCorruptException(checkpointPath, null);
            }
            if (hasNullEntry(record.completed()) || hasNullEntry(record.failed())) {
                throw new CheckpointCorruptException(checkpointPath,
                        new IllegalArgumentException("Checkpoint lists must not contain null identifiers"));
            }
            return record;
        } catch (IOException ex) {
            throw new CheckpointCorruptException(checkpointPath, ex);
        }
    }

    /**
     * Replaces the tracked sets and total with the given values and persists them.
     */
    public synchronized void save(Set<String> completed, Set<String> failed, long totalFiles) throws PersistenceFailedException {
        this.totalFiles = totalFiles;
        save(completed, failed);
    }

    private static boolean hasNullEntry(List<String> identifiers) {
        return identifiers != null && identifiers.stream().anyMatch(Objects::isNull);
    }

    /**
     * Replaces the tracked sets with the given values and persists them.
     */
    public synchronized void save(Set<String> completed, Set<String> failed) throws PersistenceFailedException {
        Set<String> completedCopy = new HashSet<>(completed);
        Set<String> failedCopy = new HashSet<>(failed);
        failedCopy.removeAll(completedCopy);
        this.completed.clear();
        this.completed.addAll(completedCopy);
        this.failed.clear();
        this.failed.addAll(failedCopy);
        save();
    }

    /**
     * Persists the current in-memory state.
     */
    public synchronized void save() throws PersistenceFailedException {
        CheckpointRecord record = new CheckpointRecord(
                sorted(completed),
                sorted(failed),
                totalFiles,
                startTime,
                now(),
                CheckpointRecord.CURRENT_VERSION
        );
        Path temp = checkpointPath.resolveSibling(checkpointPath.getFileName() + ".tmp");
        try {
            Path parent = checkpointPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(temp, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record));
            mover.move(temp, checkpointPath);
        } catch (IOException ex) {
            PersistenceFailedException failure = new PersistenceFailedException(checkpointPath, ex);
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
        unsavedOutcomes = 0;
        LOGGER.debug("Checkpoint saved: {} completed, {} failed.", completed.size(), failed.size());
    }

    /**
     * Records the outcome for one identifier, moving it out of the other set. With
     * {@code autoSave}, persists once enough outcomes have accumulated since the last save.
     */
    public synchronized void updateProgress(String identifier, ItemOutcome outcome, boolean autoSave) throws PersistenceFailedException {
        if (outcome == ItemOutcome.COMPLETED) {
            completed.add(identifier);
            failed.remove(identifier);
        } else {
            failed.add(identifier);
            completed.remove(identifier);
        }
        unsavedOutcomes++;
        if (autoSave && unsavedOutcomes >= autoSaveInterval) {
            save();
        }
    }

    public void updateProgress(String identifier, ItemOutcome outcome) throws PersistenceFailedException {
        updateProgress(identifier, outcome, true);
    }

    /**
     * Returns true if the identifier already completed and a rerun was not forced.
     */
    public synchronized boolean shouldSkip(String identifier, boolean forceRerun) {
        return !forceRerun && completed.contains(identifier);
    }

    public synchronized boolean isFailed(String identifier) {
        return failed.contains(identifier);
    }

    public synchronized void setTotalFiles(long totalFiles) {
        this.totalFiles = totalFiles;
    }

    public synchronized Set<String> completedIdentifiers() {
        return Collections.unmodifiableSet(new HashSet<>(completed));
    }

    public synchronized Set<String> failedIdentifiers() {
        return Collections.unmodifiableSet(new HashSet<>(failed));
    }

    public synchronized ProgressStats getProgressStats() {
        int completedCount = completed.size();
        int failedCount = failed.size();
        int processedCount = completedCount + failedCount;
        long remaining = Math.max(0L, totalFiles - processedCount);
        double elapsed = Math.max(0.0, now() - startTime);
        double eta = processedCount > 0 && remaining > 0 ? elapsed / processedCount * remaining : 0.0;
        return new ProgressStats(
                completedCount,
                failedCount,
                processedCount,
                totalFiles,
                remaining,
                processedCount > 0 ? completedCount * 100.0 / processedCount : 0.0,
                totalFiles > 0 ? processedCount * 100.0 / totalFiles : 0.0,
                elapsed,
                eta
        );
    }

    public void logProgressSummary() {
        ProgressStats stats = getProgressStats();
        String eta;
        if (stats.estimatedRemainingSeconds() > 3600) {
            eta = String.format("%.1f hours", stats.estimatedRemainingSeconds() / 3600);
        } else {
            eta = String.format("%.1f minutes", stats.estimatedRemainingSeconds() / 60);
        }
        LOGGER.info("Progress: {} completed, {} failed, success rate {}%, {}% done ({}/{}), estimated remaining {}",
                stats.completedCount(),
                stats.failedCount(),
                String.format("%.1f", stats.successRate()),
                String.format("%.1f", stats.progressPercentage()),
                stats.processedCount(),
                stats.totalFiles(),
                eta);
    }

    /**
     * Deletes the checkpoint file and forgets all progress.
     */
    public synchronized void reset() throws IOException {
        if (Files.deleteIfExists(checkpointPath)) {
            LOGGER.info("Checkpoint {} cleared.", checkpointPath);
        }
        clearState();
    }

    /**
     * Exposes the underlying checkpoint file path.
     */
    public Path path() {
        return checkpointPath;
    }

    private void clearState() {
        completed.clear();
        failed.clear();
        totalFiles = 0;
        unsavedOutcomes = 0;
        startTime = now();
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    private static List<String> sorted(Set<String> values) {
        List<String> list = new ArrayList<>(values);
        Collections.sort(list);
        return list;
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Moves the written temp file over the checkpoint.
     */
    @FunctionalInterface
    interface FileMover {
        void move(Path source, Path target) throws IOException;
    }
}
