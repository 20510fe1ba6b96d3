package com.example.batchrunner.pool;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskPoolTest {
    @Test
    void capacityBoundsInFlightTasks() throws Exception {
        try (TaskPool<String> pool = new TaskPool<>(2, null)) {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            List<TaskHandle<String>> handles = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                String id = "item-" + i;
                handles.add(pool.submit(() -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    Thread.sleep(50);
                    running.decrementAndGet();
                    return id;
                }, WorkItemMetadata.of(id)));
                assertTrue(pool.getStats().inFlight() <= 2);
            }
            for (TaskHandle<String> handle : handles) {
                TaskResult<String> result = handle.await();
                assertEquals(TaskStatus.SUCCESS, result.status());
                assertEquals(handle.metadata().identifier(), result.payload());
            }

            PoolStats stats = pool.getStats();
            assertEquals(2, stats.peakInFlight());
            assertEquals(2, maxRunning.get());
            assertEquals(0, stats.inFlight());
            assertEquals(2, stats.availableSlots());
            assertEquals(5, stats.submitted());
            assertEquals(5, stats.completed());
            assertEquals(100.0, stats.successRate());
        }
    }

    @Test
    void slowWorkEndsWithTimeoutAndReleasesSlot() throws Exception {
        try (TaskPool<String> pool = new TaskPool<>(1, Duration.ofMillis(10))) {
            CountDownLatch release = new CountDownLatch(1);
            long start = System.nanoTime();
            TaskHandle<String> handle = pool.submit(() -> {
                release.await(2, TimeUnit.SECONDS);
                return "late";
            }, WorkItemMetadata.of("slow.png"));

            TaskResult<String> result = handle.await(Duration.ofSeconds(5));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(TaskStatus.TIMEOUT_ERROR, result.status());
            assertNull(result.payload());
            assertInstanceOf(TaskTimeoutException.class, result.error());
            assertTrue(elapsedMillis < 1000, "timed out after " + elapsedMillis + " ms");
            assertEquals(0, pool.getStats().inFlight());
            assertEquals(1, pool.getStats().timedOut());
            assertEquals(1, pool.getStats().failed());

            TaskHandle<String> next = pool.submit(() -> "next", WorkItemMetadata.of("next.png"));
            assertEquals(TaskStatus.SUCCESS, next.await(Duration.ofSeconds(5)).status());
            release.countDown();
        }
    }

    @Test
    void valueProducedAfterTimeoutIsDiscarded() throws Exception {
        try (TaskPool<String> pool = new TaskPool<>(1, Duration.ofMillis(20))) {
            CountDownLatch finished = new CountDownLatch(1);
            TaskHandle<String> handle = pool.submit(() -> {
                try {
                    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(100);
                    while (System.nanoTime() < deadline) {
                        // busy wait, ignoring interruption
                        Thread.onSpinWait();
                    }
                    return "too late";
                } finally {
                    finished.countDown();
                }
            }, WorkItemMetadata.of("stubborn.png"));

            TaskResult<String> result = handle.await(Duration.ofSeconds(5));
            assertTrue(finished.await(5, TimeUnit.SECONDS));
            assertEquals(TaskStatus.TIMEOUT_ERROR, result.status());
            assertEquals(TaskStatus.TIMEOUT_ERROR, handle.await().status());
            assertEquals(0, pool.getStats().completed());
        }
    }

    @Test
    void failingWorkIsReportedWithTrace() throws Exception {
        try (TaskPool<String> pool = new TaskPool<>(1)) {
            TaskHandle<String> handle = pool.submit(() -> {
                throw new IllegalStateException("remote returned 500");
            }, new WorkItemMetadata("broken.png", "/images/broken.png"));

            TaskResult<String> result = handle.await();
            assertEquals(TaskStatus.TASK_ERROR, result.status());
            assertEquals("task_0", result.taskId());
            assertEquals("broken.png", result.identifier());
            WorkItemFailedException error = assertInstanceOf(WorkItemFailedException.class, result.error());
            assertInstanceOf(IllegalStateException.class, error.getCause());
            assertTrue(result.errorMessage().contains("remote returned 500"));
            assertNotNull(result.trace());
            assertTrue(result.trace().contains("IllegalStateException"));

            PoolStats stats = pool.getStats();
            assertEquals(1, stats.failed());
            assertEquals(0, stats.timedOut());
            assertEquals(0, stats.inFlight());
            assertEquals(0.0, stats.successRate());
        }
    }

    @Test
    void everyHandleResolvesExactlyOnce() throws Exception {
        try (TaskPool<Integer> pool = new TaskPool<>(4, Duration.ofMillis(200))) {
            List<TaskHandle<Integer>> handles = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                int n = i;
                handles.add(pool.submit(() -> {
                    if (n % 5 == 0) {
                        throw new RuntimeException("boom " + n);
                    }
                    if (n % 7 == 0) {
                        Thread.sleep(2000);
                    }
                    return n;
                }, WorkItemMetadata.of("item-" + n)));
            }
            int success = 0;
            int errors = 0;
            int timeouts = 0;
            for (TaskHandle<Integer> handle : handles) {
                switch (handle.await(Duration.ofSeconds(10)).status()) {
                    case SUCCESS -> success++;
                    case TASK_ERROR -> errors++;
                    case TIMEOUT_ERROR -> timeouts++;
                    case CANCELLED -> throw new AssertionError("unexpected cancellation");
                }
            }
            PoolStats stats = pool.getStats();
            assertEquals(40, success + errors + timeouts);
            assertEquals(8, errors);
            assertEquals(4, timeouts);
            assertEquals(success, stats.completed());
            assertEquals(errors + timeouts, stats.failed());
            assertEquals(timeouts, stats.timedOut());
            assertEquals(0, stats.inFlight());
            assertTrue(stats.peakInFlight() <= 4);
        }
    }

    @Test
    void taskIdsIncreaseMonotonically() throws Exception {
        try (TaskPool<String> pool = new TaskPool<>(3)) {
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                ids.add(pool.submit(() -> "ok", WorkItemMetadata.of("item-" + i)).taskId());
            }
            assertEquals(List.of("task_0", "task_1", "task_2"), ids);
        }
    }

    @Test
    void shutdownCancelsInFlightTasks() throws Exception {
        TaskPool<String> pool = new TaskPool<>(2, null);
        CountDownLatch started = new CountDownLatch(2);
        List<TaskHandle<String>> handles = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            handles.add(pool.submit(() -> {
                started.countDown();
                Thread.sleep(10_000);
                return "never";
            }, WorkItemMetadata.of("item-" + i)));
        }
        assertTrue(started.await(5, TimeUnit.SECONDS));

        pool.shutdown();

        for (TaskHandle<String> handle : handles) {
            assertTrue(handle.isDone());
            assertEquals(TaskStatus.CANCELLED, handle.await().status());
        }
        PoolStats stats = pool.getStats();
        assertEquals(0, stats.inFlight());
        assertEquals(2, stats.cancelled());
        assertEquals(0, stats.failed());

        pool.shutdown();
        assertThrows(IllegalStateException.class, () -> pool.submit(() -> "late", WorkItemMetadata.of("late")));
        assertEquals(2, pool.getStats().availableSlots());
    }

    @Test
    void waitForCompletionDrainsWithoutCancelling() throws Exception {
        try (TaskPool<String> pool = new TaskPool<>(3, null)) {
            List<TaskHandle<String>> handles = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                handles.add(pool.submit(() -> {
                    Thread.sleep(50);
                    return "done";
                }, WorkItemMetadata.of("item-" + i)));
            }

            pool.waitForCompletion(Duration.ofMillis(10));

            assertEquals(0, pool.getStats().inFlight());
            for (TaskHandle<String> handle : handles) {
                assertEquals(TaskStatus.SUCCESS, handle.await().status());
            }
        }
    }

    @Test
    void submitBlocksUntilASlotFrees() throws Exception {
        try (TaskPool<String> pool = new TaskPool<>(1, null)) {
            CountDownLatch release = new CountDownLatch(1);
            pool.submit(() -> {
                release.await();
                return "first";
            }, WorkItemMetadata.of("first"));

            CountDownLatch secondSubmitted = new CountDownLatch(1);
            Thread submitter = new Thread(() -> {
                try {
                    pool.submit(() -> "second", WorkItemMetadata.of("second"));
                    secondSubmitted.countDown();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            });
            submitter.start();

            assertFalse(secondSubmitted.await(100, TimeUnit.MILLISECONDS));
            assertEquals(1, pool.getStats().submitted());

            release.countDown();
            assertTrue(secondSubmitted.await(5, TimeUnit.SECONDS));
            submitter.join();
            pool.waitForCompletion(Duration.ofMillis(10));
            assertEquals(2, pool.getStats().completed());
        }
    }

    @Test
    void hugeTimeoutIsClampedInsteadOfFailingSubmit() throws Exception {
        try (TaskPool<String> pool = new TaskPool<>(1, Duration.ofSeconds(Long.MAX_VALUE))) {
            TaskHandle<String> handle = pool.submit(() -> "ok", WorkItemMetadata.of("item"));
            assertEquals(TaskStatus.SUCCESS, handle.await(Duration.ofSeconds(5)).status());
            assertEquals(0, pool.getStats().inFlight());
        }
    }

    @Test
    void statsSnapshotIsConsistent() throws Exception {
        try (TaskPool<String> pool = new TaskPool<>(3, null)) {
            CountDownLatch release = new CountDownLatch(1);
            pool.submit(() -> {
                release.await();
                return "held";
            }, WorkItemMetadata.of("held"));

            PoolStats stats = pool.getStats();
            assertEquals(1, stats.inFlight());
            assertEquals(2, stats.availableSlots());
            assertEquals(stats.capacity(), stats.inFlight() + stats.availableSlots());
            release.countDown();
        }
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TaskPool<String>(0));
        assertThrows(IllegalArgumentException.class, () -> new WorkItemMetadata(" ", "payload"));
    }
}
