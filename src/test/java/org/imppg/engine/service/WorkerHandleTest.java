package org.imppg.engine.service;

import static org.junit.jupiter.api.Assertions.*;

import org.imppg.engine.model.ProgressEvent;
import org.imppg.engine.utilities.ExclusiveCell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Tests for {@link WorkerHandle} and the {@link WorkerTask} lifecycle it drives.
 */
class WorkerHandleTest {

    private final ProgressChannel channel = new ProgressChannel();
    private final ExclusiveCell<WorkerHandle<?>> cell = new ExclusiveCell<>();
    private final List<ProgressEvent> events = new ArrayList<>();

    WorkerHandleTest() {
        channel.addListener((runId, event) -> events.add(event));
    }

    private <T> WorkerHandle<T> launch(WorkerTask<T> task) {
        WorkerHandle<T> handle = WorkerHandle.create(1, task, channel, cell, "test-worker-");
        try (ExclusiveCell.Guard<WorkerHandle<?>> guard = cell.lock()) {
            handle.launch(guard);
        }
        return handle;
    }

    /** Task returning a fixed value, optionally waiting at checkpoints until released. */
    private static class CountingTask extends WorkerTask<Integer> {
        final CountDownLatch started = new CountDownLatch(1);
        final int steps;

        CountingTask(int steps) {
            this.steps = steps;
        }

        @Override
        public String getName() {
            return "counting";
        }

        @Override
        protected Integer compute(WorkerContext context) throws InterruptedException {
            started.countDown();
            for (int i = 0; i < steps; i++) {
                context.check();
                Thread.sleep(5);
            }
            return steps;
        }
    }

    // ==================== Completion ====================

    @Test
    @DisplayName("Completed run publishes one Completed event, then retires and clears the cell")
    void testCompletedRun() throws Exception {
        WorkerHandle<Integer> handle = launch(new CountingTask(3));

        assertEquals(3, handle.result().get(5, TimeUnit.SECONDS));
        assertTrue(handle.awaitRetirement(5, TimeUnit.SECONDS));
        assertEquals(WorkerTask.State.RETIRED, handle.getState());
        assertTrue(cell.awaitEmpty(0, TimeUnit.MILLISECONDS));

        channel.dispatchPending();
        assertEquals(List.of(new ProgressEvent.Completed()), events);
    }

    // ==================== Abort ====================

    @Test
    @DisplayName("Abort request ends the run with a user-requested Aborted event")
    void testAbortedRun() throws Exception {
        CountingTask task = new CountingTask(100_000);
        WorkerHandle<Integer> handle = launch(task);
        assertTrue(task.started.await(5, TimeUnit.SECONDS));

        handle.requestAbort();
        handle.requestAbort();
        assertTrue(handle.isAbortRequested());
        assertTrue(handle.awaitRetirement(5, TimeUnit.SECONDS));

        CompletionException failure = assertThrows(CompletionException.class, () -> handle.result().join());
        assertInstanceOf(ProcessingAbortedException.class, failure.getCause());

        channel.dispatchPending();
        assertEquals(1, events.size());
        ProgressEvent.Aborted aborted = assertInstanceOf(ProgressEvent.Aborted.class, events.get(0));
        assertTrue(aborted.userRequested());
    }

    @Test
    @DisplayName("Failure inside the task becomes a non-user Aborted event carrying the message")
    void testFailedRun() throws Exception {
        WorkerHandle<Void> handle = launch(new WorkerTask<Void>() {
            @Override
            public String getName() {
                return "failing";
            }

            @Override
            protected Void compute(WorkerContext context) throws IOException {
                throw new IOException("disk full");
            }
        });
        assertTrue(handle.awaitRetirement(5, TimeUnit.SECONDS));
        assertTrue(handle.result().isCompletedExceptionally());

        channel.dispatchPending();
        ProgressEvent.Aborted aborted = assertInstanceOf(ProgressEvent.Aborted.class, events.get(0));
        assertEquals("disk full", aborted.reason());
        assertFalse(aborted.userRequested());
    }

    // ==================== Launch Preconditions ====================

    @Test
    @DisplayName("A handle cannot be launched into an occupied cell or launched twice")
    void testLaunchPreconditions() throws Exception {
        CountingTask task = new CountingTask(100_000);
        WorkerHandle<Integer> first = launch(task);
        assertTrue(task.started.await(5, TimeUnit.SECONDS));

        WorkerHandle<Integer> second = WorkerHandle.create(2, new CountingTask(1), channel, cell, "test-worker-");
        try (ExclusiveCell.Guard<WorkerHandle<?>> guard = cell.lock()) {
            assertThrows(IllegalStateException.class, () -> second.launch(guard));
        }

        first.requestAbort();
        assertTrue(first.awaitRetirement(5, TimeUnit.SECONDS));
        try (ExclusiveCell.Guard<WorkerHandle<?>> guard = cell.lock()) {
            assertThrows(IllegalStateException.class, () -> first.launch(guard));
        }
    }
}
