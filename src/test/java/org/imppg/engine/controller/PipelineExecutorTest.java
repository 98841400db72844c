package org.imppg.engine.controller;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import org.imppg.engine.model.CompletionStatus;
import org.imppg.engine.model.ProgressEvent;
import org.imppg.engine.service.WorkerContext;
import org.imppg.engine.service.WorkerHandle;
import org.imppg.engine.service.WorkerTask;
import org.imppg.engine.utilities.EngineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Tests for {@link PipelineExecutor}: one run at a time, abort, and exactly-once completion.
 */
class PipelineExecutorTest {

    private final PipelineExecutor executor = new PipelineExecutor("test", EngineConfig.defaults());
    private ExecutorService ownerThread;

    @AfterEach
    void tearDown() {
        executor.abortProcessing();
        if (ownerThread != null) {
            ownerThread.shutdownNow();
        }
    }

    /** Publishes a progress event per step, checking for abort in between; loops until aborted if steps < 0. */
    static class SteppingTask extends WorkerTask<Integer> {
        final CountDownLatch started = new CountDownLatch(1);
        private final int steps;

        SteppingTask(int steps) {
            this.steps = steps;
        }

        @Override
        public String getName() {
            return "stepping";
        }

        @Override
        protected Integer compute(WorkerContext context) throws InterruptedException {
            started.countDown();
            int i = 0;
            while (steps < 0 || i < steps) {
                context.check();
                context.publish(new ProgressEvent.StabilizationProgress(i, Math.max(steps, 0)));
                Thread.sleep(2);
                i++;
            }
            return i;
        }
    }

    // ==================== Completion ====================

    @Test
    @DisplayName("Completed run delivers its result and calls the handlers once, in order")
    void testCompletedRun() throws Exception {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        executor.setCompletionHandler(status -> calls.add("handler:" + status));
        executor.addProgressListener((runId, event) -> {
            if (event.isTerminal()) {
                calls.add("listener");
            }
        });

        WorkerHandle<Integer> handle = executor.start(new SteppingTask(5),
                (h, status) -> calls.add("finished:" + h.result().join()));
        assertTrue(executor.awaitCompletion(handle.getRunId(), 5, TimeUnit.SECONDS));

        assertEquals(List.of("finished:5", "handler:COMPLETED", "listener"), calls);
        assertTrue(handle.isRetired());
        assertFalse(executor.isRunning());
    }

    @Test
    @DisplayName("Progress events reach listeners tagged with the run id")
    void testProgressTaggedWithRunId() throws Exception {
        List<Long> runIds = Collections.synchronizedList(new ArrayList<>());
        executor.addProgressListener((runId, event) -> runIds.add(runId));

        WorkerHandle<Integer> handle = executor.start(new SteppingTask(3));
        assertTrue(executor.awaitCompletion(handle.getRunId(), 5, TimeUnit.SECONDS));

        assertEquals(4, runIds.size());
        assertTrue(runIds.stream().allMatch(id -> id == handle.getRunId()));
    }

    // ==================== Abort ====================

    @Test
    @DisplayName("Abort on an idle executor returns at once")
    void testAbortIdle() {
        assertFalse(executor.isRunning());
        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
            executor.abortProcessing();
            executor.abortProcessing();
        });
    }

    @Test
    @DisplayName("Abort returns only after the worker retired, and the handler reports ABORTED once")
    @SuppressWarnings("unchecked")
    void testAbortRunning() throws Exception {
        Consumer<CompletionStatus> handler = mock(Consumer.class);
        executor.setCompletionHandler(handler);
        SteppingTask task = new SteppingTask(-1);

        WorkerHandle<Integer> handle = executor.start(task);
        assertTrue(task.started.await(5, TimeUnit.SECONDS));
        assertTrue(executor.isRunning());

        executor.abortProcessing();

        assertFalse(executor.isRunning());
        assertTrue(handle.isRetired());
        verifyNoInteractions(handler);

        executor.dispatchPending();
        verify(handler, times(1)).accept(CompletionStatus.ABORTED);

        executor.abortProcessing();
        executor.dispatchPending();
        verify(handler, times(1)).accept(any());
    }

    @Test
    @DisplayName("Every abort leaves the aborted handle retired by the time it returns")
    void testAbortAlwaysRetires() throws Exception {
        for (int i = 0; i < 200; i++) {
            WorkerHandle<Integer> handle = executor.start(new SteppingTask(-1));
            executor.abortProcessing();

            assertTrue(handle.isRetired(), "run " + i + " not retired");
            assertEquals(WorkerTask.State.RETIRED, handle.getState(), "run " + i);
            executor.dispatchPending();
        }
        assertFalse(executor.isRunning());
    }

    @Test
    @DisplayName("Starting after an abort runs the new task and completes both runs exactly once")
    @SuppressWarnings("unchecked")
    void testRestart() throws Exception {
        Consumer<CompletionStatus> handler = mock(Consumer.class);
        executor.setCompletionHandler(handler);

        SteppingTask first = new SteppingTask(-1);
        executor.start(first);
        assertTrue(first.started.await(5, TimeUnit.SECONDS));
        executor.abortProcessing();

        WorkerHandle<Integer> second = executor.start(new SteppingTask(2));
        assertTrue(executor.awaitIdle(5, TimeUnit.SECONDS));

        verify(handler, times(1)).accept(CompletionStatus.ABORTED);
        verify(handler, times(1)).accept(CompletionStatus.COMPLETED);
        assertEquals(2, second.result().join());
    }

    @Test
    @DisplayName("Start waits for a running worker to retire before launching the next one")
    void testStartWaitsForRetirement() throws Exception {
        SteppingTask first = new SteppingTask(-1);
        WorkerHandle<Integer> firstHandle = executor.start(first);
        assertTrue(first.started.await(5, TimeUnit.SECONDS));

        CountDownLatch secondStarted = new CountDownLatch(1);
        Thread starter = new Thread(() -> {
            try {
                executor.start(new SteppingTask(1));
                secondStarted.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        starter.start();
        assertFalse(secondStarted.await(100, TimeUnit.MILLISECONDS));

        firstHandle.requestAbort();
        assertTrue(secondStarted.await(5, TimeUnit.SECONDS));
        assertTrue(firstHandle.isRetired());
        starter.join(5000);
    }

    // ==================== Owner Executor ====================

    @Test
    @DisplayName("With an owner executor, completion is delivered without pumping")
    void testOwnerExecutorDelivery() throws Exception {
        ownerThread = Executors.newSingleThreadExecutor();
        PipelineExecutor owned = new PipelineExecutor("owned", EngineConfig.defaults(), ownerThread);
        CountDownLatch completed = new CountDownLatch(1);
        owned.setCompletionHandler(status -> {
            if (status == CompletionStatus.COMPLETED) {
                completed.countDown();
            }
        });

        owned.start(new SteppingTask(3));
        assertTrue(completed.await(5, TimeUnit.SECONDS));
        assertFalse(owned.isRunning());
    }
}
