package org.imppg.engine.service;

import org.imppg.engine.utilities.ExclusiveCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owned handle of one run: the worker thread, its abort flag, and two futures the owner can join.
 *
 * <ul>
 *   <li>{@link #result()} completes with the computed value, or exceptionally when the run aborted</li>
 *   <li>{@link #retired()} completes when the worker retires, before anyone waiting on the engine's cell sees it empty</li>
 * </ul>
 * The worker thread is created per run and is never reused.
 *
 * @param <T> type of the computed result
 */
public final class WorkerHandle<T> {
    private static final Logger logger = LoggerFactory.getLogger(WorkerHandle.class);

    private final long runId;
    private final WorkerTask<T> task;
    private final AtomicBoolean abortRequested = new AtomicBoolean(false);
    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final CompletableFuture<Void> retired = new CompletableFuture<>();
    private final Thread thread;

    private WorkerHandle(long runId, WorkerTask<T> task, ProgressChannel channel,
                         ExclusiveCell<WorkerHandle<?>> cell, String threadNamePrefix) {
        this.runId = runId;
        this.task = task;
        WorkerContext context = new WorkerContext(runId, abortRequested, channel);
        this.thread = new Thread(() -> runAndRetire(context, cell), threadNamePrefix + runId);
        this.thread.setDaemon(true);
    }

    /**
     * Creates a handle whose worker thread is not started yet.
     */
    public static <T> WorkerHandle<T> create(long runId, WorkerTask<T> task, ProgressChannel channel,
                                             ExclusiveCell<WorkerHandle<?>> cell, String threadNamePrefix) {
        return new WorkerHandle<>(runId, task, channel, cell, threadNamePrefix);
    }

    /**
     * Registers this handle in the cell held through {@code guard} and starts the worker thread.
     *
     * <p>The cell must be empty. The worker can only retire after the guard is closed.</p>
     */
    public void launch(ExclusiveCell.Guard<WorkerHandle<?>> guard) {
        if (!guard.isEmpty()) {
            throw new IllegalStateException("A worker is already registered: run " + guard.get().getRunId());
        }
        if (thread.getState() != Thread.State.NEW) {
            throw new IllegalStateException("Run " + runId + " has already been launched");
        }
        guard.set(this);
        thread.start();
        logger.debug("Started worker thread {} for {}", thread.getName(), task.getName());
    }

    private void runAndRetire(WorkerContext context, ExclusiveCell<WorkerHandle<?>> cell) {
        try {
            task.execute(context, result);
        } finally {
            // retire while still holding the cell: waiters wake on unlock and must see RETIRED
            try (ExclusiveCell.Guard<WorkerHandle<?>> guard = cell.lock()) {
                if (guard.get() == this) {
                    guard.set(null);
                }
                task.markRetired();
                retired.complete(null);
            }
            logger.debug("Run {}: worker retired", runId);
        }
    }

    public long getRunId() {
        return runId;
    }

    public WorkerTask.State getState() {
        return task.getState();
    }

    /** Sets the abort flag; the worker stops at its next checkpoint. Idempotent. */
    public void requestAbort() {
        if (abortRequested.compareAndSet(false, true)) {
            logger.debug("Run {}: abort requested", runId);
        }
    }

    public boolean isAbortRequested() {
        return abortRequested.get();
    }

    public CompletableFuture<T> result() {
        return result;
    }

    public CompletableFuture<Void> retired() {
        return retired;
    }

    public boolean isRetired() {
        return retired.isDone();
    }

    /**
     * Waits for the worker to retire.
     *
     * @return true if retired within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitRetirement(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            retired.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // retired is only ever completed normally
            throw new IllegalStateException("Retirement future failed", e.getCause());
        }
    }

    @Override
    public String toString() {
        return "WorkerHandle[run=" + runId + ", task=" + task.getName() + ", state=" + getState() + "]";
    }
}
