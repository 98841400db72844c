package org.imppg.engine.controller;

import org.imppg.engine.model.CompletionStatus;
import org.imppg.engine.model.ProgressEvent;
import org.imppg.engine.service.ProgressChannel;
import org.imppg.engine.service.ProgressListener;
import org.imppg.engine.service.WorkerHandle;
import org.imppg.engine.service.WorkerTask;
import org.imppg.engine.utilities.EngineConfig;
import org.imppg.engine.utilities.ExclusiveCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Cancellable executor of one background run at a time, shared by all engines.
 *
 * <p>Lifecycle of a run:</p>
 * <ol>
 *   <li>{@link #start} waits until the engine's cell is empty, registers a new {@link WorkerHandle} in it
 *       and starts a fresh worker thread</li>
 *   <li>The worker publishes events to the {@link ProgressChannel}, ending with {@code Completed} or
 *       {@code Aborted}</li>
 *   <li>The worker marks itself retired and completes its retirement future, then removes its handle
 *       from the cell (waking waiters)</li>
 *   <li>When the owner dispatches the terminal event, the executor joins the retirement, then calls the
 *       run's finish callback and the completion handler, once</li>
 * </ol>
 *
 * <p>All methods except {@link #isRunning()} are meant for the single owner thread.</p>
 */
public class PipelineExecutor {
    private static final Logger logger = LoggerFactory.getLogger(PipelineExecutor.class);

    private final String name;
    private final EngineConfig config;
    private final ExclusiveCell<WorkerHandle<?>> cell = new ExclusiveCell<>();
    private final ProgressChannel channel;
    private final AtomicLong nextRunId = new AtomicLong(1);
    private final Map<Long, PendingRun<?>> pendingCompletions = new ConcurrentHashMap<>();

    private volatile Consumer<CompletionStatus> completionHandler = status -> { };

    private record PendingRun<T>(WorkerHandle<T> handle, BiConsumer<WorkerHandle<T>, CompletionStatus> onFinished) {
        void finish(CompletionStatus status) {
            onFinished.accept(handle, status);
        }
    }

    /**
     * Creates an executor whose owner pumps the progress channel.
     */
    public PipelineExecutor(String name, EngineConfig config) {
        this(name, config, null);
    }

    /**
     * @param name engine name for logs
     * @param config engine configuration
     * @param ownerExecutor serial executor delivering progress events, or null to pump via {@link #dispatchPending()}
     */
    public PipelineExecutor(String name, EngineConfig config, Executor ownerExecutor) {
        this.name = name;
        this.config = config;
        this.channel = new ProgressChannel(ownerExecutor);
        this.channel.addListener(this::onProgress);
    }

    public String getName() {
        return name;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public ProgressChannel getProgressChannel() {
        return channel;
    }

    public void addProgressListener(ProgressListener listener) {
        channel.addListener(listener);
    }

    public void removeProgressListener(ProgressListener listener) {
        channel.removeListener(listener);
    }

    /**
     * Sets the handler called once per run, on the owner's thread, after the worker has retired.
     * It runs before listeners see the terminal event.
     */
    public void setCompletionHandler(Consumer<CompletionStatus> handler) {
        this.completionHandler = handler != null ? handler : status -> { };
    }

    /** Starts a run with no finish callback. */
    public <T> WorkerHandle<T> start(WorkerTask<T> task) throws InterruptedException {
        return start(task, (handle, status) -> { });
    }

    /**
     * Starts {@code task} on a new worker thread, first waiting for any previous worker to retire.
     *
     * @param task task to run
     * @param onFinished called on the owner's thread when the run's terminal event is dispatched,
     *                   before the completion handler
     * @return handle of the started run
     * @throws InterruptedException if interrupted while waiting for the previous worker to retire
     */
    public <T> WorkerHandle<T> start(WorkerTask<T> task, BiConsumer<WorkerHandle<T>, CompletionStatus> onFinished)
            throws InterruptedException {
        try (ExclusiveCell.Guard<WorkerHandle<?>> guard = cell.lockWhenEmpty()) {
            long runId = nextRunId.getAndIncrement();
            WorkerHandle<T> handle = WorkerHandle.create(runId, task, channel, cell, config.threadNamePrefix());
            // before launch, so an owner executor cannot see the terminal event first
            pendingCompletions.put(runId, new PendingRun<>(handle, onFinished));
            handle.launch(guard);
            logger.info("{}: started run {} ({})", name, runId, task.getName());
            return handle;
        }
    }

    /**
     * Requests the running worker to stop and waits until it has retired. No-op when idle; safe to call
     * repeatedly.
     *
     * <p>The wait has no timeout. A warning is logged every {@code worker.abort_wait_warning_ms} while
     * the worker has not reached a checkpoint. An interrupt does not end the wait; the interrupt flag is
     * restored before returning.</p>
     */
    public void abortProcessing() {
        WorkerHandle<?> handle;
        try (ExclusiveCell.Guard<WorkerHandle<?>> guard = cell.lock()) {
            handle = guard.get();
            if (handle == null) {
                return;
            }
            handle.requestAbort();
        }
        logger.info("{}: aborting run {}", name, handle.getRunId());

        boolean interrupted = false;
        long waitedMs = 0;
        while (true) {
            try {
                if (cell.awaitEmpty(config.abortWaitWarningMs(), TimeUnit.MILLISECONDS)) {
                    break;
                }
                waitedMs += config.abortWaitWarningMs();
                logger.warn("{}: still waiting for run {} to stop after {} ms", name, handle.getRunId(), waitedMs);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /** True while a worker handle is registered, i.e. from start until the worker has retired. */
    public boolean isRunning() {
        try (ExclusiveCell.Guard<WorkerHandle<?>> guard = cell.lock()) {
            return !guard.isEmpty();
        }
    }

    /**
     * Delivers queued progress events; call from the owner's idle loop when no owner executor was given.
     *
     * @return number of events delivered
     */
    public int dispatchPending() {
        return channel.dispatchPending();
    }

    /**
     * Pumps events until the terminal event of {@code runId} has been delivered.
     *
     * @return true if the run finished within the timeout
     */
    public boolean awaitCompletion(long runId, long timeout, TimeUnit unit) throws InterruptedException {
        if (!pendingCompletions.containsKey(runId)) {
            return true;
        }
        return channel.dispatchUntil(e -> e.runId() == runId && e.event().isTerminal(), timeout, unit);
    }

    /**
     * Pumps events until every started run has delivered its terminal event.
     *
     * @return true if idle within the timeout
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (!pendingCompletions.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            channel.dispatchUntil(e -> pendingCompletions.isEmpty(), remaining, TimeUnit.NANOSECONDS);
        }
        return true;
    }

    private void onProgress(long runId, ProgressEvent event) {
        if (!event.isTerminal()) {
            return;
        }
        PendingRun<?> pending = pendingCompletions.remove(runId);
        if (pending == null) {
            logger.warn("{}: terminal event for unknown run {}", name, runId);
            return;
        }
        // the worker publishes its terminal event just before retiring
        pending.handle().retired().join();

        CompletionStatus status = event instanceof ProgressEvent.Completed
                ? CompletionStatus.COMPLETED
                : CompletionStatus.ABORTED;
        logger.info("{}: run {} finished with {}", name, runId, status);
        pending.finish(status);
        completionHandler.accept(status);
    }
}
