package org.imppg.engine.service;

import org.imppg.engine.model.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Unit of background execution.
 *
 * <p>Subclasses implement {@link #compute}, calling {@link WorkerContext#check()} at every checkpoint
 * (per file, per deconvolution iteration, between pipeline stages). The task moves through
 * {@code CREATED -> RUNNING -> COMPLETED | ABORTED -> RETIRED} and publishes exactly one terminal
 * event:</p>
 * <ul>
 *   <li>{@code Completed} when {@code compute} returns</li>
 *   <li>{@code Aborted(reason, true)} when a checkpoint observed an abort request</li>
 *   <li>{@code Aborted(message, false)} when {@code compute} failed; the failure is logged</li>
 * </ul>
 * A task runs at most once.
 *
 * @param <T> type of the computed result
 */
public abstract class WorkerTask<T> {
    private static final Logger logger = LoggerFactory.getLogger(WorkerTask.class);

    public enum State {
        CREATED,
        RUNNING,
        COMPLETED,
        ABORTED,
        RETIRED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);

    /** Short description used in thread names and log messages. */
    public abstract String getName();

    /**
     * Performs the work on the worker thread.
     *
     * @param context abort checkpoint and event sink of this run
     * @return the result, handed to the owner through {@link WorkerHandle#result()}
     * @throws Exception on failure; the run ends with a non-user {@code Aborted} event
     */
    protected abstract T compute(WorkerContext context) throws Exception;

    public State getState() {
        return state.get();
    }

    /**
     * Runs the task and publishes its terminal event. Completes {@code result} before the event is
     * published, so an owner reacting to {@code Completed} can read it.
     */
    final void execute(WorkerContext context, CompletableFuture<T> result) {
        if (!state.compareAndSet(State.CREATED, State.RUNNING)) {
            throw new IllegalStateException("Task " + getName() + " has already been started");
        }
        logger.debug("Run {}: {} started", context.getRunId(), getName());
        try {
            context.check();
            T value = compute(context);
            state.set(State.COMPLETED);
            result.complete(value);
            logger.debug("Run {}: {} completed", context.getRunId(), getName());
            context.publish(new ProgressEvent.Completed());
        } catch (ProcessingAbortedException e) {
            state.set(State.ABORTED);
            result.completeExceptionally(e);
            logger.info("Run {}: {} aborted", context.getRunId(), getName());
            context.publish(new ProgressEvent.Aborted(e.getMessage(), true));
        } catch (Exception e) {
            state.set(State.ABORTED);
            result.completeExceptionally(e);
            logger.error("Run {}: {} failed", context.getRunId(), getName(), e);
            context.publish(new ProgressEvent.Aborted(describeFailure(e), false));
        } catch (Error e) {
            state.set(State.ABORTED);
            result.completeExceptionally(e);
            logger.error("Run {}: {} failed with an error", context.getRunId(), getName(), e);
            context.publish(new ProgressEvent.Aborted(describeFailure(e), false));
            throw e;
        }
    }

    final void markRetired() {
        state.set(State.RETIRED);
    }

    private static String describeFailure(Throwable t) {
        String message = t.getMessage();
        return (message == null || message.isBlank()) ? t.getClass().getSimpleName() : message;
    }
}
