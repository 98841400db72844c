package org.imppg.engine.controller;

import org.imppg.engine.model.CompletionStatus;
import org.imppg.engine.model.ProgressEvent;
import org.imppg.engine.service.ProgressListener;
import org.imppg.engine.service.WorkerHandle;
import org.imppg.engine.service.WorkerTask;
import org.imppg.engine.utilities.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Run, cancel and event contract shared by all engines, delegated to one {@link PipelineExecutor}.
 *
 * <p>Subclasses add only what is specific to their kind of run (incremental selection processing,
 * whole-image processing, alignment, batch).</p>
 */
public abstract class AbstractEngine {
    private static final Logger logger = LoggerFactory.getLogger(AbstractEngine.class);

    protected final PipelineExecutor executor;
    private volatile Consumer<String> progressTextHandler = text -> { };

    protected AbstractEngine(String name, EngineConfig config, Executor ownerExecutor) {
        this.executor = new PipelineExecutor(name, config, ownerExecutor);
        this.executor.addProgressListener(this::updateProgressText);
    }

    public EngineConfig getConfig() {
        return executor.getConfig();
    }

    public void setProcessingCompletedHandler(Consumer<CompletionStatus> handler) {
        executor.setCompletionHandler(handler);
    }

    /**
     * Sets a handler receiving a short human readable description of the current progress; an empty
     * string when a run ends.
     */
    public void setProgressTextHandler(Consumer<String> handler) {
        this.progressTextHandler = handler != null ? handler : text -> { };
    }

    public void addProgressListener(ProgressListener listener) {
        executor.addProgressListener(listener);
    }

    public void removeProgressListener(ProgressListener listener) {
        executor.removeProgressListener(listener);
    }

    public boolean isProcessingInProgress() {
        return executor.isRunning();
    }

    /** Stops the current run, returning once its worker has retired. No-op when idle. */
    public void abortProcessing() {
        executor.abortProcessing();
    }

    public int dispatchPending() {
        return executor.dispatchPending();
    }

    /**
     * Pumps progress events until run {@code runId} has finished.
     *
     * @return true if it finished within the timeout
     */
    public boolean awaitCompletion(long runId, long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitCompletion(runId, timeout, unit);
    }

    /**
     * Pumps progress events until no run is pending.
     *
     * @return true if idle within the timeout
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitIdle(timeout, unit);
    }

    /**
     * Aborts whatever runs and starts {@code task}. An interrupt while waiting leaves the engine idle with
     * the interrupt flag set.
     *
     * @return handle of the new run, or null if interrupted
     */
    protected <T> WorkerHandle<T> restart(WorkerTask<T> task, BiConsumer<WorkerHandle<T>, CompletionStatus> onFinished) {
        executor.abortProcessing();
        try {
            return executor.start(task, onFinished);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("{}: interrupted before {} could start", executor.getName(), task.getName());
            return null;
        }
    }

    private void updateProgressText(long runId, ProgressEvent event) {
        String text = event.accept(new ProgressText());
        if (text != null) {
            progressTextHandler.accept(text);
        }
    }

    /** Describes events as progress text; null for events that do not change it. */
    private static final class ProgressText implements ProgressEvent.Handler<String> {
        @Override
        public String onTranslationComputed(ProgressEvent.TranslationComputed e) {
            return String.format("Determining translation vectors... %d/%d", e.index(), e.total());
        }

        @Override
        public String onImageSaved(ProgressEvent.ImageSaved e) {
            return String.format("Saved image %d/%d", e.index() + 1, e.total());
        }

        @Override
        public String onDiscRadiusFound(ProgressEvent.DiscRadiusFound e) {
            return String.format("Determining disc radius... %d/%d", e.index() + 1, e.total());
        }

        @Override
        public String onAverageRadiusUsed(ProgressEvent.AverageRadiusUsed e) {
            return null;
        }

        @Override
        public String onStabilizationProgress(ProgressEvent.StabilizationProgress e) {
            return String.format("Performing final stabilization... %d/%d", e.index() + 1, e.total());
        }

        @Override
        public String onStabilizationFailure(ProgressEvent.StabilizationFailure e) {
            return null;
        }

        @Override
        public String onStageProgress(ProgressEvent.StageProgress e) {
            return String.format("%s: %d%%", e.stage(), e.total() > 0 ? 100 * e.index() / e.total() : 0);
        }

        @Override
        public String onCompleted(ProgressEvent.Completed e) {
            return "";
        }

        @Override
        public String onAborted(ProgressEvent.Aborted e) {
            return "";
        }
    }
}
