package org.imppg.engine.controller;

import org.imppg.engine.model.CompletionStatus;
import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.Histogram;
import org.imppg.engine.model.ProcessingSettings;
import org.imppg.engine.model.ViewSelection;
import org.imppg.engine.processing.PixelPipeline;
import org.imppg.engine.processing.PixelPipeline.Stage;
import org.imppg.engine.service.PipelineTask;
import org.imppg.engine.service.WorkerHandle;
import org.imppg.engine.utilities.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Rectangle;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Incremental engine behind an image view: processes only the current selection and re-runs only the
 * stages whose settings changed.
 *
 * <p>Every change (image, selection, settings) aborts the run in flight and starts a new one. Until the
 * new run completes, {@link #getProcessedSelection()} serves the last completed result for the current
 * selection, or the unprocessed selection if there is none; never a partially computed buffer.</p>
 *
 * <p>Normalization of a selection uses the brightness range of the whole image, so a selection looks
 * the same as the corresponding part of the fully processed image.</p>
 *
 * <p>All methods are meant for the owner thread.</p>
 */
public class DisplayEngine extends AbstractEngine {
    private static final Logger logger = LoggerFactory.getLogger(DisplayEngine.class);

    private final PixelPipeline pipeline;

    private FloatImage image;
    private float[] imageRange;
    private ViewSelection selection;
    private FloatImage selectionInput;
    private ProcessingSettings settings = ProcessingSettings.defaults();

    // last completed result for the current selection, and the first stage it is stale from (null if current)
    private PixelPipeline.Result completed;
    private Stage staleFrom = Stage.NORMALIZATION;
    private long latestRunId = -1;

    public DisplayEngine(EngineConfig config) {
        this(config, null);
    }

    /**
     * @param ownerExecutor serial executor delivering progress events, or null to pump via {@link #dispatchPending()}
     */
    public DisplayEngine(EngineConfig config, Executor ownerExecutor) {
        super("display", config, ownerExecutor);
        this.pipeline = new PixelPipeline(config);
    }

    /**
     * Replaces the image being edited and starts processing the selection.
     *
     * @param newImage image to display; the engine keeps its own copy
     * @param newSelection selection in image pixels, or null to keep the current one (clipped to the new
     *                     image) or select the whole image
     */
    public void setImage(FloatImage newImage, Rectangle newSelection) {
        executor.abortProcessing();
        this.image = newImage.copy();
        this.imageRange = image.minMax();

        Rectangle requested = newSelection;
        if (requested == null) {
            requested = selection != null ? selection.logical() : image.getBounds();
        }
        ViewSelection base = ViewSelection.of(image.getWidth(), image.getHeight(),
                requested.intersects(image.getBounds()) ? requested : image.getBounds());
        if (selection != null) {
            base = base.withZoom(selection.zoom()).withScroll(selection.scrollX(), selection.scrollY());
        }
        this.selection = base;
        logger.info("New image {}, selection {}", image, selection.logical());
        resetSelectionState();
        startRun();
    }

    public Optional<FloatImage> getImage() {
        return Optional.ofNullable(image);
    }

    /**
     * Starts processing of a new selection, given in image pixels. Clipped to the image.
     */
    public void newSelection(Rectangle logicalSelection) {
        requireImage();
        executor.abortProcessing();
        selection = selection.withLogical(logicalSelection);
        logger.debug("New selection {}", selection.logical());
        resetSelectionState();
        startRun();
    }

    public void newProcessingSettings(ProcessingSettings newSettings) {
        settingsChanged(newSettings, Stage.NORMALIZATION);
    }

    public void lrSettingsChanged(ProcessingSettings newSettings) {
        settingsChanged(newSettings, Stage.DECONVOLUTION);
    }

    public void unsharpMaskSettingsChanged(ProcessingSettings newSettings) {
        settingsChanged(newSettings, Stage.UNSHARP_MASK);
    }

    public void toneCurveChanged(ProcessingSettings newSettings) {
        settingsChanged(newSettings, Stage.TONE_CURVE);
    }

    public ProcessingSettings getSettings() {
        return settings;
    }

    private void settingsChanged(ProcessingSettings newSettings, Stage firstAffected) {
        this.settings = newSettings;
        if (staleFrom == null || firstAffected.compareTo(staleFrom) < 0) {
            staleFrom = firstAffected;
        }
        if (image != null) {
            startRun();
        }
    }

    public void imageViewZoomChanged(float zoomFactor) {
        if (selection != null) {
            selection = selection.withZoom(zoomFactor);
        }
    }

    public void imageViewScrolledOrResized(float zoomFactor, int scrollX, int scrollY) {
        if (selection != null) {
            selection = selection.withZoom(zoomFactor).withScroll(scrollX, scrollY);
        }
    }

    public Optional<ViewSelection> getSelection() {
        return Optional.ofNullable(selection);
    }

    /** Selection in image view (screen) coordinates, for marking it on screen. */
    public Rectangle getPhysicalSelection() {
        requireImage();
        return selection.physical();
    }

    public Rectangle getScaledLogicalSelection() {
        requireImage();
        return selection.scaledLogical();
    }

    /**
     * Returns the processed contents of the current selection.
     *
     * <p>Aborts a run in progress, then returns the most recent completed result, or the unprocessed
     * selection if no run has completed for it.</p>
     */
    public FloatImage getProcessedSelection() {
        requireImage();
        executor.abortProcessing();
        executor.dispatchPending();
        return completed != null ? completed.output().copy() : selectionInput.copy();
    }

    /**
     * Histogram of the current selection after processing but before the tone curve; of the unprocessed
     * selection if no run has completed.
     */
    public Histogram getHistogram() {
        requireImage();
        return Histogram.of(completed != null ? completed.preToneCurve() : selectionInput);
    }

    private void resetSelectionState() {
        selectionInput = image.crop(selection.logical());
        completed = null;
        staleFrom = Stage.NORMALIZATION;
    }

    private void startRun() {
        Stage from = (completed == null || staleFrom == null) ? Stage.NORMALIZATION : staleFrom;
        if (completed != null && staleFrom == null) {
            logger.debug("Selection result is up to date");
            return;
        }
        PipelineTask task = new PipelineTask("display processing of " + selection.logical(), pipeline,
                selectionInput.copy(), settings, from, from == Stage.NORMALIZATION ? null : completed, imageRange);
        WorkerHandle<PixelPipeline.Result> handle = restart(task, this::onRunFinished);
        if (handle != null) {
            latestRunId = handle.getRunId();
        }
    }

    private void onRunFinished(WorkerHandle<PixelPipeline.Result> handle, CompletionStatus status) {
        if (status != CompletionStatus.COMPLETED) {
            return;
        }
        if (handle.getRunId() != latestRunId) {
            logger.debug("Ignoring result of superseded run {}", handle.getRunId());
            return;
        }
        completed = handle.result().join();
        staleFrom = null;
    }

    private void requireImage() {
        if (image == null) {
            throw new IllegalStateException("No image has been set");
        }
    }
}
