package org.imppg.engine.ui;

import org.imppg.engine.model.AlignmentMethod;
import org.imppg.engine.model.CompletionStatus;
import org.imppg.engine.model.ProgressEvent;
import org.imppg.engine.service.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * State of an alignment progress display, driven by the alignment engine's progress events.
 *
 * <p>Tracks what a progress dialog shows: a bold phase caption, a gauge (range and value) and an
 * append-only log. The gauge starts with range {@code n - 1}, because translations are reported from
 * the second image on; it switches to {@code n} when the disc radius, stabilization or saving phase
 * starts.</p>
 *
 * <p>Register with {@code addProgressListener}; events must arrive on the owner's thread.</p>
 */
public class AlignmentProgressModel implements ProgressListener, ProgressEvent.Handler<Void> {
    private static final Logger logger = LoggerFactory.getLogger(AlignmentProgressModel.class);

    public static final String DETERMINING_TRANSLATIONS = "Determining translation vectors...";
    public static final String DETERMINING_RADIUS = "Determining disc radius in images...";
    public static final String STABILIZING = "Performing final stabilization...";
    public static final String SAVING = "Translating and saving output images...";

    private final int fileCount;
    private final List<String> log = new ArrayList<>();
    private final List<Consumer<AlignmentProgressModel>> changeListeners = new CopyOnWriteArrayList<>();

    private String phaseText;
    private int gaugeRange;
    private int gaugeValue;
    private CompletionStatus outcome;
    private String outcomeMessage;

    public AlignmentProgressModel(AlignmentMethod method, int fileCount) {
        if (fileCount < 2) {
            throw new IllegalArgumentException("Alignment needs at least 2 images, got " + fileCount);
        }
        this.fileCount = fileCount;
        this.phaseText = method == AlignmentMethod.PHASE_CORRELATION ? DETERMINING_TRANSLATIONS : "";
        this.gaugeRange = fileCount - 1;
    }

    /** Adds a callback invoked after every event that changed the model. */
    public void addChangeListener(Consumer<AlignmentProgressModel> listener) {
        changeListeners.add(listener);
    }

    public void removeChangeListener(Consumer<AlignmentProgressModel> listener) {
        changeListeners.remove(listener);
    }

    public String getPhaseText() {
        return phaseText;
    }

    public int getGaugeRange() {
        return gaugeRange;
    }

    public int getGaugeValue() {
        return gaugeValue;
    }

    public List<String> getLog() {
        return Collections.unmodifiableList(log);
    }

    public boolean isFinished() {
        return outcome != null;
    }

    /** Outcome of the run, once its terminal event has arrived. */
    public Optional<CompletionStatus> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    /** "Processing completed." or the abort reason; empty while running. */
    public Optional<String> getOutcomeMessage() {
        return Optional.ofNullable(outcomeMessage);
    }

    @Override
    public void onProgress(long runId, ProgressEvent event) {
        event.accept(this);
        for (Consumer<AlignmentProgressModel> listener : changeListeners) {
            listener.accept(this);
        }
    }

    @Override
    public Void onTranslationComputed(ProgressEvent.TranslationComputed e) {
        gaugeValue = e.index();
        append(String.format(Locale.ROOT, "Image %d/%d: translated by %.2f, %.2f.",
                e.index() + 1, fileCount, e.dx(), e.dy()));
        return null;
    }

    @Override
    public Void onImageSaved(ProgressEvent.ImageSaved e) {
        if (e.index() == 0) {
            phaseText = SAVING;
            gaugeRange = fileCount;
            append("");
        }
        gaugeValue = e.index() + 1;
        append(String.format(Locale.ROOT, "Translated and saved image %d/%d.", e.index() + 1, fileCount));
        return null;
    }

    @Override
    public Void onDiscRadiusFound(ProgressEvent.DiscRadiusFound e) {
        if (e.index() == 0) {
            phaseText = DETERMINING_RADIUS;
            gaugeRange = fileCount;
            append("");
        }
        append(String.format(Locale.ROOT, "Image %d/%d: disc radius = %.2f", e.index() + 1, fileCount, e.radius()));
        gaugeValue = e.index() + 1;
        return null;
    }

    @Override
    public Void onAverageRadiusUsed(ProgressEvent.AverageRadiusUsed e) {
        append(String.format(Locale.ROOT, "Using average radius %.2f.", e.radius()));
        return null;
    }

    @Override
    public Void onStabilizationProgress(ProgressEvent.StabilizationProgress e) {
        if (e.index() == 0) {
            phaseText = STABILIZING;
            gaugeRange = fileCount;
        }
        gaugeValue = e.index() + 1;
        return null;
    }

    @Override
    public Void onStabilizationFailure(ProgressEvent.StabilizationFailure e) {
        append(e.message());
        return null;
    }

    @Override
    public Void onStageProgress(ProgressEvent.StageProgress e) {
        return null;
    }

    @Override
    public Void onCompleted(ProgressEvent.Completed e) {
        outcome = CompletionStatus.COMPLETED;
        outcomeMessage = "Processing completed.";
        return null;
    }

    @Override
    public Void onAborted(ProgressEvent.Aborted e) {
        outcome = CompletionStatus.ABORTED;
        outcomeMessage = e.reason();
        logger.debug("Alignment aborted: {}", e.reason());
        return null;
    }

    private void append(String line) {
        log.add(line);
    }
}
