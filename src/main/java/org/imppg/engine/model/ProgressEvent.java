package org.imppg.engine.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Event sent from a running worker to its owner.
 *
 * <p>Each kind is its own record carrying only the fields that kind needs. Consumers either
 * switch over {@link #kind()} or implement {@link Handler}, which the compiler forces to cover
 * every variant.</p>
 *
 * <p>{@link Completed} and {@link Aborted} are terminal: nothing else is published for the
 * same run after them.</p>
 */
public sealed interface ProgressEvent {

    enum Kind {
        TRANSLATION_COMPUTED,
        IMAGE_SAVED,
        DISC_RADIUS_FOUND,
        AVERAGE_RADIUS_USED,
        STABILIZATION_PROGRESS,
        STABILIZATION_FAILURE,
        STAGE_PROGRESS,
        COMPLETED,
        ABORTED
    }

    Kind kind();

    <R> R accept(Handler<R> handler);

    default boolean isTerminal() {
        return kind() == Kind.COMPLETED || kind() == Kind.ABORTED;
    }

    /**
     * Exhaustive visitor over all event kinds.
     */
    interface Handler<R> {
        R onTranslationComputed(TranslationComputed event);
        R onImageSaved(ImageSaved event);
        R onDiscRadiusFound(DiscRadiusFound event);
        R onAverageRadiusUsed(AverageRadiusUsed event);
        R onStabilizationProgress(StabilizationProgress event);
        R onStabilizationFailure(StabilizationFailure event);
        R onStageProgress(StageProgress event);
        R onCompleted(Completed event);
        R onAborted(Aborted event);
    }

    /**
     * Cumulative translation of image {@code index} relative to the first image.
     * {@code total} is the number of translations computed in the run (file count minus one).
     */
    record TranslationComputed(int index, int total, double dx, double dy) implements ProgressEvent {
        @Override public Kind kind() { return Kind.TRANSLATION_COMPUTED; }
        @Override public <R> R accept(Handler<R> handler) { return handler.onTranslationComputed(this); }
    }

    /** Output image {@code index} (0-based) of {@code total} has been written to {@code output}. */
    record ImageSaved(int index, int total, Path output) implements ProgressEvent {
        public ImageSaved {
            Objects.requireNonNull(output, "output");
        }
        @Override public Kind kind() { return Kind.IMAGE_SAVED; }
        @Override public <R> R accept(Handler<R> handler) { return handler.onImageSaved(this); }
    }

    record DiscRadiusFound(int index, int total, double radius) implements ProgressEvent {
        @Override public Kind kind() { return Kind.DISC_RADIUS_FOUND; }
        @Override public <R> R accept(Handler<R> handler) { return handler.onDiscRadiusFound(this); }
    }

    record AverageRadiusUsed(double radius) implements ProgressEvent {
        @Override public Kind kind() { return Kind.AVERAGE_RADIUS_USED; }
        @Override public <R> R accept(Handler<R> handler) { return handler.onAverageRadiusUsed(this); }
    }

    record StabilizationProgress(int index, int total) implements ProgressEvent {
        @Override public Kind kind() { return Kind.STABILIZATION_PROGRESS; }
        @Override public <R> R accept(Handler<R> handler) { return handler.onStabilizationProgress(this); }
    }

    /** Non-fatal per-file failure; the run continues with the remaining files. */
    record StabilizationFailure(int index, String message) implements ProgressEvent {
        public StabilizationFailure {
            Objects.requireNonNull(message, "message");
        }
        @Override public Kind kind() { return Kind.STABILIZATION_FAILURE; }
        @Override public <R> R accept(Handler<R> handler) { return handler.onStabilizationFailure(this); }
    }

    /**
     * Progress inside a pixel pipeline or batch run, e.g. deconvolution iteration 7 of 50.
     */
    record StageProgress(String stage, int index, int total) implements ProgressEvent {
        public StageProgress {
            Objects.requireNonNull(stage, "stage");
        }
        @Override public Kind kind() { return Kind.STAGE_PROGRESS; }
        @Override public <R> R accept(Handler<R> handler) { return handler.onStageProgress(this); }
    }

    record Completed() implements ProgressEvent {
        @Override public Kind kind() { return Kind.COMPLETED; }
        @Override public <R> R accept(Handler<R> handler) { return handler.onCompleted(this); }
    }

    /**
     * Terminal event of a run that did not finish.
     *
     * @param reason human readable cause
     * @param userRequested true when the run stopped at a checkpoint after an abort request,
     *                      false when the computation failed
     */
    record Aborted(String reason, boolean userRequested) implements ProgressEvent {
        public Aborted {
            Objects.requireNonNull(reason, "reason");
        }
        @Override public Kind kind() { return Kind.ABORTED; }
        @Override public <R> R accept(Handler<R> handler) { return handler.onAborted(this); }
    }
}
