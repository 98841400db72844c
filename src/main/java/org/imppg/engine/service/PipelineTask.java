package org.imppg.engine.service;

import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.ProcessingSettings;
import org.imppg.engine.model.ProgressEvent;
import org.imppg.engine.processing.PixelPipeline;

/**
 * Runs the pixel pipeline over one image, optionally resuming from a later stage.
 *
 * <p>The task works on its own copies: the caller hands over an image it will not touch again and
 * receives the {@link PixelPipeline.Result} through the run's handle.</p>
 */
public class PipelineTask extends WorkerTask<PixelPipeline.Result> {

    private final String name;
    private final PixelPipeline pipeline;
    private final FloatImage input;
    private final ProcessingSettings settings;
    private final PixelPipeline.Stage from;
    private final PixelPipeline.Result previous;
    private final float[] sourceRange;

    /**
     * @param name description for logs
     * @param pipeline pipeline to run
     * @param input image owned by the task from now on
     * @param settings settings snapshot of the run
     * @param from first stage to compute
     * @param previous earlier result over the same input, required unless starting at normalization
     * @param sourceRange normalization source range, or null for the input's own range
     */
    public PipelineTask(String name, PixelPipeline pipeline, FloatImage input, ProcessingSettings settings,
                        PixelPipeline.Stage from, PixelPipeline.Result previous, float[] sourceRange) {
        this.name = name;
        this.pipeline = pipeline;
        this.input = input;
        this.settings = settings;
        this.from = from;
        this.previous = previous;
        this.sourceRange = sourceRange != null ? sourceRange.clone() : null;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    protected PixelPipeline.Result compute(WorkerContext context) {
        return pipeline.resume(from, input, previous, settings, sourceRange, context,
                (stage, done, total) -> context.publish(new ProgressEvent.StageProgress(stage, done, total)));
    }
}
