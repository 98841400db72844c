package org.imppg.engine.processing;

import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.ProcessingSettings;
import org.imppg.engine.service.Checkpoint;
import org.imppg.engine.utilities.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Deterministic chain of pixel stages: normalization, Lucy-Richardson deconvolution, unsharp masking
 * and tone curve, in that order.
 *
 * <p>A stage whose settings cannot change any pixel is skipped and passes its input through unchanged.
 * Stages never modify their input; every intermediate image is kept in the {@link Result} so a later run
 * can {@link #resume} from the first stage whose settings changed.</p>
 *
 * <p>Instances are stateless apart from tuning values and may be shared between threads.</p>
 */
public class PixelPipeline {
    private static final Logger logger = LoggerFactory.getLogger(PixelPipeline.class);

    public enum Stage {
        NORMALIZATION,
        DECONVOLUTION,
        UNSHARP_MASK,
        TONE_CURVE
    }

    /**
     * Intermediate and final images of one pipeline pass.
     *
     * @param normalized output of normalization; also the brightness source of adaptive unsharp masking
     * @param deconvolved output of Lucy-Richardson deconvolution
     * @param preToneCurve output of unsharp masking, used for histograms
     * @param output final image
     */
    public record Result(FloatImage normalized, FloatImage deconvolved, FloatImage preToneCurve, FloatImage output) { }

    private final LucyRichardsonStage lucyRichardson;
    private final UnsharpMaskStage unsharpMask;

    public PixelPipeline() {
        this(EngineConfig.defaults());
    }

    public PixelPipeline(EngineConfig config) {
        this.lucyRichardson = new LucyRichardsonStage(
                config.kernelRadiusSigmas(),
                config.ratioEpsilon(),
                config.deringingSaturationThreshold(),
                config.deringingMaxCorrection(),
                config.deringingMarginSigmas());
        this.unsharpMask = new UnsharpMaskStage(config.kernelRadiusSigmas());
    }

    /** Runs all stages with no abort checks and no progress reporting. */
    public FloatImage process(FloatImage input, ProcessingSettings settings) {
        return process(input, settings, null, Checkpoint.NONE, PipelineProgress.NONE).output();
    }

    /**
     * Runs all stages.
     *
     * @param input image to process; not modified
     * @param settings processing parameters
     * @param sourceRange {min, max} the normalization maps from, or null for the input's own range
     * @param checkpoint called between stages and once per deconvolution iteration
     * @param progress receives deconvolution iteration progress
     */
    public Result process(FloatImage input, ProcessingSettings settings, float[] sourceRange,
                          Checkpoint checkpoint, PipelineProgress progress) {
        return resume(Stage.NORMALIZATION, input, null, settings, sourceRange, checkpoint, progress);
    }

    /**
     * Re-runs the pipeline starting at {@code from}, reusing the earlier intermediates of {@code previous}.
     *
     * @param previous result of an earlier pass over the same input; required unless {@code from} is
     *                 {@link Stage#NORMALIZATION}
     */
    public Result resume(Stage from, FloatImage input, Result previous, ProcessingSettings settings,
                         float[] sourceRange, Checkpoint checkpoint, PipelineProgress progress) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(settings, "settings");
        if (from != Stage.NORMALIZATION && previous == null) {
            throw new IllegalArgumentException("Resuming at " + from + " needs a previous result");
        }
        logger.debug("Pipeline pass from {} over {}", from, input);

        FloatImage normalized = from.compareTo(Stage.NORMALIZATION) <= 0
                ? NormalizationStage.apply(input, settings.normalization(), sourceRange)
                : previous.normalized();
        checkpoint.check();

        FloatImage deconvolved = from.compareTo(Stage.DECONVOLUTION) <= 0
                ? lucyRichardson.apply(normalized, settings.lucyRichardson(), checkpoint, progress)
                : previous.deconvolved();
        checkpoint.check();

        FloatImage preToneCurve = from.compareTo(Stage.UNSHARP_MASK) <= 0
                ? unsharpMask.apply(deconvolved, normalized, settings.unsharpMask())
                : previous.preToneCurve();
        checkpoint.check();

        FloatImage output = ToneCurveStage.apply(preToneCurve, settings.toneCurve());
        return new Result(normalized, deconvolved, preToneCurve, output);
    }
}
