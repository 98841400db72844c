package org.imppg.engine.utilities;

import org.imppg.engine.model.CropMode;
import org.imppg.engine.model.OutputFormat;

/**
 * Tuning values of the engine, normally produced by {@link EngineConfigManager#toEngineConfig()}.
 *
 * @param threadNamePrefix prefix of worker thread names, followed by the run id
 * @param abortWaitWarningMs interval of the warning logged while an abort waits for a worker to retire
 * @param kernelRadiusSigmas Gaussian kernel half-width in multiples of sigma
 * @param deringingSaturationThreshold brightness at or above which a pixel counts as saturated
 * @param deringingMaxCorrection limit {@code c} of the per-iteration correction near saturated pixels
 * @param deringingMarginSigmas size of the neighbourhood around saturated pixels, in multiples of sigma
 * @param ratioEpsilon lower bound of the re-blurred estimate when dividing in deconvolution
 * @param alignmentOutputSuffix file name suffix of aligned images
 * @param alignmentOutputFormat default file format of aligned images
 * @param alignmentCropMode default output frame of aligned images
 * @param alignmentSubpixel default interpolation of aligned images
 * @param writeAlignmentReport write a JSON report next to the aligned images
 * @param runLogEnabled write a log file into the output directory of alignment and batch runs
 * @param limbRayCount rays cast per image by the limb detector
 */
public record EngineConfig(
        String threadNamePrefix,
        long abortWaitWarningMs,
        double kernelRadiusSigmas,
        float deringingSaturationThreshold,
        float deringingMaxCorrection,
        double deringingMarginSigmas,
        float ratioEpsilon,
        String alignmentOutputSuffix,
        OutputFormat alignmentOutputFormat,
        CropMode alignmentCropMode,
        boolean alignmentSubpixel,
        boolean writeAlignmentReport,
        boolean runLogEnabled,
        int limbRayCount) {

    public EngineConfig {
        if (abortWaitWarningMs <= 0) {
            throw new IllegalArgumentException("abort wait warning interval must be positive");
        }
        if (!(kernelRadiusSigmas > 0)) {
            throw new IllegalArgumentException("kernel radius must be positive");
        }
        if (!(ratioEpsilon > 0)) {
            throw new IllegalArgumentException("ratio epsilon must be positive");
        }
    }

    /** Built-in values, identical to the bundled {@code imppg-engine.yml}. */
    public static EngineConfig defaults() {
        return new EngineConfig(
                "imppg-worker-",
                2000,
                3.0,
                0.99f,
                0.5f,
                2.0,
                1.0e-6f,
                "_aligned",
                OutputFormat.TIFF_16,
                CropMode.CROP_TO_INTERSECTION,
                true,
                true,
                true,
                64);
    }
}
