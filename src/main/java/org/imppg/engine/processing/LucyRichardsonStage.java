package org.imppg.engine.processing;

import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.ProcessingSettings.LucyRichardson;
import org.imppg.engine.service.Checkpoint;
import org.imppg.engine.utilities.GaussianBlur;

/**
 * Lucy-Richardson deconvolution with a Gaussian point spread function.
 *
 * <p>Each iteration computes {@code estimate *= blur(observed / blur(estimate))}; the Gaussian is
 * symmetric, so its flipped kernel is the kernel itself.</p>
 *
 * <p>With deringing enabled, pixels at or above the saturation threshold keep their observed value,
 * and within {@code marginSigmas * sigma} of them the per-iteration correction factor is limited to
 * {@code [1/(1+c), 1+c]}. This stops the estimate from oscillating around overexposed areas.</p>
 */
final class LucyRichardsonStage {

    static final String STAGE_NAME = "deconvolution";

    private final double kernelRadiusSigmas;
    private final float ratioEpsilon;
    private final float saturationThreshold;
    private final float maxCorrection;
    private final double marginSigmas;

    LucyRichardsonStage(double kernelRadiusSigmas, float ratioEpsilon,
                        float saturationThreshold, float maxCorrection, double marginSigmas) {
        this.kernelRadiusSigmas = kernelRadiusSigmas;
        this.ratioEpsilon = ratioEpsilon;
        this.saturationThreshold = saturationThreshold;
        this.maxCorrection = maxCorrection;
        this.marginSigmas = marginSigmas;
    }

    /**
     * @return the input itself when the iteration count is zero, otherwise a new image
     */
    FloatImage apply(FloatImage observed, LucyRichardson settings, Checkpoint checkpoint, PipelineProgress progress) {
        if (!settings.isEnabled()) {
            return observed;
        }
        int w = observed.getWidth();
        int h = observed.getHeight();
        float[] obs = observed.getPixels();
        GaussianBlur blur = new GaussianBlur(settings.sigma(), kernelRadiusSigmas);

        boolean[] saturated = null;
        boolean[] nearSaturated = null;
        if (settings.deringing()) {
            saturated = new boolean[obs.length];
            boolean any = false;
            for (int i = 0; i < obs.length; i++) {
                if (obs[i] >= saturationThreshold) {
                    saturated[i] = true;
                    any = true;
                }
            }
            if (any) {
                int margin = Math.max(1, (int) Math.ceil(marginSigmas * settings.sigma()));
                nearSaturated = dilate(saturated, w, h, margin);
            } else {
                saturated = null;
            }
        }
        float upper = 1 + maxCorrection;
        float lower = 1 / upper;

        float[] estimate = obs.clone();
        float[] ratio = new float[obs.length];
        for (int iter = 0; iter < settings.iterations(); iter++) {
            checkpoint.check();

            float[] reblurred = blur.apply(estimate, w, h);
            for (int i = 0; i < obs.length; i++) {
                ratio[i] = obs[i] / Math.max(reblurred[i], ratioEpsilon);
            }
            float[] correction = blur.apply(ratio, w, h);
            for (int i = 0; i < obs.length; i++) {
                float factor = correction[i];
                if (nearSaturated != null && nearSaturated[i]) {
                    factor = Math.max(lower, Math.min(upper, factor));
                }
                estimate[i] *= factor;
            }
            if (saturated != null) {
                for (int i = 0; i < obs.length; i++) {
                    if (saturated[i]) {
                        estimate[i] = obs[i];
                    }
                }
            }
            progress.stageProgress(STAGE_NAME, iter + 1, settings.iterations());
        }
        return new FloatImage(w, h, estimate);
    }

    // Square dilation by a separable running maximum
    static boolean[] dilate(boolean[] mask, int w, int h, int radius) {
        boolean[] horizontal = new boolean[mask.length];
        for (int y = 0; y < h; y++) {
            int lastSet = Integer.MIN_VALUE / 2;
            // forward pass: within radius after a set pixel
            for (int x = 0; x < w; x++) {
                if (mask[y * w + x]) lastSet = x;
                horizontal[y * w + x] = x - lastSet <= radius;
            }
            int nextSet = Integer.MAX_VALUE / 2;
            for (int x = w - 1; x >= 0; x--) {
                if (mask[y * w + x]) nextSet = x;
                if (nextSet - x <= radius) horizontal[y * w + x] = true;
            }
        }
        boolean[] out = new boolean[mask.length];
        for (int x = 0; x < w; x++) {
            int lastSet = Integer.MIN_VALUE / 2;
            for (int y = 0; y < h; y++) {
                if (horizontal[y * w + x]) lastSet = y;
                out[y * w + x] = y - lastSet <= radius;
            }
            int nextSet = Integer.MAX_VALUE / 2;
            for (int y = h - 1; y >= 0; y--) {
                if (horizontal[y * w + x]) nextSet = y;
                if (nextSet - y <= radius) out[y * w + x] = true;
            }
        }
        return out;
    }
}
