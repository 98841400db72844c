package org.imppg.engine.processing;

import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.ProcessingSettings.UnsharpMask;
import org.imppg.engine.utilities.GaussianBlur;

/**
 * Unsharp masking: {@code out = blur + amount * (in - blur)}.
 *
 * <p>The adaptive amount is evaluated on a separate brightness image (the normalized input), so the
 * sharpening strength does not depend on what deconvolution did to the pixel.</p>
 */
final class UnsharpMaskStage {

    private final double kernelRadiusSigmas;

    UnsharpMaskStage(double kernelRadiusSigmas) {
        this.kernelRadiusSigmas = kernelRadiusSigmas;
    }

    /**
     * @param input image to sharpen
     * @param brightness image driving the adaptive amount, same size as {@code input}
     * @return the input itself when the settings are not effective, otherwise a new image
     */
    FloatImage apply(FloatImage input, FloatImage brightness, UnsharpMask settings) {
        if (!settings.isEffective()) {
            return input;
        }
        if (!input.sameSize(brightness)) {
            throw new IllegalArgumentException("Brightness image " + brightness + " does not match " + input);
        }
        int w = input.getWidth();
        int h = input.getHeight();
        float[] src = input.getPixels();
        float[] blurred = new GaussianBlur(settings.sigma(), kernelRadiusSigmas).apply(src, w, h);
        float[] dst = new float[src.length];

        if (settings.adaptive()) {
            AdaptiveAmountCurve curve = AdaptiveAmountCurve.of(settings);
            float[] bright = brightness.getPixels();
            for (int i = 0; i < src.length; i++) {
                float amount = curve.amountAt(bright[i]);
                dst[i] = blurred[i] + amount * (src[i] - blurred[i]);
            }
        } else {
            float amount = settings.amountMax();
            for (int i = 0; i < src.length; i++) {
                dst[i] = blurred[i] + amount * (src[i] - blurred[i]);
            }
        }
        return new FloatImage(w, h, dst);
    }
}
