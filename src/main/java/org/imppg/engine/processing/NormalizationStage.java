package org.imppg.engine.processing;

import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.ProcessingSettings.Normalization;

import java.util.Arrays;

/**
 * Linear mapping of a source brightness range onto the configured {@code [min, max]}.
 */
final class NormalizationStage {

    private NormalizationStage() {
    }

    /**
     * @param sourceRange {min, max} of the source data, or null to use the input's own extremes
     * @return the input itself when normalization is disabled, otherwise a new image
     */
    static FloatImage apply(FloatImage input, Normalization settings, float[] sourceRange) {
        if (!settings.enabled()) {
            return input;
        }
        float[] range = sourceRange != null ? sourceRange : input.minMax();
        float srcMin = range[0];
        float srcMax = range[1];
        float[] src = input.getPixels();
        float[] dst = new float[src.length];

        if (!(srcMax > srcMin)) {
            Arrays.fill(dst, settings.min());
        } else {
            float scale = (settings.max() - settings.min()) / (srcMax - srcMin);
            for (int i = 0; i < src.length; i++) {
                dst[i] = settings.min() + (src[i] - srcMin) * scale;
            }
        }
        return new FloatImage(input.getWidth(), input.getHeight(), dst);
    }
}
