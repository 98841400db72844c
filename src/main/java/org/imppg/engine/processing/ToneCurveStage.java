package org.imppg.engine.processing;

import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.ToneCurve;

final class ToneCurveStage {

    private ToneCurveStage() {
    }

    /** Returns the input itself for an identity curve. */
    static FloatImage apply(FloatImage input, ToneCurve curve) {
        if (curve.isIdentity()) {
            return input;
        }
        float[] dst = new float[input.getPixels().length];
        curve.apply(input.getPixels(), dst);
        return new FloatImage(input.getWidth(), input.getHeight(), dst);
    }
}
