package org.imppg.engine.processing;

import org.imppg.engine.model.ProcessingSettings.UnsharpMask;

/**
 * Brightness-dependent unsharp masking amount.
 *
 * <p>Below {@code threshold - width} the amount is {@code amountMin}, above {@code threshold + width}
 * it is {@code amountMax}; in between it follows the cubic {@code a*x^3 + b*x^2 + c*x + d}, which meets
 * both plateaus with zero slope and is monotonic between them.</p>
 */
public final class AdaptiveAmountCurve {

    private final float amountMin;
    private final float amountMax;
    private final float threshold;
    private final float width;

    private final double a;
    private final double b;
    private final double c;
    private final double d;

    public AdaptiveAmountCurve(float amountMin, float amountMax, float threshold, float width) {
        if (!(width > 0)) {
            throw new IllegalArgumentException("Transition width must be positive, got " + width);
        }
        this.amountMin = amountMin;
        this.amountMax = amountMax;
        this.threshold = threshold;
        this.width = width;

        double w3 = (double) width * width * width;
        double divisor = 4 * w3;
        double t = threshold;
        this.a = (amountMin - amountMax) / divisor;
        this.b = 3 * (amountMax - amountMin) * t / divisor;
        this.c = 3 * (amountMax - amountMin) * (width - t) * (width + t) / divisor;
        this.d = (2 * w3 * (amountMin + amountMax)
                + 3 * t * width * width * (amountMin - amountMax)
                + t * t * t * (amountMax - amountMin)) / divisor;
    }

    public static AdaptiveAmountCurve of(UnsharpMask settings) {
        return new AdaptiveAmountCurve(settings.amountMin(), settings.amountMax(),
                settings.threshold(), settings.width());
    }

    /** Polynomial coefficients {a, b, c, d}. */
    public double[] getCoefficients() {
        return new double[]{a, b, c, d};
    }

    public float amountAt(float brightness) {
        if (brightness < threshold - width) {
            return amountMin;
        }
        if (brightness > threshold + width) {
            return amountMax;
        }
        double x = brightness;
        return (float) (((a * x + b) * x + c) * x + d);
    }
}
