package org.imppg.engine.model;

import java.util.Objects;

/**
 * Immutable snapshot of all pixel pipeline parameters, consumed once per run.
 *
 * <p>A run keeps the instance it was started with; changing a parameter means building a new
 * snapshot through one of the {@code with...} methods.</p>
 *
 * @param normalization optional linear range mapping before all other stages
 * @param lucyRichardson deconvolution parameters
 * @param unsharpMask sharpening parameters
 * @param toneCurve final brightness mapping
 */
public record ProcessingSettings(
        Normalization normalization,
        LucyRichardson lucyRichardson,
        UnsharpMask unsharpMask,
        ToneCurve toneCurve) {

    public ProcessingSettings {
        Objects.requireNonNull(normalization, "normalization");
        Objects.requireNonNull(lucyRichardson, "lucyRichardson");
        Objects.requireNonNull(unsharpMask, "unsharpMask");
        Objects.requireNonNull(toneCurve, "toneCurve");
    }

    /** Settings that leave every pixel unchanged. */
    public static ProcessingSettings defaults() {
        return new ProcessingSettings(
                Normalization.disabled(),
                LucyRichardson.disabled(),
                UnsharpMask.disabled(),
                ToneCurve.identity());
    }

    public ProcessingSettings withNormalization(Normalization value) {
        return new ProcessingSettings(value, lucyRichardson, unsharpMask, toneCurve);
    }

    public ProcessingSettings withLucyRichardson(LucyRichardson value) {
        return new ProcessingSettings(normalization, value, unsharpMask, toneCurve);
    }

    public ProcessingSettings withUnsharpMask(UnsharpMask value) {
        return new ProcessingSettings(normalization, lucyRichardson, value, toneCurve);
    }

    public ProcessingSettings withToneCurve(ToneCurve value) {
        return new ProcessingSettings(normalization, lucyRichardson, unsharpMask, value);
    }

    /**
     * Linear mapping of the source brightness range onto {@code [min, max]}.
     * {@code min > max} inverts the brightness.
     */
    public record Normalization(boolean enabled, float min, float max) {

        public static Normalization disabled() {
            return new Normalization(false, 0.0f, 1.0f);
        }
    }

    /**
     * Lucy-Richardson deconvolution with a Gaussian point spread function.
     *
     * <p>Zero iterations disables the stage.</p>
     */
    public record LucyRichardson(float sigma, int iterations, boolean deringing) {

        public static final float DEFAULT_SIGMA = 1.3f;

        public LucyRichardson {
            if (!(sigma > 0)) {
                throw new IllegalArgumentException("L-R sigma must be positive, got " + sigma);
            }
            if (iterations < 0) {
                throw new IllegalArgumentException("L-R iterations must not be negative, got " + iterations);
            }
        }

        public static LucyRichardson disabled() {
            return new LucyRichardson(DEFAULT_SIGMA, 0, false);
        }

        public boolean isEnabled() {
            return iterations > 0;
        }
    }

    /**
     * Unsharp masking, optionally with a brightness-dependent amount.
     *
     * @param adaptive use the cubic transition between {@code amountMin} and {@code amountMax}
     * @param sigma Gaussian blur sigma of the mask
     * @param amountMin amount used below {@code threshold - width} (adaptive only)
     * @param amountMax amount used above {@code threshold + width}, or everywhere if non-adaptive
     * @param threshold brightness at the centre of the transition band
     * @param width half-width of the transition band
     */
    public record UnsharpMask(
            boolean adaptive,
            float sigma,
            float amountMin,
            float amountMax,
            float threshold,
            float width) {

        public static final float DEFAULT_SIGMA = 1.3f;

        public UnsharpMask {
            if (!(sigma > 0)) {
                throw new IllegalArgumentException("Unsharp mask sigma must be positive, got " + sigma);
            }
            if (adaptive && !(width > 0)) {
                throw new IllegalArgumentException("Adaptive unsharp mask needs a positive transition width, got " + width);
            }
        }

        public static UnsharpMask disabled() {
            return new UnsharpMask(false, DEFAULT_SIGMA, 1.0f, 1.0f, 0.01f, 0.001f);
        }

        /**
         * Returns false when the mask cannot change any pixel: non-adaptive with
         * {@code amountMax == 1}, or adaptive with both amounts equal to 1.
         */
        public boolean isEffective() {
            if (adaptive) {
                return amountMin != 1.0f || amountMax != 1.0f;
            }
            return amountMax != 1.0f;
        }
    }
}
