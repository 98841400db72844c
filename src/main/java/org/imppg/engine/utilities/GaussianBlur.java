package org.imppg.engine.utilities;

import org.imppg.engine.model.FloatImage;

/**
 * Separable Gaussian convolution of single-channel float images.
 *
 * <p>Out-of-image pixels take the value of the nearest edge pixel. The kernel is truncated at
 * {@code ceil(radiusSigmas * sigma)} pixels on each side and normalized to unit sum, so a
 * constant image stays constant.</p>
 */
public final class GaussianBlur {

    public static final double DEFAULT_RADIUS_SIGMAS = 3.0;

    private final float sigma;
    private final float[] kernel;
    private final int radius;

    public GaussianBlur(float sigma) {
        this(sigma, DEFAULT_RADIUS_SIGMAS);
    }

    public GaussianBlur(float sigma, double radiusSigmas) {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("Gaussian sigma must be positive, got " + sigma);
        }
        if (!(radiusSigmas > 0)) {
            throw new IllegalArgumentException("Kernel radius must be positive, got " + radiusSigmas);
        }
        this.sigma = sigma;
        this.radius = Math.max(1, (int) Math.ceil(radiusSigmas * sigma));
        this.kernel = makeKernel(sigma, radius);
    }

    public float getSigma() { return sigma; }
    public int getRadius() { return radius; }

    /** Returns a copy of the normalized kernel, index {@code radius} is the centre. */
    public float[] getKernel() { return kernel.clone(); }

    private static float[] makeKernel(float sigma, int radius) {
        float[] k = new float[2 * radius + 1];
        double twoSigmaSq = 2.0 * sigma * sigma;
        double sum = 0;
        for (int i = -radius; i <= radius; i++) {
            double v = Math.exp(-(i * i) / twoSigmaSq);
            k[i + radius] = (float) v;
            sum += v;
        }
        for (int i = 0; i < k.length; i++) {
            k[i] = (float) (k[i] / sum);
        }
        return k;
    }

    public FloatImage apply(FloatImage image) {
        return new FloatImage(image.getWidth(), image.getHeight(),
                apply(image.getPixels(), image.getWidth(), image.getHeight()));
    }

    /**
     * Blurs a row-major buffer. The input is left untouched.
     *
     * @return new buffer of the same size
     */
    public float[] apply(float[] src, int width, int height) {
        float[] tmp = new float[src.length];
        float[] dst = new float[src.length];

        // 1) horizontal pass
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                float acc = 0;
                for (int k = -radius; k <= radius; k++) {
                    int xx = clamp(x + k, width);
                    acc += kernel[k + radius] * src[row + xx];
                }
                tmp[row + x] = acc;
            }
        }

        // 2) vertical pass
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                float acc = 0;
                for (int k = -radius; k <= radius; k++) {
                    int yy = clamp(y + k, height);
                    acc += kernel[k + radius] * tmp[yy * width + x];
                }
                dst[y * width + x] = acc;
            }
        }
        return dst;
    }

    private static int clamp(int i, int length) {
        return i < 0 ? 0 : (i >= length ? length - 1 : i);
    }
}
