package org.imppg.engine.utilities;

/**
 * In-place radix-2 complex FFT over row-major buffers whose dimensions are powers of two.
 *
 * <p>The inverse transform is scaled by {@code 1/(width*height)}, so forward followed by inverse
 * returns the input.</p>
 */
public final class Fft2D {

    private Fft2D() {
    }

    public static boolean isPowerOf2(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    public static int nextPowerOf2(int n) {
        int p = 1;
        while (p < n) {
            p <<= 1;
        }
        return p;
    }

    /**
     * Transforms a {@code width x height} complex buffer in place.
     *
     * @param re real parts, row-major
     * @param im imaginary parts, row-major
     * @param inverse true for the inverse transform
     */
    public static void transform(double[] re, double[] im, int width, int height, boolean inverse) {
        if (!isPowerOf2(width) || !isPowerOf2(height)) {
            throw new IllegalArgumentException("FFT size must be a power of 2: " + width + "x" + height);
        }
        if (re.length != width * height || im.length != re.length) {
            throw new IllegalArgumentException("Buffer length does not match " + width + "x" + height);
        }

        double[] rowRe = new double[width];
        double[] rowIm = new double[width];
        for (int y = 0; y < height; y++) {
            System.arraycopy(re, y * width, rowRe, 0, width);
            System.arraycopy(im, y * width, rowIm, 0, width);
            transform1d(rowRe, rowIm, inverse);
            System.arraycopy(rowRe, 0, re, y * width, width);
            System.arraycopy(rowIm, 0, im, y * width, width);
        }

        double[] colRe = new double[height];
        double[] colIm = new double[height];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                colRe[y] = re[y * width + x];
                colIm[y] = im[y * width + x];
            }
            transform1d(colRe, colIm, inverse);
            for (int y = 0; y < height; y++) {
                re[y * width + x] = colRe[y];
                im[y * width + x] = colIm[y];
            }
        }

        if (inverse) {
            double scale = 1.0 / (width * (double) height);
            for (int i = 0; i < re.length; i++) {
                re[i] *= scale;
                im[i] *= scale;
            }
        }
    }

    /** Unscaled in-place 1-D transform (iterative Cooley-Tukey). */
    static void transform1d(double[] re, double[] im, boolean inverse) {
        int n = re.length;
        if (n == 1) {
            return;
        }

        // bit-reversal permutation
        for (int i = 1, j = 0; i < n; i++) {
            int bit = n >> 1;
            for (; (j & bit) != 0; bit >>= 1) {
                j ^= bit;
            }
            j ^= bit;
            if (i < j) {
                double t = re[i]; re[i] = re[j]; re[j] = t;
                t = im[i]; im[i] = im[j]; im[j] = t;
            }
        }

        double sign = inverse ? 1.0 : -1.0;
        for (int len = 2; len <= n; len <<= 1) {
            double angle = sign * 2 * Math.PI / len;
            double wRe = Math.cos(angle);
            double wIm = Math.sin(angle);
            int half = len >> 1;
            for (int start = 0; start < n; start += len) {
                double curRe = 1.0;
                double curIm = 0.0;
                for (int k = 0; k < half; k++) {
                    int a = start + k;
                    int b = a + half;
                    double tRe = re[b] * curRe - im[b] * curIm;
                    double tIm = re[b] * curIm + im[b] * curRe;
                    re[b] = re[a] - tRe;
                    im[b] = im[a] - tIm;
                    re[a] += tRe;
                    im[a] += tIm;
                    double nextRe = curRe * wRe - curIm * wIm;
                    curIm = curRe * wIm + curIm * wRe;
                    curRe = nextRe;
                }
            }
        }
    }
}
