package org.imppg.engine.utilities;

import org.imppg.engine.model.FloatImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the translation between two images from the peak of their normalized cross-power spectrum.
 *
 * <p>Steps:
 * <ol>
 *   <li>Subtract each image's mean and apply a Hann window to suppress edge discontinuities</li>
 *   <li>Zero-pad both to a common power-of-2 size and transform</li>
 *   <li>Compute {@code F_img * conj(F_ref) / |F_img * conj(F_ref)|} and transform back</li>
 *   <li>Locate the peak, wrap it to a signed offset and refine with a parabola through the neighbours</li>
 * </ol>
 * The result is the displacement of {@code image} relative to {@code reference}: a feature at
 * {@code (x, y)} in the reference appears at {@code (x + dx, y + dy)} in the image.
 */
public final class PhaseCorrelation {
    private static final Logger logger = LoggerFactory.getLogger(PhaseCorrelation.class);

    private static final double MAGNITUDE_EPSILON = 1.0e-12;

    /** Translation vector in pixels. */
    public record Translation(double dx, double dy) {

        public static final Translation ZERO = new Translation(0, 0);

        public Translation plus(Translation other) {
            return new Translation(dx + other.dx, dy + other.dy);
        }
    }

    private PhaseCorrelation() {
    }

    public static Translation determineTranslation(FloatImage reference, FloatImage image) {
        int fftW = Fft2D.nextPowerOf2(Math.max(reference.getWidth(), image.getWidth()));
        int fftH = Fft2D.nextPowerOf2(Math.max(reference.getHeight(), image.getHeight()));

        double[] refRe = windowed(reference, fftW, fftH);
        double[] refIm = new double[refRe.length];
        double[] imgRe = windowed(image, fftW, fftH);
        double[] imgIm = new double[imgRe.length];

        Fft2D.transform(refRe, refIm, fftW, fftH, false);
        Fft2D.transform(imgRe, imgIm, fftW, fftH, false);

        // cross-power spectrum, stored in imgRe/imgIm
        for (int i = 0; i < imgRe.length; i++) {
            double cRe = imgRe[i] * refRe[i] + imgIm[i] * refIm[i];
            double cIm = imgIm[i] * refRe[i] - imgRe[i] * refIm[i];
            double mag = Math.hypot(cRe, cIm);
            if (mag > MAGNITUDE_EPSILON) {
                imgRe[i] = cRe / mag;
                imgIm[i] = cIm / mag;
            } else {
                imgRe[i] = 0;
                imgIm[i] = 0;
            }
        }
        Fft2D.transform(imgRe, imgIm, fftW, fftH, true);

        int peak = 0;
        for (int i = 1; i < imgRe.length; i++) {
            if (imgRe[i] > imgRe[peak]) {
                peak = i;
            }
        }
        int px = peak % fftW;
        int py = peak / fftW;

        double subX = parabolicOffset(
                imgRe[py * fftW + Math.floorMod(px - 1, fftW)],
                imgRe[peak],
                imgRe[py * fftW + Math.floorMod(px + 1, fftW)]);
        double subY = parabolicOffset(
                imgRe[Math.floorMod(py - 1, fftH) * fftW + px],
                imgRe[peak],
                imgRe[Math.floorMod(py + 1, fftH) * fftW + px]);

        double dx = (px > fftW / 2 ? px - fftW : px) + subX;
        double dy = (py > fftH / 2 ? py - fftH : py) + subY;
        logger.debug("Phase correlation peak at ({}, {}), translation ({}, {})", px, py, dx, dy);
        return new Translation(dx, dy);
    }

    /**
     * Vertex of the parabola through three equally spaced samples, relative to the middle one.
     */
    static double parabolicOffset(double left, double centre, double right) {
        double denom = left - 2 * centre + right;
        if (Math.abs(denom) < MAGNITUDE_EPSILON) {
            return 0;
        }
        double offset = 0.5 * (left - right) / denom;
        return Math.max(-0.5, Math.min(0.5, offset));
    }

    private static double[] windowed(FloatImage image, int fftW, int fftH) {
        int w = image.getWidth();
        int h = image.getHeight();
        float[] px = image.getPixels();

        double mean = 0;
        for (float v : px) {
            mean += v;
        }
        mean /= px.length;

        double[] wx = hann(w);
        double[] wy = hann(h);
        double[] out = new double[fftW * fftH];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                out[y * fftW + x] = (px[y * w + x] - mean) * wx[x] * wy[y];
            }
        }
        return out;
    }

    static double[] hann(int n) {
        double[] w = new double[n];
        if (n == 1) {
            w[0] = 1;
            return w;
        }
        for (int i = 0; i < n; i++) {
            w[i] = 0.5 * (1 - Math.cos(2 * Math.PI * i / (n - 1)));
        }
        return w;
    }
}
