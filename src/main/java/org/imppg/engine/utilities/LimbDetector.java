package org.imppg.engine.utilities;

import org.imppg.engine.model.FloatImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Locates a bright disc (solar or lunar limb) in an image.
 *
 * <p>Detection works in four steps:
 * <ol>
 *   <li>Otsu threshold of the brightness histogram separates disc from background</li>
 *   <li>Centroid and area of the above-threshold pixels give a first centre and radius guess</li>
 *   <li>Rays cast from the centre find the threshold crossing of the limb</li>
 *   <li>An algebraic circle fit through the crossings, repeated once without outliers</li>
 * </ol>
 * {@link #refineCenter} re-fits only the centre with a fixed radius, used to stabilize a sequence once
 * the average radius is known.</p>
 */
public class LimbDetector {
    private static final Logger logger = LoggerFactory.getLogger(LimbDetector.class);

    private static final int THRESHOLD_BINS = 256;
    private static final double MIN_DISC_AREA_FRACTION = 0.005;
    private static final double MAX_DISC_AREA_FRACTION = 0.95;
    private static final double OUTLIER_SIGMAS = 2.5;
    private static final int REFINE_ITERATIONS = 10;

    public static final int DEFAULT_RAY_COUNT = 64;

    /** Detected disc, in image pixel coordinates. */
    public record Disc(double centerX, double centerY, double radius) { }

    private final int rayCount;
    private final int minEdgePoints;

    public LimbDetector() {
        this(DEFAULT_RAY_COUNT);
    }

    public LimbDetector(int rayCount) {
        if (rayCount < 8) {
            throw new IllegalArgumentException("At least 8 rays are needed, got " + rayCount);
        }
        this.rayCount = rayCount;
        this.minEdgePoints = Math.max(5, rayCount / 4);
    }

    /**
     * Finds the disc in {@code image}.
     *
     * @throws LimbDetectionException if no disc edge can be located
     */
    public Disc detect(FloatImage image) throws LimbDetectionException {
        float threshold = otsuThreshold(image);

        // centroid of the bright region
        float[] px = image.getPixels();
        int w = image.getWidth();
        double sumX = 0;
        double sumY = 0;
        long count = 0;
        for (int i = 0; i < px.length; i++) {
            if (px[i] > threshold) {
                sumX += i % w;
                sumY += i / w;
                count++;
            }
        }
        double fraction = count / (double) px.length;
        if (fraction < MIN_DISC_AREA_FRACTION || fraction > MAX_DISC_AREA_FRACTION) {
            throw new LimbDetectionException(String.format(
                    "No disc found (%.1f%% of pixels above threshold %.3f)", 100 * fraction, threshold));
        }
        double cx = sumX / count;
        double cy = sumY / count;
        double guessRadius = Math.sqrt(count / Math.PI);

        List<double[]> edge = findEdgePoints(image, threshold, cx, cy, guessRadius);
        Disc disc = fitCircle(edge);
        logger.debug("Disc fit: centre ({}, {}), radius {} from {} edge points",
                disc.centerX(), disc.centerY(), disc.radius(), edge.size());
        return disc;
    }

    /**
     * Re-determines the disc centre assuming it has the given radius.
     *
     * @param image image containing the disc
     * @param radius radius to keep fixed
     * @param initial starting estimate, usually from {@link #detect}
     * @throws LimbDetectionException if too few edge points are found around the initial estimate
     */
    public Disc refineCenter(FloatImage image, double radius, Disc initial) throws LimbDetectionException {
        float threshold = otsuThreshold(image);
        List<double[]> edge = findEdgePoints(image, threshold, initial.centerX(), initial.centerY(), radius);

        double cx = initial.centerX();
        double cy = initial.centerY();
        // Gauss-Newton on sum((|p - c| - R)^2) over the centre only
        for (int iter = 0; iter < REFINE_ITERATIONS; iter++) {
            double jtj00 = 0, jtj01 = 0, jtj11 = 0, jtr0 = 0, jtr1 = 0;
            for (double[] p : edge) {
                double ddx = cx - p[0];
                double ddy = cy - p[1];
                double dist = Math.hypot(ddx, ddy);
                if (dist < 1e-9) continue;
                double jx = ddx / dist;
                double jy = ddy / dist;
                double r = dist - radius;
                jtj00 += jx * jx;
                jtj01 += jx * jy;
                jtj11 += jy * jy;
                jtr0 += jx * r;
                jtr1 += jy * r;
            }
            double det = jtj00 * jtj11 - jtj01 * jtj01;
            if (Math.abs(det) < 1e-12) {
                throw new LimbDetectionException("Degenerate edge point distribution");
            }
            double stepX = (jtj11 * jtr0 - jtj01 * jtr1) / det;
            double stepY = (jtj00 * jtr1 - jtj01 * jtr0) / det;
            cx -= stepX;
            cy -= stepY;
            if (Math.hypot(stepX, stepY) < 1e-4) {
                break;
            }
        }
        return new Disc(cx, cy, radius);
    }

    /**
     * Casts rays from {@code (cx, cy)} and returns the points where brightness first drops below the
     * threshold between half and one and a half times the expected radius.
     */
    List<double[]> findEdgePoints(FloatImage image, float threshold, double cx, double cy, double expectedRadius)
            throws LimbDetectionException {
        List<double[]> points = new ArrayList<>();
        double rMin = 0.5 * expectedRadius;
        double rMax = 1.5 * expectedRadius;
        double step = 0.5;

        for (int ray = 0; ray < rayCount; ray++) {
            double angle = 2 * Math.PI * ray / rayCount;
            double ux = Math.cos(angle);
            double uy = Math.sin(angle);

            double prevR = rMin;
            float prev = image.sampleBilinear(cx + ux * prevR, cy + uy * prevR, Float.NaN);
            if (Float.isNaN(prev) || prev <= threshold) {
                continue;
            }
            for (double r = rMin + step; r <= rMax; r += step) {
                float v = image.sampleBilinear(cx + ux * r, cy + uy * r, Float.NaN);
                if (Float.isNaN(v)) {
                    // limb outside the image on this ray
                    break;
                }
                if (v <= threshold) {
                    double t = (prev - threshold) / (prev - v);
                    double edgeR = prevR + t * (r - prevR);
                    points.add(new double[]{cx + ux * edgeR, cy + uy * edgeR});
                    break;
                }
                prev = v;
                prevR = r;
            }
        }
        if (points.size() < minEdgePoints) {
            throw new LimbDetectionException("Only " + points.size() + " limb edge points found, need " + minEdgePoints);
        }
        return points;
    }

    /**
     * Algebraic (Kasa) circle fit, repeated once after dropping points farther than
     * {@value #OUTLIER_SIGMAS} RMS residuals from the first circle.
     */
    Disc fitCircle(List<double[]> points) throws LimbDetectionException {
        Disc first = kasaFit(points);

        double sumSq = 0;
        double[] residuals = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            double[] p = points.get(i);
            residuals[i] = Math.hypot(p[0] - first.centerX(), p[1] - first.centerY()) - first.radius();
            sumSq += residuals[i] * residuals[i];
        }
        double limit = Math.max(1.0, OUTLIER_SIGMAS * Math.sqrt(sumSq / points.size()));
        List<double[]> inliers = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            if (Math.abs(residuals[i]) <= limit) {
                inliers.add(points.get(i));
            }
        }
        if (inliers.size() == points.size()) {
            return first;
        }
        if (inliers.size() < minEdgePoints) {
            throw new LimbDetectionException("Too many outliers among limb edge points ("
                    + (points.size() - inliers.size()) + " of " + points.size() + ")");
        }
        logger.debug("Rejected {} outlier edge points", points.size() - inliers.size());
        return kasaFit(inliers);
    }

    private static Disc kasaFit(List<double[]> points) throws LimbDetectionException {
        // least squares for x^2 + y^2 + D*x + E*y + F = 0
        double sx = 0, sy = 0, sxx = 0, syy = 0, sxy = 0, sz = 0, sxz = 0, syz = 0;
        int n = points.size();
        for (double[] p : points) {
            double x = p[0];
            double y = p[1];
            double z = x * x + y * y;
            sx += x;
            sy += y;
            sxx += x * x;
            syy += y * y;
            sxy += x * y;
            sz += z;
            sxz += x * z;
            syz += y * z;
        }
        double[][] a = {
                {sxx, sxy, sx},
                {sxy, syy, sy},
                {sx, sy, n}
        };
        double[] b = {-sxz, -syz, -sz};
        double[] sol = solve3x3(a, b);
        if (sol == null) {
            throw new LimbDetectionException("Limb edge points are collinear");
        }
        double cx = -sol[0] / 2;
        double cy = -sol[1] / 2;
        double rSq = cx * cx + cy * cy - sol[2];
        if (!(rSq > 0)) {
            throw new LimbDetectionException("Circle fit produced an invalid radius");
        }
        return new Disc(cx, cy, Math.sqrt(rSq));
    }

    // Cramer's rule; null if singular
    private static double[] solve3x3(double[][] a, double[] b) {
        double det = det3(a);
        if (Math.abs(det) < 1e-12) {
            return null;
        }
        double[] x = new double[3];
        for (int col = 0; col < 3; col++) {
            double[][] m = new double[3][];
            for (int row = 0; row < 3; row++) {
                m[row] = Arrays.copyOf(a[row], 3);
                m[row][col] = b[row];
            }
            x[col] = det3(m) / det;
        }
        return x;
    }

    private static double det3(double[][] m) {
        return m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
                - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
                + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
    }

    /**
     * Otsu's split over a {@value #THRESHOLD_BINS}-bin histogram of the image's own value range,
     * placed halfway between the means of the two classes.
     */
    static float otsuThreshold(FloatImage image) {
        float[] mm = image.minMax();
        float min = mm[0];
        float range = mm[1] - mm[0];
        if (range <= 0) {
            return mm[1];
        }

        int[] histogram = new int[THRESHOLD_BINS];
        for (float v : image.getPixels()) {
            int bin = (int) ((v - min) / range * (THRESHOLD_BINS - 1));
            histogram[bin]++;
        }

        long total = image.getPixels().length;
        double sum = 0;
        for (int i = 0; i < THRESHOLD_BINS; i++) {
            sum += (double) i * histogram[i];
        }

        double sumB = 0;
        long wB = 0;
        double varMax = 0;
        double bestMeanB = 0;
        double bestMeanF = THRESHOLD_BINS - 1;
        for (int i = 0; i < THRESHOLD_BINS; i++) {
            wB += histogram[i];
            if (wB == 0) continue;
            long wF = total - wB;
            if (wF == 0) break;

            sumB += (double) i * histogram[i];
            double mB = sumB / wB;
            double mF = (sum - sumB) / wF;
            double varBetween = (double) wB * wF * (mB - mF) * (mB - mF);
            if (varBetween > varMax) {
                varMax = varBetween;
                bestMeanB = mB;
                bestMeanF = mF;
            }
        }
        // midway between the background and disc class means of the best split
        return (float) (min + (bestMeanB + bestMeanF) / 2 / (THRESHOLD_BINS - 1) * range);
    }
}
