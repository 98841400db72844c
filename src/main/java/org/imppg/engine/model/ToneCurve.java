package org.imppg.engine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Brightness mapping applied as the last pipeline stage.
 *
 * <p>The curve is defined by at least two control points (sorted by x) and evaluated in one of three modes:
 * <ul>
 *   <li><b>Linear:</b> piecewise linear interpolation between control points</li>
 *   <li><b>Smooth:</b> monotone cubic Hermite spline (Fritsch-Carlson tangents), so a monotonic set of
 *       points never produces overshoot</li>
 *   <li><b>Gamma:</b> {@code y0 + (yN - y0) * t^(1/gamma)} between the first and last point</li>
 * </ul>
 * Inputs are clamped into [0, 1]; values left of the first point map to its y, right of the last to its y.
 */
public final class ToneCurve {

    public static final int MIN_POINTS = 2;

    /** Control point of the curve. */
    public record Point(float x, float y) { }

    private final List<Point> points;
    private final boolean smooth;
    private final boolean gammaMode;
    private final float gamma;

    // Hermite tangents, only used in smooth mode
    private final float[] tangents;

    private ToneCurve(List<Point> points, boolean smooth, boolean gammaMode, float gamma) {
        this.points = points;
        this.smooth = smooth;
        this.gammaMode = gammaMode;
        this.gamma = gamma;
        this.tangents = smooth ? computeTangents(points) : null;
    }

    /**
     * Creates a tone curve.
     *
     * @param points control points in any order; at least two with distinct x values
     * @param smooth use spline interpolation instead of straight segments
     * @param gammaMode use the gamma function between the end points
     * @param gamma gamma exponent, must be positive when {@code gammaMode} is set
     * @throws IllegalArgumentException if the points or gamma are invalid
     */
    public static ToneCurve of(List<Point> points, boolean smooth, boolean gammaMode, float gamma) {
        Objects.requireNonNull(points, "points");
        if (points.size() < MIN_POINTS) {
            throw new IllegalArgumentException("Tone curve needs at least " + MIN_POINTS
                    + " points, got " + points.size());
        }
        List<Point> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingDouble(Point::x));
        for (int i = 0; i < sorted.size(); i++) {
            Point p = sorted.get(i);
            if (!Float.isFinite(p.x()) || !Float.isFinite(p.y())) {
                throw new IllegalArgumentException("Tone curve point is not finite: " + p);
            }
            if (i > 0 && sorted.get(i - 1).x() == p.x()) {
                throw new IllegalArgumentException("Duplicate tone curve x value: " + p.x());
            }
        }
        if (gammaMode && !(gamma > 0)) {
            throw new IllegalArgumentException("Gamma must be positive, got " + gamma);
        }
        return new ToneCurve(Collections.unmodifiableList(sorted), smooth, gammaMode, gamma);
    }

    /** Straight line through (0,0) and (1,1). */
    public static ToneCurve identity() {
        return of(List.of(new Point(0, 0), new Point(1, 1)), false, false, 1.0f);
    }

    public List<Point> getPoints() { return points; }
    public int getNumPoints() { return points.size(); }
    public boolean isSmooth() { return smooth; }
    public boolean isGammaMode() { return gammaMode; }
    public float getGamma() { return gamma; }

    /**
     * True if the curve maps every value in [0, 1] onto itself.
     */
    public boolean isIdentity() {
        if (gammaMode) {
            return gamma == 1.0f && isUnitDiagonal(points.get(0), points.get(points.size() - 1));
        }
        for (Point p : points) {
            if (p.x() != p.y()) return false;
        }
        return isUnitDiagonal(points.get(0), points.get(points.size() - 1))
                && (!smooth || points.size() == 2);
    }

    private static boolean isUnitDiagonal(Point first, Point last) {
        return first.x() == 0 && first.y() == 0 && last.x() == 1 && last.y() == 1;
    }

    public float apply(float value) {
        float v = Math.max(0f, Math.min(1f, value));
        Point first = points.get(0);
        Point last = points.get(points.size() - 1);
        if (v <= first.x()) return first.y();
        if (v >= last.x()) return last.y();

        if (gammaMode) {
            double t = (v - first.x()) / (last.x() - first.x());
            return (float) (first.y() + (last.y() - first.y()) * Math.pow(t, 1.0 / gamma));
        }

        int k = segmentIndex(v);
        Point p0 = points.get(k);
        Point p1 = points.get(k + 1);
        float h = p1.x() - p0.x();
        float t = (v - p0.x()) / h;
        if (!smooth) {
            return p0.y() + t * (p1.y() - p0.y());
        }

        float t2 = t * t;
        float t3 = t2 * t;
        float h00 = 2 * t3 - 3 * t2 + 1;
        float h10 = t3 - 2 * t2 + t;
        float h01 = -2 * t3 + 3 * t2;
        float h11 = t3 - t2;
        return h00 * p0.y() + h10 * h * tangents[k] + h01 * p1.y() + h11 * h * tangents[k + 1];
    }

    /** Applies the curve to every pixel of {@code input}, writing into {@code output} (may be the same array). */
    public void apply(float[] input, float[] output) {
        for (int i = 0; i < input.length; i++) {
            output[i] = apply(input[i]);
        }
    }

    // Largest k with points[k].x <= v, limited to the last segment
    private int segmentIndex(float v) {
        int lo = 0;
        int hi = points.size() - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (points.get(mid).x() <= v) lo = mid; else hi = mid;
        }
        return lo;
    }

    private static float[] computeTangents(List<Point> pts) {
        int n = pts.size();
        float[] delta = new float[n - 1];
        for (int k = 0; k < n - 1; k++) {
            delta[k] = (pts.get(k + 1).y() - pts.get(k).y()) / (pts.get(k + 1).x() - pts.get(k).x());
        }
        float[] m = new float[n];
        m[0] = delta[0];
        m[n - 1] = delta[n - 2];
        for (int k = 1; k < n - 1; k++) {
            m[k] = (delta[k - 1] * delta[k] <= 0) ? 0 : (delta[k - 1] + delta[k]) / 2;
        }
        for (int k = 0; k < n - 1; k++) {
            if (delta[k] == 0) {
                m[k] = 0;
                m[k + 1] = 0;
                continue;
            }
            float a = m[k] / delta[k];
            float b = m[k + 1] / delta[k];
            float s = a * a + b * b;
            if (s > 9) {
                float tau = (float) (3 / Math.sqrt(s));
                m[k] = tau * a * delta[k];
                m[k + 1] = tau * b * delta[k];
            }
        }
        return m;
    }

    public ToneCurve withPoints(List<Point> newPoints) {
        return of(newPoints, smooth, gammaMode, gamma);
    }

    public ToneCurve withGamma(boolean newGammaMode, float newGamma) {
        return of(points, smooth, newGammaMode, newGamma);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToneCurve other)) return false;
        return smooth == other.smooth && gammaMode == other.gammaMode
                && Float.compare(gamma, other.gamma) == 0 && points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points, smooth, gammaMode, gamma);
    }

    @Override
    public String toString() {
        return String.format("ToneCurve[%d points, smooth=%b, gamma=%s]",
                points.size(), smooth, gammaMode ? Float.toString(gamma) : "off");
    }
}
