package org.imppg.engine.model;

import static org.junit.jupiter.api.Assertions.*;

import org.imppg.engine.model.ToneCurve.Point;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

/**
 * Tests for {@link ToneCurve} evaluation and validation.
 */
class ToneCurveTest {

    // ==================== Identity ====================

    @Test
    @DisplayName("Default curve is the identity")
    void testIdentity() {
        ToneCurve identity = ToneCurve.identity();
        assertTrue(identity.isIdentity());
        for (float v = 0; v <= 1.0f; v += 0.1f) {
            assertEquals(v, identity.apply(v), 1e-6);
        }
    }

    @Test
    @DisplayName("Moving a point or changing gamma makes the curve non-identity")
    void testNotIdentity() {
        ToneCurve identity = ToneCurve.identity();
        assertFalse(identity.withPoints(List.of(new Point(0, 0), new Point(0.5f, 0.7f), new Point(1, 1))).isIdentity());
        assertFalse(identity.withGamma(true, 2.0f).isIdentity());
        assertTrue(identity.withGamma(true, 1.0f).isIdentity());
    }

    // ==================== Evaluation ====================

    @ParameterizedTest
    @CsvSource({
            "0.0, 0.2",
            "0.25, 0.4",
            "0.5, 0.6",
            "0.75, 0.7",
            "1.0, 0.8"
    })
    @DisplayName("Linear curve interpolates between points")
    void testLinearInterpolation(float x, float expected) {
        ToneCurve curve = ToneCurve.of(
                List.of(new Point(0, 0.2f), new Point(0.5f, 0.6f), new Point(1, 0.8f)), false, false, 1);
        assertEquals(expected, curve.apply(x), 1e-5);
    }

    @Test
    @DisplayName("Inputs outside [0, 1] and outside the point range map to the end points")
    void testClamping() {
        ToneCurve curve = ToneCurve.of(List.of(new Point(0.2f, 0.1f), new Point(0.8f, 0.9f)), false, false, 1);
        assertEquals(0.1f, curve.apply(-3f), 1e-6);
        assertEquals(0.1f, curve.apply(0.1f), 1e-6);
        assertEquals(0.9f, curve.apply(0.95f), 1e-6);
        assertEquals(0.9f, curve.apply(7f), 1e-6);
    }

    @Test
    @DisplayName("Smooth curve passes through its points and does not overshoot")
    void testSmoothMonotone() {
        List<Point> points = List.of(new Point(0, 0), new Point(0.3f, 0.5f), new Point(0.6f, 0.55f), new Point(1, 1));
        ToneCurve curve = ToneCurve.of(points, true, false, 1);
        for (Point p : points) {
            assertEquals(p.y(), curve.apply(p.x()), 1e-5);
        }
        float previous = curve.apply(0);
        for (int i = 1; i <= 200; i++) {
            float y = curve.apply(i / 200f);
            assertTrue(y >= previous - 1e-6, "Curve decreased at x=" + i / 200f);
            previous = y;
        }
    }

    @Test
    @DisplayName("Gamma mode follows t^(1/gamma) between the end points")
    void testGamma() {
        ToneCurve curve = ToneCurve.identity().withGamma(true, 2.0f);
        assertEquals(0.5f, curve.apply(0.25f), 1e-5);
        assertEquals(0.0f, curve.apply(0.0f), 1e-6);
        assertEquals(1.0f, curve.apply(1.0f), 1e-6);
    }

    @Test
    @DisplayName("Array form equals per-value form and may work in place")
    void testApplyArray() {
        ToneCurve curve = ToneCurve.identity().withGamma(true, 2.2f);
        float[] data = {0f, 0.1f, 0.5f, 0.9f};
        float[] expected = new float[data.length];
        for (int i = 0; i < data.length; i++) {
            expected[i] = curve.apply(data[i]);
        }
        curve.apply(data, data);
        assertArrayEquals(expected, data, 1e-7f);
    }

    // ==================== Validation ====================

    @Test
    @DisplayName("Points are sorted by x")
    void testPointsSorted() {
        ToneCurve curve = ToneCurve.of(List.of(new Point(1, 1), new Point(0, 0)), false, false, 1);
        assertEquals(0f, curve.getPoints().get(0).x());
        assertTrue(curve.isIdentity());
    }

    @Test
    @DisplayName("Invalid definitions are rejected")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class,
                () -> ToneCurve.of(List.of(new Point(0, 0)), false, false, 1));
        assertThrows(IllegalArgumentException.class,
                () -> ToneCurve.of(List.of(new Point(0.5f, 0), new Point(0.5f, 1)), false, false, 1));
        assertThrows(IllegalArgumentException.class,
                () -> ToneCurve.of(List.of(new Point(0, Float.NaN), new Point(1, 1)), false, false, 1));
        assertThrows(IllegalArgumentException.class,
                () -> ToneCurve.identity().withGamma(true, 0f));
    }
}
