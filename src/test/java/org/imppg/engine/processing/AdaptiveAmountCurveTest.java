package org.imppg.engine.processing;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for {@link AdaptiveAmountCurve}.
 */
class AdaptiveAmountCurveTest {

    @Test
    @DisplayName("Coefficients follow the closed-form transition cubic")
    void testCoefficients() {
        float min = 1.0f, max = 3.0f, t = 0.5f, w = 0.1f;
        double[] c = new AdaptiveAmountCurve(min, max, t, w).getCoefficients();

        double div = 4 * Math.pow(w, 3);
        assertEquals((min - max) / div, c[0], 1e-6);
        assertEquals(3 * (max - min) * t / div, c[1], 1e-6);
        assertEquals(3 * (max - min) * (w - t) * (w + t) / div, c[2], 1e-4);
        double d = (2 * Math.pow(w, 3) * (min + max) + 3 * t * w * w * (min - max) + Math.pow(t, 3) * (max - min)) / div;
        assertEquals(d, c[3], 1e-4);
    }

    @ParameterizedTest
    @CsvSource({
            "1.0, 3.0, 0.5, 0.1",
            "2.0, 0.5, 0.3, 0.05",
            "1.0, 1.0, 0.5, 0.2"
    })
    @DisplayName("Cubic meets both plateaus and its midpoint is the mean amount")
    void testContinuity(float min, float max, float t, float w) {
        AdaptiveAmountCurve curve = new AdaptiveAmountCurve(min, max, t, w);
        assertEquals(min, curve.amountAt(t - w), 1e-3);
        assertEquals(max, curve.amountAt(t + w), 1e-3);
        assertEquals((min + max) / 2, curve.amountAt(t), 1e-3);
        assertEquals(min, curve.amountAt(0f), 1e-6);
        assertEquals(max, curve.amountAt(1f), 1e-6);
    }

    @Test
    @DisplayName("Amount rises monotonically through the transition band")
    void testMonotonic() {
        AdaptiveAmountCurve curve = new AdaptiveAmountCurve(1.0f, 4.0f, 0.4f, 0.1f);
        float previous = curve.amountAt(0.29f);
        for (int i = 0; i <= 100; i++) {
            float x = 0.3f + 0.2f * i / 100;
            float amount = curve.amountAt(x);
            assertTrue(amount >= previous - 1e-4, "Amount decreased at " + x);
            previous = amount;
        }
    }

    @Test
    @DisplayName("Zero transition width is rejected")
    void testZeroWidth() {
        assertThrows(IllegalArgumentException.class, () -> new AdaptiveAmountCurve(1, 2, 0.5f, 0f));
    }
}
