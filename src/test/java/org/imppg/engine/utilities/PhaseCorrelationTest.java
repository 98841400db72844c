package org.imppg.engine.utilities;

import static org.junit.jupiter.api.Assertions.*;

import org.imppg.engine.TestImages;
import org.imppg.engine.model.FloatImage;
import org.imppg.engine.utilities.PhaseCorrelation.Translation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for {@link PhaseCorrelation} and the {@link Fft2D} it is built on.
 */
class PhaseCorrelationTest {

    // ==================== FFT ====================

    @Test
    @DisplayName("Power of two helpers")
    void testPowerOf2() {
        assertTrue(Fft2D.isPowerOf2(1));
        assertTrue(Fft2D.isPowerOf2(64));
        assertFalse(Fft2D.isPowerOf2(96));
        assertEquals(128, Fft2D.nextPowerOf2(97));
        assertEquals(64, Fft2D.nextPowerOf2(64));
    }

    @Test
    @DisplayName("Forward then inverse transform restores the input")
    void testInverseRestoresInput() {
        int w = 16;
        int h = 8;
        double[] re = new double[w * h];
        double[] im = new double[w * h];
        for (int i = 0; i < re.length; i++) {
            re[i] = Math.sin(i * 0.37) + (i % 5);
        }
        double[] original = re.clone();

        Fft2D.transform(re, im, w, h, false);
        Fft2D.transform(re, im, w, h, true);

        for (int i = 0; i < re.length; i++) {
            assertEquals(original[i], re[i], 1e-9);
            assertEquals(0.0, im[i], 1e-9);
        }
    }

    @Test
    @DisplayName("DC term of the forward transform is the sum of the input")
    void testDcTerm() {
        double[] re = {1, 2, 3, 4};
        double[] im = new double[4];
        Fft2D.transform(re, im, 2, 2, false);
        assertEquals(10.0, re[0], 1e-12);
    }

    // ==================== Translation ====================

    @ParameterizedTest
    @CsvSource({
            "3, 0",
            "0, -4",
            "5, 2",
            "-6, -3"
    })
    @DisplayName("Whole-pixel shifts are recovered with the sign of the content movement")
    void testRecoversShift(int dx, int dy) {
        FloatImage reference = TestImages.spots(64, 64, 7);
        FloatImage moved = TestImages.shifted(reference, dx, dy);

        Translation t = PhaseCorrelation.determineTranslation(reference, moved);

        assertEquals(dx, t.dx(), 0.3);
        assertEquals(dy, t.dy(), 0.3);
    }

    @Test
    @DisplayName("Identical images have zero translation")
    void testIdenticalImages() {
        FloatImage reference = TestImages.spots(48, 40, 11);
        Translation t = PhaseCorrelation.determineTranslation(reference, reference.copy());
        assertEquals(0.0, t.dx(), 0.1);
        assertEquals(0.0, t.dy(), 0.1);
    }

    @Test
    @DisplayName("Translations add component-wise")
    void testTranslationPlus() {
        Translation sum = new Translation(1.5, -2).plus(new Translation(0.25, 3));
        assertEquals(1.75, sum.dx(), 1e-12);
        assertEquals(1.0, sum.dy(), 1e-12);
        assertEquals(sum, sum.plus(Translation.ZERO));
    }

    @Test
    @DisplayName("Parabolic peak offset stays within half a pixel")
    void testParabolicOffset() {
        assertEquals(0.0, PhaseCorrelation.parabolicOffset(1, 2, 1), 1e-12);
        assertTrue(PhaseCorrelation.parabolicOffset(1, 2, 1.5) > 0);
        assertTrue(PhaseCorrelation.parabolicOffset(1.5, 2, 1) < 0);
        assertEquals(0.0, PhaseCorrelation.parabolicOffset(1, 1, 1), 1e-12);
        double offset = PhaseCorrelation.parabolicOffset(0, 1, 5);
        assertTrue(Math.abs(offset) <= 0.5);
    }
}
