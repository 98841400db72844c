package org.imppg.engine.processing;

import static org.junit.jupiter.api.Assertions.*;

import org.imppg.engine.model.CropMode;
import org.imppg.engine.model.FloatImage;
import org.imppg.engine.utilities.PhaseCorrelation.Translation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.Dimension;
import java.awt.Rectangle;
import java.util.List;

/**
 * Tests for {@link AlignmentFrame}.
 */
class AlignmentFrameTest {

    private static final List<Dimension> SIZES = List.of(new Dimension(100, 80), new Dimension(100, 80));

    @Test
    @DisplayName("Intersection shrinks the frame by the translation")
    void testIntersection() {
        List<Translation> t = List.of(Translation.ZERO, new Translation(10, -5));
        Rectangle frame = AlignmentFrame.compute(t, SIZES, CropMode.CROP_TO_INTERSECTION);
        assertEquals(new Rectangle(0, 5, 90, 75), frame);
    }

    @Test
    @DisplayName("Bounding box grows the frame by the translation")
    void testBoundingBox() {
        List<Translation> t = List.of(Translation.ZERO, new Translation(10, -5));
        Rectangle frame = AlignmentFrame.compute(t, SIZES, CropMode.PAD_TO_BOUNDING_BOX);
        assertEquals(new Rectangle(-10, 0, 110, 85), frame);
    }

    @Test
    @DisplayName("Images without common area cannot be cropped")
    void testNoOverlap() {
        List<Translation> t = List.of(Translation.ZERO, new Translation(150, 0));
        assertThrows(IllegalArgumentException.class,
                () -> AlignmentFrame.compute(t, SIZES, CropMode.CROP_TO_INTERSECTION));
        assertThrows(IllegalArgumentException.class,
                () -> AlignmentFrame.compute(List.of(Translation.ZERO), SIZES, CropMode.CROP_TO_INTERSECTION));
    }

    @Test
    @DisplayName("Translating a moved image brings its content back to reference coordinates")
    void testTranslateWholePixels() {
        FloatImage image = new FloatImage(10, 10);
        // feature at (3, 4) in the reference appears at (5, 5) in the moved image
        image.set(5, 5, 1.0f);
        Translation t = new Translation(2, 1);
        FloatImage out = AlignmentFrame.translate(image, t, new Rectangle(0, 0, 8, 9), false);
        assertEquals(1.0f, out.get(3, 4));
        assertEquals(0.0f, out.get(5, 5));
    }

    @Test
    @DisplayName("Nearest mode rounds the translation, subpixel mode interpolates")
    void testSubpixel() {
        FloatImage image = new FloatImage(4, 1, new float[]{0f, 1f, 0f, 0f});
        Translation half = new Translation(0.5, 0);
        Rectangle frame = new Rectangle(0, 0, 3, 1);

        FloatImage interpolated = AlignmentFrame.translate(image, half, frame, true);
        assertEquals(0.5f, interpolated.get(0, 0), 1e-6f);
        assertEquals(0.5f, interpolated.get(1, 0), 1e-6f);

        FloatImage nearest = AlignmentFrame.translate(image, half, frame, false);
        assertEquals(1.0f, nearest.get(0, 0));
        assertEquals(0.0f, nearest.get(1, 0));
    }

    @Test
    @DisplayName("Areas outside the image are black in the padded frame")
    void testPaddingIsBlack() {
        FloatImage image = FloatImage.filled(4, 4, 0.7f);
        FloatImage out = AlignmentFrame.translate(image, Translation.ZERO, new Rectangle(-2, 0, 6, 4), true);
        assertEquals(0.0f, out.get(0, 0));
        assertEquals(0.7f, out.get(2, 0), 1e-6f);
    }
}
