package org.imppg.engine.processing;

import org.imppg.engine.model.CropMode;
import org.imppg.engine.model.FloatImage;
import org.imppg.engine.utilities.PhaseCorrelation.Translation;

import java.awt.Dimension;
import java.awt.Rectangle;
import java.util.List;

/**
 * Output frame of an alignment run and the resampling of each image into it.
 *
 * <p>Frame coordinates are those of the first image. Image {@code i}, translated by {@code t_i}
 * relative to the first image, covers {@code [-t_i.dx, w_i - t_i.dx)} horizontally (likewise vertically).</p>
 */
public final class AlignmentFrame {

    private AlignmentFrame() {
    }

    /**
     * Computes the output frame.
     *
     * @param translations cumulative translation of each image relative to the first
     * @param sizes size of each image
     * @param mode intersection or bounding box of the translated images
     * @throws IllegalArgumentException if the lists differ in length, or the images share no area in
     *                                  {@link CropMode#CROP_TO_INTERSECTION} mode
     */
    public static Rectangle compute(List<Translation> translations, List<Dimension> sizes, CropMode mode) {
        if (translations.size() != sizes.size() || translations.isEmpty()) {
            throw new IllegalArgumentException("Need one size per translation");
        }
        double minLeft = Double.MAX_VALUE, maxLeft = -Double.MAX_VALUE;
        double minTop = Double.MAX_VALUE, maxTop = -Double.MAX_VALUE;
        double minRight = Double.MAX_VALUE, maxRight = -Double.MAX_VALUE;
        double minBottom = Double.MAX_VALUE, maxBottom = -Double.MAX_VALUE;
        for (int i = 0; i < translations.size(); i++) {
            Translation t = translations.get(i);
            Dimension d = sizes.get(i);
            double left = -t.dx();
            double top = -t.dy();
            double right = d.width - t.dx();
            double bottom = d.height - t.dy();
            minLeft = Math.min(minLeft, left);
            maxLeft = Math.max(maxLeft, left);
            minTop = Math.min(minTop, top);
            maxTop = Math.max(maxTop, top);
            minRight = Math.min(minRight, right);
            maxRight = Math.max(maxRight, right);
            minBottom = Math.min(minBottom, bottom);
            maxBottom = Math.max(maxBottom, bottom);
        }

        int x0, y0, x1, y1;
        if (mode == CropMode.CROP_TO_INTERSECTION) {
            x0 = (int) Math.ceil(maxLeft - 1e-6);
            y0 = (int) Math.ceil(maxTop - 1e-6);
            x1 = (int) Math.floor(minRight + 1e-6);
            y1 = (int) Math.floor(minBottom + 1e-6);
            if (x1 <= x0 || y1 <= y0) {
                throw new IllegalArgumentException("Aligned images have no common area");
            }
        } else {
            x0 = (int) Math.floor(minLeft + 1e-6);
            y0 = (int) Math.floor(minTop + 1e-6);
            x1 = (int) Math.ceil(maxRight - 1e-6);
            y1 = (int) Math.ceil(maxBottom - 1e-6);
        }
        return new Rectangle(x0, y0, x1 - x0, y1 - y0);
    }

    /**
     * Resamples {@code image} into {@code frame}. Areas not covered by the image are black.
     *
     * @param subpixel bilinear interpolation at the exact translation; otherwise the translation is
     *                 rounded to whole pixels
     */
    public static FloatImage translate(FloatImage image, Translation translation, Rectangle frame, boolean subpixel) {
        FloatImage out = new FloatImage(frame.width, frame.height);
        float[] dst = out.getPixels();
        if (subpixel) {
            for (int fy = 0; fy < frame.height; fy++) {
                double sy = frame.y + fy + translation.dy();
                for (int fx = 0; fx < frame.width; fx++) {
                    double sx = frame.x + fx + translation.dx();
                    dst[fy * frame.width + fx] = image.sampleBilinear(sx, sy, 0f);
                }
            }
        } else {
            int shiftX = (int) Math.round(translation.dx());
            int shiftY = (int) Math.round(translation.dy());
            for (int fy = 0; fy < frame.height; fy++) {
                int sy = frame.y + fy + shiftY;
                if (sy < 0 || sy >= image.getHeight()) continue;
                for (int fx = 0; fx < frame.width; fx++) {
                    int sx = frame.x + fx + shiftX;
                    if (sx < 0 || sx >= image.getWidth()) continue;
                    dst[fy * frame.width + fx] = image.get(sx, sy);
                }
            }
        }
        return out;
    }
}
