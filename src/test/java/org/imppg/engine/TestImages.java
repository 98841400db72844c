package org.imppg.engine;

import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.OutputFormat;
import org.imppg.engine.utilities.ImageFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;

/**
 * Synthetic images shared by tests.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * Smooth random texture: a sum of Gaussian spots on a dark background, values in [0, 1].
     */
    public static FloatImage spots(int width, int height, long seed) {
        Random random = new Random(seed);
        FloatImage image = new FloatImage(width, height);
        float[] px = image.getPixels();
        int count = Math.max(8, width * height / 200);
        for (int s = 0; s < count; s++) {
            double cx = random.nextDouble() * width;
            double cy = random.nextDouble() * height;
            double sigma = 1.5 + random.nextDouble() * 3;
            double amp = 0.2 + random.nextDouble() * 0.6;
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    double d2 = (x - cx) * (x - cx) + (y - cy) * (y - cy);
                    px[y * width + x] += (float) (amp * Math.exp(-d2 / (2 * sigma * sigma)));
                }
            }
        }
        float[] range = image.minMax();
        for (int i = 0; i < px.length; i++) {
            px[i] = 0.05f + 0.9f * (px[i] - range[0]) / (range[1] - range[0]);
        }
        return image;
    }

    /**
     * Copy of {@code source} whose content is moved by whole pixels; uncovered pixels repeat the edge.
     * A feature at (x, y) in the source appears at (x + dx, y + dy).
     */
    public static FloatImage shifted(FloatImage source, int dx, int dy) {
        int w = source.getWidth();
        int h = source.getHeight();
        FloatImage out = new FloatImage(w, h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int sx = Math.max(0, Math.min(w - 1, x - dx));
                int sy = Math.max(0, Math.min(h - 1, y - dy));
                out.set(x, y, source.get(sx, sy));
            }
        }
        return out;
    }

    /** Bright uniform disc with a soft edge on a dark background. */
    public static FloatImage disc(int width, int height, double cx, double cy, double radius) {
        FloatImage image = new FloatImage(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double r = Math.hypot(x - cx, y - cy);
                double t = Math.max(0, Math.min(1, radius + 0.5 - r));
                image.set(x, y, (float) (0.05 + 0.8 * t));
            }
        }
        return image;
    }

    /** Horizontal ramp from 0 to {@code max}. */
    public static FloatImage ramp(int width, int height, float max) {
        FloatImage image = new FloatImage(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.set(x, y, max * x / (width - 1));
            }
        }
        return image;
    }

    public static Path writeTiff(FloatImage image, Path file) throws IOException {
        ImageFiles.write(image, file, OutputFormat.TIFF_16);
        return file;
    }
}
