package org.imppg.engine.model;

import java.awt.Rectangle;

/**
 * Brightness histogram of an image fragment.
 *
 * <p>Values are clamped into [0, 1] and counted in bin {@code floor(v * (NUM_BINS - 1))}.
 * {@code min} and {@code max} are the unclamped extremes of the fragment.</p>
 */
public record Histogram(float min, float max, int[] bins, int maxCount) {

    public static final int NUM_BINS = 1024;

    public Histogram {
        if (bins == null || bins.length != NUM_BINS) {
            throw new IllegalArgumentException("Histogram must have " + NUM_BINS + " bins");
        }
        bins = bins.clone();
    }

    @Override
    public int[] bins() {
        return bins.clone();
    }

    public int count(int bin) {
        return bins[bin];
    }

    public static int binOf(float value) {
        float v = Math.max(0f, Math.min(1f, value));
        return (int) (v * (NUM_BINS - 1));
    }

    public static Histogram of(FloatImage image) {
        return of(image, image.getBounds());
    }

    /**
     * Computes the histogram of {@code region}, which must lie within the image.
     */
    public static Histogram of(FloatImage image, Rectangle region) {
        if (region.isEmpty() || !image.getBounds().contains(region)) {
            throw new IllegalArgumentException("Region " + region + " is outside image bounds " + image.getBounds());
        }
        int[] counts = new int[NUM_BINS];
        float min = Float.MAX_VALUE;
        float max = -Float.MAX_VALUE;
        float[] px = image.getPixels();
        int stride = image.getWidth();
        for (int y = region.y; y < region.y + region.height; y++) {
            int offset = y * stride;
            for (int x = region.x; x < region.x + region.width; x++) {
                float v = px[offset + x];
                if (v < min) min = v;
                if (v > max) max = v;
                counts[binOf(v)]++;
            }
        }
        int maxCount = 0;
        for (int c : counts) {
            maxCount = Math.max(maxCount, c);
        }
        return new Histogram(min, max, counts, maxCount);
    }
}
