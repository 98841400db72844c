package org.imppg.engine.model;

import java.awt.Rectangle;
import java.util.Arrays;

/**
 * Single-channel floating point image stored row-major.
 *
 * <p>Pixel values are nominally in [0, 1]; intermediate pipeline results may leave that range.
 * Instances are mutable, so anything crossing a thread boundary is passed as a {@link #copy()}.
 */
public final class FloatImage {

    private final int width;
    private final int height;
    private final float[] pixels;

    public FloatImage(int width, int height) {
        this(width, height, new float[checkedSize(width, height)]);
    }

    /**
     * Wraps an existing pixel array without copying it.
     *
     * @param width image width, must be positive
     * @param height image height, must be positive
     * @param pixels row-major pixel data of length {@code width * height}
     */
    public FloatImage(int width, int height, float[] pixels) {
        int size = checkedSize(width, height);
        if (pixels == null || pixels.length != size) {
            throw new IllegalArgumentException("Pixel array must have exactly " + size + " elements");
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    private static int checkedSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        return Math.multiplyExact(width, height);
    }

    public static FloatImage filled(int width, int height, float value) {
        FloatImage img = new FloatImage(width, height);
        Arrays.fill(img.pixels, value);
        return img;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    /** Direct access to the backing array. */
    public float[] getPixels() { return pixels; }

    public Rectangle getBounds() {
        return new Rectangle(0, 0, width, height);
    }

    public float get(int x, int y) {
        return pixels[y * width + x];
    }

    public void set(int x, int y, float value) {
        pixels[y * width + x] = value;
    }

    /**
     * Samples the image at a fractional position with bilinear interpolation.
     * Positions outside the image return {@code outside}.
     */
    public float sampleBilinear(double x, double y, float outside) {
        if (x < 0 || y < 0 || x > width - 1 || y > height - 1) {
            return outside;
        }
        int x0 = (int) Math.floor(x);
        int y0 = (int) Math.floor(y);
        int x1 = Math.min(x0 + 1, width - 1);
        int y1 = Math.min(y0 + 1, height - 1);
        float fx = (float) (x - x0);
        float fy = (float) (y - y0);

        float top = get(x0, y0) * (1 - fx) + get(x1, y0) * fx;
        float bottom = get(x0, y1) * (1 - fx) + get(x1, y1) * fx;
        return top * (1 - fy) + bottom * fy;
    }

    public FloatImage copy() {
        return new FloatImage(width, height, pixels.clone());
    }

    /**
     * Copies a rectangular fragment into a new image.
     *
     * @param region fragment to copy; must lie within the image bounds
     * @return new image of the region's size
     */
    public FloatImage crop(Rectangle region) {
        if (region.isEmpty() || !getBounds().contains(region)) {
            throw new IllegalArgumentException("Region " + region + " is outside image bounds " + getBounds());
        }
        FloatImage out = new FloatImage(region.width, region.height);
        for (int row = 0; row < region.height; row++) {
            System.arraycopy(pixels, (region.y + row) * width + region.x,
                    out.pixels, row * region.width, region.width);
        }
        return out;
    }

    /** Returns {min, max} of all pixel values. */
    public float[] minMax() {
        float min = Float.MAX_VALUE;
        float max = -Float.MAX_VALUE;
        for (float v : pixels) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        return new float[]{min, max};
    }

    public boolean sameSize(FloatImage other) {
        return other != null && other.width == width && other.height == height;
    }

    @Override
    public String toString() {
        return "FloatImage[" + width + "x" + height + "]";
    }
}
