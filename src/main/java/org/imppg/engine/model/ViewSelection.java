package org.imppg.engine.model;

import java.awt.Rectangle;
import java.util.Objects;

/**
 * Selection rectangle tracked in three coordinate spaces.
 *
 * <ul>
 *   <li><b>logical</b> - image pixels, always clipped to the image bounds</li>
 *   <li><b>scaled-logical</b> - logical multiplied by the current zoom factor</li>
 *   <li><b>physical</b> - scaled-logical shifted by the view's scroll offset (screen coordinates)</li>
 * </ul>
 *
 * Immutable; every view change produces a new instance.
 */
public final class ViewSelection {

    private final int imageWidth;
    private final int imageHeight;
    private final Rectangle logical;
    private final float zoom;
    private final int scrollX;
    private final int scrollY;

    private ViewSelection(int imageWidth, int imageHeight, Rectangle logical, float zoom, int scrollX, int scrollY) {
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.logical = logical;
        this.zoom = zoom;
        this.scrollX = scrollX;
        this.scrollY = scrollY;
    }

    /**
     * Creates a selection at zoom 1 with no scroll offset.
     *
     * @param imageWidth width of the image the selection refers to
     * @param imageHeight height of the image the selection refers to
     * @param requested requested rectangle in image pixels; clipped to the image
     * @throws IllegalArgumentException if nothing of the rectangle lies within the image
     */
    public static ViewSelection of(int imageWidth, int imageHeight, Rectangle requested) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + imageWidth + "x" + imageHeight);
        }
        return new ViewSelection(imageWidth, imageHeight, clip(imageWidth, imageHeight, requested), 1.0f, 0, 0);
    }

    /** Selection covering the whole image. */
    public static ViewSelection whole(int imageWidth, int imageHeight) {
        return of(imageWidth, imageHeight, new Rectangle(0, 0, imageWidth, imageHeight));
    }

    private static Rectangle clip(int imageWidth, int imageHeight, Rectangle requested) {
        Rectangle clipped = requested.intersection(new Rectangle(0, 0, imageWidth, imageHeight));
        if (clipped.isEmpty()) {
            throw new IllegalArgumentException("Selection " + requested + " lies outside the "
                    + imageWidth + "x" + imageHeight + " image");
        }
        return clipped;
    }

    public ViewSelection withLogical(Rectangle requested) {
        return new ViewSelection(imageWidth, imageHeight, clip(imageWidth, imageHeight, requested), zoom, scrollX, scrollY);
    }

    public ViewSelection withZoom(float newZoom) {
        if (!(newZoom > 0)) {
            throw new IllegalArgumentException("Zoom factor must be positive, got " + newZoom);
        }
        return new ViewSelection(imageWidth, imageHeight, logical, newZoom, scrollX, scrollY);
    }

    public ViewSelection withScroll(int newScrollX, int newScrollY) {
        return new ViewSelection(imageWidth, imageHeight, logical, zoom, newScrollX, newScrollY);
    }

    public Rectangle logical() {
        return new Rectangle(logical);
    }

    public Rectangle scaledLogical() {
        int x0 = (int) Math.floor(logical.x * zoom);
        int y0 = (int) Math.floor(logical.y * zoom);
        int x1 = (int) Math.ceil((logical.x + logical.width) * zoom);
        int y1 = (int) Math.ceil((logical.y + logical.height) * zoom);
        return new Rectangle(x0, y0, x1 - x0, y1 - y0);
    }

    public Rectangle physical() {
        Rectangle r = scaledLogical();
        r.translate(-scrollX, -scrollY);
        return r;
    }

    public float zoom() { return zoom; }
    public int scrollX() { return scrollX; }
    public int scrollY() { return scrollY; }
    public int imageWidth() { return imageWidth; }
    public int imageHeight() { return imageHeight; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ViewSelection other)) return false;
        return imageWidth == other.imageWidth && imageHeight == other.imageHeight
                && logical.equals(other.logical) && Float.compare(zoom, other.zoom) == 0
                && scrollX == other.scrollX && scrollY == other.scrollY;
    }

    @Override
    public int hashCode() {
        return Objects.hash(imageWidth, imageHeight, logical, zoom, scrollX, scrollY);
    }

    @Override
    public String toString() {
        return "ViewSelection[logical=" + logical + ", zoom=" + zoom + ", scroll=(" + scrollX + "," + scrollY + ")]";
    }
}
