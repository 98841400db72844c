package org.imppg.engine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;

/**
 * Summary of a finished alignment run: output frame and per-image translation.
 *
 * <p>Plain fields so it serializes directly to the JSON report written next to the aligned images.</p>
 */
public class AlignmentReport {
    private final String method;
    private final String cropMode;
    private final int frameX;
    private final int frameY;
    private final int frameWidth;
    private final int frameHeight;
    private final Double averageRadius;
    private final Date createdDate;
    private final List<ImageEntry> images;

    public AlignmentReport(AlignmentMethod method, CropMode cropMode,
                           int frameX, int frameY, int frameWidth, int frameHeight,
                           Double averageRadius, List<ImageEntry> images) {
        this.method = method.name();
        this.cropMode = cropMode.name();
        this.frameX = frameX;
        this.frameY = frameY;
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
        this.averageRadius = averageRadius;
        this.createdDate = new Date();
        this.images = new ArrayList<>(images);
    }

    public AlignmentMethod getMethod() { return AlignmentMethod.valueOf(method); }
    public CropMode getCropMode() { return CropMode.valueOf(cropMode); }
    public int getFrameX() { return frameX; }
    public int getFrameY() { return frameY; }
    public int getFrameWidth() { return frameWidth; }
    public int getFrameHeight() { return frameHeight; }
    /** Average disc radius of a limb-based run, null for phase correlation. */
    public Double getAverageRadius() { return averageRadius; }
    public Date getCreatedDate() { return createdDate; }
    public List<ImageEntry> getImages() { return Collections.unmodifiableList(images); }

    /**
     * One aligned image.
     */
    public static class ImageEntry {
        private final String input;
        private final String output;
        private final double dx;
        private final double dy;
        private final Double discRadius;
        private final String failure;

        public ImageEntry(String input, String output, double dx, double dy, Double discRadius, String failure) {
            this.input = input;
            this.output = output;
            this.dx = dx;
            this.dy = dy;
            this.discRadius = discRadius;
            this.failure = failure;
        }

        public String getInput() { return input; }
        public String getOutput() { return output; }
        /** Translation of the input relative to the first image. */
        public double getDx() { return dx; }
        public double getDy() { return dy; }
        public Double getDiscRadius() { return discRadius; }
        /** Last stabilization failure message for this image, or null. */
        public String getFailure() { return failure; }
    }
}
