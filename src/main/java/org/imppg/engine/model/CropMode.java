package org.imppg.engine.model;

/**
 * Size of the output frame produced by an alignment run.
 */
public enum CropMode {
    /** Keep only the area covered by every translated image. */
    CROP_TO_INTERSECTION,
    /** Enlarge the frame to the bounding box of all translated images, padding with black. */
    PAD_TO_BOUNDING_BOX
}
