package org.imppg.engine.utilities;

/**
 * Thrown when no disc edge can be located in an image. Alignment reports it as a
 * per-file stabilization failure and continues with the next file.
 */
public class LimbDetectionException extends Exception {

    public LimbDetectionException(String message) {
        super(message);
    }
}
