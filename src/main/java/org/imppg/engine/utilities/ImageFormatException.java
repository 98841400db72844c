package org.imppg.engine.utilities;

import java.io.IOException;

/**
 * Thrown when an image file cannot be decoded or no writer exists for the requested format.
 */
public class ImageFormatException extends IOException {

    public ImageFormatException(String message) {
        super(message);
    }

    public ImageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
