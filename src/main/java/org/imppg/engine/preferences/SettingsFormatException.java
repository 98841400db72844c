package org.imppg.engine.preferences;

import java.io.IOException;

/**
 * Thrown when a settings file is not well-formed XML or a section present in it holds an invalid value.
 */
public class SettingsFormatException extends IOException {

    public SettingsFormatException(String message) {
        super(message);
    }

    public SettingsFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
