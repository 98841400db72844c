package org.imppg.engine.model;

/**
 * How image translations are determined in an alignment run.
 */
public enum AlignmentMethod {
    /** Frequency-domain correlation of consecutive images. */
    PHASE_CORRELATION,
    /** Detection of the solar or lunar disc edge in each image. */
    LIMB;

    /**
     * Parses a command line or config value such as {@code "phase-correlation"} or {@code "limb"}.
     */
    public static AlignmentMethod fromString(String value) {
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (AlignmentMethod m : values()) {
            if (m.name().equals(normalized)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown alignment method: " + value);
    }
}
