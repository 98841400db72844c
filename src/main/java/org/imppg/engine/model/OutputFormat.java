package org.imppg.engine.model;

/**
 * File format of images written by alignment and batch runs.
 */
public enum OutputFormat {
    TIFF_16("tif", "tif", 16),
    PNG_16("png", "png", 16),
    PNG_8("png", "png", 8);

    private final String imageIoName;
    private final String extension;
    private final int bitsPerSample;

    OutputFormat(String imageIoName, String extension, int bitsPerSample) {
        this.imageIoName = imageIoName;
        this.extension = extension;
        this.bitsPerSample = bitsPerSample;
    }

    public String getImageIoName() { return imageIoName; }
    public String getExtension() { return extension; }
    public int getBitsPerSample() { return bitsPerSample; }

    /**
     * Parses values like {@code "tiff-16"}, {@code "png_8"} or {@code "TIFF_16"}.
     */
    public static OutputFormat fromString(String value) {
        String normalized = value.trim().toUpperCase().replace('-', '_');
        if (normalized.startsWith("TIF_")) {
            normalized = "TIFF_" + normalized.substring(4);
        }
        for (OutputFormat f : values()) {
            if (f.name().equals(normalized)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + value);
    }
}
