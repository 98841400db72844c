package org.imppg.engine.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how an alignment run writes its output images.
 *
 * @param outputDirectory existing directory receiving the aligned images
 * @param cropMode size of the output frame
 * @param format output file format
 * @param suffix appended to each input file's base name, e.g. {@code "_aligned"}
 * @param subpixel translate with bilinear interpolation instead of whole-pixel shifts
 */
public record OutputPolicy(
        Path outputDirectory,
        CropMode cropMode,
        OutputFormat format,
        String suffix,
        boolean subpixel) {

    public static final String DEFAULT_SUFFIX = "_aligned";

    public OutputPolicy {
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(cropMode, "cropMode");
        Objects.requireNonNull(format, "format");
        suffix = suffix == null ? "" : suffix;
    }

    public Path outputPathFor(Path input) {
        return outputDirectory.resolve(outputFileName(input, suffix, format));
    }

    /**
     * Builds {@code <base name><suffix>.<extension>} for an input file.
     */
    public static String outputFileName(Path input, String suffix, OutputFormat format) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return base + suffix + "." + format.getExtension();
    }
}
