package org.imppg.engine.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Input of a batch run: every file is processed with the same settings and written to
 * {@code outputDirectory}.
 */
public record BatchRun(
        List<Path> files,
        ProcessingSettings settings,
        Path outputDirectory,
        OutputFormat format,
        String suffix) {

    public BatchRun {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(format, "format");
        if (files.isEmpty()) {
            throw new IllegalArgumentException("Batch run needs at least one file");
        }
        files = List.copyOf(files);
        suffix = suffix == null ? "" : suffix;
    }

    public Path outputPathFor(Path input) {
        return outputDirectory.resolve(OutputPolicy.outputFileName(input, suffix, format));
    }
}
