package org.imppg.engine.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Input of an alignment run. The order of {@code files} is both the processing and the output order.
 */
public record AlignmentRun(List<Path> files, AlignmentMethod method, OutputPolicy output) {

    public AlignmentRun {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(output, "output");
        if (files.size() < 2) {
            throw new IllegalArgumentException("Alignment needs at least 2 images, got " + files.size());
        }
        files = List.copyOf(files);
    }

    public int fileCount() {
        return files.size();
    }
}
