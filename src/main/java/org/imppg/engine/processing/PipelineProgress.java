package org.imppg.engine.processing;

/**
 * Receives progress of long pipeline stages, e.g. deconvolution iterations.
 */
@FunctionalInterface
public interface PipelineProgress {

    PipelineProgress NONE = (stage, done, total) -> { };

    void stageProgress(String stage, int done, int total);
}
