package org.imppg.engine.controller;

import org.imppg.engine.model.CompletionStatus;
import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.ProcessingSettings;
import org.imppg.engine.processing.PixelPipeline;
import org.imppg.engine.service.PipelineTask;
import org.imppg.engine.service.WorkerHandle;
import org.imppg.engine.utilities.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;

/**
 * Processes a whole image with one settings snapshot, e.g. before saving it.
 */
public class ProcessingEngine extends AbstractEngine {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingEngine.class);

    private final PixelPipeline pipeline;
    private FloatImage processedOutput;
    private long latestRunId = -1;

    public ProcessingEngine(EngineConfig config) {
        this(config, null);
    }

    public ProcessingEngine(EngineConfig config, Executor ownerExecutor) {
        super("processing", config, ownerExecutor);
        this.pipeline = new PixelPipeline(config);
    }

    /**
     * Aborts any run and starts processing a copy of {@code image}.
     *
     * @return id of the started run, or -1 if interrupted before it could start
     */
    public long startProcessing(FloatImage image, ProcessingSettings settings) {
        processedOutput = null;
        PipelineTask task = new PipelineTask("processing of whole image " + image, pipeline, image.copy(), settings,
                PixelPipeline.Stage.NORMALIZATION, null, null);
        WorkerHandle<PixelPipeline.Result> handle = restart(task, this::onRunFinished);
        latestRunId = handle != null ? handle.getRunId() : -1;
        return latestRunId;
    }

    /**
     * Result of the last completed run.
     *
     * @throws IllegalStateException if no run has completed since the last {@link #startProcessing}
     */
    public FloatImage getProcessedOutput() {
        if (processedOutput == null) {
            throw new IllegalStateException("Processing has not completed");
        }
        return processedOutput;
    }

    public boolean hasProcessedOutput() {
        return processedOutput != null;
    }

    private void onRunFinished(WorkerHandle<PixelPipeline.Result> handle, CompletionStatus status) {
        if (status == CompletionStatus.COMPLETED && handle.getRunId() == latestRunId) {
            processedOutput = handle.result().join().output();
            logger.debug("Whole image result available from run {}", handle.getRunId());
        }
    }
}
