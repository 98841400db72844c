package org.imppg.engine.controller;

import org.imppg.engine.model.BatchRun;
import org.imppg.engine.model.CompletionStatus;
import org.imppg.engine.processing.PixelPipeline;
import org.imppg.engine.service.BatchProcessingTask;
import org.imppg.engine.service.WorkerHandle;
import org.imppg.engine.utilities.EngineConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Processes a list of files with one settings snapshot, emitting {@code ImageSaved} per file.
 */
public class BatchEngine extends AbstractEngine {

    private final PixelPipeline pipeline;
    private List<Path> outputs = List.of();
    private long latestRunId = -1;

    public BatchEngine(EngineConfig config) {
        this(config, null);
    }

    public BatchEngine(EngineConfig config, Executor ownerExecutor) {
        super("batch", config, ownerExecutor);
        this.pipeline = new PixelPipeline(config);
    }

    /**
     * Aborts any run and starts processing {@code run}.
     *
     * @return id of the started run, or -1 if interrupted before it could start
     */
    public long startBatch(BatchRun run) {
        outputs = List.of();
        WorkerHandle<List<Path>> handle = restart(
                new BatchProcessingTask(run, pipeline, getConfig().runLogEnabled()), this::onRunFinished);
        latestRunId = handle != null ? handle.getRunId() : -1;
        return latestRunId;
    }

    /** Files written by the last completed batch; empty otherwise. */
    public List<Path> getOutputs() {
        return outputs;
    }

    private void onRunFinished(WorkerHandle<List<Path>> handle, CompletionStatus status) {
        if (status == CompletionStatus.COMPLETED && handle.getRunId() == latestRunId) {
            outputs = handle.result().join();
        }
    }
}
