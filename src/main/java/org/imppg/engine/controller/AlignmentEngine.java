package org.imppg.engine.controller;

import org.imppg.engine.model.AlignmentReport;
import org.imppg.engine.model.AlignmentRun;
import org.imppg.engine.model.CompletionStatus;
import org.imppg.engine.service.AlignmentTask;
import org.imppg.engine.service.WorkerHandle;
import org.imppg.engine.utilities.EngineConfig;
import org.imppg.engine.utilities.LimbDetector;

import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Runs image sequence alignment in the background.
 *
 * <p>Progress arrives as {@code TranslationComputed}, {@code DiscRadiusFound}, {@code AverageRadiusUsed},
 * {@code StabilizationProgress}, {@code StabilizationFailure} and {@code ImageSaved} events, followed by
 * exactly one {@code Completed} or {@code Aborted}.</p>
 */
public class AlignmentEngine extends AbstractEngine {

    private AlignmentReport report;
    private long latestRunId = -1;

    public AlignmentEngine(EngineConfig config) {
        this(config, null);
    }

    public AlignmentEngine(EngineConfig config, Executor ownerExecutor) {
        super("alignment", config, ownerExecutor);
    }

    /**
     * Aborts any run and starts aligning {@code run}.
     *
     * @return id of the started run, or -1 if interrupted before it could start
     */
    public long startAlignment(AlignmentRun run) {
        report = null;
        EngineConfig config = getConfig();
        AlignmentTask task = new AlignmentTask(run, new LimbDetector(config.limbRayCount()),
                config.writeAlignmentReport(), config.runLogEnabled());
        WorkerHandle<AlignmentReport> handle = restart(task, this::onRunFinished);
        latestRunId = handle != null ? handle.getRunId() : -1;
        return latestRunId;
    }

    /** Report of the last completed alignment; empty while running or after an abort. */
    public Optional<AlignmentReport> getReport() {
        return Optional.ofNullable(report);
    }

    private void onRunFinished(WorkerHandle<AlignmentReport> handle, CompletionStatus status) {
        if (status == CompletionStatus.COMPLETED && handle.getRunId() == latestRunId) {
            report = handle.result().join();
        }
    }
}
