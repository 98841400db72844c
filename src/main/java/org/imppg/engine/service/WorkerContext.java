package org.imppg.engine.service;

import org.imppg.engine.model.ProgressEvent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * What a running {@link WorkerTask} may touch outside its own memory: the abort flag of its run
 * and the progress channel.
 */
public final class WorkerContext implements Checkpoint {

    static final String ABORT_REASON = "Processing aborted by request";

    private final long runId;
    private final AtomicBoolean abortRequested;
    private final ProgressChannel channel;

    WorkerContext(long runId, AtomicBoolean abortRequested, ProgressChannel channel) {
        this.runId = runId;
        this.abortRequested = abortRequested;
        this.channel = channel;
    }

    public long getRunId() {
        return runId;
    }

    public boolean isAbortRequested() {
        return abortRequested.get();
    }

    @Override
    public void check() {
        if (abortRequested.get()) {
            throw new ProcessingAbortedException(ABORT_REASON);
        }
    }

    public void publish(ProgressEvent event) {
        channel.publish(runId, event);
    }
}
