package org.imppg.engine.model;

/**
 * Status passed to an engine's completion handler once per run.
 */
public enum CompletionStatus {
    COMPLETED,
    ABORTED
}
