package org.imppg.engine.service;

/**
 * Unwinds a worker from a checkpoint after an abort request.
 *
 * <p>Never reaches the owner as a fault: the worker turns it into an
 * {@link org.imppg.engine.model.ProgressEvent.Aborted} event.</p>
 */
public class ProcessingAbortedException extends RuntimeException {

    public ProcessingAbortedException(String reason) {
        super(reason);
    }
}
