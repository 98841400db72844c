package org.imppg.engine.service;

import org.imppg.engine.model.ProgressEvent;

/**
 * Receives events on the owner's thread, in the order the worker produced them.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(long runId, ProgressEvent event);
}
