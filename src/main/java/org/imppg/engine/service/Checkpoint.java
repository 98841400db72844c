package org.imppg.engine.service;

/**
 * Point in a long computation where an abort request is honoured.
 */
@FunctionalInterface
public interface Checkpoint {

    /** Checkpoint that never aborts. */
    Checkpoint NONE = () -> { };

    /**
     * @throws ProcessingAbortedException if the computation should stop
     */
    void check();
}
