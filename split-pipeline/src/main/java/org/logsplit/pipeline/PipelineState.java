package org.logsplit.pipeline;

/**
 * Lifecycle of one split run. Records are only processed while RUNNING.
 */
public enum PipelineState {
    IDLE,
    RUNNING,
    COMPLETED,
    ABORTED
}
