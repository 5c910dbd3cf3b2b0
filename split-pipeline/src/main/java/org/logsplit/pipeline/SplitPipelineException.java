package org.logsplit.pipeline;

/**
 * Base type for failures that abort a split run.
 * Per-record problems never surface as exceptions; they are counted as skips.
 */
public class SplitPipelineException extends RuntimeException {

    public SplitPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
