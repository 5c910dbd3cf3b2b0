package org.logsplit.pipeline.sink;

import java.io.IOException;

import org.logsplit.pipeline.ir.RawRecord;
import org.logsplit.pipeline.ir.SkipReason;

/**
 * Port for keeping the records the pipeline could not route.
 */
public interface SkippedRecordSink extends AutoCloseable {

    void accept(RawRecord record, SkipReason reason) throws IOException;

    @Override
    default void close() throws IOException {
        // Default no-op
    }

    /** A sink that drops skipped records; they are still counted by the pipeline. */
    static SkippedRecordSink discarding() {
        return (record, reason) -> { };
    }
}
