package org.logsplit.pipeline.extract;

import org.logsplit.pipeline.ir.ExtractionResult;
import org.logsplit.pipeline.ir.RawRecord;

/**
 * Recovers the timestamp of a record.
 *
 * Implementations are pure: no I/O, no shared mutable state, so they can run on any thread.
 * A record that cannot yield a timestamp produces a skipped result, never an exception.
 */
@FunctionalInterface
public interface TimestampExtractor {

    ExtractionResult extract(RawRecord record);
}
