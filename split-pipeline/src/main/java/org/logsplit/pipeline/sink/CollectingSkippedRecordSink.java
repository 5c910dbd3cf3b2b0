package org.logsplit.pipeline.sink;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.logsplit.pipeline.ir.RawRecord;
import org.logsplit.pipeline.ir.SkipReason;

/**
 * Keeps skipped records in memory so callers can assert on exactly what was dropped and why.
 */
public class CollectingSkippedRecordSink implements SkippedRecordSink {

    private final List<SkippedRecord> skipped = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    @Override
    public void accept(RawRecord record, SkipReason reason) {
        skipped.add(new SkippedRecord(record, reason));
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<SkippedRecord> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    public boolean isClosed() {
        return closed;
    }

    public record SkippedRecord(RawRecord record, SkipReason reason) {}
}
