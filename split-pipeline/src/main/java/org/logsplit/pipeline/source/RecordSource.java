package org.logsplit.pipeline.source;

import org.logsplit.pipeline.ir.RawRecord;

import reactor.core.publisher.Flux;

/**
 * Port for reading raw records from an input log.
 *
 * Implementations must stream: memory use stays bounded no matter how large the input is.
 */
public interface RecordSource extends AutoCloseable {

    /**
     * Stream every record of the input in file order.
     * Returns a cold Flux; subscription opens the input and termination or cancellation closes it.
     * Failures to open or read are signalled as {@link RecordSourceException}.
     */
    Flux<RawRecord> readRecords();

    @Override
    default void close() throws Exception {
        // Default no-op for sources that don't hold resources outside a subscription
    }
}
